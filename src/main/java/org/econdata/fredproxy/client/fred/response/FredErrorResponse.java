package org.econdata.fredproxy.client.fred.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Error payload FRED returns for rejected requests, sometimes with HTTP 200. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FredErrorResponse(
    @JsonProperty("error_code") Integer errorCode,
    @JsonProperty("error_message") String errorMessage) {}
