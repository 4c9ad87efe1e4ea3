package org.econdata.fredproxy.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

/** Body of every error response. */
@Schema(description = "Error response")
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "UPSTREAM_ERROR")
        ApiErrorType type,
    @Schema(
            description = "Human readable error message",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Too Many Requests.  Exceeded Rate Limit")
        String message,
    @Schema(description = "Machine readable error code", example = "FRED_API_ERROR")
        String code) {}
