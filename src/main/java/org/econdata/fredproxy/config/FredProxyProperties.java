package org.econdata.fredproxy.config;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "fred-proxy")
@Validated
public class FredProxyProperties {

  @Valid private Fred fred = new Fred();
  @Valid private Cors cors = new Cors();

  public Fred getFred() {
    return fred;
  }

  public void setFred(Fred fred) {
    this.fred = fred;
  }

  public Cors getCors() {
    return cors;
  }

  public void setCors(Cors cors) {
    this.cors = cors;
  }

  public static class Fred {
    /** FRED API base URL. */
    private String baseUrl = "https://api.stlouisfed.org/fred";

    /** FRED API key - should be set via the FRED_API_KEY environment variable. */
    @NotBlank(message = "FRED API key must be configured")
    private String apiKey;

    /** Timeout in seconds for a single FRED API request. */
    @Min(1)
    @Max(120)
    private int timeoutSeconds = 30;

    /** TCP connect timeout in milliseconds. */
    @Min(100)
    @Max(60000)
    private int connectTimeoutMillis = 5000;

    /** Rows requested per observations page; FRED caps this at 100000. */
    @Min(1)
    @Max(100000)
    private int pageSize = 10000;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }

    public int getConnectTimeoutMillis() {
      return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
      this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public int getPageSize() {
      return pageSize;
    }

    public void setPageSize(int pageSize) {
      this.pageSize = pageSize;
    }

    /** API key with all but the last four characters masked, for logging. */
    public String getMaskedApiKey() {
      if (apiKey == null || apiKey.length() <= 4) {
        return "****";
      }
      return "*".repeat(apiKey.length() - 4) + apiKey.substring(apiKey.length() - 4);
    }
  }

  public static class Cors {
    /** Origins allowed to call the read endpoints. */
    private List<String> allowedOrigins = List.of("*");

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }
}
