package org.econdata.fredproxy.exception;

/**
 * Raised when the FRED API cannot satisfy a request.
 *
 * <p>Covers transport failures, timeouts, non-success HTTP statuses and FRED error payloads (which
 * FRED may send with HTTP 200). The status code is the most specific one available: the FRED
 * {@code error_code} when present, otherwise the HTTP status, otherwise a synthetic 503 for
 * transport failures. It is forwarded verbatim to API callers.
 */
public class FredApiException extends ServiceException {

  private static final int FALLBACK_STATUS = 500;

  private final int statusCode;

  public FredApiException(int statusCode, String message) {
    super(message);
    this.statusCode = sanitize(statusCode);
  }

  public FredApiException(int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = sanitize(statusCode);
  }

  public int getStatusCode() {
    return statusCode;
  }

  private static int sanitize(int statusCode) {
    return statusCode >= 100 && statusCode <= 599 ? statusCode : FALLBACK_STATUS;
  }
}
