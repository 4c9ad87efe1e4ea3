package org.econdata.fredproxy.api;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.econdata.fredproxy.api.response.ApiErrorResponse;
import org.econdata.fredproxy.api.response.ApiErrorType;
import org.econdata.fredproxy.exception.FredApiException;
import org.econdata.fredproxy.exception.InvalidRequestException;
import org.econdata.fredproxy.exception.ResourceNotFoundException;
import org.econdata.fredproxy.exception.StorageException;

/** Maps exceptions raised while serving a request to an {@link ApiErrorResponse}. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(FredApiException.class)
  public ResponseEntity<ApiErrorResponse> handleFredApi(
      FredApiException ex, HttpServletRequest request) {
    return build(ex.getStatusCode(), ApiErrorType.UPSTREAM_ERROR, "FRED_API_ERROR", ex, request);
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(
      ResourceNotFoundException ex, HttpServletRequest request) {
    return build(
        HttpStatus.NOT_FOUND.value(), ApiErrorType.NOT_FOUND, "SERIES_NOT_FOUND", ex, request);
  }

  @ExceptionHandler({
    InvalidRequestException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(
      Exception ex, HttpServletRequest request) {
    return build(
        HttpStatus.BAD_REQUEST.value(),
        ApiErrorType.INVALID_REQUEST,
        "INVALID_REQUEST",
        ex,
        request);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ApiErrorResponse> handleStorage(
      StorageException ex, HttpServletRequest request) {
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR.value(),
        ApiErrorType.STORAGE_ERROR,
        "STORAGE_ERROR",
        ex,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleServerError(
      Exception ex, HttpServletRequest request) {
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR.value(),
        ApiErrorType.INTERNAL_ERROR,
        "INTERNAL_ERROR",
        ex,
        request);
  }

  private ResponseEntity<ApiErrorResponse> build(
      int status, ApiErrorType type, String code, Exception ex, HttpServletRequest request) {
    var message = ex.getMessage();
    if (message == null || message.isBlank()) {
      message = ex.getClass().getSimpleName();
    }

    logException(status, message, ex, request);

    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ApiErrorResponse(type, message, code));
  }

  private void logException(
      int status, String message, Exception ex, HttpServletRequest request) {
    var uriWithQuery = getRequestUriWithQuery(request);

    if (status >= 500) {
      log.error(
          "Request {} {} failed with status {}: {}",
          request.getMethod(),
          uriWithQuery,
          status,
          message,
          ex);
    } else {
      log.warn(
          "Request {} {} returned status {}: {}",
          request.getMethod(),
          uriWithQuery,
          status,
          message);
    }
  }

  private String getRequestUriWithQuery(HttpServletRequest request) {
    var queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }
}
