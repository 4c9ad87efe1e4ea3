package org.econdata.fredproxy.api.response;

/** Category of an error response. */
public enum ApiErrorType {
  INVALID_REQUEST,
  NOT_FOUND,
  UPSTREAM_ERROR,
  STORAGE_ERROR,
  INTERNAL_ERROR
}
