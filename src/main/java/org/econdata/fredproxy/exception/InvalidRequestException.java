package org.econdata.fredproxy.exception;

/** Raised when request parameters are well-formed but inconsistent. */
public class InvalidRequestException extends ServiceException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
