package org.econdata.fredproxy.exception;

/** Raised when a requested resource does not exist upstream. */
public class ResourceNotFoundException extends ServiceException {

  public ResourceNotFoundException(String message) {
    super(message);
  }
}
