package org.econdata.fredproxy.exception;

/** Raised when the local observation cache cannot be read or written. */
public class StorageException extends ServiceException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
