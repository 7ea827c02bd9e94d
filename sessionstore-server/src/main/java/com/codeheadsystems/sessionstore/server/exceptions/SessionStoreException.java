package com.codeheadsystems.sessionstore.server.exceptions;

/**
 * Base type for failures raised by the session layer itself (as opposed to failures
 * passed through from the document store).
 */
public class SessionStoreException extends RuntimeException {

  /**
   * Instantiates a new Session store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SessionStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
