package com.codeheadsystems.sessionstore.server.exceptions;

/**
 * A session could not be converted to or from its stored document.
 */
public class SessionCodecException extends SessionStoreException {

  /**
   * Instantiates a new Session codec exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SessionCodecException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
