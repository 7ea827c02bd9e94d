package com.codeheadsystems.sessionstore.client.exceptions;

/**
 * The store could not be reached.
 */
public class StoreUnavailableException extends DocumentStoreException {

  /**
   * Instantiates a new Store unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StoreUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
