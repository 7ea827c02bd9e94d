package com.codeheadsystems.sessionstore.client.exceptions;

/**
 * A write carried a revision that is no longer the current one, or tried to create a
 * document that already exists.
 */
public class RevisionConflictException extends DocumentStoreException {

  /**
   * Instantiates a new Revision conflict exception.
   *
   * @param message the message
   */
  public RevisionConflictException(final String message) {
    super(message, 409, null);
  }
}
