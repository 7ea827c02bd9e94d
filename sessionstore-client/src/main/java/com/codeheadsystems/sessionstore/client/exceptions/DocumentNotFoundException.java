package com.codeheadsystems.sessionstore.client.exceptions;

/**
 * The requested document or index does not exist.
 */
public class DocumentNotFoundException extends DocumentStoreException {

  /**
   * Instantiates a new Document not found exception.
   *
   * @param message the message
   */
  public DocumentNotFoundException(final String message) {
    super(message, 404, null);
  }
}
