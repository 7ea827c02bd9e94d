package com.codeheadsystems.sessionstore.client.exceptions;

/**
 * Base type for failures reported by a {@code DocumentStore}.
 */
public class DocumentStoreException extends RuntimeException {

  private final int statusCode;

  /**
   * Instantiates a new Document store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DocumentStoreException(final String message, final Throwable cause) {
    this(message, 0, cause);
  }

  /**
   * Instantiates a new Document store exception.
   *
   * @param message    the message
   * @param statusCode the HTTP status reported by the store, 0 when not applicable
   * @param cause      the cause
   */
  public DocumentStoreException(final String message, final int statusCode, final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * Status code reported by the store, or 0.
   *
   * @return the status code
   */
  public int statusCode() {
    return statusCode;
  }
}
