package com.codeheadsystems.sessionstore.server.exceptions;

/**
 * An explicit {@code touch} or {@code destroy} addressed a session that does not exist.
 */
public class SessionNotFoundException extends SessionStoreException {

  private final String sessionId;

  /**
   * Instantiates a new Session not found exception.
   *
   * @param sessionId the session id
   * @param cause     the cause
   */
  public SessionNotFoundException(final String sessionId, final Throwable cause) {
    super("Session not found: " + sessionId, cause);
    this.sessionId = sessionId;
  }

  /**
   * Session id.
   *
   * @return the string
   */
  public String sessionId() {
    return sessionId;
  }
}
