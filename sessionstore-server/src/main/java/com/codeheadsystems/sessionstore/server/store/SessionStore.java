package com.codeheadsystems.sessionstore.server.store;

import com.codeheadsystems.sessionstore.model.Session;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Session persistence contract expected by the host framework.
 * <p>
 * The future-returning methods are the primary API. The callback overloads adapt them for
 * frameworks that expect a completion callback; they add no behaviour of their own.
 * <p>
 * Implementations must be thread-safe.
 */
public interface SessionStore {

  /**
   * Loads a session. A missing or expired session is an empty result, not a failure.
   *
   * @param sessionId the session id
   * @return the session, or empty
   */
  CompletableFuture<Optional<Session>> get(String sessionId);

  /**
   * Creates or replaces a session.
   *
   * @param sessionId the session id
   * @param session   the session
   * @return completion
   */
  CompletableFuture<Void> set(String sessionId, Session session);

  /**
   * Deletes a session. Fails if the session does not exist.
   *
   * @param sessionId the session id
   * @return completion
   */
  CompletableFuture<Void> destroy(String sessionId);

  /**
   * Restarts a session's time-to-live without changing its content. Fails if the session
   * does not exist. A session that has expired but is still stored is brought back to life.
   *
   * @param sessionId the session id
   * @param session   the caller's view of the session, used for its cookie max-age
   * @return completion
   */
  CompletableFuture<Void> touch(String sessionId, Session session);

  /**
   * Callback form of {@link #get(String)}; the result is {@code null} when not found.
   *
   * @param sessionId the session id
   * @param callback  the callback
   */
  default void get(String sessionId, SessionCallback<Session> callback) {
    SessionCallback.bind(get(sessionId).thenApply(found -> found.orElse(null)), callback);
  }

  /**
   * Callback form of {@link #set(String, Session)}.
   *
   * @param sessionId the session id
   * @param session   the session
   * @param callback  the callback
   */
  default void set(String sessionId, Session session, SessionCallback<Void> callback) {
    SessionCallback.bind(set(sessionId, session), callback);
  }

  /**
   * Callback form of {@link #destroy(String)}.
   *
   * @param sessionId the session id
   * @param callback  the callback
   */
  default void destroy(String sessionId, SessionCallback<Void> callback) {
    SessionCallback.bind(destroy(sessionId), callback);
  }

  /**
   * Callback form of {@link #touch(String, Session)}.
   *
   * @param sessionId the session id
   * @param session   the session
   * @param callback  the callback
   */
  default void touch(String sessionId, Session session, SessionCallback<Void> callback) {
    SessionCallback.bind(touch(sessionId, session), callback);
  }
}
