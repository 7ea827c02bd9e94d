package com.codeheadsystems.sessionstore.server.monitor;

/**
 * Observer of store-level signals. All methods default to no-ops.
 */
public interface SessionStoreListener {

  /**
   * The store answered a reachability check.
   */
  default void onConnect() {
  }

  /**
   * The store failed a reachability check.
   *
   * @param cause the failure
   */
  default void onDisconnect(Throwable cause) {
  }

  /**
   * A session operation failed for a reason other than a missing session. Fired before the
   * operation's own result completes.
   *
   * @param error the failure
   */
  default void onError(Throwable error) {
  }
}
