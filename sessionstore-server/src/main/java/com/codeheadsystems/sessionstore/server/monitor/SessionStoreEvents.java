package com.codeheadsystems.sessionstore.server.monitor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches signals to registered {@link SessionStoreListener}s.
 * <p>
 * A listener that throws is logged and skipped; it never affects the operation that raised
 * the signal or the other listeners.
 */
public class SessionStoreEvents {

  private static final Logger log = LoggerFactory.getLogger(SessionStoreEvents.class);

  private final List<SessionStoreListener> listeners = new CopyOnWriteArrayList<>();

  /**
   * Registers a listener.
   *
   * @param listener the listener
   */
  public void addListener(final SessionStoreListener listener) {
    listeners.add(listener);
  }

  /**
   * Unregisters a listener.
   *
   * @param listener the listener
   */
  public void removeListener(final SessionStoreListener listener) {
    listeners.remove(listener);
  }

  /**
   * Fire connect.
   */
  public void fireConnect() {
    dispatch("connect", SessionStoreListener::onConnect);
  }

  /**
   * Fire disconnect.
   *
   * @param cause the cause
   */
  public void fireDisconnect(final Throwable cause) {
    dispatch("disconnect", listener -> listener.onDisconnect(cause));
  }

  /**
   * Fire error.
   *
   * @param error the error
   */
  public void fireError(final Throwable error) {
    dispatch("error", listener -> listener.onError(error));
  }

  private void dispatch(final String signal, final Consumer<SessionStoreListener> action) {
    for (SessionStoreListener listener : listeners) {
      try {
        action.accept(listener);
      } catch (RuntimeException e) {
        log.warn("Listener {} failed handling '{}' signal", listener, signal, e);
      }
    }
  }
}
