package com.codeheadsystems.sessionstore.server.monitor;

import com.codeheadsystems.sessionstore.client.store.DocumentStore;
import com.codeheadsystems.sessionstore.server.Futures;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks store reachability and raises connect/disconnect signals.
 * <p>
 * Purely observational: the returned future always completes normally, with {@code true}
 * when the store answered.
 */
public class ConnectionMonitor {

  private static final Logger log = LoggerFactory.getLogger(ConnectionMonitor.class);

  private final DocumentStore documentStore;
  private final SessionStoreEvents events;

  /**
   * Instantiates a new Connection monitor.
   *
   * @param documentStore the document store
   * @param events        the events
   */
  public ConnectionMonitor(final DocumentStore documentStore, final SessionStoreEvents events) {
    this.documentStore = documentStore;
    this.events = events;
  }

  /**
   * Issues a metadata request.
   *
   * @return whether the store is reachable
   */
  public CompletableFuture<Boolean> checkConnection() {
    return documentStore.info()
        .handle((info, error) -> {
          if (error == null) {
            log.debug("checkConnection(): reachable, database={} documents={}", info.name(), info.documentCount());
            events.fireConnect();
            return true;
          }
          Throwable cause = Futures.unwrap(error);
          log.warn("Database is not reachable: {}", cause.getMessage(), cause);
          events.fireDisconnect(cause);
          return false;
        });
  }
}
