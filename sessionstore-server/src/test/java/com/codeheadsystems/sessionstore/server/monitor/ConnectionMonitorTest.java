package com.codeheadsystems.sessionstore.server.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.sessionstore.client.exceptions.StoreUnavailableException;
import com.codeheadsystems.sessionstore.client.model.DatabaseInfo;
import com.codeheadsystems.sessionstore.client.store.DocumentStore;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Connection monitor test.
 */
@ExtendWith(MockitoExtension.class)
class ConnectionMonitorTest {

  @Mock private DocumentStore documentStore;

  private final List<String> signals = new CopyOnWriteArrayList<>();
  private final List<Throwable> causes = new CopyOnWriteArrayList<>();
  private ConnectionMonitor monitor;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    SessionStoreEvents events = new SessionStoreEvents();
    events.addListener(new SessionStoreListener() {
      @Override
      public void onConnect() {
        signals.add("connect");
      }

      @Override
      public void onDisconnect(Throwable cause) {
        signals.add("disconnect");
        causes.add(cause);
      }

      @Override
      public void onError(Throwable error) {
        signals.add("error");
      }
    });
    monitor = new ConnectionMonitor(documentStore, events);
  }

  /**
   * Reachable store signals connect.
   */
  @Test
  void checkConnection_reachable_signalsConnect() {
    when(documentStore.info()).thenReturn(CompletableFuture.completedFuture(new DatabaseInfo("sessions", 12)));

    assertThat(monitor.checkConnection().join()).isTrue();
    assertThat(signals).containsExactly("connect");
  }

  /**
   * Unreachable store signals disconnect and still completes normally.
   */
  @Test
  void checkConnection_unreachable_signalsDisconnect() {
    StoreUnavailableException failure = new StoreUnavailableException("refused", new IOException("refused"));
    when(documentStore.info()).thenReturn(CompletableFuture.failedFuture(failure));

    assertThat(monitor.checkConnection().join()).isFalse();
    assertThat(signals).containsExactly("disconnect");
    assertThat(causes).containsExactly(failure);
  }
}
