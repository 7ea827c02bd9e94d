package com.codeheadsystems.sessionstore.dropwizard.lifecycle;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.sessionstore.server.exceptions.PartialBulkFailureException;
import com.codeheadsystems.sessionstore.server.store.DocumentSessionStore;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Expired session cleanup task test.
 */
@ExtendWith(MockitoExtension.class)
class ExpiredSessionCleanupTaskTest {

  @Mock private DocumentSessionStore sessionStore;

  /**
   * Started task runs cleanup repeatedly until stopped.
   */
  @Test
  void start_runsCleanupOnSchedule() {
    when(sessionStore.cleanupExpired()).thenReturn(CompletableFuture.completedFuture(3));
    ExpiredSessionCleanupTask task = new ExpiredSessionCleanupTask(sessionStore, Duration.ofMillis(10));

    task.start();
    try {
      verify(sessionStore, timeout(2_000).atLeast(2)).cleanupExpired();
    } finally {
      task.stop();
    }
  }

  /**
   * A failed run is absorbed.
   */
  @Test
  void runOnce_failure_isAbsorbed() {
    when(sessionStore.cleanupExpired()).thenReturn(
        CompletableFuture.failedFuture(new PartialBulkFailureException(List.of(), 0)));
    ExpiredSessionCleanupTask task = new ExpiredSessionCleanupTask(sessionStore, Duration.ofMinutes(1));

    assertThatCode(task::runOnce).doesNotThrowAnyException();
    verify(sessionStore, atLeast(1)).cleanupExpired();
  }

  /**
   * Non-positive intervals are rejected.
   */
  @Test
  void constructor_nonPositiveInterval_rejected() {
    assertThatThrownBy(() -> new ExpiredSessionCleanupTask(sessionStore, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
