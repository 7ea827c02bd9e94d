package com.codeheadsystems.sessionstore.dropwizard.lifecycle;

import com.codeheadsystems.sessionstore.server.Futures;
import com.codeheadsystems.sessionstore.server.store.DocumentSessionStore;
import io.dropwizard.lifecycle.Managed;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link DocumentSessionStore#cleanupExpired()} at a fixed delay while the application
 * is running.
 * <p>
 * A failed run is logged and the schedule continues; the next run picks up whatever is still
 * expired. Register with {@code environment.lifecycle().manage(task)}.
 */
public class ExpiredSessionCleanupTask implements Managed {

  private static final Logger log = LoggerFactory.getLogger(ExpiredSessionCleanupTask.class);

  private final DocumentSessionStore sessionStore;
  private final Duration interval;
  private final ScheduledExecutorService scheduler =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "expired-session-cleanup");
        t.setDaemon(true);
        return t;
      });

  /**
   * Instantiates a new Expired session cleanup task.
   *
   * @param sessionStore the session store
   * @param interval     delay between the end of one run and the start of the next
   */
  public ExpiredSessionCleanupTask(DocumentSessionStore sessionStore, Duration interval) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
    this.sessionStore = sessionStore;
    this.interval = interval;
  }

  @Override
  public void start() {
    log.info("Scheduling expired session cleanup every {}", interval);
    scheduler.scheduleWithFixedDelay(this::runOnce, interval.toMillis(), interval.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  @Override
  public void stop() {
    scheduler.shutdown();
  }

  // Blocks the scheduler thread until the run finishes so runs never overlap.
  void runOnce() {
    try {
      int deleted = sessionStore.cleanupExpired().join();
      if (deleted > 0) {
        log.info("Removed {} expired sessions", deleted);
      }
    } catch (RuntimeException e) {
      log.warn("Expired session cleanup failed: {}", Futures.unwrap(e).getMessage());
    }
  }
}
