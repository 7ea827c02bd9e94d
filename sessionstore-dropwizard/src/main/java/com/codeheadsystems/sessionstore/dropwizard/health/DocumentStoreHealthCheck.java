package com.codeheadsystems.sessionstore.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.sessionstore.client.model.DatabaseInfo;
import com.codeheadsystems.sessionstore.client.store.DocumentStore;
import com.codeheadsystems.sessionstore.server.Futures;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Health check that queries the session database with a metadata request.
 */
public class DocumentStoreHealthCheck extends HealthCheck {

  private final DocumentStore documentStore;
  private final Duration timeout;

  /**
   * Instantiates a new Document store health check.
   *
   * @param documentStore the document store
   * @param timeout       how long to wait for the check
   */
  public DocumentStoreHealthCheck(DocumentStore documentStore, Duration timeout) {
    this.documentStore = documentStore;
    this.timeout = timeout;
  }

  @Override
  protected Result check() throws Exception {
    try {
      DatabaseInfo info = documentStore.info().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return Result.healthy("database=%s documents=%d", info.name(), info.documentCount());
    } catch (ExecutionException e) {
      return Result.unhealthy(Futures.unwrap(e));
    } catch (TimeoutException e) {
      return Result.unhealthy("Database did not answer within %d ms", timeout.toMillis());
    }
  }
}
