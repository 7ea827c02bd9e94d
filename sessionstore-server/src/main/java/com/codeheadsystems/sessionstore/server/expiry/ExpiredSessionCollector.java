package com.codeheadsystems.sessionstore.server.expiry;

import com.codeheadsystems.sessionstore.client.model.BulkWriteItem;
import com.codeheadsystems.sessionstore.client.model.BulkWriteResult;
import com.codeheadsystems.sessionstore.client.model.IndexRow;
import com.codeheadsystems.sessionstore.client.store.DocumentStore;
import com.codeheadsystems.sessionstore.server.Futures;
import com.codeheadsystems.sessionstore.server.exceptions.PartialBulkFailureException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reclaims expired session records in batches.
 * <p>
 * One run reads at most {@code maxPerRun} rows from the {@link ExpiryIndex} and deletes them
 * with a single bulk write, each entry pinned to the revision the index reported. Cost is
 * proportional to the number of expired records, not to the number of sessions.
 * <p>
 * Rejected entries (typically a session refreshed between the index read and the delete)
 * fail the run with {@link PartialBulkFailureException}; nothing is retried or rolled back.
 * Failures are reported only through the returned future: a run is usually detached from
 * any request, so it raises no listener signal.
 * <p>
 * The collector owns no thread. Callers or an external scheduler decide when to run it.
 */
public class ExpiredSessionCollector {

  private static final Logger log = LoggerFactory.getLogger(ExpiredSessionCollector.class);

  private final DocumentStore documentStore;
  private final ExpiryIndex expiryIndex;
  private final int maxPerRun;

  /**
   * Instantiates a new Expired session collector.
   *
   * @param documentStore the document store
   * @param expiryIndex   the expiry index
   * @param maxPerRun     the maximum number of records deleted per run
   */
  public ExpiredSessionCollector(final DocumentStore documentStore,
                                 final ExpiryIndex expiryIndex,
                                 final int maxPerRun) {
    this.documentStore = documentStore;
    this.expiryIndex = expiryIndex;
    this.maxPerRun = maxPerRun;
  }

  /**
   * Deletes one batch of expired records.
   *
   * @return the number of records deleted
   */
  public CompletableFuture<Integer> cleanupExpired() {
    return expiryIndex.ensureExists()
        .thenCompose(ignored -> expiryIndex.expired(maxPerRun))
        .thenCompose(this::delete)
        .whenComplete((deleted, error) -> {
          if (error != null) {
            log.warn("cleanupExpired() failed: {}", Futures.unwrap(error).getMessage());
          }
        });
  }

  private CompletableFuture<Integer> delete(final List<IndexRow> rows) {
    if (rows.isEmpty()) {
      log.debug("cleanupExpired(): nothing to delete");
      return CompletableFuture.completedFuture(0);
    }
    List<BulkWriteItem> deletions = rows.stream()
        .map(row -> BulkWriteItem.deletion(row.key(), row.value()))
        .toList();
    log.debug("cleanupExpired(): bulk deleting {} expired sessions", deletions.size());
    return documentStore.bulkWrite(deletions)
        .thenApply(results -> {
          List<BulkWriteResult> failures = results.stream()
              .filter(result -> !result.isSuccess())
              .toList();
          int deleted = results.size() - failures.size();
          if (!failures.isEmpty()) {
            failures.forEach(failure -> log.trace("cleanupExpired(): {} rejected: {} {}",
                failure.id(), failure.error(), failure.reason()));
            throw new PartialBulkFailureException(failures, deleted);
          }
          return deleted;
        });
  }
}
