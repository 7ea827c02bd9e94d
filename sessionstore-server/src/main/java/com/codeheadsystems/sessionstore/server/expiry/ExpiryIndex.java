package com.codeheadsystems.sessionstore.server.expiry;

import com.codeheadsystems.sessionstore.client.exceptions.DocumentNotFoundException;
import com.codeheadsystems.sessionstore.client.model.IndexDefinition;
import com.codeheadsystems.sessionstore.client.model.IndexRow;
import com.codeheadsystems.sessionstore.client.store.DocumentStore;
import com.codeheadsystems.sessionstore.server.Futures;
import com.codeheadsystems.sessionstore.server.codec.SessionRecordCodec;
import com.codeheadsystems.sessionstore.server.config.SessionStoreConfig;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The store-side index of logically expired session records.
 * <p>
 * The index is maintained by the store's indexing engine, so it is an eventually consistent
 * view: a row means "expired when the engine last evaluated it", not "expired now". Each row
 * is keyed by document id and carries the revision seen at evaluation time.
 * <p>
 * The index is created on first use. Creation is idempotent at the store, so concurrent
 * bootstraps from several processes are harmless.
 */
public class ExpiryIndex {

  private static final Logger log = LoggerFactory.getLogger(ExpiryIndex.class);

  private final DocumentStore documentStore;
  private final IndexDefinition definition;

  /**
   * Instantiates a new Expiry index.
   *
   * @param documentStore the document store
   * @param config        the config naming the index
   */
  public ExpiryIndex(final DocumentStore documentStore, final SessionStoreConfig config) {
    this.documentStore = documentStore;
    this.definition = new IndexDefinition(config.expiryIndexDesignName(), config.expiryIndexName(),
        SessionRecordCodec.MODIFIED_FIELD, SessionRecordCodec.TTL_FIELD);
  }

  /**
   * The index definition shipped to the store.
   *
   * @return the index definition
   */
  public IndexDefinition definition() {
    return definition;
  }

  /**
   * Makes sure the index exists, creating it if the store reports it missing.
   *
   * @return completion
   */
  public CompletableFuture<Void> ensureExists() {
    return documentStore.queryIndex(definition.designName(), definition.indexName(), 0)
        .<Void>thenApply(ignored -> null)
        .exceptionallyCompose(error -> {
          Throwable cause = Futures.unwrap(error);
          if (!(cause instanceof DocumentNotFoundException)) {
            return CompletableFuture.failedFuture(cause);
          }
          log.info("Expiry index {}/{} does not exist, creating it",
              definition.designName(), definition.indexName());
          return documentStore.createIndex(definition);
        });
  }

  /**
   * Reads up to {@code limit} expired entries.
   *
   * @param limit the limit
   * @return rows keyed by document id, valued by revision
   */
  public CompletableFuture<List<IndexRow>> expired(final int limit) {
    return documentStore.queryIndex(definition.designName(), definition.indexName(), limit)
        .thenApply(result -> {
          log.trace("expired(limit={}): {} of {} rows", limit, result.rows().size(), result.totalRows());
          return result.rows();
        });
  }
}
