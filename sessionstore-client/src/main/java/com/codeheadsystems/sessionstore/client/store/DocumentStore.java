package com.codeheadsystems.sessionstore.client.store;

import com.codeheadsystems.sessionstore.client.model.BulkWriteItem;
import com.codeheadsystems.sessionstore.client.model.BulkWriteResult;
import com.codeheadsystems.sessionstore.client.model.DatabaseInfo;
import com.codeheadsystems.sessionstore.client.model.IndexDefinition;
import com.codeheadsystems.sessionstore.client.model.IndexQueryResult;
import com.codeheadsystems.sessionstore.client.model.StoredDocument;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous, revision-versioned key/value document store.
 * <p>
 * Every write is assigned a new opaque revision token. Updates and deletes must present the
 * current revision; a stale revision fails with
 * {@link com.codeheadsystems.sessionstore.client.exceptions.RevisionConflictException}.
 * Missing documents and indexes fail with
 * {@link com.codeheadsystems.sessionstore.client.exceptions.DocumentNotFoundException}.
 * Connectivity failures surface as
 * {@link com.codeheadsystems.sessionstore.client.exceptions.StoreUnavailableException}.
 * <p>
 * Implementations must be thread-safe. Each returned future completes exactly once, either
 * with a value or with one of the exceptions above.
 */
public interface DocumentStore {

  /**
   * Reads a document.
   *
   * @param id the document identifier
   * @return the document with its current revision
   */
  CompletableFuture<StoredDocument> get(String id);

  /**
   * Creates or updates a document.
   *
   * @param id       the document identifier
   * @param revision the current revision for an update, {@code null} to create
   * @param body     the document content; reserved {@code _id}/{@code _rev} fields are ignored
   * @return the new revision
   */
  CompletableFuture<String> put(String id, String revision, ObjectNode body);

  /**
   * Deletes a document.
   *
   * @param id       the document identifier
   * @param revision the current revision
   * @return completion
   */
  CompletableFuture<Void> remove(String id, String revision);

  /**
   * Applies several writes in one request. Entries succeed or fail independently.
   *
   * @param items the writes
   * @return one result per item, in request order
   */
  CompletableFuture<List<BulkWriteResult>> bulkWrite(List<BulkWriteItem> items);

  /**
   * Queries a secondary index.
   *
   * @param designName the index container name
   * @param indexName  the index name
   * @param limit      maximum number of rows to return, 0 to only check existence
   * @return the matching rows ordered by key
   */
  CompletableFuture<IndexQueryResult> queryIndex(String designName, String indexName, int limit);

  /**
   * Creates a secondary index. Creating an index that already exists succeeds.
   *
   * @param definition the index definition
   * @return completion
   */
  CompletableFuture<Void> createIndex(IndexDefinition definition);

  /**
   * Lightweight metadata request.
   *
   * @return database metadata
   */
  CompletableFuture<DatabaseInfo> info();
}
