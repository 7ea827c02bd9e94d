package com.codeheadsystems.sessionstore.client.store;

import com.codeheadsystems.sessionstore.client.exceptions.DocumentNotFoundException;
import com.codeheadsystems.sessionstore.client.exceptions.RevisionConflictException;
import com.codeheadsystems.sessionstore.client.model.BulkWriteItem;
import com.codeheadsystems.sessionstore.client.model.BulkWriteResult;
import com.codeheadsystems.sessionstore.client.model.DatabaseInfo;
import com.codeheadsystems.sessionstore.client.model.IndexDefinition;
import com.codeheadsystems.sessionstore.client.model.IndexQueryResult;
import com.codeheadsystems.sessionstore.client.model.IndexRow;
import com.codeheadsystems.sessionstore.client.model.StoredDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DocumentStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Revisions follow the {@code <generation>-<hex>} shape and every write bumps the generation.
 * Index definitions are evaluated against the injected {@link Clock} when queried, so the
 * result reflects "now" at query time. All futures are returned already completed.
 * <p>
 * All documents are lost on restart. Suitable for development and testing only.
 */
public class InMemoryDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

  private final String name;
  private final Clock clock;
  private final ConcurrentHashMap<String, StoredDocument> documents = new ConcurrentHashMap<>();
  // Keyed by "<design>/<index>".
  private final ConcurrentHashMap<String, IndexDefinition> indexes = new ConcurrentHashMap<>();

  /**
   * Instantiates a new In memory document store using the system clock.
   *
   * @param name the database name reported by {@link #info()}
   */
  public InMemoryDocumentStore(final String name) {
    this(name, Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory document store.
   *
   * @param name  the database name reported by {@link #info()}
   * @param clock the clock used to evaluate expiry indexes
   */
  public InMemoryDocumentStore(final String name, final Clock clock) {
    log.warn("Using InMemoryDocumentStore({}); documents will NOT survive restarts. "
        + "Replace with a persistent DocumentStore for production.", name);
    this.name = name;
    this.clock = clock;
  }

  @Override
  public CompletableFuture<StoredDocument> get(final String id) {
    StoredDocument document = documents.get(id);
    if (document == null) {
      return CompletableFuture.failedFuture(new DocumentNotFoundException("missing: " + id));
    }
    return CompletableFuture.completedFuture(copyOf(document));
  }

  @Override
  public CompletableFuture<String> put(final String id, final String revision, final ObjectNode body) {
    try {
      StoredDocument written = documents.compute(id, (key, current) -> {
        if (current == null && revision != null) {
          throw new RevisionConflictException("Document update conflict: " + id + " does not exist");
        }
        if (current != null && !current.revision().equals(revision)) {
          throw new RevisionConflictException("Document update conflict: " + id);
        }
        return new StoredDocument(id, nextRevision(current), stripReserved(body));
      });
      log.trace("put({}) -> {}", id, written.revision());
      return CompletableFuture.completedFuture(written.revision());
    } catch (RevisionConflictException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public CompletableFuture<Void> remove(final String id, final String revision) {
    BulkWriteResult result = delete(id, revision);
    if (result.isSuccess()) {
      return CompletableFuture.completedFuture(null);
    }
    if ("not_found".equals(result.error())) {
      return CompletableFuture.failedFuture(new DocumentNotFoundException("missing: " + id));
    }
    return CompletableFuture.failedFuture(new RevisionConflictException("Document update conflict: " + id));
  }

  @Override
  public CompletableFuture<List<BulkWriteResult>> bulkWrite(final List<BulkWriteItem> items) {
    List<BulkWriteResult> results = new ArrayList<>(items.size());
    for (BulkWriteItem item : items) {
      if (!item.deleted()) {
        results.add(BulkWriteResult.rejected(item.id(), "forbidden", "only deletions are supported"));
        continue;
      }
      results.add(delete(item.id(), item.revision()));
    }
    return CompletableFuture.completedFuture(results);
  }

  @Override
  public CompletableFuture<IndexQueryResult> queryIndex(final String designName,
                                                        final String indexName,
                                                        final int limit) {
    IndexDefinition definition = indexes.get(designName + "/" + indexName);
    if (definition == null) {
      return CompletableFuture.failedFuture(
          new DocumentNotFoundException("missing index: " + designName + "/" + indexName));
    }
    long now = clock.millis();
    List<IndexRow> rows = documents.values().stream()
        .filter(document -> selects(definition, document.body(), now))
        .sorted(Comparator.comparing(StoredDocument::id))
        .map(document -> new IndexRow(document.id(), document.id(), document.revision()))
        .toList();
    List<IndexRow> page = rows.subList(0, Math.min(Math.max(limit, 0), rows.size()));
    return CompletableFuture.completedFuture(new IndexQueryResult(rows.size(), 0, page));
  }

  @Override
  public CompletableFuture<Void> createIndex(final IndexDefinition definition) {
    IndexDefinition existing = indexes.putIfAbsent(
        definition.designName() + "/" + definition.indexName(), definition);
    if (existing == null) {
      log.debug("createIndex({}/{})", definition.designName(), definition.indexName());
    }
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<DatabaseInfo> info() {
    return CompletableFuture.completedFuture(new DatabaseInfo(name, documents.size()));
  }

  /**
   * Whether a document currently exists, bypassing any expiry semantics.
   *
   * @param id the document identifier
   * @return true if present
   */
  public boolean contains(final String id) {
    return documents.containsKey(id);
  }

  private BulkWriteResult delete(final String id, final String revision) {
    BulkWriteResult[] outcome = new BulkWriteResult[1];
    documents.computeIfPresent(id, (key, current) -> {
      if (!current.revision().equals(revision)) {
        outcome[0] = BulkWriteResult.rejected(id, "conflict", "Document update conflict.");
        return current;
      }
      outcome[0] = BulkWriteResult.ok(id, nextRevision(current));
      return null;
    });
    return outcome[0] != null ? outcome[0] : BulkWriteResult.rejected(id, "not_found", "missing");
  }

  private static boolean selects(final IndexDefinition definition, final ObjectNode body, final long now) {
    JsonNode timestamp = body.get(definition.timestampField());
    JsonNode ttl = body.get(definition.ttlField());
    if (timestamp == null || ttl == null || !timestamp.isNumber() || !ttl.isNumber()) {
      return false;
    }
    return now > timestamp.asLong() + ttl.asLong() * 1000L;
  }

  private static String nextRevision(final StoredDocument current) {
    long generation = current == null ? 1 : Long.parseLong(current.revision().split("-", 2)[0]) + 1;
    return generation + "-" + UUID.randomUUID().toString().replace("-", "");
  }

  private static ObjectNode stripReserved(final ObjectNode body) {
    ObjectNode copy = Objects.requireNonNull(body, "body").deepCopy();
    copy.remove("_id");
    copy.remove("_rev");
    return copy;
  }

  private static StoredDocument copyOf(final StoredDocument document) {
    return new StoredDocument(document.id(), document.revision(), document.body().deepCopy());
  }
}
