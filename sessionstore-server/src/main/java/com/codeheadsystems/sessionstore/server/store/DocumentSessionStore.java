package com.codeheadsystems.sessionstore.server.store;

import com.codeheadsystems.sessionstore.client.accessor.CouchDbDocumentStore;
import com.codeheadsystems.sessionstore.client.exceptions.DocumentNotFoundException;
import com.codeheadsystems.sessionstore.client.exceptions.RevisionConflictException;
import com.codeheadsystems.sessionstore.client.model.DatabaseConnectionInfo;
import com.codeheadsystems.sessionstore.client.model.StoredDocument;
import com.codeheadsystems.sessionstore.client.store.DocumentStore;
import com.codeheadsystems.sessionstore.model.Session;
import com.codeheadsystems.sessionstore.server.Futures;
import com.codeheadsystems.sessionstore.server.codec.SessionRecordCodec;
import com.codeheadsystems.sessionstore.server.codec.TtlPolicy;
import com.codeheadsystems.sessionstore.server.config.SessionStoreConfig;
import com.codeheadsystems.sessionstore.server.exceptions.SessionNotFoundException;
import com.codeheadsystems.sessionstore.server.expiry.ExpiredSessionCollector;
import com.codeheadsystems.sessionstore.server.expiry.ExpiryIndex;
import com.codeheadsystems.sessionstore.server.model.SessionRecord;
import com.codeheadsystems.sessionstore.server.monitor.ConnectionMonitor;
import com.codeheadsystems.sessionstore.server.monitor.SessionStoreEvents;
import com.codeheadsystems.sessionstore.server.monitor.SessionStoreListener;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Inject;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStore} persisting sessions in a revision-versioned {@link DocumentStore}.
 * <p>
 * <strong>Concurrency:</strong> operations on the same session are not serialized here.
 * Every mutation reads the current revision and writes against it, so of two racing writers
 * one wins and the other fails with {@link RevisionConflictException}. Conflicts are never
 * retried. Fields of a stored document that do not belong to the session are kept across
 * writes.
 * <p>
 * <strong>Expiry:</strong> a record read after {@code modified + ttl} is reported as missing
 * and its expired revision is deleted on the spot, unless a writer has replaced it meanwhile.
 * Bulk reclamation of records nobody reads is done by {@link #cleanupExpired()}.
 * <p>
 * <strong>Failures:</strong> a missing session is either an empty result ({@code get}) or a
 * {@link SessionNotFoundException} ({@code touch}, {@code destroy}). Every other failure is
 * also announced to {@link SessionStoreListener#onError} before the returned future completes.
 */
public class DocumentSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(DocumentSessionStore.class);

  private final DocumentStore documentStore;
  private final SessionStoreConfig config;
  private final Clock clock;
  private final TtlPolicy ttlPolicy;
  private final SessionRecordCodec codec;
  private final SessionStoreEvents events;
  private final ConnectionMonitor connectionMonitor;
  private final ExpiredSessionCollector expiredSessionCollector;

  /**
   * Connects to {@link SessionStoreConfig#databaseUri()} with a store of its own.
   *
   * @param config the config
   */
  public DocumentSessionStore(final SessionStoreConfig config) {
    this(config, new CouchDbDocumentStore(HttpClient.newHttpClient(), new ObjectMapper(),
        new DatabaseConnectionInfo(config.databaseUri())));
  }

  /**
   * Reuses a caller-supplied store handle.
   *
   * @param config        the config
   * @param documentStore the document store
   */
  @Inject
  public DocumentSessionStore(final SessionStoreConfig config, final DocumentStore documentStore) {
    this(config, documentStore, new ObjectMapper(), Clock.systemUTC());
  }

  /**
   * Instantiates a new Document session store.
   *
   * @param config        the config
   * @param documentStore the document store
   * @param objectMapper  the object mapper used for session documents
   * @param clock         the clock stamping writes and evaluating expiry
   */
  public DocumentSessionStore(final SessionStoreConfig config,
                              final DocumentStore documentStore,
                              final ObjectMapper objectMapper,
                              final Clock clock) {
    log.info("DocumentSessionStore({})", config);
    this.documentStore = documentStore;
    this.config = config;
    this.clock = clock;
    this.ttlPolicy = new TtlPolicy(config.ttlOverrideSeconds());
    this.codec = new SessionRecordCodec(objectMapper, clock);
    this.events = new SessionStoreEvents();
    this.connectionMonitor = new ConnectionMonitor(documentStore, events);
    this.expiredSessionCollector = new ExpiredSessionCollector(documentStore,
        new ExpiryIndex(documentStore, config), config.maxExpiredPerCleanup());
  }

  // ── Signals ───────────────────────────────────────────────────────────────

  /**
   * Registers a listener for connect, disconnect and error signals.
   *
   * @param listener the listener
   */
  public void addListener(final SessionStoreListener listener) {
    events.addListener(listener);
  }

  /**
   * Unregisters a listener.
   *
   * @param listener the listener
   */
  public void removeListener(final SessionStoreListener listener) {
    events.removeListener(listener);
  }

  // ── Lifecycle ─────────────────────────────────────────────────────────────

  @Override
  public CompletableFuture<Optional<Session>> get(final String sessionId) {
    final String id = documentId(sessionId);
    log.debug("get(id={})", id);
    return report("get", id, readDocument(id).thenCompose(existing -> {
      if (existing.isEmpty()) {
        log.debug("get(id={}): not found", id);
        return CompletableFuture.completedFuture(Optional.<Session>empty());
      }
      SessionRecord record = codec.decode(existing.get());
      if (record.isExpiredAt(clock.millis())) {
        log.debug("get(id={}): expired at {}, reclaiming rev={}", id, record.expiresAtMillis(), record.revision());
        return reclaim(id, record.revision()).thenApply(ignored -> Optional.<Session>empty());
      }
      log.debug("get(id={}): found rev={}", id, record.revision());
      return CompletableFuture.completedFuture(Optional.of(record.session()));
    }));
  }

  @Override
  public CompletableFuture<Void> set(final String sessionId, final Session session) {
    final String id = documentId(sessionId);
    final long ttlSeconds = ttlPolicy.ttlSeconds(session);
    log.debug("set(id={}, ttl={})", id, ttlSeconds);
    return report("set", id, readDocument(id)
        .thenCompose(existing -> {
          String revision = existing.map(StoredDocument::revision).orElse(null);
          ObjectNode stored = existing.map(StoredDocument::body).orElse(null);
          SessionRecord record = codec.encode(id, revision, session, ttlSeconds);
          return documentStore.put(id, revision, codec.toDocument(record, stored));
        })
        .thenAccept(revision -> log.debug("set(id={}): stored rev={}", id, revision)));
  }

  @Override
  public CompletableFuture<Void> touch(final String sessionId, final Session session) {
    if (config.isTtlRefreshDisabled()) {
      return CompletableFuture.completedFuture(null);
    }
    final String id = documentId(sessionId);
    final long ttlSeconds = ttlPolicy.ttlSeconds(session);
    log.debug("touch(id={}, ttl={})", id, ttlSeconds);
    return report("touch", id, readDocument(id)
        .thenCompose(existing -> {
          StoredDocument document = existing.orElseThrow(() -> new SessionNotFoundException(sessionId, null));
          SessionRecord current = codec.decode(document);
          SessionRecord refreshed = codec.encode(id, current.revision(), current.session(), ttlSeconds);
          return documentStore.put(id, current.revision(), codec.toDocument(refreshed, document.body()));
        })
        .thenAccept(revision -> log.debug("touch(id={}): stored rev={}", id, revision)));
  }

  @Override
  public CompletableFuture<Void> destroy(final String sessionId) {
    final String id = documentId(sessionId);
    log.debug("destroy(id={})", id);
    return report("destroy", id, remove(id).exceptionallyCompose(error -> {
      Throwable cause = Futures.unwrap(error);
      if (cause instanceof DocumentNotFoundException) {
        return CompletableFuture.failedFuture(new SessionNotFoundException(sessionId, cause));
      }
      return CompletableFuture.failedFuture(cause);
    }));
  }

  // ── Maintenance ───────────────────────────────────────────────────────────

  /**
   * Deletes one batch of expired records, see {@link ExpiredSessionCollector}.
   *
   * @return the number of records deleted
   */
  public CompletableFuture<Integer> cleanupExpired() {
    return expiredSessionCollector.cleanupExpired();
  }

  /**
   * Checks the store and raises a connect or disconnect signal.
   *
   * @return whether the store is reachable
   */
  public CompletableFuture<Boolean> checkConnection() {
    return connectionMonitor.checkConnection();
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private String documentId(final String sessionId) {
    return config.keyPrefix() + Objects.requireNonNull(sessionId, "sessionId");
  }

  private CompletableFuture<Optional<StoredDocument>> readDocument(final String id) {
    return documentStore.get(id)
        .thenApply(Optional::of)
        .exceptionallyCompose(error -> {
          Throwable cause = Futures.unwrap(error);
          if (cause instanceof DocumentNotFoundException) {
            return CompletableFuture.completedFuture(Optional.<StoredDocument>empty());
          }
          return CompletableFuture.failedFuture(cause);
        });
  }

  private CompletableFuture<Void> remove(final String id) {
    return documentStore.get(id)
        .thenCompose(document -> documentStore.remove(id, document.revision()));
  }

  // Deletes only the revision seen expired. Gone means reclaimed already; a conflict means a
  // writer refreshed the record in between, and the new revision is left alone.
  private CompletableFuture<Void> reclaim(final String id, final String expiredRevision) {
    return documentStore.remove(id, expiredRevision).exceptionallyCompose(error -> {
      Throwable cause = Futures.unwrap(error);
      if (cause instanceof DocumentNotFoundException) {
        log.debug("reclaim(id={}): already gone", id);
        return CompletableFuture.completedFuture(null);
      }
      if (cause instanceof RevisionConflictException) {
        log.debug("reclaim(id={}): rev={} was replaced, keeping the newer revision", id, expiredRevision);
        return CompletableFuture.completedFuture(null);
      }
      return CompletableFuture.failedFuture(cause);
    });
  }

  private <T> CompletableFuture<T> report(final String operation, final String id,
                                          final CompletableFuture<T> future) {
    return future.whenComplete((result, error) -> {
      if (error == null) {
        return;
      }
      Throwable cause = Futures.unwrap(error);
      if (cause instanceof SessionNotFoundException || cause instanceof DocumentNotFoundException) {
        log.debug("{}(id={}): {}", operation, id, cause.getMessage());
        return;
      }
      log.warn("{}(id={}) failed: {}", operation, id, cause.toString());
      events.fireError(cause);
    });
  }
}
