package com.codeheadsystems.sessionstore.client.accessor;

import com.codeheadsystems.sessionstore.client.exceptions.DocumentNotFoundException;
import com.codeheadsystems.sessionstore.client.exceptions.DocumentStoreException;
import com.codeheadsystems.sessionstore.client.exceptions.RevisionConflictException;
import com.codeheadsystems.sessionstore.client.exceptions.StoreUnavailableException;
import com.codeheadsystems.sessionstore.client.model.BulkWriteItem;
import com.codeheadsystems.sessionstore.client.model.BulkWriteResult;
import com.codeheadsystems.sessionstore.client.model.DatabaseConnectionInfo;
import com.codeheadsystems.sessionstore.client.model.DatabaseInfo;
import com.codeheadsystems.sessionstore.client.model.IndexDefinition;
import com.codeheadsystems.sessionstore.client.model.IndexQueryResult;
import com.codeheadsystems.sessionstore.client.model.StoredDocument;
import com.codeheadsystems.sessionstore.client.store.DocumentStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentStore} speaking the CouchDB HTTP API.
 * <p>
 * The {@code databaseUri} in {@link DatabaseConnectionInfo} points at the database itself
 * (e.g. {@code http://host:5984/sessions}); document, bulk and view paths are appended to it.
 * Index definitions are rendered into a design document holding a single map function.
 * <p>
 * Status handling: 404 becomes {@link DocumentNotFoundException}, 409 becomes
 * {@link RevisionConflictException}, 401 becomes {@link SecurityException}, any other error
 * status becomes {@link DocumentStoreException}. I/O errors are wrapped in
 * {@link StoreUnavailableException}.
 */
@Singleton
public class CouchDbDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(CouchDbDocumentStore.class);
  private static final String JSON = "application/json";
  private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final TypeReference<List<BulkWriteResult>> BULK_RESULTS = new TypeReference<>() {
  };

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final DatabaseConnectionInfo connectionInfo;

  /**
   * Instantiates a new Couch db document store.
   *
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   * @param connectionInfo the connection info
   */
  @Inject
  public CouchDbDocumentStore(final HttpClient httpClient,
                              final ObjectMapper objectMapper,
                              final DatabaseConnectionInfo connectionInfo) {
    log.info("CouchDbDocumentStore({})", connectionInfo.databaseUri());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  // ── Documents ─────────────────────────────────────────────────────────────

  @Override
  public CompletableFuture<StoredDocument> get(final String id) {
    log.trace("get(id={})", id);
    return send(id, () -> request(resolve(encode(id))).GET().build())
        .thenApply(response -> {
          checkStatus(id, response.statusCode());
          ObjectNode body = read(response.body(), ObjectNode.class);
          String revision = body.path("_rev").asText(null);
          body.remove("_id");
          body.remove("_rev");
          return new StoredDocument(id, revision, body);
        });
  }

  @Override
  public CompletableFuture<String> put(final String id, final String revision, final ObjectNode body) {
    log.trace("put(id={}, rev={})", id, revision);
    return send(id, () -> {
      ObjectNode payload = body.deepCopy();
      payload.put("_id", id);
      payload.remove("_rev");
      if (revision != null) {
        payload.put("_rev", revision);
      }
      return request(resolve(encode(id)))
          .header("Content-Type", JSON)
          .PUT(HttpRequest.BodyPublishers.ofString(write(payload)))
          .build();
    }).thenApply(response -> {
      checkStatus(id, response.statusCode());
      return read(response.body(), ObjectNode.class).path("rev").asText();
    });
  }

  @Override
  public CompletableFuture<Void> remove(final String id, final String revision) {
    log.trace("remove(id={}, rev={})", id, revision);
    return send(id, () -> request(resolve(encode(id) + "?rev=" + encode(revision))).DELETE().build())
        .thenAccept(response -> checkStatus(id, response.statusCode()));
  }

  @Override
  public CompletableFuture<List<BulkWriteResult>> bulkWrite(final List<BulkWriteItem> items) {
    log.trace("bulkWrite(items={})", items.size());
    return send("_bulk_docs", () -> request(resolve("_bulk_docs"))
        .header("Content-Type", JSON)
        .POST(HttpRequest.BodyPublishers.ofString(write(Map.of("docs", items))))
        .build())
        .thenApply(response -> {
          checkStatus("_bulk_docs", response.statusCode());
          return read(response.body(), BULK_RESULTS);
        });
  }

  // ── Indexes ───────────────────────────────────────────────────────────────

  @Override
  public CompletableFuture<IndexQueryResult> queryIndex(final String designName,
                                                        final String indexName,
                                                        final int limit) {
    final String path = "_design/" + encode(designName) + "/_view/" + encode(indexName);
    log.trace("queryIndex({}, limit={})", path, limit);
    return send(path, () -> request(resolve(path + "?limit=" + limit)).GET().build())
        .thenApply(response -> {
          checkStatus(path, response.statusCode());
          return read(response.body(), IndexQueryResult.class);
        });
  }

  /**
   * Writes the design document for the definition. A 409 means the design document already
   * exists. It is then read back, and the view is added to it when missing; a design
   * document that already holds the view counts as success.
   */
  @Override
  public CompletableFuture<Void> createIndex(final IndexDefinition definition) {
    final String path = "_design/" + encode(definition.designName());
    log.debug("createIndex({}, index={})", path, definition.indexName());
    return send(path, () -> request(resolve(path))
        .header("Content-Type", JSON)
        .PUT(HttpRequest.BodyPublishers.ofString(write(designDocument(definition))))
        .build())
        .thenCompose(response -> {
          if (response.statusCode() == 409) {
            log.debug("createIndex({}): design document already exists", path);
            return addView(path, definition);
          }
          checkStatus(path, response.statusCode());
          return CompletableFuture.<Void>completedFuture(null);
        });
  }

  // ── Reachability ──────────────────────────────────────────────────────────

  @Override
  public CompletableFuture<DatabaseInfo> info() {
    return send("info", () -> request(connectionInfo.databaseUri()).GET().build())
        .thenApply(response -> {
          checkStatus("info", response.statusCode());
          return read(response.body(), DatabaseInfo.class);
        });
  }

  /**
   * Renders the CouchDB map function selecting expired documents for the definition.
   *
   * @param definition the index definition
   * @return JavaScript source of the map function
   */
  static String mapFunction(final IndexDefinition definition) {
    String timestamp = fieldName(definition.timestampField());
    String ttl = fieldName(definition.ttlField());
    return "function (doc) {"
        + " var modified = doc." + timestamp + ";"
        + " var ttl = doc." + ttl + ";"
        + " if (typeof modified === 'number' && typeof ttl === 'number'"
        + " && Date.now() > modified + ttl * 1000) {"
        + " emit(doc._id, doc._rev);"
        + " } }";
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private Map<String, Object> designDocument(final IndexDefinition definition) {
    return Map.of("language", "javascript",
        "views", Map.of(definition.indexName(), Map.of("map", mapFunction(definition))));
  }

  // Merges the view into an existing design document, keeping the views already there.
  private CompletableFuture<Void> addView(final String path, final IndexDefinition definition) {
    return send(path, () -> request(resolve(path)).GET().build())
        .thenCompose(response -> {
          checkStatus(path, response.statusCode());
          ObjectNode design = read(response.body(), ObjectNode.class);
          if (design.path("views").has(definition.indexName())) {
            log.debug("createIndex({}): view {} already present", path, definition.indexName());
            return CompletableFuture.<Void>completedFuture(null);
          }
          log.info("createIndex({}): adding view {} to existing design document", path, definition.indexName());
          JsonNode current = design.get("views");
          ObjectNode views = current != null && current.isObject()
              ? (ObjectNode) current
              : design.putObject("views");
          views.putObject(definition.indexName()).put("map", mapFunction(definition));
          if (!design.has("language")) {
            design.put("language", "javascript");
          }
          return send(path, () -> request(resolve(path))
              .header("Content-Type", JSON)
              .PUT(HttpRequest.BodyPublishers.ofString(write(design)))
              .build())
              .thenAccept(update -> checkStatus(path, update.statusCode()));
        });
  }

  private CompletableFuture<HttpResponse<String>> send(final String target,
                                                       final Supplier<HttpRequest> requestSupplier) {
    final HttpRequest request;
    try {
      request = requestSupplier.get();
    } catch (DocumentStoreException | IllegalArgumentException e) {
      return CompletableFuture.failedFuture(e);
    }
    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .exceptionallyCompose(error -> CompletableFuture.failedFuture(new StoreUnavailableException(
            "HTTP request failed for " + target + " at " + connectionInfo.databaseUri(), unwrap(error))));
  }

  private HttpRequest.Builder request(final URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(connectionInfo.requestTimeout())
        .header("Accept", JSON);
  }

  private URI resolve(final String path) {
    String base = connectionInfo.databaseUri().toString();
    return URI.create(base.endsWith("/") ? base + path : base + "/" + path);
  }

  private void checkStatus(final String target, final int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Database rejected request (401) for " + target);
    }
    if (statusCode == 404) {
      throw new DocumentNotFoundException("Database returned HTTP 404 for " + target);
    }
    if (statusCode == 409) {
      throw new RevisionConflictException("Database returned HTTP 409 for " + target);
    }
    if (statusCode >= 400) {
      throw new DocumentStoreException("Database returned HTTP " + statusCode + " for " + target,
          statusCode, null);
    }
  }

  private String write(final Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Unable to serialize request body", e);
    }
  }

  private <T> T read(final String body, final Class<T> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Unable to parse response as " + type.getSimpleName(), e);
    }
  }

  private <T> T read(final String body, final TypeReference<T> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Unable to parse response", e);
    }
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static String fieldName(final String field) {
    if (!FIELD_NAME.matcher(field).matches()) {
      throw new IllegalArgumentException("Unsupported index field name: " + field);
    }
    return field;
  }

  private static Throwable unwrap(final Throwable error) {
    return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
  }
}
