package com.codeheadsystems.sessionstore.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.sessionstore.client.exceptions.DocumentNotFoundException;
import com.codeheadsystems.sessionstore.client.exceptions.DocumentStoreException;
import com.codeheadsystems.sessionstore.client.exceptions.RevisionConflictException;
import com.codeheadsystems.sessionstore.client.exceptions.StoreUnavailableException;
import com.codeheadsystems.sessionstore.client.model.BulkWriteItem;
import com.codeheadsystems.sessionstore.client.model.BulkWriteResult;
import com.codeheadsystems.sessionstore.client.model.DatabaseConnectionInfo;
import com.codeheadsystems.sessionstore.client.model.IndexDefinition;
import com.codeheadsystems.sessionstore.client.model.IndexQueryResult;
import com.codeheadsystems.sessionstore.client.model.IndexRow;
import com.codeheadsystems.sessionstore.client.model.StoredDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Couch db document store test.
 */
@ExtendWith(MockitoExtension.class)
class CouchDbDocumentStoreTest {

  private static final URI DATABASE = URI.create("http://localhost:5984/sessions");
  private static final IndexDefinition DEFINITION =
      new IndexDefinition("expired_sessions", "express_expired_sessions", "session_modified", "session_ttl");

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private CouchDbDocumentStore store;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    store = new CouchDbDocumentStore(httpClient, new ObjectMapper(), new DatabaseConnectionInfo(DATABASE));
  }

  // ── Documents ─────────────────────────────────────────────────────────────

  /**
   * Get success strips reserved fields.
   */
  @Test
  void get_success_stripsReservedFields() {
    respond(200, "{\"_id\":\"sess:a\",\"_rev\":\"1-abc\",\"value\":7}");

    StoredDocument document = store.get("sess:a").join();

    assertThat(document.revision()).isEqualTo("1-abc");
    assertThat(document.body().has("_id")).isFalse();
    assertThat(document.body().has("_rev")).isFalse();
    assertThat(document.body().get("value").asInt()).isEqualTo(7);
    HttpRequest request = sentRequest();
    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.uri().toString()).isEqualTo("http://localhost:5984/sessions/sess%3Aa");
  }

  /**
   * Get 404 fails not found.
   */
  @Test
  void get_404_failsNotFound() {
    respondStatus(404);

    assertThatThrownBy(() -> store.get("sess:a").join())
        .hasCauseInstanceOf(DocumentNotFoundException.class);
  }

  /**
   * Put success returns new revision.
   */
  @Test
  void put_success_returnsNewRevision() {
    respond(201, "{\"ok\":true,\"id\":\"sess:a\",\"rev\":\"2-def\"}");

    String revision = store.put("sess:a", "1-abc", new ObjectMapper().createObjectNode().put("v", 1)).join();

    assertThat(revision).isEqualTo("2-def");
    assertThat(sentRequest().method()).isEqualTo("PUT");
  }

  /**
   * Put 409 fails revision conflict.
   */
  @Test
  void put_409_failsRevisionConflict() {
    respondStatus(409);

    assertThatThrownBy(() -> store.put("sess:a", "1-old", new ObjectMapper().createObjectNode()).join())
        .hasCauseInstanceOf(RevisionConflictException.class);
  }

  /**
   * Remove sends revision as query parameter.
   */
  @Test
  void remove_sendsRevisionQueryParameter() {
    respondStatus(200);

    store.remove("sess:a", "3-xyz").join();

    HttpRequest request = sentRequest();
    assertThat(request.method()).isEqualTo("DELETE");
    assertThat(request.uri().toString()).isEqualTo("http://localhost:5984/sessions/sess%3Aa?rev=3-xyz");
  }

  /**
   * Bulk write parses per item results.
   */
  @Test
  void bulkWrite_parsesPerItemResults() {
    respond(201, "[{\"ok\":true,\"id\":\"a\",\"rev\":\"2-z\"},"
        + "{\"id\":\"b\",\"error\":\"conflict\",\"reason\":\"Document update conflict.\"}]");

    List<BulkWriteResult> results = store.bulkWrite(List.of(
        BulkWriteItem.deletion("a", "1-x"), BulkWriteItem.deletion("b", "1-y"))).join();

    assertThat(results).hasSize(2);
    assertThat(results.get(0).isSuccess()).isTrue();
    assertThat(results.get(1).isSuccess()).isFalse();
    assertThat(results.get(1).error()).isEqualTo("conflict");
    assertThat(sentRequest().uri().getPath()).isEqualTo("/sessions/_bulk_docs");
  }

  // ── Indexes ───────────────────────────────────────────────────────────────

  /**
   * Query index parses rows and passes limit.
   */
  @Test
  void queryIndex_parsesRowsAndPassesLimit() {
    respond(200, "{\"total_rows\":3,\"offset\":0,\"rows\":[{\"id\":\"a\",\"key\":\"a\",\"value\":\"1-x\"}]}");

    IndexQueryResult result = store.queryIndex("expired_sessions", "express_expired_sessions", 5).join();

    assertThat(result.totalRows()).isEqualTo(3);
    assertThat(result.rows()).containsExactly(new IndexRow("a", "a", "1-x"));
    assertThat(sentRequest().uri().toString()).isEqualTo(
        "http://localhost:5984/sessions/_design/expired_sessions/_view/express_expired_sessions?limit=5");
  }

  /**
   * Create index writes a new design document holding the view.
   */
  @Test
  void createIndex_created_writesDesignDocument() {
    respondStatus(201);

    store.createIndex(DEFINITION).join();

    HttpRequest request = sentRequest();
    assertThat(request.method()).isEqualTo("PUT");
    assertThat(request.uri().getPath()).isEqualTo("/sessions/_design/expired_sessions");
  }

  /**
   * Create index against a design document that already holds the view does nothing more.
   */
  @Test
  void createIndex_409_viewPresent_isSuccess() {
    respondInSequence(
        response(409, "{\"error\":\"conflict\"}"),
        response(200, "{\"_id\":\"_design/expired_sessions\",\"_rev\":\"1-a\","
            + "\"views\":{\"express_expired_sessions\":{\"map\":\"function (doc) {}\"}}}"));

    store.createIndex(DEFINITION).join();

    List<HttpRequest> requests = sentRequests(2);
    assertThat(requests.get(1).method()).isEqualTo("GET");
  }

  /**
   * Create index adds the view to a design document that exists without it.
   */
  @Test
  void createIndex_409_viewMissing_addsViewWithRevision() throws Exception {
    respondInSequence(
        response(409, "{\"error\":\"conflict\"}"),
        response(200, "{\"_id\":\"_design/expired_sessions\",\"_rev\":\"3-c\",\"language\":\"javascript\","
            + "\"views\":{\"other_view\":{\"map\":\"function (doc) {}\"}}}"),
        response(201, "{\"ok\":true,\"id\":\"_design/expired_sessions\",\"rev\":\"4-d\"}"));

    store.createIndex(DEFINITION).join();

    List<HttpRequest> requests = sentRequests(3);
    HttpRequest update = requests.get(2);
    assertThat(update.method()).isEqualTo("PUT");
    assertThat(update.uri().getPath()).isEqualTo("/sessions/_design/expired_sessions");
    JsonNode design = new ObjectMapper().readTree(bodyOf(update));
    assertThat(design.path("_rev").asText()).isEqualTo("3-c");
    assertThat(design.path("views").has("other_view")).isTrue();
    assertThat(design.path("views").path("express_expired_sessions").path("map").asText())
        .contains("emit(doc._id, doc._rev)");
  }

  /**
   * Create index surfaces other errors.
   */
  @Test
  void createIndex_500_fails() {
    respondStatus(500);

    assertThatThrownBy(() -> store.createIndex(DEFINITION).join())
        .hasCauseInstanceOf(DocumentStoreException.class)
        .hasMessageContaining("HTTP 500");
  }

  /**
   * Map function renders configured fields.
   */
  @Test
  void mapFunction_rendersConfiguredFields() {
    String map = CouchDbDocumentStore.mapFunction(DEFINITION);

    assertThat(map)
        .contains("doc.session_modified")
        .contains("doc.session_ttl")
        .contains("modified + ttl * 1000")
        .contains("emit(doc._id, doc._rev)");
  }

  /**
   * Map function rejects unsafe field names.
   */
  @Test
  void mapFunction_rejectsUnsafeFieldNames() {
    IndexDefinition hostile = new IndexDefinition("d", "i", "a; emit(1)", "ttl");

    assertThatThrownBy(() -> CouchDbDocumentStore.mapFunction(hostile))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ── Reachability and transport ────────────────────────────────────────────

  /**
   * Info parses database metadata.
   */
  @Test
  void info_parsesDatabaseMetadata() {
    respond(200, "{\"db_name\":\"sessions\",\"doc_count\":12,\"update_seq\":\"40-g1\"}");

    assertThat(store.info().join().documentCount()).isEqualTo(12);
    assertThat(sentRequest().uri()).isEqualTo(DATABASE);
  }

  /**
   * Io failure fails store unavailable.
   */
  @Test
  void info_ioFailure_failsStoreUnavailable() {
    doReturn(CompletableFuture.failedFuture(new IOException("connection refused")))
        .when(httpClient).sendAsync(any(), any());

    assertThatThrownBy(() -> store.info().join())
        .hasCauseInstanceOf(StoreUnavailableException.class)
        .hasRootCauseInstanceOf(IOException.class);
  }

  /**
   * 401 fails security exception.
   */
  @Test
  void get_401_failsSecurityException() {
    respondStatus(401);

    assertThatThrownBy(() -> store.get("sess:a").join())
        .hasCauseInstanceOf(SecurityException.class)
        .hasMessageContaining("401");
  }

  private void respond(int status, String body) {
    respondStatus(status);
    when(httpResponse.body()).thenReturn(body);
  }

  private void respondStatus(int status) {
    doReturn(CompletableFuture.completedFuture(httpResponse)).when(httpClient).sendAsync(any(), any());
    when(httpResponse.statusCode()).thenReturn(status);
  }

  @SuppressWarnings("unchecked")
  private HttpResponse<String> response(int status, String body) {
    HttpResponse<String> response = mock(HttpResponse.class);
    lenient().when(response.statusCode()).thenReturn(status);
    lenient().when(response.body()).thenReturn(body);
    return response;
  }

  @SafeVarargs
  private void respondInSequence(HttpResponse<String> first, HttpResponse<String>... rest) {
    Object[] others = Arrays.stream(rest).map(CompletableFuture::completedFuture).toArray();
    doReturn(CompletableFuture.completedFuture(first), others).when(httpClient).sendAsync(any(), any());
  }

  @SuppressWarnings("unchecked")
  private HttpRequest sentRequest() {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).sendAsync(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }

  @SuppressWarnings("unchecked")
  private List<HttpRequest> sentRequests(int count) {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient, times(count)).sendAsync(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getAllValues();
  }

  private static String bodyOf(HttpRequest request) {
    StringBuilder body = new StringBuilder();
    request.bodyPublisher().orElseThrow().subscribe(new Flow.Subscriber<>() {
      @Override
      public void onSubscribe(Flow.Subscription subscription) {
        subscription.request(Long.MAX_VALUE);
      }

      @Override
      public void onNext(ByteBuffer item) {
        body.append(StandardCharsets.UTF_8.decode(item));
      }

      @Override
      public void onError(Throwable throwable) {
        throw new IllegalStateException(throwable);
      }

      @Override
      public void onComplete() {
      }
    });
    return body.toString();
  }
}
