package com.codeheadsystems.sessionstore.server.codec;

import com.codeheadsystems.sessionstore.client.model.StoredDocument;
import com.codeheadsystems.sessionstore.model.Session;
import com.codeheadsystems.sessionstore.server.exceptions.SessionCodecException;
import com.codeheadsystems.sessionstore.server.model.SessionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Maps sessions to and from stored documents.
 * <p>
 * The stored document is the JSON form of the {@link Session} plus two storage fields,
 * {@value #TTL_FIELD} (seconds) and {@value #MODIFIED_FIELD} (epoch milliseconds). Encoding
 * takes a deep copy of the session, so later changes to the caller's objects never reach
 * the record.
 */
public class SessionRecordCodec {

  /**
   * Document field holding the TTL in seconds.
   */
  public static final String TTL_FIELD = "session_ttl";
  /**
   * Document field holding the last-write instant in epoch milliseconds.
   */
  public static final String MODIFIED_FIELD = "session_modified";

  // Top-level fields owned by a written record; anything else in a stored document is foreign.
  private static final List<String> SESSION_FIELDS =
      List.of("cookie", "attributes", TTL_FIELD, MODIFIED_FIELD);

  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Instantiates a new Session record codec.
   *
   * @param objectMapper the object mapper
   * @param clock        the clock stamping each write
   */
  public SessionRecordCodec(final ObjectMapper objectMapper, final Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Builds the record for a write happening now.
   *
   * @param id         the document id
   * @param revision   the revision the write replaces, {@code null} for a create
   * @param session    the session
   * @param ttlSeconds the ttl seconds
   * @return the session record
   */
  public SessionRecord encode(final String id, final String revision, final Session session,
                              final long ttlSeconds) {
    Objects.requireNonNull(session, "session");
    return new SessionRecord(id, revision, copy(session), ttlSeconds, clock.millis());
  }

  /**
   * Document body for the record, without {@code _id} and {@code _rev}.
   *
   * @param record the record
   * @return the object node
   */
  public ObjectNode toDocument(final SessionRecord record) {
    final ObjectNode body;
    try {
      body = objectMapper.valueToTree(record.session());
    } catch (IllegalArgumentException e) {
      throw new SessionCodecException("Unable to serialize session " + record.id(), e);
    }
    body.put(TTL_FIELD, record.ttlSeconds());
    body.put(MODIFIED_FIELD, record.modifiedAtMillis());
    return body;
  }

  /**
   * Document body for the record laid over a document already stored under its id. Fields of
   * the stored document that are neither session nor storage fields are carried over.
   *
   * @param record   the record
   * @param existing the stored body, {@code null} when there is none
   * @return the object node
   */
  public ObjectNode toDocument(final SessionRecord record, final ObjectNode existing) {
    ObjectNode document = toDocument(record);
    if (existing == null) {
      return document;
    }
    ObjectNode merged = existing.deepCopy();
    merged.remove(SESSION_FIELDS);
    merged.setAll(document);
    return merged;
  }

  /**
   * Rebuilds the record from a stored document, stripping the storage fields.
   *
   * @param document the document
   * @return the session record
   */
  public SessionRecord decode(final StoredDocument document) {
    ObjectNode body = document.body().deepCopy();
    JsonNode ttl = body.remove(TTL_FIELD);
    JsonNode modified = body.remove(MODIFIED_FIELD);
    if (ttl == null || modified == null || !ttl.isNumber() || !modified.isNumber()) {
      throw new SessionCodecException("Document " + document.id() + " is not a session record", null);
    }
    try {
      Session session = objectMapper.treeToValue(body, Session.class);
      return new SessionRecord(document.id(), document.revision(), session, ttl.asLong(), modified.asLong());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new SessionCodecException("Unable to read session from document " + document.id(), e);
    }
  }

  private Session copy(final Session session) {
    try {
      return objectMapper.treeToValue(objectMapper.valueToTree(session), Session.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new SessionCodecException("Session is not serializable", e);
    }
  }
}
