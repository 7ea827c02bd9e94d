package com.codeheadsystems.sessionstore.client.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A document as read from the store.
 *
 * @param id       the document identifier
 * @param revision the revision token assigned by the store on the last write
 * @param body     the document content without the store's reserved {@code _id} and {@code _rev} fields
 */
public record StoredDocument(String id, String revision, ObjectNode body) {
}
