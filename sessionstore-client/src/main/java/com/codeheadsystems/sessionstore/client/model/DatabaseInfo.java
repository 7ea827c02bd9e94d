package com.codeheadsystems.sessionstore.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Database metadata returned by the reachability check.
 *
 * @param name          the database name
 * @param documentCount the number of live documents
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatabaseInfo(
    @JsonProperty("db_name") String name,
    @JsonProperty("doc_count") long documentCount) {
}
