package com.codeheadsystems.sessionstore.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row emitted by a secondary index.
 *
 * @param id    the source document identifier
 * @param key   the emitted key
 * @param value the emitted value
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexRow(
    @JsonProperty("id") String id,
    @JsonProperty("key") String key,
    @JsonProperty("value") String value) {
}
