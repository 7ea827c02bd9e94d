package com.codeheadsystems.sessionstore.client.model;

import java.util.Objects;

/**
 * Declarative definition of an expiry index.
 * <p>
 * A document is selected when both {@code timestampField} (epoch milliseconds) and
 * {@code ttlField} (seconds) are numeric and the evaluation instant is strictly after
 * {@code timestamp + ttl * 1000}. Each selected document emits one row keyed by its id
 * with its revision as the value.
 * <p>
 * The definition is plain data. Each {@code DocumentStore} translates it into whatever
 * its indexing engine understands.
 *
 * @param designName     the name of the index container (design document)
 * @param indexName      the name of the index within the container
 * @param timestampField the document field holding the last-write instant in epoch milliseconds
 * @param ttlField       the document field holding the time-to-live in seconds
 */
public record IndexDefinition(String designName,
                              String indexName,
                              String timestampField,
                              String ttlField) {

  /**
   * Instantiates a new Index definition.
   *
   * @param designName     the design name
   * @param indexName      the index name
   * @param timestampField the timestamp field
   * @param ttlField       the ttl field
   */
  public IndexDefinition {
    Objects.requireNonNull(designName, "designName");
    Objects.requireNonNull(indexName, "indexName");
    Objects.requireNonNull(timestampField, "timestampField");
    Objects.requireNonNull(ttlField, "ttlField");
  }
}
