package com.codeheadsystems.sessionstore.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of querying a secondary index.
 *
 * @param totalRows number of rows in the whole index, regardless of the limit
 * @param offset    offset of the first returned row
 * @param rows      the returned rows, at most the requested limit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexQueryResult(
    @JsonProperty("total_rows") long totalRows,
    @JsonProperty("offset") long offset,
    @JsonProperty("rows") List<IndexRow> rows) {

  /**
   * Instantiates a new Index query result.
   *
   * @param totalRows the total rows
   * @param offset    the offset
   * @param rows      the rows
   */
  public IndexQueryResult {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }
}
