package com.codeheadsystems.sessionstore.client.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-entry outcome of a bulk write.
 *
 * @param id       the document identifier
 * @param revision the new revision on success
 * @param error    the error code (for example {@code conflict} or {@code not_found}), {@code null} on success
 * @param reason   human readable detail for the error
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkWriteResult(
    @JsonProperty("id") String id,
    @JsonProperty("rev") String revision,
    @JsonProperty("error") String error,
    @JsonProperty("reason") String reason) {

  /**
   * Successful result.
   *
   * @param id       the id
   * @param revision the revision
   * @return the bulk write result
   */
  public static BulkWriteResult ok(String id, String revision) {
    return new BulkWriteResult(id, revision, null, null);
  }

  /**
   * Rejected result.
   *
   * @param id     the id
   * @param error  the error
   * @param reason the reason
   * @return the bulk write result
   */
  public static BulkWriteResult rejected(String id, String error, String reason) {
    return new BulkWriteResult(id, null, error, reason);
  }

  /**
   * Whether the entry was applied.
   *
   * @return true on success
   */
  @JsonIgnore
  public boolean isSuccess() {
    return error == null;
  }
}
