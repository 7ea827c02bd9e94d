package com.codeheadsystems.sessionstore.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a bulk write request. The store only uses bulk writes for deletion.
 *
 * @param id       the document identifier
 * @param revision the revision the caller last observed; a mismatch rejects this entry only
 * @param deleted  whether this entry deletes the document
 */
public record BulkWriteItem(
    @JsonProperty("_id") String id,
    @JsonProperty("_rev") String revision,
    @JsonProperty("_deleted") boolean deleted) {

  /**
   * A deletion entry.
   *
   * @param id       the id
   * @param revision the revision
   * @return the bulk write item
   */
  public static BulkWriteItem deletion(String id, String revision) {
    return new BulkWriteItem(id, revision, true);
  }
}
