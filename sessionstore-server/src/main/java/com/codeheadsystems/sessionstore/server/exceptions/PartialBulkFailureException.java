package com.codeheadsystems.sessionstore.server.exceptions;

import com.codeheadsystems.sessionstore.client.model.BulkWriteResult;
import java.util.List;

/**
 * Some entries of a bulk delete were rejected. Entries that were applied stay deleted.
 */
public class PartialBulkFailureException extends SessionStoreException {

  private final List<BulkWriteResult> failures;
  private final int deleted;

  /**
   * Instantiates a new Partial bulk failure exception.
   *
   * @param failures the rejected entries
   * @param deleted  the number of entries that were applied
   */
  public PartialBulkFailureException(final List<BulkWriteResult> failures, final int deleted) {
    super(failures.size() + " of " + (failures.size() + deleted) + " bulk deletes rejected", null);
    this.failures = List.copyOf(failures);
    this.deleted = deleted;
  }

  /**
   * The rejected entries.
   *
   * @return the failures
   */
  public List<BulkWriteResult> failures() {
    return failures;
  }

  /**
   * Number of entries that were applied.
   *
   * @return the count
   */
  public int deleted() {
    return deleted;
  }
}
