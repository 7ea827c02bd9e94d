package com.codeheadsystems.sessionstore.server.model;

import com.codeheadsystems.sessionstore.model.Session;

/**
 * A session as persisted in the document store.
 *
 * @param id               document id, {@code <prefix><sessionId>}
 * @param revision         revision of the stored document, {@code null} before the first write
 * @param session          the application payload
 * @param ttlSeconds       time-to-live at the last write
 * @param modifiedAtMillis epoch milliseconds of the last write
 */
public record SessionRecord(String id,
                            String revision,
                            Session session,
                            long ttlSeconds,
                            long modifiedAtMillis) {

  /**
   * The instant after which the record is logically dead.
   *
   * @return epoch milliseconds
   */
  public long expiresAtMillis() {
    return modifiedAtMillis + ttlSeconds * 1000L;
  }

  /**
   * Whether the record is strictly past its expiry at the given instant.
   *
   * @param nowMillis the current epoch milliseconds
   * @return true if expired
   */
  public boolean isExpiredAt(long nowMillis) {
    return nowMillis > expiresAtMillis();
  }
}
