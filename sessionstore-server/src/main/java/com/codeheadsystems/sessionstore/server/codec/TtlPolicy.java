package com.codeheadsystems.sessionstore.server.codec;

import com.codeheadsystems.sessionstore.model.Session;

/**
 * Computes a session's time-to-live in whole seconds.
 * <p>
 * Priority: the cookie max-age when present ({@code floor(maxAge / 1000)}, never negative),
 * then the configured override, then one day.
 */
public class TtlPolicy {

  /**
   * One day in seconds.
   */
  public static final long ONE_DAY_SECONDS = 86_400L;

  private final Long ttlOverrideSeconds;

  /**
   * Instantiates a new Ttl policy.
   *
   * @param ttlOverrideSeconds configured TTL, may be {@code null}
   */
  public TtlPolicy(final Long ttlOverrideSeconds) {
    this.ttlOverrideSeconds = ttlOverrideSeconds;
  }

  /**
   * TTL for the session.
   *
   * @param session the session, may be {@code null}
   * @return TTL in seconds
   */
  public long ttlSeconds(final Session session) {
    return ttlSeconds(session == null ? null : session.cookieMaxAge().orElse(null));
  }

  /**
   * TTL for a cookie max-age.
   *
   * @param cookieMaxAgeMillis cookie max-age in milliseconds, may be {@code null}
   * @return TTL in seconds
   */
  public long ttlSeconds(final Long cookieMaxAgeMillis) {
    if (cookieMaxAgeMillis != null) {
      return Math.max(0L, Math.floorDiv(cookieMaxAgeMillis, 1000L));
    }
    if (ttlOverrideSeconds != null) {
      return ttlOverrideSeconds;
    }
    return ONE_DAY_SECONDS;
  }
}
