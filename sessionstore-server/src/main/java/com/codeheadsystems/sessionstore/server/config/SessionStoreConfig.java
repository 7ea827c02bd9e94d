package com.codeheadsystems.sessionstore.server.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;

/**
 * Construction-time options of a {@code DocumentSessionStore}.
 * <p>
 * Every option has a default, so {@code null} components (or missing JSON/YAML properties)
 * fall back to it. The configuration is immutable once built.
 *
 * @param ttlOverrideSeconds    TTL used when the session cookie carries no max-age; {@code null} means one day
 * @param keyPrefix             prefix prepended to the session id to form the document id
 * @param disableTtlRefresh     when true, {@code touch} completes immediately without writing
 * @param expiryIndexName       name of the expired-session index
 * @param expiryIndexDesignName name of the index container (design document)
 * @param maxExpiredPerCleanup  upper bound of records deleted by one cleanup run
 * @param databaseUri           database to connect to when no external store handle is supplied
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionStoreConfig(
    Long ttlOverrideSeconds,
    String keyPrefix,
    Boolean disableTtlRefresh,
    String expiryIndexName,
    String expiryIndexDesignName,
    Integer maxExpiredPerCleanup,
    URI databaseUri) {

  /**
   * The constant DEFAULT_KEY_PREFIX.
   */
  public static final String DEFAULT_KEY_PREFIX = "sess:";
  /**
   * The constant DEFAULT_EXPIRY_INDEX_NAME.
   */
  public static final String DEFAULT_EXPIRY_INDEX_NAME = "express_expired_sessions";
  /**
   * The constant DEFAULT_EXPIRY_INDEX_DESIGN_NAME.
   */
  public static final String DEFAULT_EXPIRY_INDEX_DESIGN_NAME = "expired_sessions";
  /**
   * The constant DEFAULT_MAX_EXPIRED_PER_CLEANUP.
   */
  public static final int DEFAULT_MAX_EXPIRED_PER_CLEANUP = 100;
  /**
   * The constant DEFAULT_DATABASE_URI.
   */
  public static final URI DEFAULT_DATABASE_URI = URI.create("http://localhost:5984/sessions");

  /**
   * Applies defaults and validates.
   *
   * @param ttlOverrideSeconds    the ttl override seconds
   * @param keyPrefix             the key prefix
   * @param disableTtlRefresh     the disable ttl refresh
   * @param expiryIndexName       the expiry index name
   * @param expiryIndexDesignName the expiry index design name
   * @param maxExpiredPerCleanup  the max expired per cleanup
   * @param databaseUri           the database uri
   */
  @JsonCreator
  public SessionStoreConfig(
      @JsonProperty("ttlOverrideSeconds") Long ttlOverrideSeconds,
      @JsonProperty("keyPrefix") String keyPrefix,
      @JsonProperty("disableTtlRefresh") Boolean disableTtlRefresh,
      @JsonProperty("expiryIndexName") String expiryIndexName,
      @JsonProperty("expiryIndexDesignName") String expiryIndexDesignName,
      @JsonProperty("maxExpiredPerCleanup") Integer maxExpiredPerCleanup,
      @JsonProperty("databaseUri") URI databaseUri) {
    if (ttlOverrideSeconds != null && ttlOverrideSeconds < 0) {
      throw new IllegalArgumentException("ttlOverrideSeconds must be >= 0: " + ttlOverrideSeconds);
    }
    if (maxExpiredPerCleanup != null && maxExpiredPerCleanup < 1) {
      throw new IllegalArgumentException("maxExpiredPerCleanup must be >= 1: " + maxExpiredPerCleanup);
    }
    this.ttlOverrideSeconds = ttlOverrideSeconds;
    this.keyPrefix = keyPrefix == null ? DEFAULT_KEY_PREFIX : keyPrefix;
    this.disableTtlRefresh = disableTtlRefresh != null && disableTtlRefresh;
    this.expiryIndexName = blankToDefault(expiryIndexName, DEFAULT_EXPIRY_INDEX_NAME);
    this.expiryIndexDesignName = blankToDefault(expiryIndexDesignName, DEFAULT_EXPIRY_INDEX_DESIGN_NAME);
    this.maxExpiredPerCleanup = maxExpiredPerCleanup == null ? DEFAULT_MAX_EXPIRED_PER_CLEANUP : maxExpiredPerCleanup;
    this.databaseUri = databaseUri == null ? DEFAULT_DATABASE_URI : databaseUri;
  }

  /**
   * All defaults.
   *
   * @return the session store config
   */
  public static SessionStoreConfig defaults() {
    return builder().build();
  }

  /**
   * Builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Whether touch-driven TTL refresh is suppressed.
   *
   * @return true if disabled
   */
  @JsonIgnore
  public boolean isTtlRefreshDisabled() {
    return disableTtlRefresh;
  }

  private static String blankToDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  /**
   * Builder for {@link SessionStoreConfig}. Unset options keep their defaults.
   */
  public static class Builder {

    private Long ttlOverrideSeconds;
    private String keyPrefix;
    private Boolean disableTtlRefresh;
    private String expiryIndexName;
    private String expiryIndexDesignName;
    private Integer maxExpiredPerCleanup;
    private URI databaseUri;

    private Builder() {
    }

    /**
     * With ttl override seconds.
     *
     * @param ttlOverrideSeconds the ttl override seconds
     * @return the builder
     */
    public Builder withTtlOverrideSeconds(long ttlOverrideSeconds) {
      this.ttlOverrideSeconds = ttlOverrideSeconds;
      return this;
    }

    /**
     * With key prefix.
     *
     * @param keyPrefix the key prefix
     * @return the builder
     */
    public Builder withKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
      return this;
    }

    /**
     * With disable ttl refresh.
     *
     * @param disableTtlRefresh the disable ttl refresh
     * @return the builder
     */
    public Builder withDisableTtlRefresh(boolean disableTtlRefresh) {
      this.disableTtlRefresh = disableTtlRefresh;
      return this;
    }

    /**
     * With expiry index name.
     *
     * @param expiryIndexName the expiry index name
     * @return the builder
     */
    public Builder withExpiryIndexName(String expiryIndexName) {
      this.expiryIndexName = expiryIndexName;
      return this;
    }

    /**
     * With expiry index design name.
     *
     * @param expiryIndexDesignName the expiry index design name
     * @return the builder
     */
    public Builder withExpiryIndexDesignName(String expiryIndexDesignName) {
      this.expiryIndexDesignName = expiryIndexDesignName;
      return this;
    }

    /**
     * With max expired per cleanup.
     *
     * @param maxExpiredPerCleanup the max expired per cleanup
     * @return the builder
     */
    public Builder withMaxExpiredPerCleanup(int maxExpiredPerCleanup) {
      this.maxExpiredPerCleanup = maxExpiredPerCleanup;
      return this;
    }

    /**
     * With database uri.
     *
     * @param databaseUri the database uri
     * @return the builder
     */
    public Builder withDatabaseUri(URI databaseUri) {
      this.databaseUri = databaseUri;
      return this;
    }

    /**
     * Build session store config.
     *
     * @return the session store config
     */
    public SessionStoreConfig build() {
      return new SessionStoreConfig(ttlOverrideSeconds, keyPrefix, disableTtlRefresh,
          expiryIndexName, expiryIndexDesignName, maxExpiredPerCleanup, databaseUri);
    }
  }
}
