package com.codeheadsystems.sessionstore.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import org.junit.jupiter.api.Test;

/**
 * The type Session store config test.
 */
class SessionStoreConfigTest {

  /**
   * Defaults are applied.
   */
  @Test
  void defaults_areApplied() {
    SessionStoreConfig config = SessionStoreConfig.defaults();

    assertThat(config.ttlOverrideSeconds()).isNull();
    assertThat(config.keyPrefix()).isEqualTo("sess:");
    assertThat(config.isTtlRefreshDisabled()).isFalse();
    assertThat(config.expiryIndexName()).isEqualTo("express_expired_sessions");
    assertThat(config.expiryIndexDesignName()).isEqualTo("expired_sessions");
    assertThat(config.maxExpiredPerCleanup()).isEqualTo(100);
    assertThat(config.databaseUri()).isEqualTo(URI.create("http://localhost:5984/sessions"));
  }

  /**
   * Builder overrides defaults.
   */
  @Test
  void builder_overridesDefaults() {
    SessionStoreConfig config = SessionStoreConfig.builder()
        .withTtlOverrideSeconds(600)
        .withKeyPrefix("app:")
        .withDisableTtlRefresh(true)
        .withExpiryIndexName("idx")
        .withExpiryIndexDesignName("design")
        .withMaxExpiredPerCleanup(5)
        .withDatabaseUri(URI.create("http://db:5984/s"))
        .build();

    assertThat(config.ttlOverrideSeconds()).isEqualTo(600L);
    assertThat(config.keyPrefix()).isEqualTo("app:");
    assertThat(config.isTtlRefreshDisabled()).isTrue();
    assertThat(config.expiryIndexName()).isEqualTo("idx");
    assertThat(config.expiryIndexDesignName()).isEqualTo("design");
    assertThat(config.maxExpiredPerCleanup()).isEqualTo(5);
    assertThat(config.databaseUri()).isEqualTo(URI.create("http://db:5984/s"));
  }

  /**
   * Json with partial properties keeps defaults for the rest.
   *
   * @throws Exception the exception
   */
  @Test
  void json_partialProperties_keepsDefaults() throws Exception {
    SessionStoreConfig config = new ObjectMapper().readValue(
        "{\"keyPrefix\":\"x:\",\"maxExpiredPerCleanup\":7,\"unknown\":1}", SessionStoreConfig.class);

    assertThat(config.keyPrefix()).isEqualTo("x:");
    assertThat(config.maxExpiredPerCleanup()).isEqualTo(7);
    assertThat(config.expiryIndexName()).isEqualTo("express_expired_sessions");
  }

  /**
   * Invalid values are rejected.
   */
  @Test
  void invalidValues_areRejected() {
    assertThatThrownBy(() -> SessionStoreConfig.builder().withMaxExpiredPerCleanup(0).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("maxExpiredPerCleanup");
    assertThatThrownBy(() -> SessionStoreConfig.builder().withTtlOverrideSeconds(-1).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ttlOverrideSeconds");
  }
}
