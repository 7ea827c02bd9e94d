package com.codeheadsystems.sessionstore.client.model;

import java.net.URI;
import java.time.Duration;

/**
 * Network connection details for a CouchDB-compatible database.
 *
 * @param databaseUri    the fully-qualified database URI (e.g. http://host:5984/sessions)
 * @param requestTimeout per-request timeout
 */
public record DatabaseConnectionInfo(URI databaseUri, Duration requestTimeout) {

  /**
   * Default per-request timeout.
   */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  /**
   * Instantiates a new Database connection info with the default timeout.
   *
   * @param databaseUri the database uri
   */
  public DatabaseConnectionInfo(URI databaseUri) {
    this(databaseUri, DEFAULT_TIMEOUT);
  }
}
