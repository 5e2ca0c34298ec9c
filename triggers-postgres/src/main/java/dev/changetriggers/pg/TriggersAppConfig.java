/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.changetriggers.pg;

import dev.changetriggers.core.NotificationDispatcher;
import java.util.Map;
import java.util.Objects;

/**
 * Service settings read from environment variables.
 */
public final class TriggersAppConfig {

  private static final int DEFAULT_HTTP_PORT = 8080;

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final String triggersJdbcUrl;
  private final String slotName;
  private final String publicationName;
  private final long deliveryTimeoutMs;
  private final boolean preflightEnabled;
  private final int httpPort;

  private TriggersAppConfig(String pgHost,
                            int pgPort,
                            String pgDatabase,
                            String pgUser,
                            String pgPasswordEnv,
                            boolean ssl,
                            String triggersJdbcUrl,
                            String slotName,
                            String publicationName,
                            long deliveryTimeoutMs,
                            boolean preflightEnabled,
                            int httpPort) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgDatabase = pgDatabase;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.triggersJdbcUrl = triggersJdbcUrl;
    this.slotName = slotName;
    this.publicationName = publicationName;
    this.deliveryTimeoutMs = deliveryTimeoutMs;
    this.preflightEnabled = preflightEnabled;
    this.httpPort = httpPort;
  }

  public static TriggersAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static TriggersAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String host = envOrDefault(env, "PGHOST", ReplicationOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", ReplicationOptions.DEFAULT_PORT);
    String database = envOrDefault(env, "PGDATABASE", ReplicationOptions.DEFAULT_DATABASE);
    String user = envOrDefault(env, "PGUSER", ReplicationOptions.DEFAULT_USER);
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    String jdbcUrl = envOrDefault(env, "TRIGGERS_JDBC_URL", null);
    String slotName = envOrDefault(env, "REPLICATION_SLOT", ReplicationOptions.DEFAULT_SLOT_NAME);
    String publicationName = envOrDefault(env, "PUBLICATION_NAME", ReplicationOptions.DEFAULT_PUBLICATION_NAME);
    long deliveryTimeoutMs = intEnvOrDefault(env, "DELIVERY_TIMEOUT_MS",
      (int) NotificationDispatcher.DEFAULT_DELIVERY_TIMEOUT_MS);
    boolean preflight = boolEnvOrDefault(env, "REPLICATION_PREFLIGHT", false);
    int httpPort = intEnvOrDefault(env, "HTTP_PORT", DEFAULT_HTTP_PORT);

    return new TriggersAppConfig(host, port, database, user, passwordEnv, ssl, jdbcUrl, slotName,
      publicationName, deliveryTimeoutMs, preflight, httpPort);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public String slotName() {
    return slotName;
  }

  public String publicationName() {
    return publicationName;
  }

  public long deliveryTimeoutMs() {
    return deliveryTimeoutMs;
  }

  public boolean preflightEnabled() {
    return preflightEnabled;
  }

  public int httpPort() {
    return httpPort;
  }

  /**
   * JDBC URL of the database holding the trigger tables; the replication source when unset.
   */
  public String triggersJdbcUrl() {
    return triggersJdbcUrl != null ? triggersJdbcUrl : toReplicationOptions().jdbcUrl();
  }

  public ReplicationOptions toReplicationOptions() {
    return new ReplicationOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setSlotName(slotName)
      .setPublicationName(publicationName)
      .setPreflightEnabled(preflightEnabled);
  }

  public JdbcConnectionFactory triggerStoreConnections() {
    ReplicationOptions options = toReplicationOptions();
    if (triggersJdbcUrl == null) {
      return JdbcConnectionFactory.of(options);
    }
    return JdbcConnectionFactory.of(triggersJdbcUrl, pgUser, options.resolvePassword());
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }
}
