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

import dev.changetriggers.core.EntityType;
import dev.changetriggers.core.ReconnectPolicy;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Connection, slot and publication configuration for the dispatch loop.
 */
public class ReplicationOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_DATABASE = "postgres";
  public static final String DEFAULT_USER = "postgres";
  public static final String DEFAULT_SLOT_NAME = "triggers_slot";
  public static final String DEFAULT_PUBLICATION_NAME = "triggers_publication";
  public static final String PLUGIN = "wal2json";
  static final String DEFAULT_SCHEMA = "public";
  /**
   * The entity source tables plus {@code monitor_tags}, whose changes are published but not mapped
   * to an entity type.
   */
  public static final List<String> DEFAULT_WATCHED_TABLES = defaultWatchedTables();
  public static final int DEFAULT_FORMAT_VERSION = 1;
  public static final long DEFAULT_POLL_INTERVAL_MS = 50L;
  public static final int DEFAULT_STATUS_INTERVAL_MS = 10_000;
  public static final long DEFAULT_STOP_GRACE_PERIOD_MS = 5_000L;

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  private String host = DEFAULT_HOST;
  private int port = DEFAULT_PORT;
  private String database = DEFAULT_DATABASE;
  private String user = DEFAULT_USER;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String slotName = DEFAULT_SLOT_NAME;
  private String publicationName = DEFAULT_PUBLICATION_NAME;
  private List<String> watchedTables = new ArrayList<>(DEFAULT_WATCHED_TABLES);
  private int formatVersion = DEFAULT_FORMAT_VERSION;
  private long pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;
  private int statusIntervalMs = DEFAULT_STATUS_INTERVAL_MS;
  private long stopGracePeriodMs = DEFAULT_STOP_GRACE_PERIOD_MS;
  private boolean preflightEnabled;
  private ReconnectPolicy reconnectPolicy = ReconnectPolicy.disabled();

  private static List<String> defaultWatchedTables() {
    List<String> tables = new ArrayList<>();
    for (EntityType type : EntityType.values()) {
      tables.add(DEFAULT_SCHEMA + "." + type.sourceTable());
    }
    tables.add(DEFAULT_SCHEMA + ".monitor_tags");
    return Collections.unmodifiableList(tables);
  }

  public ReplicationOptions() {
  }

  public ReplicationOptions(JsonObject json) {
    Objects.requireNonNull(json, "json");
    this.host = json.getString("host", DEFAULT_HOST);
    this.port = json.getInteger("port", DEFAULT_PORT);
    this.database = json.getString("database", DEFAULT_DATABASE);
    this.user = json.getString("user", DEFAULT_USER);
    this.password = json.getString("password");
    this.passwordEnv = json.getString("passwordEnv");
    this.ssl = json.getBoolean("ssl", false);
    this.slotName = json.getString("slotName", DEFAULT_SLOT_NAME);
    this.publicationName = json.getString("publicationName", DEFAULT_PUBLICATION_NAME);
    JsonArray tables = json.getJsonArray("watchedTables");
    if (tables != null) {
      List<String> parsed = new ArrayList<>();
      for (int i = 0; i < tables.size(); i++) {
        parsed.add(tables.getString(i));
      }
      this.watchedTables = parsed;
    }
    this.formatVersion = json.getInteger("formatVersion", DEFAULT_FORMAT_VERSION);
    this.pollIntervalMs = json.getLong("pollIntervalMs", DEFAULT_POLL_INTERVAL_MS);
    this.statusIntervalMs = json.getInteger("statusIntervalMs", DEFAULT_STATUS_INTERVAL_MS);
    this.stopGracePeriodMs = json.getLong("stopGracePeriodMs", DEFAULT_STOP_GRACE_PERIOD_MS);
    this.preflightEnabled = json.getBoolean("preflightEnabled", false);
    JsonObject reconnect = json.getJsonObject("reconnectPolicy");
    if (reconnect != null) {
      this.reconnectPolicy = ReconnectPolicy.fromJson(reconnect);
    }
  }

  public ReplicationOptions(ReplicationOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.slotName = other.slotName;
    this.publicationName = other.publicationName;
    this.watchedTables = new ArrayList<>(other.watchedTables);
    this.formatVersion = other.formatVersion;
    this.pollIntervalMs = other.pollIntervalMs;
    this.statusIntervalMs = other.statusIntervalMs;
    this.stopGracePeriodMs = other.stopGracePeriodMs;
    this.preflightEnabled = other.preflightEnabled;
    this.reconnectPolicy = other.reconnectPolicy.copy();
  }

  public String getHost() {
    return host;
  }

  public ReplicationOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public int getPort() {
    return port;
  }

  public ReplicationOptions setPort(int port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public ReplicationOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public ReplicationOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public ReplicationOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  /**
   * Name of an environment variable read for the password when none is set directly.
   */
  public ReplicationOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public boolean isSsl() {
    return ssl;
  }

  public ReplicationOptions setSsl(boolean ssl) {
    this.ssl = ssl;
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public ReplicationOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPublicationName() {
    return publicationName;
  }

  public ReplicationOptions setPublicationName(String publicationName) {
    this.publicationName = publicationName;
    return this;
  }

  public List<String> getWatchedTables() {
    return Collections.unmodifiableList(watchedTables);
  }

  /**
   * Tables added to the publication and to the plugin's table filter, as {@code schema.table}.
   */
  public ReplicationOptions setWatchedTables(List<String> watchedTables) {
    this.watchedTables = watchedTables == null ? new ArrayList<>() : new ArrayList<>(watchedTables);
    return this;
  }

  public int getFormatVersion() {
    return formatVersion;
  }

  public ReplicationOptions setFormatVersion(int formatVersion) {
    this.formatVersion = formatVersion;
    return this;
  }

  public long getPollIntervalMs() {
    return pollIntervalMs;
  }

  public ReplicationOptions setPollIntervalMs(long pollIntervalMs) {
    this.pollIntervalMs = pollIntervalMs;
    return this;
  }

  public int getStatusIntervalMs() {
    return statusIntervalMs;
  }

  public ReplicationOptions setStatusIntervalMs(int statusIntervalMs) {
    this.statusIntervalMs = statusIntervalMs;
    return this;
  }

  public long getStopGracePeriodMs() {
    return stopGracePeriodMs;
  }

  public ReplicationOptions setStopGracePeriodMs(long stopGracePeriodMs) {
    this.stopGracePeriodMs = stopGracePeriodMs;
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public ReplicationOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  public ReplicationOptions setReconnectPolicy(ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("host", host)
      .put("port", port)
      .put("database", database)
      .put("user", user)
      .put("ssl", ssl)
      .put("slotName", slotName)
      .put("publicationName", publicationName)
      .put("watchedTables", new JsonArray(new ArrayList<>(watchedTables)))
      .put("formatVersion", formatVersion)
      .put("pollIntervalMs", pollIntervalMs)
      .put("statusIntervalMs", statusIntervalMs)
      .put("stopGracePeriodMs", stopGracePeriodMs)
      .put("preflightEnabled", preflightEnabled)
      .put("reconnectPolicy", reconnectPolicy.toJson());
    if (password != null) {
      json.put("password", password);
    }
    if (passwordEnv != null) {
      json.put("passwordEnv", passwordEnv);
    }
    return json;
  }

  public ReplicationOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new ReplicationOptions(json);
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ':' + port + '/' + database;
  }

  String resolvePassword() {
    String resolved = password;
    if (resolved == null || resolved.isBlank()) {
      if (passwordEnv != null && !passwordEnv.isBlank()) {
        resolved = System.getenv(passwordEnv);
      }
    }
    return resolved;
  }

  void validate() {
    require("host", host);
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    require("database", database);
    require("user", user);
    requireIdentifier("slotName", slotName);
    requireIdentifier("publicationName", publicationName);
    if (watchedTables.isEmpty()) {
      throw new IllegalArgumentException("watchedTables must not be empty");
    }
    for (String table : watchedTables) {
      String[] parts = table == null ? new String[0] : table.split("\\.", -1);
      if (parts.length < 1 || parts.length > 2) {
        throw new IllegalArgumentException("watchedTables entry is not schema.table: " + table);
      }
      for (String part : parts) {
        requireIdentifier("watchedTables entry", part);
      }
    }
    if (formatVersion != 1 && formatVersion != 2) {
      throw new IllegalArgumentException("formatVersion must be 1 or 2");
    }
    if (pollIntervalMs < 1) {
      throw new IllegalArgumentException("pollIntervalMs must be >= 1");
    }
    if (statusIntervalMs < 1) {
      throw new IllegalArgumentException("statusIntervalMs must be >= 1");
    }
    if (stopGracePeriodMs < 0) {
      throw new IllegalArgumentException("stopGracePeriodMs must be >= 0");
    }
    Objects.requireNonNull(reconnectPolicy, "reconnectPolicy").validate();
  }

  static boolean isIdentifier(String value) {
    return value != null && IDENTIFIER.matcher(value).matches();
  }

  private static void require(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private static void requireIdentifier(String name, String value) {
    require(name, value);
    if (!isIdentifier(value)) {
      throw new IllegalArgumentException(name + " must be a plain SQL identifier: " + value);
    }
  }
}
