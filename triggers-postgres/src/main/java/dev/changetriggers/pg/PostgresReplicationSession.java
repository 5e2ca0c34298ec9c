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

import dev.changetriggers.core.PreflightReport;
import dev.changetriggers.core.PreflightReport.Issue;
import dev.changetriggers.core.PreflightReport.Severity;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wal2json logical replication stream over the configured slot.
 *
 * <p>{@link #open(ReplicationOptions)} creates the publication and the slot when they are missing.
 * The stream starts at the slot's confirmed position. Closing a session never drops the slot or the
 * publication.
 */
public final class PostgresReplicationSession implements ChangeSource {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresReplicationSession.class);
  private static final long SLOT_LAG_WARNING_BYTES = 128L * 1024L * 1024L;
  private static final String DUPLICATE_OBJECT = "42710";

  private final ReplicationOptions options;
  private final Connection connection;
  private final PGReplicationStream stream;

  private PostgresReplicationSession(ReplicationOptions options, Connection connection, PGReplicationStream stream) {
    this.options = options;
    this.connection = connection;
    this.stream = stream;
  }

  public static PostgresReplicationSession open(ReplicationOptions options) throws SQLException {
    ReplicationOptions resolved = new ReplicationOptions(options);
    resolved.validate();

    try (Connection conn = openStandardConnection(resolved)) {
      ensurePublication(conn, resolved);
      ensureReplicationSlot(conn, resolved);
    }

    Connection replication = openReplicationConnection(resolved);
    try {
      PGReplicationStream stream = replication.unwrap(PGConnection.class)
        .getReplicationAPI()
        .replicationStream()
        .logical()
        .withSlotName(resolved.getSlotName())
        .withStartPosition(LogSequenceNumber.INVALID_LSN)
        .withStatusInterval(resolved.getStatusIntervalMs(), TimeUnit.MILLISECONDS)
        .withSlotOption("format-version", resolved.getFormatVersion())
        .withSlotOption("include-xids", false)
        .withSlotOption("include-timestamp", true)
        .withSlotOption("add-tables", String.join(",", resolved.getWatchedTables()))
        .start();
      LOG.info("Started logical replication from slot {}", resolved.getSlotName());
      return new PostgresReplicationSession(resolved, replication, stream);
    } catch (SQLException | RuntimeException e) {
      try {
        replication.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  @Override
  public WalMessage read() throws SQLException {
    ByteBuffer buffer = stream.readPending();
    if (buffer == null) {
      return null;
    }
    LogSequenceNumber lsn = stream.getLastReceiveLSN();
    return new WalMessage(decodeWalMessage(buffer), lsn == null ? null : lsn.asString());
  }

  @Override
  public void acknowledge(String lsn) throws SQLException {
    if (lsn == null) {
      return;
    }
    LogSequenceNumber position = LogSequenceNumber.valueOf(lsn);
    stream.setAppliedLSN(position);
    stream.setFlushedLSN(position);
    stream.forceUpdateStatus();
  }

  @Override
  public void close() {
    try {
      if (!stream.isClosed()) {
        stream.close();
      }
    } catch (SQLException e) {
      LOG.debug("Error closing replication stream for slot {}", options.getSlotName(), e);
    }
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.debug("Error closing replication connection for slot {}", options.getSlotName(), e);
    }
  }

  static void ensurePublication(Connection conn, ReplicationOptions options) throws SQLException {
    String name = options.getPublicationName();
    try (PreparedStatement statement = conn.prepareStatement("SELECT 1 FROM pg_publication WHERE pubname = ?")) {
      statement.setString(1, name);
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          return;
        }
      }
    }

    String tables = options.getWatchedTables().stream()
      .map(PostgresReplicationSession::quoteQualified)
      .collect(Collectors.joining(", "));
    try (Statement statement = conn.createStatement()) {
      statement.execute("CREATE PUBLICATION " + quoteIdentifier(name) + " FOR TABLE " + tables);
      LOG.info("Created publication {} for {}", name, options.getWatchedTables());
    } catch (SQLException e) {
      if (!isAlreadyExists(e)) {
        throw e;
      }
    }
  }

  static void ensureReplicationSlot(Connection conn, ReplicationOptions options) throws SQLException {
    String slot = options.getSlotName();
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT plugin FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slot);
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          String plugin = rs.getString(1);
          if (!ReplicationOptions.PLUGIN.equalsIgnoreCase(plugin)) {
            LOG.warn("Replication slot {} uses plugin {} instead of {}", slot, plugin, ReplicationOptions.PLUGIN);
          }
          return;
        }
      }
    }

    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT pg_create_logical_replication_slot(?, ?)")) {
      statement.setString(1, slot);
      statement.setString(2, ReplicationOptions.PLUGIN);
      statement.execute();
      LOG.info("Created replication slot {}", slot);
    } catch (SQLException e) {
      if (!isAlreadyExists(e)) {
        throw e;
      }
    }
  }

  /**
   * Checks server settings, privileges and the slot before streaming starts. Connection problems
   * are reported as an error issue rather than thrown.
   */
  public static PreflightReport preflight(ReplicationOptions options) {
    List<Issue> issues = new ArrayList<>();
    try (Connection conn = openStandardConnection(options)) {
      checkWalLevel(conn, issues);
      checkRolePrivileges(conn, issues);
      checkPositiveSetting(conn, "max_replication_slots", issues, "MAX_REPLICATION_SLOTS_INVALID");
      checkPositiveSetting(conn, "max_wal_senders", issues, "MAX_WAL_SENDERS_INVALID");
      checkExistingSlot(conn, options, issues);
      checkSlotLag(conn, options, issues);
      checkWatchedTables(conn, options, issues);
    } catch (Exception e) {
      issues.add(new Issue(
        Severity.ERROR,
        "CONNECTION_FAILED",
        "Could not connect to PostgreSQL: " + e.getMessage(),
        "Verify host, port, database, user, password, and SSL settings."
      ));
    }
    return new PreflightReport(issues);
  }

  private static void checkWalLevel(Connection conn, List<Issue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      String walLevel = rs.next() ? rs.getString(1) : null;
      if (!"logical".equalsIgnoreCase(walLevel)) {
        issues.add(new Issue(
          Severity.ERROR,
          "WAL_LEVEL_INVALID",
          "wal_level is '" + walLevel + "'",
          "Set wal_level=logical and restart PostgreSQL."
        ));
      }
    }
  }

  private static void checkRolePrivileges(Connection conn, List<Issue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT (rolreplication OR rolsuper) FROM pg_roles WHERE rolname = current_user");
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && !rs.getBoolean(1)) {
        issues.add(new Issue(
          Severity.WARNING,
          "ROLE_NOT_REPLICATION",
          "Current user does not have replication privileges",
          "Grant REPLICATION privilege or use a superuser role."
        ));
      }
    }
  }

  private static void checkPositiveSetting(Connection conn,
                                           String setting,
                                           List<Issue> issues,
                                           String code) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW " + setting);
         ResultSet rs = statement.executeQuery()) {
      if (rs.next()) {
        long value = rs.getLong(1);
        if (value < 1) {
          issues.add(new Issue(
            Severity.ERROR,
            code,
            setting + " is set to " + value,
            "Set " + setting + " to at least 1 and restart PostgreSQL."
          ));
        }
      }
    }
  }

  private static void checkExistingSlot(Connection conn, ReplicationOptions options, List<Issue> issues)
    throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT plugin FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          String slotPlugin = rs.getString(1);
          if (!ReplicationOptions.PLUGIN.equalsIgnoreCase(slotPlugin)) {
            issues.add(new Issue(
              Severity.ERROR,
              "SLOT_PLUGIN_MISMATCH",
              "Replication slot " + options.getSlotName() + " uses plugin '" + slotPlugin + "'",
              "Drop the slot or configure a slot created with wal2json."
            ));
          }
        }
      }
    }
  }

  private static void checkSlotLag(Connection conn, ReplicationOptions options, List<Issue> issues)
    throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT pg_wal_lsn_diff(pg_current_wal_lsn(), restart_lsn) "
        + "FROM pg_replication_slots WHERE slot_name = ? AND restart_lsn IS NOT NULL")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          long lagBytes = rs.getLong(1);
          if (lagBytes > SLOT_LAG_WARNING_BYTES) {
            issues.add(new Issue(
              Severity.WARNING,
              "SLOT_LAG_HIGH",
              "Replication slot lag is " + lagBytes + " bytes",
              "Check that the dispatch loop keeps up with the write rate."
            ));
          }
        }
      }
    }
  }

  private static void checkWatchedTables(Connection conn, ReplicationOptions options, List<Issue> issues)
    throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SELECT to_regclass(?)")) {
      for (String table : options.getWatchedTables()) {
        statement.setString(1, table);
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next() || rs.getString(1) == null) {
            issues.add(new Issue(
              Severity.ERROR,
              "WATCHED_TABLE_MISSING",
              "Watched table " + table + " does not exist",
              "Create the table or remove it from the watched tables."
            ));
          }
        }
      }
    }
  }

  static Connection openStandardConnection(ReplicationOptions options) throws SQLException {
    return DriverManager.getConnection(options.jdbcUrl(), connectionProperties(options));
  }

  private static Connection openReplicationConnection(ReplicationOptions options) throws SQLException {
    Properties props = connectionProperties(options);
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "9.4");
    return DriverManager.getConnection(options.jdbcUrl(), props);
  }

  static Properties connectionProperties(ReplicationOptions options) {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());
    String password = options.resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }
    if (options.isSsl()) {
      props.setProperty("ssl", "true");
    }
    return props;
  }

  private static boolean isAlreadyExists(SQLException error) {
    if (DUPLICATE_OBJECT.equals(error.getSQLState())) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }

  private static String quoteQualified(String table) {
    return Arrays.stream(table.split("\\."))
      .map(PostgresReplicationSession::quoteIdentifier)
      .collect(Collectors.joining("."));
  }

  private static String quoteIdentifier(String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  private static String decodeWalMessage(ByteBuffer buffer) {
    byte[] bytes = new byte[buffer.remaining()];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
