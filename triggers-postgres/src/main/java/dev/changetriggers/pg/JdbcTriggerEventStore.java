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

import dev.changetriggers.core.ChangeType;
import dev.changetriggers.core.TriggerEvent;
import dev.changetriggers.core.TriggerEventStore;
import dev.changetriggers.core.TriggerStoreException;
import io.vertx.core.json.JsonObject;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores delivery audit records in the {@code trigger_events} table.
 */
public class JdbcTriggerEventStore implements TriggerEventStore {

  private static final String COLUMNS =
    "id, trigger_id, entity_id, change_type, old_data::text AS old_data, new_data::text AS new_data, "
      + "processed, response_status, created_at, processed_at";

  private static final String INSERT =
    "INSERT INTO trigger_events (trigger_id, entity_id, change_type, old_data, new_data, processed) "
      + "VALUES (?, ?, ?, ?::jsonb, ?::jsonb, false) RETURNING id, created_at";

  private static final String MARK_PROCESSED =
    "UPDATE trigger_events SET processed = true, response_status = ?, processed_at = ? WHERE id = ?";

  private final JdbcConnectionFactory connections;

  public JdbcTriggerEventStore(JdbcConnectionFactory connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  @Override
  public TriggerEvent create(long triggerId,
                             long entityId,
                             ChangeType changeType,
                             Map<String, Object> oldData,
                             Map<String, Object> newData) {
    try (Connection conn = connections.open();
         PreparedStatement statement = conn.prepareStatement(INSERT)) {
      statement.setLong(1, triggerId);
      statement.setLong(2, entityId);
      statement.setString(3, changeType.wireName());
      setJson(statement, 4, oldData);
      setJson(statement, 5, newData);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("Insert into trigger_events returned no row");
        }
        return new TriggerEvent(
          rs.getLong("id"),
          triggerId,
          entityId,
          changeType,
          oldData,
          newData,
          false,
          null,
          JdbcTriggerStore.toInstant(rs.getObject("created_at", OffsetDateTime.class)),
          null);
      }
    } catch (SQLException e) {
      throw new TriggerStoreException("Failed to record trigger event for trigger " + triggerId, e);
    }
  }

  @Override
  public void markProcessed(long eventId, int responseStatus, Instant processedAt) {
    int updated;
    try (Connection conn = connections.open();
         PreparedStatement statement = conn.prepareStatement(MARK_PROCESSED)) {
      statement.setInt(1, responseStatus);
      statement.setObject(2, OffsetDateTime.ofInstant(processedAt, ZoneOffset.UTC));
      statement.setLong(3, eventId);
      updated = statement.executeUpdate();
    } catch (SQLException e) {
      throw new TriggerStoreException("Failed to mark trigger event " + eventId + " processed", e);
    }
    if (updated == 0) {
      throw new TriggerStoreException("No trigger event with id " + eventId, null);
    }
  }

  @Override
  public Optional<TriggerEvent> findById(long eventId) {
    List<TriggerEvent> events = query("SELECT " + COLUMNS + " FROM trigger_events WHERE id = ?", eventId);
    return events.stream().findFirst();
  }

  @Override
  public List<TriggerEvent> findByTrigger(long triggerId, int limit) {
    return query("SELECT " + COLUMNS + " FROM trigger_events WHERE trigger_id = ? "
      + "ORDER BY created_at DESC, id DESC LIMIT ?", triggerId, limit);
  }

  @Override
  public List<TriggerEvent> findUnprocessed(int limit) {
    return query("SELECT " + COLUMNS + " FROM trigger_events WHERE NOT processed "
      + "ORDER BY created_at, id LIMIT ?", limit);
  }

  /**
   * Runs {@code sql}, binding {@code params} to its placeholders in order.
   */
  private List<TriggerEvent> query(String sql, Object... params) {
    try (Connection conn = connections.open();
         PreparedStatement statement = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        statement.setObject(i + 1, params[i]);
      }
      List<TriggerEvent> events = new ArrayList<>();
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          events.add(mapRow(rs));
        }
      }
      return events;
    } catch (SQLException e) {
      throw new TriggerStoreException("Failed to query trigger events", e);
    }
  }

  private static TriggerEvent mapRow(ResultSet rs) throws SQLException {
    int status = rs.getInt("response_status");
    Integer responseStatus = rs.wasNull() ? null : status;
    return new TriggerEvent(
      rs.getLong("id"),
      rs.getLong("trigger_id"),
      rs.getLong("entity_id"),
      ChangeType.fromWire(rs.getString("change_type")),
      parseJson(rs.getString("old_data")),
      parseJson(rs.getString("new_data")),
      rs.getBoolean("processed"),
      responseStatus,
      JdbcTriggerStore.toInstant(rs.getObject("created_at", OffsetDateTime.class)),
      JdbcTriggerStore.toInstant(rs.getObject("processed_at", OffsetDateTime.class)));
  }

  private static void setJson(PreparedStatement statement, int idx, Map<String, Object> data) throws SQLException {
    if (data == null) {
      statement.setNull(idx, Types.VARCHAR);
    } else {
      statement.setString(idx, new JsonObject(new LinkedHashMap<>(data)).encode());
    }
  }

  private static Map<String, Object> parseJson(String json) {
    return json == null ? null : new JsonObject(json).getMap();
  }
}
