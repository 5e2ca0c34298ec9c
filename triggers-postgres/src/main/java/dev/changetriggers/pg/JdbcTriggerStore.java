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
import dev.changetriggers.core.EntityType;
import dev.changetriggers.core.Trigger;
import dev.changetriggers.core.TriggerStore;
import dev.changetriggers.core.TriggerStoreException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads triggers from the {@code triggers} table.
 */
public class JdbcTriggerStore implements TriggerStore {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcTriggerStore.class);

  private static final String FIND_ACTIVE =
    "SELECT id, name, entity_type, change_types::text AS change_types, "
      + "filter_condition::text AS filter_condition, endpoint, is_active, created_at, updated_at "
      + "FROM triggers "
      + "WHERE is_active AND entity_type = ? AND change_types @> ?::jsonb "
      + "ORDER BY id";

  private final JdbcConnectionFactory connections;

  public JdbcTriggerStore(JdbcConnectionFactory connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  @Override
  public List<Trigger> findActive(EntityType entityType, ChangeType changeType) {
    try (Connection conn = connections.open();
         PreparedStatement statement = conn.prepareStatement(FIND_ACTIVE)) {
      statement.setString(1, entityType.wireName());
      statement.setString(2, new JsonArray().add(changeType.wireName()).encode());
      List<Trigger> triggers = new ArrayList<>();
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          Trigger trigger = mapRow(rs);
          if (trigger != null) {
            triggers.add(trigger);
          }
        }
      }
      return triggers;
    } catch (SQLException e) {
      throw new TriggerStoreException("Failed to load triggers for " + entityType.wireName()
        + "/" + changeType.wireName(), e);
    }
  }

  private static Trigger mapRow(ResultSet rs) throws SQLException {
    long id = rs.getLong("id");
    EntityType entityType = EntityType.fromWire(rs.getString("entity_type"));
    Set<ChangeType> changeTypes = parseChangeTypes(rs.getString("change_types"));
    if (entityType == null || changeTypes.isEmpty()) {
      LOG.warn("Ignoring trigger {} with unreadable entity type or change types", id);
      return null;
    }

    String filter = rs.getString("filter_condition");
    return new Trigger(
      id,
      rs.getString("name"),
      entityType,
      changeTypes,
      filter == null ? null : Json.decodeValue(filter),
      rs.getString("endpoint"),
      rs.getBoolean("is_active"),
      toInstant(rs.getObject("created_at", OffsetDateTime.class)),
      toInstant(rs.getObject("updated_at", OffsetDateTime.class)));
  }

  private static Set<ChangeType> parseChangeTypes(String json) {
    Set<ChangeType> types = EnumSet.noneOf(ChangeType.class);
    if (json == null) {
      return types;
    }
    Object decoded = Json.decodeValue(json);
    if (!(decoded instanceof JsonArray)) {
      return types;
    }
    for (Object value : (JsonArray) decoded) {
      ChangeType type = value instanceof String ? ChangeType.fromWire((String) value) : null;
      if (type != null) {
        types.add(type);
      }
    }
    return types;
  }

  static Instant toInstant(OffsetDateTime value) {
    return value == null ? null : value.toInstant();
  }
}
