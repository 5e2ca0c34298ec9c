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

import dev.changetriggers.core.ChangeEvent;
import dev.changetriggers.core.ChangeType;
import dev.changetriggers.core.EntityType;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns wal2json output into {@link ChangeEvent}s for the watched tables.
 *
 * <p>Format version 1 messages carry a {@code change} list per transaction; format version 2
 * messages carry a single row with an {@code action}. Entries for unmapped tables and unknown
 * kinds are dropped.
 */
public class Wal2JsonDecoder {

  /**
   * @param payload raw message text
   * @param lsn     start position of the message
   * @throws WalDecodeException if the payload is not valid wal2json
   */
  public DecodedMessage decode(String payload, String lsn) {
    if (payload == null || payload.isBlank()) {
      return new DecodedMessage(Collections.emptyList(), lsn);
    }

    try {
      JsonObject message = new JsonObject(payload);
      if (message.containsKey("action")) {
        return new DecodedMessage(decodeRowMessage(message, lsn), lsn);
      }
      return new DecodedMessage(decodeChangeList(message.getJsonArray("change"), lsn), lsn);
    } catch (RuntimeException e) {
      throw new WalDecodeException("Malformed wal2json message at " + lsn + ": " + e.getMessage(), e);
    }
  }

  private static List<ChangeEvent> decodeChangeList(JsonArray changes, String lsn) {
    if (changes == null || changes.isEmpty()) {
      return Collections.emptyList();
    }

    List<ChangeEvent> events = new ArrayList<>();
    for (int i = 0; i < changes.size(); i++) {
      Object raw = changes.getValue(i);
      if (!(raw instanceof JsonObject)) {
        continue;
      }

      JsonObject change = (JsonObject) raw;
      String table = change.getString("table");
      EntityType entityType = EntityType.forTable(table);
      ChangeType changeType = ChangeType.fromWire(change.getString("kind"));
      if (entityType == null || changeType == null) {
        continue;
      }

      JsonObject oldKeys = change.getJsonObject("oldkeys", new JsonObject());
      Map<String, Object> columns = zip(change.getJsonArray("columnnames"), change.getJsonArray("columnvalues"));
      Map<String, Object> keys = zip(oldKeys.getJsonArray("keynames"), oldKeys.getJsonArray("keyvalues"));
      events.add(toEvent(entityType, changeType, keys, columns, table, lsn));
    }
    return events;
  }

  private static List<ChangeEvent> decodeRowMessage(JsonObject message, String lsn) {
    String table = message.getString("table");
    EntityType entityType = EntityType.forTable(table);
    ChangeType changeType = mapAction(message.getString("action"));
    if (entityType == null || changeType == null) {
      return Collections.emptyList();
    }

    Map<String, Object> columns = namedValues(message.getJsonArray("columns"));
    Map<String, Object> identity = namedValues(message.getJsonArray("identity"));
    return Collections.singletonList(toEvent(entityType, changeType, identity, columns, table, lsn));
  }

  private static ChangeEvent toEvent(EntityType entityType,
                                     ChangeType changeType,
                                     Map<String, Object> keys,
                                     Map<String, Object> columns,
                                     String table,
                                     String lsn) {
    switch (changeType) {
      case INSERT:
        return new ChangeEvent(entityType, changeType, null, columns, table, lsn);
      case UPDATE:
        return new ChangeEvent(entityType, changeType, keys, columns, table, lsn);
      case DELETE:
        return new ChangeEvent(entityType, changeType, keys, null, table, lsn);
      default:
        throw new IllegalStateException("unhandled change type " + changeType);
    }
  }

  private static Map<String, Object> zip(JsonArray names, JsonArray values) {
    Map<String, Object> data = new LinkedHashMap<>();
    if (names == null || values == null) {
      return data;
    }
    int size = Math.min(names.size(), values.size());
    for (int idx = 0; idx < size; idx++) {
      data.put(names.getString(idx), values.getValue(idx));
    }
    return data;
  }

  private static Map<String, Object> namedValues(JsonArray columns) {
    Map<String, Object> data = new LinkedHashMap<>();
    if (columns == null) {
      return data;
    }
    for (int i = 0; i < columns.size(); i++) {
      Object raw = columns.getValue(i);
      if (!(raw instanceof JsonObject)) {
        continue;
      }
      JsonObject column = (JsonObject) raw;
      String name = column.getString("name");
      if (name != null) {
        data.put(name, column.getValue("value"));
      }
    }
    return data;
  }

  private static ChangeType mapAction(String action) {
    if (action == null) {
      return null;
    }
    switch (action.toUpperCase(Locale.ROOT)) {
      case "I":
        return ChangeType.INSERT;
      case "U":
        return ChangeType.UPDATE;
      case "D":
        return ChangeType.DELETE;
      default:
        return null;
    }
  }
}
