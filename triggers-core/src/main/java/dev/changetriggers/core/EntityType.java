package dev.changetriggers.core;

import java.util.Locale;

/**
 * Logical class of watched rows. Each entity type is fed by exactly one source table.
 */
public enum EntityType {
  MONITOR("monitor", "monitor"),
  MONITOR_STATUS("monitor_status", "monitor_statuses"),
  TAG("tag", "tags");

  private final String wireName;
  private final String sourceTable;

  EntityType(String wireName, String sourceTable) {
    this.wireName = wireName;
    this.sourceTable = sourceTable;
  }

  public String wireName() {
    return wireName;
  }

  public String sourceTable() {
    return sourceTable;
  }

  /**
   * Maps an unqualified source table name to its entity type.
   *
   * @return the entity type, or {@code null} for tables that are not watched
   */
  public static EntityType forTable(String table) {
    if (table == null) {
      return null;
    }
    for (EntityType type : values()) {
      if (type.sourceTable.equals(table)) {
        return type;
      }
    }
    return null;
  }

  public static EntityType fromWire(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.toLowerCase(Locale.ROOT);
    for (EntityType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    return null;
  }
}
