package dev.changetriggers.core;

import java.util.Locale;

/**
 * The kind of row mutation a change event describes.
 */
public enum ChangeType {
  INSERT("insert"),
  UPDATE("update"),
  DELETE("delete");

  private final String wireName;

  ChangeType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Lower-case name used in wal2json payloads, stored rows and notification bodies.
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name, ignoring case.
   *
   * @return the change type, or {@code null} when {@code value} names no known kind
   */
  public static ChangeType fromWire(String value) {
    if (value == null) {
      return null;
    }
    switch (value.toLowerCase(Locale.ROOT)) {
      case "insert":
        return INSERT;
      case "update":
        return UPDATE;
      case "delete":
        return DELETE;
      default:
        return null;
    }
  }
}
