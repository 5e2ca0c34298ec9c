package dev.changetriggers.core;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One replicated row mutation on a watched table.
 *
 * <p>{@code oldData} is {@code null} for inserts and {@code newData} is {@code null} for deletes;
 * updates carry both. The constructor rejects any other combination.
 */
public final class ChangeEvent {

  private final EntityType entityType;
  private final ChangeType changeType;
  private final Map<String, Object> oldData;
  private final Map<String, Object> newData;
  private final String tableName;
  private final String lsn;

  public ChangeEvent(EntityType entityType,
                     ChangeType changeType,
                     Map<String, Object> oldData,
                     Map<String, Object> newData,
                     String tableName,
                     String lsn) {
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.changeType = Objects.requireNonNull(changeType, "changeType");
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.oldData = unmodifiableCopy(oldData);
    this.newData = unmodifiableCopy(newData);
    this.lsn = lsn;
    checkSnapshots();
  }

  public static ChangeEvent insert(EntityType entityType, String tableName, Map<String, Object> newData) {
    return new ChangeEvent(entityType, ChangeType.INSERT, null, newData, tableName, null);
  }

  public static ChangeEvent update(EntityType entityType,
                                   String tableName,
                                   Map<String, Object> oldData,
                                   Map<String, Object> newData) {
    return new ChangeEvent(entityType, ChangeType.UPDATE, oldData, newData, tableName, null);
  }

  public static ChangeEvent delete(EntityType entityType, String tableName, Map<String, Object> oldData) {
    return new ChangeEvent(entityType, ChangeType.DELETE, oldData, null, tableName, null);
  }

  public EntityType entityType() {
    return entityType;
  }

  public ChangeType changeType() {
    return changeType;
  }

  /**
   * @return old key values, or {@code null} for inserts
   */
  public Map<String, Object> oldData() {
    return oldData;
  }

  /**
   * @return new column values, or {@code null} for deletes
   */
  public Map<String, Object> newData() {
    return newData;
  }

  public String tableName() {
    return tableName;
  }

  public String lsn() {
    return lsn;
  }

  /**
   * The snapshot predicates are evaluated against: new data when non-empty, otherwise old data when
   * non-empty, otherwise an empty map.
   */
  public Map<String, Object> snapshot() {
    if (newData != null && !newData.isEmpty()) {
      return newData;
    }
    if (oldData != null && !oldData.isEmpty()) {
      return oldData;
    }
    return Collections.emptyMap();
  }

  public JsonObject oldDataJson() {
    return oldData == null ? null : new JsonObject(new LinkedHashMap<>(oldData));
  }

  public JsonObject newDataJson() {
    return newData == null ? null : new JsonObject(new LinkedHashMap<>(newData));
  }

  @Override
  public String toString() {
    return "ChangeEvent{" +
      "entityType=" + entityType +
      ", changeType=" + changeType +
      ", table='" + tableName + '\'' +
      ", oldData=" + oldData +
      ", newData=" + newData +
      ", lsn='" + lsn + '\'' +
      '}';
  }

  private void checkSnapshots() {
    switch (changeType) {
      case INSERT:
        if (oldData != null || newData == null) {
          throw new IllegalArgumentException("insert events carry newData only");
        }
        break;
      case UPDATE:
        if (oldData == null || newData == null) {
          throw new IllegalArgumentException("update events carry both oldData and newData");
        }
        break;
      case DELETE:
        if (oldData == null || newData != null) {
          throw new IllegalArgumentException("delete events carry oldData only");
        }
        break;
      default:
        throw new IllegalStateException("unhandled change type " + changeType);
    }
  }

  private static Map<String, Object> unmodifiableCopy(Map<String, Object> data) {
    if (data == null) {
      return null;
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
