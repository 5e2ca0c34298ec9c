package dev.changetriggers.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Body POSTed to a trigger endpoint.
 */
public final class ChangeNotification {

  private final String triggerName;
  private final EntityType entityType;
  private final long entityId;
  private final ChangeType changeType;
  private final JsonObject oldData;
  private final JsonObject newData;
  private final Instant timestamp;

  public ChangeNotification(String triggerName,
                            EntityType entityType,
                            long entityId,
                            ChangeType changeType,
                            JsonObject oldData,
                            JsonObject newData,
                            Instant timestamp) {
    this.triggerName = Objects.requireNonNull(triggerName, "triggerName");
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.entityId = entityId;
    this.changeType = Objects.requireNonNull(changeType, "changeType");
    this.oldData = oldData;
    this.newData = newData;
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * The notification for a freshly recorded trigger event; the timestamp is the record's creation
   * time.
   */
  public static ChangeNotification of(Trigger trigger, ChangeEvent event, TriggerEvent record) {
    return new ChangeNotification(
      trigger.name(),
      event.entityType(),
      record.entityId(),
      event.changeType(),
      event.oldDataJson(),
      event.newDataJson(),
      record.createdAt());
  }

  public String triggerName() {
    return triggerName;
  }

  public long entityId() {
    return entityId;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("trigger_name", triggerName)
      .put("entity_type", entityType.wireName())
      .put("entity_id", entityId)
      .put("change_type", changeType.wireName())
      .put("old_data", oldData)
      .put("new_data", newData)
      .put("timestamp", DateTimeFormatter.ISO_INSTANT.format(timestamp));
  }
}
