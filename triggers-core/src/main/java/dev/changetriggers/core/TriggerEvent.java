package dev.changetriggers.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Audit record of one matched (trigger, change) pair and its single delivery attempt.
 */
public final class TriggerEvent {

  private final long id;
  private final long triggerId;
  private final long entityId;
  private final ChangeType changeType;
  private final Map<String, Object> oldData;
  private final Map<String, Object> newData;
  private final boolean processed;
  private final Integer responseStatus;
  private final Instant createdAt;
  private final Instant processedAt;

  public TriggerEvent(long id,
                      long triggerId,
                      long entityId,
                      ChangeType changeType,
                      Map<String, Object> oldData,
                      Map<String, Object> newData,
                      boolean processed,
                      Integer responseStatus,
                      Instant createdAt,
                      Instant processedAt) {
    this.id = id;
    this.triggerId = triggerId;
    this.entityId = entityId;
    this.changeType = Objects.requireNonNull(changeType, "changeType");
    this.oldData = copyOrNull(oldData);
    this.newData = copyOrNull(newData);
    this.processed = processed;
    this.responseStatus = responseStatus;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    this.processedAt = processedAt;
  }

  public long id() {
    return id;
  }

  public long triggerId() {
    return triggerId;
  }

  public long entityId() {
    return entityId;
  }

  public ChangeType changeType() {
    return changeType;
  }

  public Map<String, Object> oldData() {
    return oldData;
  }

  public Map<String, Object> newData() {
    return newData;
  }

  public boolean processed() {
    return processed;
  }

  public Integer responseStatus() {
    return responseStatus;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant processedAt() {
    return processedAt;
  }

  public TriggerEvent withOutcome(int status, Instant completedAt) {
    return new TriggerEvent(id, triggerId, entityId, changeType, oldData, newData,
      true, status, createdAt, Objects.requireNonNull(completedAt, "completedAt"));
  }

  @Override
  public String toString() {
    return "TriggerEvent{id=" + id + ", triggerId=" + triggerId + ", entityId=" + entityId
      + ", changeType=" + changeType + ", processed=" + processed
      + ", responseStatus=" + responseStatus + '}';
  }

  private static Map<String, Object> copyOrNull(Map<String, Object> data) {
    return data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
