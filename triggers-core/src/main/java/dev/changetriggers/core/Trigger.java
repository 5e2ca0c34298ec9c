package dev.changetriggers.core;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A stored rule: notify {@link #endpoint()} when rows of {@link #entityType()} change in one of
 * {@link #changeTypes()} and satisfy the optional filter.
 */
public final class Trigger {

  private final long id;
  private final String name;
  private final EntityType entityType;
  private final Set<ChangeType> changeTypes;
  private final Object filterCondition;
  private final String endpoint;
  private final boolean active;
  private final Instant createdAt;
  private final Instant updatedAt;

  /**
   * @param filterCondition decoded JSON value of the filter column, {@code null} when the trigger
   *                        matches unconditionally. Not validated here; see
   *                        {@link FilterCondition#of(Object)}.
   */
  public Trigger(long id,
                 String name,
                 EntityType entityType,
                 Set<ChangeType> changeTypes,
                 Object filterCondition,
                 String endpoint,
                 boolean active,
                 Instant createdAt,
                 Instant updatedAt) {
    this.id = id;
    this.name = Objects.requireNonNull(name, "name");
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(changeTypes, "changeTypes");
    if (changeTypes.isEmpty()) {
      throw new IllegalArgumentException("changeTypes must not be empty");
    }
    this.changeTypes = Collections.unmodifiableSet(EnumSet.copyOf(changeTypes));
    this.filterCondition = filterCondition;
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.active = active;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
  }

  public long id() {
    return id;
  }

  public String name() {
    return name;
  }

  public EntityType entityType() {
    return entityType;
  }

  public Set<ChangeType> changeTypes() {
    return changeTypes;
  }

  public Object filterCondition() {
    return filterCondition;
  }

  public boolean hasFilter() {
    return filterCondition != null;
  }

  public String endpoint() {
    return endpoint;
  }

  public boolean isActive() {
    return active;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  /**
   * Eligibility before the filter is applied.
   */
  public boolean watches(EntityType type, ChangeType change) {
    return active && entityType == type && changeTypes.contains(change);
  }

  @Override
  public String toString() {
    return "Trigger{id=" + id + ", name='" + name + "', entityType=" + entityType
      + ", changeTypes=" + changeTypes + ", active=" + active + '}';
  }
}
