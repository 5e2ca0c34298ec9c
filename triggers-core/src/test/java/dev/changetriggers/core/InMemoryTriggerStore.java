package dev.changetriggers.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Returns every stored trigger for the requested entity type, active or not, so that callers'
 * own checks are exercised.
 */
final class InMemoryTriggerStore implements TriggerStore {

  private final List<Trigger> triggers = new CopyOnWriteArrayList<>();
  private volatile RuntimeException failure;

  InMemoryTriggerStore add(Trigger trigger) {
    triggers.add(trigger);
    return this;
  }

  void failWith(RuntimeException failure) {
    this.failure = failure;
  }

  @Override
  public List<Trigger> findActive(EntityType entityType, ChangeType changeType) {
    if (failure != null) {
      throw failure;
    }
    List<Trigger> result = new ArrayList<>();
    for (Trigger trigger : triggers) {
      if (trigger.entityType() == entityType) {
        result.add(trigger);
      }
    }
    return result;
  }
}
