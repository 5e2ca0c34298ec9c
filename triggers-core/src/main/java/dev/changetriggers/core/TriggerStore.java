package dev.changetriggers.core;

import java.util.List;

/**
 * Read access to trigger definitions. Implementations block; call them off the event loop.
 */
public interface TriggerStore {

  /**
   * Active triggers watching {@code entityType} for {@code changeType}, in a stable order.
   *
   * @throws TriggerStoreException if the store cannot be read
   */
  List<Trigger> findActive(EntityType entityType, ChangeType changeType);
}
