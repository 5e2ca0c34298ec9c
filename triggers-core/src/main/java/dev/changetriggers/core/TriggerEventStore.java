package dev.changetriggers.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for {@link TriggerEvent} records. Each call is its own unit of work; methods
 * block and throw {@link TriggerStoreException} on failure.
 */
public interface TriggerEventStore {

  /**
   * Inserts an unprocessed record and returns it with its id and creation time.
   */
  TriggerEvent create(long triggerId,
                      long entityId,
                      ChangeType changeType,
                      Map<String, Object> oldData,
                      Map<String, Object> newData);

  /**
   * Records the outcome of the delivery attempt.
   */
  void markProcessed(long eventId, int responseStatus, Instant processedAt);

  Optional<TriggerEvent> findById(long eventId);

  /**
   * Records of one trigger, newest first.
   */
  List<TriggerEvent> findByTrigger(long triggerId, int limit);

  /**
   * Records whose delivery attempt never completed, oldest first.
   */
  List<TriggerEvent> findUnprocessed(int limit);
}
