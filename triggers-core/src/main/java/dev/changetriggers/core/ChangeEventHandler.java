package dev.changetriggers.core;

import io.vertx.core.Future;

/**
 * Downstream stage of the dispatch loop. The loop waits for the returned future before it reads
 * further and only acknowledges a replication message once every event of it has completed.
 */
@FunctionalInterface
public interface ChangeEventHandler {
  Future<Void> handle(ChangeEvent event);
}
