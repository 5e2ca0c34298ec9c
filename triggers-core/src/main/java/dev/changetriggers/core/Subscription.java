package dev.changetriggers.core;

/**
 * Handle returned by listener registrations.
 */
@FunctionalInterface
public interface Subscription {
  void cancel();
}
