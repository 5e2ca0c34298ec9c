package dev.changetriggers.core;

/**
 * Lifecycle of the dispatch loop: {@code STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED}.
 * A failure while starting or running also ends in {@code STOPPED}.
 */
public enum DispatchLoopState {
  STOPPED,
  STARTING,
  RUNNING,
  STOPPING;

  public boolean isActive() {
    return this == STARTING || this == RUNNING;
  }
}
