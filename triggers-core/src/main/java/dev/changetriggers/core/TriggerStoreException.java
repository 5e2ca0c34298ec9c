package dev.changetriggers.core;

/**
 * A trigger or trigger-event store operation failed.
 */
public class TriggerStoreException extends RuntimeException {

  public TriggerStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
