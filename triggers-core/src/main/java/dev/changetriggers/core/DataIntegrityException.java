package dev.changetriggers.core;

/**
 * A change payload lacks data the notification pipeline requires, such as the entity identifier.
 */
public class DataIntegrityException extends RuntimeException {

  public DataIntegrityException(String message) {
    super(message);
  }
}
