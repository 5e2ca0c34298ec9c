package dev.changetriggers.core;

import java.time.Instant;
import java.util.EnumSet;

final class Triggers {

  private Triggers() {
  }

  static Trigger trigger(long id, EntityType entityType, Object filter, String endpoint, ChangeType first, ChangeType... rest) {
    Instant now = Instant.now();
    return new Trigger(id, "trigger-" + id, entityType, EnumSet.of(first, rest), filter, endpoint, true, now, now);
  }

  static Trigger inactive(long id, EntityType entityType, String endpoint, ChangeType first) {
    Instant now = Instant.now();
    return new Trigger(id, "trigger-" + id, entityType, EnumSet.of(first), null, endpoint, false, now, now);
  }
}
