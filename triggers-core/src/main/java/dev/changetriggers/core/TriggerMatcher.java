package dev.changetriggers.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the triggers a change event satisfies.
 *
 * <p>Candidates come from the store already narrowed by entity type, change type and the active
 * flag; the filter condition is then evaluated in memory. A filter that cannot be evaluated is a
 * non-match for that trigger only.
 */
public class TriggerMatcher {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerMatcher.class);

  private final TriggerStore triggerStore;

  public TriggerMatcher(TriggerStore triggerStore) {
    this.triggerStore = Objects.requireNonNull(triggerStore, "triggerStore");
  }

  /**
   * Blocking. Store failures propagate as {@link TriggerStoreException}.
   *
   * @return matching triggers in store order, possibly empty
   */
  public List<Trigger> match(ChangeEvent event) {
    Objects.requireNonNull(event, "event");
    List<Trigger> candidates = triggerStore.findActive(event.entityType(), event.changeType());

    List<Trigger> matches = new ArrayList<>();
    for (Trigger candidate : candidates) {
      if (candidate.watches(event.entityType(), event.changeType()) && filterMatches(candidate, event)) {
        matches.add(candidate);
      }
    }
    return matches;
  }

  static boolean filterMatches(Trigger trigger, ChangeEvent event) {
    if (!trigger.hasFilter()) {
      return true;
    }
    try {
      return FilterCondition.of(trigger.filterCondition()).test(event.snapshot());
    } catch (RuntimeException e) {
      LOG.warn("Could not evaluate filter condition of trigger {} ({}), treating as no match: {}",
        trigger.id(), trigger.name(), e.toString());
      return false;
    }
  }
}
