package dev.changetriggers.core;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches a change event and dispatches every match, one after another.
 *
 * <p>The returned future fails only when matching itself fails (the trigger store is
 * unreachable); per-trigger failures are absorbed by the {@link NotificationDispatcher}.
 */
public class TriggerProcessor implements ChangeEventHandler {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerProcessor.class);

  private final Vertx vertx;
  private final TriggerMatcher matcher;
  private final NotificationDispatcher dispatcher;

  public TriggerProcessor(Vertx vertx, TriggerMatcher matcher, NotificationDispatcher dispatcher) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  @Override
  public Future<Void> handle(ChangeEvent event) {
    return vertx.executeBlocking(() -> matcher.match(event))
      .compose(matches -> dispatchAll(matches, event));
  }

  private Future<Void> dispatchAll(List<Trigger> matches, ChangeEvent event) {
    if (matches.isEmpty()) {
      LOG.debug("No matching triggers for {}", event);
      return Future.succeededFuture();
    }

    Future<Void> chain = Future.succeededFuture();
    for (Trigger trigger : matches) {
      chain = chain.compose(v -> dispatcher.dispatch(trigger, event).mapEmpty());
    }
    return chain;
  }
}
