package dev.changetriggers.core;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records and delivers the notification for one matched (trigger, event) pair.
 *
 * <p>The audit record is written with {@code processed = false} before the webhook is called and
 * updated once the single attempt finishes. Store calls run on the worker pool, each in its own
 * unit of work, so no database transaction is open while the webhook responds.
 *
 * <p>The returned future never fails for per-pair problems: a missing entity id, a store failure
 * or a delivery failure is logged and the future completes. It holds the final record, or
 * {@code null} when the pair was abandoned before or after delivery.
 */
public class NotificationDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

  /**
   * Status recorded when the request could not complete (timeout, refused connection, bad URL).
   */
  public static final int DELIVERY_FAILURE_STATUS = 500;
  public static final long DEFAULT_DELIVERY_TIMEOUT_MS = 30_000L;
  static final String ENTITY_ID_FIELD = "id";

  private final Vertx vertx;
  private final WebClient webClient;
  private final TriggerEventStore eventStore;
  private final long deliveryTimeoutMs;

  public NotificationDispatcher(Vertx vertx,
                                WebClient webClient,
                                TriggerEventStore eventStore,
                                long deliveryTimeoutMs) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.webClient = Objects.requireNonNull(webClient, "webClient");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    if (deliveryTimeoutMs < 1) {
      throw new IllegalArgumentException("deliveryTimeoutMs must be >= 1");
    }
    this.deliveryTimeoutMs = deliveryTimeoutMs;
  }

  public Future<TriggerEvent> dispatch(Trigger trigger, ChangeEvent event) {
    Objects.requireNonNull(trigger, "trigger");
    Objects.requireNonNull(event, "event");

    long entityId;
    try {
      entityId = entityId(event);
    } catch (DataIntegrityException e) {
      LOG.error("Skipping trigger {} for {} change on {}: {}",
        trigger.id(), event.changeType().wireName(), event.tableName(), e.getMessage());
      return Future.succeededFuture();
    }

    return vertx.executeBlocking(() -> eventStore.create(
        trigger.id(), entityId, event.changeType(), event.oldData(), event.newData()))
      .transform(created -> {
        if (created.failed()) {
          LOG.error("Could not record event for trigger {}, notification not sent", trigger.id(), created.cause());
          return Future.succeededFuture();
        }
        TriggerEvent record = created.result();
        return deliver(trigger, ChangeNotification.of(trigger, event, record))
          .compose(status -> complete(record, status));
      });
  }

  /**
   * Reads the identifier from new data, falling back to old data.
   *
   * @throws DataIntegrityException when neither snapshot has a numeric {@code id}
   */
  public static long entityId(ChangeEvent event) {
    Object raw = idOf(event.newData());
    if (raw == null) {
      raw = idOf(event.oldData());
    }
    if (raw == null) {
      throw new DataIntegrityException("could not determine entity id from " + event.snapshot());
    }
    if (raw instanceof Number) {
      return ((Number) raw).longValue();
    }
    try {
      return Long.parseLong(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new DataIntegrityException("entity id '" + raw + "' is not numeric");
    }
  }

  private static Object idOf(Map<String, Object> data) {
    return data == null ? null : data.get(ENTITY_ID_FIELD);
  }

  Future<Integer> deliver(Trigger trigger, ChangeNotification notification) {
    Future<HttpResponse<Buffer>> response;
    try {
      response = webClient.postAbs(trigger.endpoint())
        .timeout(deliveryTimeoutMs)
        .putHeader("Content-Type", "application/json")
        .sendJsonObject(notification.toJson());
    } catch (RuntimeException e) {
      response = Future.failedFuture(e);
    }

    return response
      .map(resp -> {
        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
          LOG.info("Sent notification for trigger {} entity {}: {}", trigger.id(), notification.entityId(), status);
        } else {
          LOG.warn("Notification for trigger {} entity {} was rejected: {}", trigger.id(), notification.entityId(), status);
        }
        return status;
      })
      .otherwise(err -> {
        LOG.error("Could not deliver notification for trigger {} to {}: {}",
          trigger.id(), trigger.endpoint(), err.toString());
        return DELIVERY_FAILURE_STATUS;
      });
  }

  private Future<TriggerEvent> complete(TriggerEvent record, int status) {
    Instant processedAt = Instant.now();
    return vertx.<Void>executeBlocking(() -> {
        eventStore.markProcessed(record.id(), status, processedAt);
        return null;
      })
      .map(v -> record.withOutcome(status, processedAt))
      .otherwise(err -> {
        LOG.error("Could not record delivery outcome {} for event {}", status, record.id(), err);
        return null;
      });
  }
}
