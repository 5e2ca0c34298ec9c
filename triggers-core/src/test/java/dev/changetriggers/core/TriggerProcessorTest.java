package dev.changetriggers.core;

import static dev.changetriggers.core.Triggers.trigger;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TriggerProcessorTest {

  private Vertx vertx;
  private WebClient webClient;
  private WebhookServer webhook;
  private InMemoryTriggerStore triggers;
  private RecordingTriggerEventStore events;
  private TriggerProcessor processor;

  @BeforeEach
  void setUp() throws Exception {
    vertx = Vertx.vertx();
    webClient = WebClient.create(vertx);
    webhook = WebhookServer.start(vertx);
    triggers = new InMemoryTriggerStore();
    events = new RecordingTriggerEventStore();
    processor = new TriggerProcessor(vertx, new TriggerMatcher(triggers),
      new NotificationDispatcher(vertx, webClient, events, 5_000));
  }

  @AfterEach
  void tearDown() throws Exception {
    webhook.close();
    webClient.close();
    vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
  }

  @Test
  void matchingInsertIsRecordedAndDelivered() throws Exception {
    triggers.add(trigger(7, EntityType.MONITOR, new JsonObject().put("status", "active"), webhook.url(),
      ChangeType.INSERT));

    await(processor.handle(ChangeEvent.insert(EntityType.MONITOR, "monitor", Map.of("id", 1, "status", "active"))));

    List<TriggerEvent> recorded = events.all();
    assertEquals(1, recorded.size());
    assertEquals(7L, recorded.get(0).triggerId());
    assertEquals(1L, recorded.get(0).entityId());
    assertEquals(200, recorded.get(0).responseStatus());
    assertEquals(1, webhook.bodies().size());
    assertEquals(1L, webhook.bodies().get(0).getLong("entity_id"));
  }

  @Test
  void unfilteredTriggerRecordsBeforeDelivering() throws Exception {
    List<Boolean> unprocessedAtDelivery = new CopyOnWriteArrayList<>();
    webhook.onRequest(body -> unprocessedAtDelivery.add(!events.all().get(0).processed()));
    triggers.add(trigger(1, EntityType.MONITOR, null, webhook.url(), ChangeType.INSERT));

    await(processor.handle(ChangeEvent.insert(EntityType.MONITOR, "monitor", Map.of("id", 7, "name", "n1"))));

    assertEquals(List.of(true), unprocessedAtDelivery);
    TriggerEvent record = events.all().get(0);
    assertEquals(7L, record.entityId());
    assertEquals(ChangeType.INSERT, record.changeType());
    assertTrue(record.processed());
    assertEquals(200, record.responseStatus());
    assertEquals(7L, webhook.bodies().get(0).getLong("entity_id"));
  }

  @Test
  void unwatchedChangeTypeProducesNothing() throws Exception {
    triggers.add(trigger(7, EntityType.MONITOR, null, webhook.url(), ChangeType.INSERT));

    await(processor.handle(ChangeEvent.update(EntityType.MONITOR, "monitor",
      Map.of("id", 1), Map.of("id", 1, "status", "paused"))));

    assertTrue(events.all().isEmpty());
    assertTrue(webhook.bodies().isEmpty());
  }

  @Test
  void everyMatchIsDeliveredInStoreOrder() throws Exception {
    triggers.add(trigger(3, EntityType.MONITOR_STATUS, null, webhook.url(), ChangeType.INSERT))
      .add(trigger(1, EntityType.MONITOR_STATUS, null, webhook.url(), ChangeType.INSERT));

    await(processor.handle(ChangeEvent.insert(EntityType.MONITOR_STATUS, "monitor_statuses", Map.of("id", 20))));

    List<String> names = webhook.bodies().stream()
      .map(body -> body.getString("trigger_name"))
      .collect(Collectors.toList());
    assertEquals(List.of("trigger-3", "trigger-1"), names);
  }

  @Test
  void failedDeliveryDoesNotStopLaterMatches() throws Exception {
    triggers.add(trigger(1, EntityType.TAG, null, "http://localhost:1/hook", ChangeType.INSERT))
      .add(trigger(2, EntityType.TAG, null, webhook.url(), ChangeType.INSERT));

    await(processor.handle(ChangeEvent.insert(EntityType.TAG, "tags", Map.of("id", 4))));

    List<Integer> statuses = events.all().stream()
      .map(TriggerEvent::responseStatus)
      .collect(Collectors.toList());
    assertEquals(List.of(500, 200), statuses);
  }

  @Test
  void storeFailureFailsTheHandler() {
    triggers.failWith(new TriggerStoreException("connection refused", null));

    ExecutionException error = Assertions.assertThrows(ExecutionException.class,
      () -> await(processor.handle(ChangeEvent.insert(EntityType.TAG, "tags", Map.of("id", 4)))));

    assertTrue(error.getCause() instanceof TriggerStoreException);
  }

  private static void await(Future<Void> future) throws Exception {
    future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
  }
}
