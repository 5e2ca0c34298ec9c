/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.changetriggers.pg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import dev.changetriggers.core.ChangeEvent;
import dev.changetriggers.core.ChangeEventHandler;
import dev.changetriggers.core.DispatchLoopState;
import dev.changetriggers.core.DispatchStateChange;
import dev.changetriggers.core.ReconnectPolicy;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DispatchLoopTest {

  private static final String INSERT_MONITOR_1 = "{\"change\":[{\"kind\":\"insert\",\"schema\":\"public\","
    + "\"table\":\"monitor\",\"columnnames\":[\"id\"],\"columnvalues\":[1]}]}";
  private static final String INSERT_TWO_TAGS = "{\"change\":["
    + "{\"kind\":\"insert\",\"schema\":\"public\",\"table\":\"tags\",\"columnnames\":[\"id\"],\"columnvalues\":[2]},"
    + "{\"kind\":\"insert\",\"schema\":\"public\",\"table\":\"tags\",\"columnnames\":[\"id\"],\"columnvalues\":[3]}]}";

  private Vertx vertx;
  private List<String> log;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    log = new CopyOnWriteArrayList<>();
  }

  @AfterEach
  void tearDown() throws Exception {
    vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
  }

  @Test
  void acknowledgesOnlyAfterEveryEventWasHandled() throws Exception {
    FakeChangeSource source = new FakeChangeSource(log)
      .offer(INSERT_TWO_TAGS, "0/10")
      .offer(INSERT_MONITOR_1, "0/20");
    ChangeEventHandler handler = event -> {
      Promise<Void> promise = Promise.promise();
      vertx.setTimer(50, id -> {
        log.add("handled " + event.newData().get("id"));
        promise.complete();
      });
      return promise.future();
    };
    DispatchLoop loop = new DispatchLoop(vertx, options(), handler, () -> source);

    await(loop.start());
    waitUntil(() -> source.acknowledged().size() == 2);
    loop.stop();

    assertEquals(List.of("handled 2", "handled 3", "ack 0/10", "handled 1", "ack 0/20"), log);
    assertTrue(source.isClosed());
    assertEquals(DispatchLoopState.STOPPED, loop.state());
  }

  @Test
  void malformedMessageIsSkippedAndAcknowledged() throws Exception {
    FakeChangeSource source = new FakeChangeSource(log)
      .offer("{\"change\":[", "0/30")
      .offer(INSERT_MONITOR_1, "0/40");
    List<ChangeEvent> handled = new CopyOnWriteArrayList<>();
    DispatchLoop loop = new DispatchLoop(vertx, options(), event -> {
      handled.add(event);
      return Future.succeededFuture();
    }, () -> source);

    await(loop.start());
    waitUntil(() -> source.acknowledged().size() == 2);
    loop.stop();

    assertEquals(List.of("0/30", "0/40"), source.acknowledged());
    assertEquals(1, handled.size());
  }

  @Test
  void failedHandlerStopsTheLoopWithoutAcknowledging() throws Exception {
    FakeChangeSource source = new FakeChangeSource(log).offer(INSERT_MONITOR_1, "0/50");
    IllegalStateException boom = new IllegalStateException("store down");
    CompletableFuture<DispatchStateChange> stopped = new CompletableFuture<>();
    DispatchLoop loop = new DispatchLoop(vertx, options(), event -> Future.failedFuture(boom), () -> source);
    loop.onStateChange(change -> {
      if (change.state() == DispatchLoopState.STOPPED) {
        stopped.complete(change);
      }
    });

    await(loop.start());
    DispatchStateChange change = stopped.get(10, TimeUnit.SECONDS);

    assertSame(boom, change.cause());
    assertTrue(source.acknowledged().isEmpty());
    assertTrue(source.isClosed());
    assertEquals(DispatchLoopState.STOPPED, loop.state());
  }

  @Test
  void startIsIdempotent() throws Exception {
    AtomicInteger opened = new AtomicInteger();
    DispatchLoop loop = new DispatchLoop(vertx, options(), event -> Future.succeededFuture(), () -> {
      opened.incrementAndGet();
      return new FakeChangeSource(log);
    });

    await(loop.start());
    await(loop.start());

    assertTrue(loop.isRunning());
    assertEquals(1, opened.get());
    loop.stop();
  }

  @Test
  void stopWhenStoppedIsANoOp() {
    DispatchLoop loop = new DispatchLoop(vertx, options(), event -> Future.succeededFuture(),
      () -> new FakeChangeSource(log));

    loop.stop();
    loop.close();

    assertEquals(DispatchLoopState.STOPPED, loop.state());
  }

  @Test
  void publishesLifecycleTransitions() throws Exception {
    List<DispatchLoopState> states = new CopyOnWriteArrayList<>();
    DispatchLoop loop = new DispatchLoop(vertx, options(), event -> Future.succeededFuture(),
      () -> new FakeChangeSource(log));
    loop.onStateChange(change -> states.add(change.state()));

    await(loop.start());
    loop.stop();
    waitUntil(() -> states.size() == 4);

    assertEquals(List.of(DispatchLoopState.STARTING, DispatchLoopState.RUNNING,
      DispatchLoopState.STOPPING, DispatchLoopState.STOPPED), states);
  }

  @Test
  void failedOpenFailsStart() {
    DispatchLoop loop = new DispatchLoop(vertx, options(), event -> Future.succeededFuture(), () -> {
      throw new SQLException("connection refused", "08001");
    });

    Throwable error = awaitFailure(loop.start());

    assertTrue(error instanceof SQLException);
    waitUntil(() -> loop.state() == DispatchLoopState.STOPPED);
  }

  @Test
  void reconnectPolicyReopensTheSession() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    FakeChangeSource source = new FakeChangeSource(log).offer(INSERT_MONITOR_1, "0/60");
    ReplicationOptions options = options().setReconnectPolicy(ReconnectPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(10))
      .setMaxDelay(Duration.ofMillis(10))
      .setJitter(0.0d)
      .setMaxAttempts(3));
    DispatchLoop loop = new DispatchLoop(vertx, options, event -> Future.succeededFuture(), () -> {
      if (attempts.incrementAndGet() < 3) {
        throw new SQLException("not yet");
      }
      return source;
    });

    await(loop.start());
    waitUntil(() -> source.acknowledged().size() == 1);
    loop.stop();

    assertEquals(3, attempts.get());
  }

  @Test
  void stopLetsTheInFlightHandlerFinishWithoutAcknowledging() throws Exception {
    FakeChangeSource source = new FakeChangeSource(log).offer(INSERT_MONITOR_1, "0/70");
    CountDownLatch handling = new CountDownLatch(1);
    CountDownLatch handled = new CountDownLatch(1);
    ReplicationOptions options = options().setStopGracePeriodMs(200);
    DispatchLoop loop = new DispatchLoop(vertx, options, event -> {
      handling.countDown();
      Promise<Void> promise = Promise.promise();
      vertx.setTimer(800, id -> {
        handled.countDown();
        promise.complete();
      });
      return promise.future();
    }, () -> source);

    await(loop.start());
    assertTrue(handling.await(10, TimeUnit.SECONDS));
    long began = System.nanoTime();
    loop.stop();
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began);

    assertTrue(elapsedMs < 700, "stop took " + elapsedMs + " ms");
    assertTrue(source.isClosed());
    assertTrue(handled.await(10, TimeUnit.SECONDS));
    waitUntil(() -> loop.state() == DispatchLoopState.STOPPED);
    assertTrue(source.acknowledged().isEmpty());
    assertNull(loop.lastAcknowledgedLsn());
  }

  @Test
  void stopDuringReconnectBackoffEndsTheLoopAndAllowsARestart() throws Exception {
    AtomicBoolean reachable = new AtomicBoolean(false);
    List<DispatchStateChange> changes = new CopyOnWriteArrayList<>();
    CountDownLatch backingOff = new CountDownLatch(1);
    ReplicationOptions options = options().setReconnectPolicy(ReconnectPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofSeconds(30))
      .setMaxDelay(Duration.ofSeconds(30))
      .setJitter(0.0d));
    DispatchLoop loop = new DispatchLoop(vertx, options, event -> Future.succeededFuture(), () -> {
      if (!reachable.get()) {
        throw new SQLException("connection refused", "08001");
      }
      return new FakeChangeSource(log);
    });
    loop.onStateChange(change -> {
      changes.add(change);
      if (change.state() == DispatchLoopState.STARTING && change.cause() != null) {
        backingOff.countDown();
      }
    });

    Future<Void> firstStart = loop.start();
    assertTrue(backingOff.await(10, TimeUnit.SECONDS));
    long began = System.nanoTime();
    loop.stop();
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began);

    assertTrue(elapsedMs < 1_500, "stop took " + elapsedMs + " ms");
    assertEquals(DispatchLoopState.STOPPED, loop.state());
    assertTrue(awaitFailure(firstStart) instanceof IllegalStateException);

    reachable.set(true);
    Future<Void> secondStart = loop.start();
    assertNotSame(firstStart, secondStart);
    await(secondStart);
    assertTrue(loop.isRunning());
    loop.stop();

    waitUntil(() -> changes.stream().filter(c -> c.state() == DispatchLoopState.STOPPED).count() == 2);
    for (DispatchStateChange change : changes) {
      if (change.previousState() == DispatchLoopState.STOPPING) {
        assertEquals(DispatchLoopState.STOPPED, change.state(), "left STOPPING: " + change);
      }
    }
  }

  private static ReplicationOptions options() {
    return new ReplicationOptions()
      .setPollIntervalMs(5)
      .setStopGracePeriodMs(2_000);
  }

  private static void await(Future<Void> future) throws Exception {
    future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
  }

  private static Throwable awaitFailure(Future<Void> future) {
    try {
      future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      return e.getCause();
    } catch (Exception e) {
      throw new AssertionError("unexpected failure", e);
    }
    throw new AssertionError("expected start to fail");
  }

  private static void waitUntil(BooleanSupplier condition) {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) {
        return;
      }
      try {
        Thread.sleep(10);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new AssertionError("interrupted", e);
      }
    }
    fail("condition not met in time");
  }
}
