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

import dev.changetriggers.core.ChangeEvent;
import dev.changetriggers.core.ChangeEventHandler;
import dev.changetriggers.core.DispatchLoopState;
import dev.changetriggers.core.DispatchStateChange;
import dev.changetriggers.core.PreflightFailedException;
import dev.changetriggers.core.PreflightReport;
import dev.changetriggers.core.ReconnectPolicy;
import dev.changetriggers.core.Subscription;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads WAL messages on a dedicated thread, hands every decoded change to a
 * {@link ChangeEventHandler} on a Vert.x context and acknowledges a message only after all of its
 * changes were handled.
 *
 * <p>Exactly one handler invocation is in flight at a time, so events are handled in WAL order. A
 * failed handler future ends the session without acknowledging the message; it is redelivered by
 * the next session. Malformed messages are logged, acknowledged and skipped.
 *
 * <p>Lifecycle: {@code STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED}. A session error moves
 * the loop to {@code STOPPED} with the error as cause unless the {@link ReconnectPolicy} reopens it.
 */
public class DispatchLoop implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(DispatchLoop.class);

  private final Vertx vertx;
  private final Context context;
  private final ReplicationOptions options;
  private final ChangeEventHandler handler;
  private final ChangeSource.Factory sourceFactory;
  private final Wal2JsonDecoder decoder = new Wal2JsonDecoder();
  private final List<Handler<DispatchStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);
  private final Object sessionLock = new Object();

  private volatile ChangeSource source;
  private volatile Thread worker;
  private volatile Promise<Void> startPromise;
  private volatile DispatchLoopState state = DispatchLoopState.STOPPED;
  private volatile CountDownLatch stopSignal = new CountDownLatch(0);
  private volatile String lastAcknowledgedLsn;
  private long failedAttempts;

  public DispatchLoop(Vertx vertx, ReplicationOptions options, ChangeEventHandler handler) {
    this(vertx, options, handler, sessionFactory(new ReplicationOptions(options)));
  }

  DispatchLoop(Vertx vertx, ReplicationOptions options, ChangeEventHandler handler, ChangeSource.Factory sourceFactory) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.context = vertx.getOrCreateContext();
    this.options = new ReplicationOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.handler = Objects.requireNonNull(handler, "handler");
    this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory");
  }

  private static ChangeSource.Factory sessionFactory(ReplicationOptions options) {
    return () -> PostgresReplicationSession.open(options);
  }

  /**
   * Starts reading. Completes once the loop is {@code RUNNING}, fails if preflight or the first
   * session fails. Calling it while starting or running returns the pending or completed future.
   */
  public Future<Void> start() {
    Promise<Void> promise;
    synchronized (this) {
      if (state == DispatchLoopState.RUNNING && shouldRun.get()) {
        LOG.warn("Dispatch loop for slot {} is already running", options.getSlotName());
        return Future.succeededFuture();
      }
      if (state == DispatchLoopState.STARTING && shouldRun.get() && startPromise != null) {
        LOG.warn("Dispatch loop for slot {} is already starting", options.getSlotName());
        return startPromise.future();
      }
      if (state != DispatchLoopState.STOPPED) {
        return Future.failedFuture(new IllegalStateException("dispatch loop is " + state));
      }

      shouldRun.set(true);
      failedAttempts = 0;
      stopSignal = new CountDownLatch(1);
      startPromise = Promise.promise();
      promise = startPromise;
      transition(DispatchLoopState.STARTING, null, 0);
    }

    Future<Void> preflightFuture = options.isPreflightEnabled()
      ? preflight().compose(report -> report.ok()
      ? Future.succeededFuture()
      : Future.failedFuture(new PreflightFailedException(report)))
      : Future.succeededFuture();

    preflightFuture.onSuccess(v -> startWorker(promise))
      .onFailure(err -> {
        LOG.error("Dispatch loop for slot {} failed to start: {}", options.getSlotName(), err.getMessage());
        synchronized (this) {
          if (startPromise == promise && shouldRun.get()) {
            shouldRun.set(false);
            transition(DispatchLoopState.STOPPED, err, 0);
          }
        }
        promise.tryFail(err);
      });

    return promise.future();
  }

  public Future<PreflightReport> preflight() {
    return vertx.executeBlocking(() -> PostgresReplicationSession.preflight(options));
  }

  /**
   * Signals the reader to finish, waits up to the stop grace period for it and closes the session.
   * A handler invocation in flight is allowed to complete, but its message is not acknowledged once
   * the session is closed. Blocks the caller; do not call from an event loop thread.
   */
  public void stop() {
    Thread thread;
    synchronized (this) {
      if (state == DispatchLoopState.STOPPED || state == DispatchLoopState.STOPPING) {
        LOG.warn("Dispatch loop for slot {} is not running", options.getSlotName());
        return;
      }
      shouldRun.set(false);
      stopSignal.countDown();
      transition(DispatchLoopState.STOPPING, null, 0);
      thread = worker;
      if (thread == null) {
        transition(DispatchLoopState.STOPPED, null, 0);
      }
    }

    if (thread == null) {
      failStart(new IllegalStateException("dispatch loop stopped before reaching RUNNING"));
      return;
    }

    if (thread != Thread.currentThread()) {
      try {
        thread.join(options.getStopGracePeriodMs());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    if (thread.isAlive()) {
      LOG.warn("Dispatch loop for slot {} did not finish within {} ms, closing the session anyway",
        options.getSlotName(), options.getStopGracePeriodMs());
    }
    closeSource();
    LOG.info("Stopped dispatch loop for slot {}", options.getSlotName());
  }

  @Override
  public void close() {
    if (state.isActive()) {
      stop();
    }
  }

  public DispatchLoopState state() {
    return state;
  }

  public boolean isRunning() {
    return state == DispatchLoopState.RUNNING;
  }

  public String slotName() {
    return options.getSlotName();
  }

  /**
   * @return the last LSN confirmed to the server, or {@code null} before the first acknowledgement
   */
  public String lastAcknowledgedLsn() {
    return lastAcknowledgedLsn;
  }

  public Subscription onStateChange(Handler<DispatchStateChange> stateHandler) {
    Handler<DispatchStateChange> resolved = Objects.requireNonNull(stateHandler, "stateHandler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  private synchronized void startWorker(Promise<Void> promise) {
    if (!shouldRun.get() || startPromise != promise) {
      return;
    }
    if (worker != null && worker.isAlive()) {
      return;
    }
    worker = new Thread(this::runLoop, "dispatch-loop-" + options.getSlotName());
    worker.setDaemon(false);
    worker.start();
  }

  private void runLoop() {
    long attempt = 0;
    Throwable failure = null;
    try {
      while (shouldRun.get()) {
        attempt++;
        try {
          runSession(attempt);
        } catch (Exception e) {
          closeSource();
          if (!shouldRun.get()) {
            break;
          }
          failedAttempts++;
          LOG.error("Replication session for slot {} failed (attempt {})", options.getSlotName(), attempt, e);
          ReconnectPolicy policy = options.getReconnectPolicy();
          if (!policy.shouldReconnect(failedAttempts)) {
            failure = e;
            break;
          }
          long delay = policy.delayMillis(failedAttempts);
          if (!transitionWhileRunning(DispatchLoopState.STARTING, e, attempt)) {
            break;
          }
          LOG.warn("Reopening replication session for slot {} in {} ms", options.getSlotName(), delay);
          awaitStop(delay);
        }
      }
    } finally {
      closeSource();
      finishLoop(failure, attempt);
    }
  }

  private void runSession(long attempt) throws Exception {
    ChangeSource opened = sourceFactory.open();
    synchronized (sessionLock) {
      source = opened;
    }
    failedAttempts = 0;
    if (!transitionWhileRunning(DispatchLoopState.RUNNING, null, attempt)) {
      return;
    }
    completeStart();
    LOG.info("Dispatch loop for slot {} is running", options.getSlotName());

    while (shouldRun.get()) {
      WalMessage message = opened.read();
      if (message == null) {
        awaitStop(options.getPollIntervalMs());
        continue;
      }

      DecodedMessage decoded;
      try {
        decoded = decoder.decode(message.payload(), message.lsn());
      } catch (WalDecodeException e) {
        LOG.error("Skipping malformed WAL message at {}: {}", message.lsn(), e.getMessage());
        acknowledge(opened, message.lsn());
        continue;
      }

      for (ChangeEvent event : decoded.events()) {
        dispatchAndAwait(event);
      }
      if (!acknowledge(opened, decoded.ackLsn())) {
        LOG.warn("Session for slot {} closed while handling {}, leaving it for redelivery",
          options.getSlotName(), decoded.ackLsn());
        return;
      }
    }
  }

  /**
   * Confirms {@code lsn} on {@code session} unless the session was already closed by {@link #stop()}.
   */
  private boolean acknowledge(ChangeSource session, String lsn) throws Exception {
    synchronized (sessionLock) {
      if (source != session) {
        return false;
      }
      session.acknowledge(lsn);
      lastAcknowledgedLsn = lsn;
      return true;
    }
  }

  private void dispatchAndAwait(ChangeEvent event) throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    AtomicReference<Throwable> failure = new AtomicReference<>();
    context.runOnContext(v -> {
      try {
        Future<Void> result = handler.handle(event);
        if (result == null) {
          result = Future.succeededFuture();
        }
        result.onComplete(ar -> {
          if (ar.failed()) {
            failure.set(ar.cause());
          }
          latch.countDown();
        });
      } catch (Throwable err) {
        failure.set(err);
        latch.countDown();
      }
    });
    latch.await();

    Throwable err = failure.get();
    if (err != null) {
      if (err instanceof Exception) {
        throw (Exception) err;
      }
      throw new RuntimeException(err);
    }
  }

  private synchronized boolean transitionWhileRunning(DispatchLoopState nextState, Throwable cause, long attempt) {
    if (!shouldRun.get()) {
      return false;
    }
    transition(nextState, cause, attempt);
    return true;
  }

  private synchronized void finishLoop(Throwable failure, long attempt) {
    worker = null;
    shouldRun.set(false);
    transition(DispatchLoopState.STOPPED, failure, attempt);
    failStart(failure != null ? failure : new IllegalStateException("dispatch loop stopped before reaching RUNNING"));
  }

  private void closeSource() {
    ChangeSource current;
    synchronized (sessionLock) {
      current = source;
      source = null;
    }
    if (current != null) {
      current.close();
    }
  }

  private synchronized void transition(DispatchLoopState nextState, Throwable cause, long attempt) {
    DispatchLoopState previous = state;
    if (previous == nextState && cause == null) {
      return;
    }
    state = nextState;
    DispatchStateChange change = new DispatchStateChange(previous, nextState, cause, attempt);
    for (Handler<DispatchStateChange> stateHandler : stateHandlers) {
      context.runOnContext(v -> stateHandler.handle(change));
    }
  }

  private void failStart(Throwable error) {
    Promise<Void> promise = startPromise;
    if (promise != null) {
      promise.tryFail(error);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null) {
      promise.tryComplete();
    }
  }

  /**
   * Waits up to {@code millis}, returning early once {@link #stop()} was called.
   */
  private void awaitStop(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      stopSignal.await(millis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
