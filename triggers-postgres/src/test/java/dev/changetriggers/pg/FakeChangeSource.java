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

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves queued messages and records acknowledgements in order.
 */
final class FakeChangeSource implements ChangeSource {

  private final ConcurrentLinkedQueue<WalMessage> pending = new ConcurrentLinkedQueue<>();
  private final List<String> acknowledged = new CopyOnWriteArrayList<>();
  private final List<String> log;
  private final AtomicBoolean closed = new AtomicBoolean();

  FakeChangeSource(List<String> log) {
    this.log = log;
  }

  FakeChangeSource offer(String payload, String lsn) {
    pending.add(new WalMessage(payload, lsn));
    return this;
  }

  @Override
  public WalMessage read() {
    if (closed.get()) {
      throw new IllegalStateException("source closed");
    }
    return pending.poll();
  }

  @Override
  public void acknowledge(String lsn) {
    if (closed.get()) {
      throw new IllegalStateException("acknowledged " + lsn + " on a closed source");
    }
    acknowledged.add(lsn);
    log.add("ack " + lsn);
  }

  @Override
  public void close() {
    closed.set(true);
  }

  List<String> acknowledged() {
    return acknowledged;
  }

  boolean isClosed() {
    return closed.get();
  }
}
