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
import java.util.Collections;
import java.util.List;
import java.util.ArrayList;

/**
 * The change events of one WAL message, in payload order, and the position that acknowledges
 * them.
 */
public final class DecodedMessage {

  private final List<ChangeEvent> events;
  private final String ackLsn;

  public DecodedMessage(List<ChangeEvent> events, String ackLsn) {
    this.events = events == null || events.isEmpty()
      ? Collections.emptyList()
      : Collections.unmodifiableList(new ArrayList<>(events));
    this.ackLsn = ackLsn;
  }

  public List<ChangeEvent> events() {
    return events;
  }

  public String ackLsn() {
    return ackLsn;
  }
}
