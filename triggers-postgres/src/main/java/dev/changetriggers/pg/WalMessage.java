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

/**
 * One raw logical decoding message as read from the replication stream.
 */
public final class WalMessage {

  private final String payload;
  private final String lsn;

  public WalMessage(String payload, String lsn) {
    this.payload = payload;
    this.lsn = lsn;
  }

  public String payload() {
    return payload;
  }

  /**
   * Start position of the message; acknowledged once the message is processed.
   */
  public String lsn() {
    return lsn;
  }
}
