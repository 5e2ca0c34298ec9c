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
 * A single-reader source of WAL messages with explicit acknowledgement.
 */
public interface ChangeSource extends AutoCloseable {

  /**
   * Returns the next pending message without blocking.
   *
   * @return the message, or {@code null} when nothing is pending
   */
  WalMessage read() throws Exception;

  /**
   * Confirms every message up to and including {@code lsn} as processed.
   */
  void acknowledge(String lsn) throws Exception;

  /**
   * Releases the connection. Server-side resume state is kept.
   */
  @Override
  void close();

  @FunctionalInterface
  interface Factory {
    /**
     * Opens a source, performing any server-side setup it needs.
     */
    ChangeSource open() throws Exception;
  }
}
