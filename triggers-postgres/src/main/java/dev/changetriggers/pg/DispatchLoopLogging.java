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

import dev.changetriggers.core.DispatchLoopState;
import dev.changetriggers.core.DispatchStateChange;
import dev.changetriggers.core.Subscription;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Writes one log line per dispatch loop transition, naming the slot position the next session
 * resumes from. Failures that end the loop are logged at ERROR, sessions that will be reopened at
 * WARN, everything else at INFO.
 */
public final class DispatchLoopLogging {

  private DispatchLoopLogging() {
  }

  public static Subscription attachDefaultLogging(DispatchLoop loop, Logger logger) {
    Objects.requireNonNull(loop, "loop");
    Objects.requireNonNull(logger, "logger");

    return loop.onStateChange(change -> {
      String line = describe(loop.slotName(), loop.lastAcknowledgedLsn(), change);
      if (change.cause() == null) {
        logger.info(line);
      } else if (change.state() == DispatchLoopState.STARTING) {
        logger.warn(line);
      } else {
        logger.error(line, change.cause());
      }
    });
  }

  static String describe(String slot, String lastAcknowledgedLsn, DispatchStateChange change) {
    String position = lastAcknowledgedLsn == null ? "the slot's confirmed position" : lastAcknowledgedLsn;
    Throwable cause = change.cause();
    switch (change.state()) {
      case STARTING:
        if (cause != null) {
          return "Slot " + slot + ": session " + change.attempt() + " failed with " + summarize(cause)
            + ", reconnecting from " + position;
        }
        return "Slot " + slot + ": starting";
      case RUNNING:
        return "Slot " + slot + ": streaming (session " + change.attempt() + ") from " + position;
      case STOPPING:
        return "Slot " + slot + ": stopping, last acknowledged " + position;
      case STOPPED:
      default:
        if (cause != null) {
          return "Slot " + slot + ": halted by " + summarize(cause) + ", changes after " + position
            + " are redelivered on the next start";
        }
        return "Slot " + slot + ": stopped at " + position;
    }
  }

  private static String summarize(Throwable cause) {
    String message = cause.getMessage();
    String type = cause.getClass().getSimpleName();
    return message == null ? type : type + " (" + message + ")";
  }
}
