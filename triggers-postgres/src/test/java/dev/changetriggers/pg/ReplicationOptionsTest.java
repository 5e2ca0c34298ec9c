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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.changetriggers.core.ReconnectPolicy;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReplicationOptionsTest {

  @Test
  void defaultsAreValid() {
    ReplicationOptions options = new ReplicationOptions();

    options.validate();
    assertEquals("triggers_slot", options.getSlotName());
    assertEquals("triggers_publication", options.getPublicationName());
    assertEquals(List.of("public.monitor", "public.monitor_statuses", "public.tags", "public.monitor_tags"),
      options.getWatchedTables());
    assertEquals("jdbc:postgresql://localhost:5432/postgres", options.jdbcUrl());
    assertFalse(options.getReconnectPolicy().isEnabled());
  }

  @Test
  void jsonRoundTripKeepsSettings() {
    ReplicationOptions options = new ReplicationOptions()
      .setHost("db")
      .setPort(6543)
      .setSlotName("slot_a")
      .setWatchedTables(List.of("public.monitor"))
      .setPollIntervalMs(25)
      .setReconnectPolicy(ReconnectPolicy.exponentialBackoff().setMaxAttempts(5));

    ReplicationOptions copy = new ReplicationOptions(options.toJson());

    assertEquals(options.toJson(), copy.toJson());
    assertTrue(copy.getReconnectPolicy().isEnabled());
    assertEquals(5L, copy.getReconnectPolicy().getMaxAttempts());
  }

  @Test
  void mergeOverridesOnlyGivenKeys() {
    ReplicationOptions merged = new ReplicationOptions().setHost("db")
      .merge(new JsonObject().put("slotName", "other_slot").put("watchedTables", new JsonArray().add("public.tags")));

    assertEquals("db", merged.getHost());
    assertEquals("other_slot", merged.getSlotName());
    assertEquals(List.of("public.tags"), merged.getWatchedTables());
  }

  @Test
  void copyIsIndependent() {
    ReplicationOptions original = new ReplicationOptions();
    ReplicationOptions copy = new ReplicationOptions(original).setSlotName("copy_slot");

    assertEquals("triggers_slot", original.getSlotName());
    assertEquals("copy_slot", copy.getSlotName());
  }

  @Test
  void rejectsNamesThatAreNotPlainIdentifiers() {
    assertThrows(IllegalArgumentException.class, () -> new ReplicationOptions().setSlotName("bad-slot").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new ReplicationOptions().setPublicationName("pub; DROP TABLE x").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new ReplicationOptions().setWatchedTables(List.of("public.monitor.extra")).validate());
    assertThrows(IllegalArgumentException.class,
      () -> new ReplicationOptions().setWatchedTables(List.of()).validate());
  }

  @Test
  void rejectsInvalidNumbers() {
    assertThrows(IllegalArgumentException.class, () -> new ReplicationOptions().setPort(0).validate());
    assertThrows(IllegalArgumentException.class, () -> new ReplicationOptions().setPollIntervalMs(0).validate());
    assertThrows(IllegalArgumentException.class, () -> new ReplicationOptions().setFormatVersion(3).validate());
  }

  @Test
  void passwordFallsBackToEnvironmentVariable() {
    ReplicationOptions options = new ReplicationOptions().setPassword("secret").setPasswordEnv("PATH");

    assertEquals("secret", options.resolvePassword());
    assertEquals(System.getenv("PATH"), new ReplicationOptions().setPasswordEnv("PATH").resolvePassword());
  }
}
