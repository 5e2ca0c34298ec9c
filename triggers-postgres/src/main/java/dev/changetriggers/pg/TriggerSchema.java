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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@code triggers} and {@code trigger_events} tables when they are missing.
 */
public final class TriggerSchema {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerSchema.class);
  private static final String RESOURCE = "/dev/changetriggers/pg/schema.sql";

  private TriggerSchema() {
  }

  public static void apply(JdbcConnectionFactory connections) throws SQLException {
    List<String> statements = statements();
    try (Connection conn = connections.open();
         Statement statement = conn.createStatement()) {
      for (String sql : statements) {
        statement.execute(sql);
      }
    }
    LOG.info("Trigger schema is up to date ({} statements)", statements.size());
  }

  static List<String> statements() {
    String script;
    try (InputStream in = TriggerSchema.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing schema resource " + RESOURCE);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read " + RESOURCE, e);
    }

    List<String> statements = new ArrayList<>();
    for (String part : script.split(";")) {
      String sql = part.trim();
      if (!sql.isEmpty()) {
        statements.add(sql);
      }
    }
    return statements;
  }
}
