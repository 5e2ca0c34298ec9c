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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Opens plain JDBC connections for the trigger stores.
 */
@FunctionalInterface
public interface JdbcConnectionFactory {

  Connection open() throws SQLException;

  static JdbcConnectionFactory of(String jdbcUrl, String user, String password) {
    Properties props = new Properties();
    if (user != null && !user.isBlank()) {
      PGProperty.USER.set(props, user);
    }
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }
    return () -> DriverManager.getConnection(jdbcUrl, props);
  }

  /**
   * Connects with the credentials of the replication source.
   */
  static JdbcConnectionFactory of(ReplicationOptions options) {
    Properties props = PostgresReplicationSession.connectionProperties(options);
    String url = options.jdbcUrl();
    return () -> DriverManager.getConnection(url, props);
  }
}
