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

import dev.changetriggers.core.NotificationDispatcher;
import dev.changetriggers.core.TriggerMatcher;
import dev.changetriggers.core.TriggerProcessor;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the trigger stores, the notification dispatcher and the dispatch loop, and serves
 * {@code GET /health}.
 */
public class TriggersApp {

  private static final Logger LOG = LoggerFactory.getLogger(TriggersApp.class);
  static final String VERSION = "0.1.0";

  private final Vertx vertx;
  private final TriggersAppConfig config;
  private final JdbcConnectionFactory connections;
  private final WebClient webClient;
  private final DispatchLoop dispatchLoop;
  private HttpServer httpServer;

  public TriggersApp(Vertx vertx, TriggersAppConfig config) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.config = Objects.requireNonNull(config, "config");
    this.connections = config.triggerStoreConnections();
    this.webClient = WebClient.create(vertx);

    NotificationDispatcher dispatcher = new NotificationDispatcher(
      vertx, webClient, new JdbcTriggerEventStore(connections), config.deliveryTimeoutMs());
    TriggerProcessor processor = new TriggerProcessor(
      vertx, new TriggerMatcher(new JdbcTriggerStore(connections)), dispatcher);
    this.dispatchLoop = new DispatchLoop(vertx, config.toReplicationOptions(), processor);
    DispatchLoopLogging.attachDefaultLogging(dispatchLoop, LOG);
  }

  public static void main(String[] args) {
    Vertx vertx = Vertx.vertx();
    TriggersApp app = new TriggersApp(vertx, TriggersAppConfig.fromEnv());
    Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "triggers-shutdown"));
    app.start().onFailure(err -> LOG.error("Failed to start change triggers service", err));
  }

  /**
   * Applies the schema, opens the health endpoint and starts the dispatch loop. The health
   * endpoint stays up when the dispatch loop fails to start.
   */
  public Future<Void> start() {
    return vertx.<Void>executeBlocking(() -> {
        TriggerSchema.apply(connections);
        return null;
      })
      .compose(v -> startHttpServer())
      .compose(v -> dispatchLoop.start()
        .recover(err -> {
          LOG.error("Dispatch loop did not start; notifications are disabled", err);
          return Future.succeededFuture();
        }));
  }

  public void stop() {
    if (dispatchLoop.state().isActive()) {
      dispatchLoop.stop();
    }
    webClient.close();
    vertx.close();
  }

  public DispatchLoop dispatchLoop() {
    return dispatchLoop;
  }

  public int httpPort() {
    return httpServer == null ? -1 : httpServer.actualPort();
  }

  JsonObject health() {
    return new JsonObject()
      .put("status", "ok")
      .put("version", VERSION)
      .put("dispatchLoop", dispatchLoop.state().name());
  }

  private Future<Void> startHttpServer() {
    return vertx.createHttpServer()
      .requestHandler(request -> {
        if ("/health".equals(request.path()) && "GET".equals(request.method().name())) {
          request.response()
            .putHeader("Content-Type", "application/json")
            .end(health().encode());
        } else {
          request.response().setStatusCode(404).end();
        }
      })
      .listen(config.httpPort())
      .onSuccess(server -> {
        httpServer = server;
        LOG.info("Health endpoint listening on port {}", server.actualPort());
      })
      .mapEmpty();
  }
}
