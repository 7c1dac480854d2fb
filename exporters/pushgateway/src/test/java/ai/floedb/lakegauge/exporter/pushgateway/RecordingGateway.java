/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.lakegauge.exporter.pushgateway;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/** In-process stand-in for a Pushgateway that records every request it receives. */
final class RecordingGateway implements AutoCloseable {
  record Request(String method, String path, String body) {}

  private final HttpServer server;
  private final List<Request> requests = new CopyOnWriteArrayList<>();
  private volatile Predicate<Request> rejects = r -> false;
  private volatile String metricsJson = "{\"status\":\"success\",\"data\":[]}";
  private volatile int metricsStatus = 200;

  RecordingGateway() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          String body =
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
          Request request =
              new Request(exchange.getRequestMethod(), exchange.getRequestURI().getPath(), body);
          requests.add(request);
          int status;
          byte[] response;
          if (request.path().equals("/api/v1/metrics")) {
            status = metricsStatus;
            response = metricsJson.getBytes(StandardCharsets.UTF_8);
          } else {
            status = rejects.test(request) ? 500 : 202;
            response = new byte[0];
          }
          exchange.sendResponseHeaders(status, response.length == 0 ? -1 : response.length);
          if (response.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
              out.write(response);
            }
          }
          exchange.close();
        });
    server.start();
  }

  String address() {
    return "localhost:" + server.getAddress().getPort();
  }

  List<Request> requests() {
    return requests;
  }

  void reject(Predicate<Request> rejects) {
    this.rejects = rejects;
  }

  void serveMetrics(int status, String json) {
    this.metricsStatus = status;
    this.metricsJson = json;
  }

  @Override
  public void close() {
    server.stop(0);
  }
}
