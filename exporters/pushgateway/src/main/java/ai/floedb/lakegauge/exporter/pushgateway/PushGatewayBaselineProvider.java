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

import ai.floedb.lakegauge.collector.model.PreviousAggregate;
import ai.floedb.lakegauge.collector.spi.BaselineProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.SortedMap;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Reads the totals the previous run pushed for this warehouse from the Pushgateway's JSON API
 * ({@code GET /api/v1/metrics}).
 */
public final class PushGatewayBaselineProvider implements BaselineProvider {
  private static final Logger LOG = Logger.getLogger(PushGatewayBaselineProvider.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final URI metricsUri;
  private final String warehouse;
  private final HttpClient client;
  private final Duration timeout;

  public PushGatewayBaselineProvider(String address, String warehouse, Duration timeout) {
    this.metricsUri = URI.create(baseUrl(address) + "/api/v1/metrics");
    this.warehouse = Objects.requireNonNull(warehouse, "warehouse");
    this.timeout = timeout;
    this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  @Override
  public Optional<PreviousAggregate> previous() {
    final HttpResponse<String> response;
    try {
      var request = HttpRequest.newBuilder().uri(metricsUri).timeout(timeout).GET().build();
      response = client.send(request, BodyHandlers.ofString());
    } catch (IOException e) {
      LOG.warnf("Pushgateway %s unreachable, no baseline: %s", metricsUri, e.getMessage());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
    if (response.statusCode() != 200) {
      LOG.warnf("Pushgateway %s answered %d, no baseline", metricsUri, response.statusCode());
      return Optional.empty();
    }
    try {
      return parse(MAPPER.readTree(response.body()), warehouse);
    } catch (IOException e) {
      LOG.warnf("Unparseable response from %s, no baseline: %s", metricsUri, e.getMessage());
      return Optional.empty();
    }
  }

  static Optional<PreviousAggregate> parse(JsonNode root, String warehouse) {
    for (JsonNode group : root.path("data")) {
      JsonNode labels = group.path("labels");
      if (!PushGatewayExporter.AGGREGATE_JOB.equals(labels.path("job").asText())
          || !warehouse.equals(labels.path("warehouse").asText())) {
        continue;
      }
      OptionalLong total = OptionalLong.empty();
      JsonNode totals = group.path(PushGatewayExporter.WAREHOUSE_TOTAL_BYTES).path("metrics");
      for (JsonNode sample : totals) {
        total = value(sample);
      }
      if (total.isEmpty()) {
        return Optional.empty();
      }
      SortedMap<String, Long> perNamespace = new TreeMap<>();
      JsonNode namespaces = group.path(PushGatewayExporter.NAMESPACE_TOTAL_BYTES).path("metrics");
      for (JsonNode sample : namespaces) {
        String database = sample.path("labels").path("database").asText("");
        OptionalLong bytes = value(sample);
        if (!database.isEmpty() && bytes.isPresent()) {
          perNamespace.put(database, bytes.getAsLong());
        }
      }
      return Optional.of(new PreviousAggregate(total.getAsLong(), perNamespace));
    }
    return Optional.empty();
  }

  private static OptionalLong value(JsonNode sample) {
    String raw = sample.path("value").asText("");
    try {
      return OptionalLong.of(new BigDecimal(raw).longValue());
    } catch (NumberFormatException e) {
      LOG.debugf("Ignoring non-numeric sample value %s", raw);
      return OptionalLong.empty();
    }
  }

  /** Normalizes {@code host:port} or a URL to a base URL without a trailing slash. */
  static String baseUrl(String address) {
    String trimmed = address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
    return trimmed.contains("://") ? trimmed : "http://" + trimmed;
  }
}
