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

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.lakegauge.collector.model.AggregateMetrics;
import ai.floedb.lakegauge.collector.model.AggregateMetrics.RankedTable;
import ai.floedb.lakegauge.collector.model.CollectionResult;
import ai.floedb.lakegauge.collector.model.GrowthDelta;
import ai.floedb.lakegauge.collector.model.TableMetrics;
import ai.floedb.lakegauge.collector.model.TableRef;
import ai.floedb.lakegauge.collector.spi.ExportFailure;
import ai.floedb.lakegauge.exporter.pushgateway.RecordingGateway.Request;
import java.net.ServerSocket;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PushGatewayExporterTest {
  private static final String WAREHOUSE = "lake";
  private static final TableMetrics ORDERS =
      new TableMetrics("sales", "orders", 1, 2, 1333, 9, 1333.0d);

  private RecordingGateway gateway;

  @BeforeEach
  void setUp() throws Exception {
    gateway = new RecordingGateway();
  }

  @AfterEach
  void tearDown() {
    gateway.close();
  }

  @Test
  void pushesEachTableAsItsOwnGroup() {
    TableMetrics people = new TableMetrics("hr", "people", 2, 3, 10, 1, 5.0d);

    List<ExportFailure> failures =
        new PushGatewayExporter(gateway.address(), WAREHOUSE)
            .export(result(ORDERS, people), aggregate(Optional.empty()));

    assertThat(failures).isEmpty();
    List<Request> tablePushes =
        gateway.requests().stream()
            .filter(r -> r.path().startsWith("/metrics/job/iceberg_metrics/"))
            .toList();
    assertThat(tablePushes)
        .extracting(Request::path)
        .containsExactlyInAnyOrder(
            "/metrics/job/iceberg_metrics/database/sales/table/orders",
            "/metrics/job/iceberg_metrics/database/hr/table/people");
    assertThat(tablePushes).extracting(Request::method).containsOnly("PUT");
    Request orders =
        tablePushes.stream().filter(r -> r.path().endsWith("/orders")).findFirst().orElseThrow();
    assertThat(orders.body())
        .contains("iceberg_table_partitions{database=\"sales\",table=\"orders\",} 1.0")
        .contains("iceberg_table_files{database=\"sales\",table=\"orders\",} 2.0")
        .contains("iceberg_storage_total_bytes{database=\"sales\",table=\"orders\",} 1333.0")
        .contains("iceberg_table_records{database=\"sales\",table=\"orders\",} 9.0")
        .contains("iceberg_table_avg_partition_size{database=\"sales\",table=\"orders\",} 1333.0")
        .contains("iceberg_table_info{database=\"sales\",table=\"orders\",} 1.0");
  }

  @Test
  void pushesAggregateFamiliesOneAtATime() {
    new PushGatewayExporter(gateway.address(), WAREHOUSE)
        .export(result(ORDERS), aggregate(Optional.empty()));

    List<Request> aggregatePushes = aggregatePushes();
    assertThat(aggregatePushes).hasSize(9);
    assertThat(aggregatePushes).extracting(Request::method).containsOnly("POST");
    assertThat(String.join("\n", aggregatePushes.stream().map(Request::body).toList()))
        .contains("iceberg_database_count 1.0")
        .contains("iceberg_table_count 1.0")
        .contains("iceberg_table_failures 0.0")
        .contains("iceberg_warehouse_total_bytes 1333.0")
        .contains("iceberg_namespace_total_bytes{database=\"sales\",} 1333.0")
        .contains(
            "iceberg_top_tables_by_size{rank=\"1\",database=\"sales\",table=\"orders\",} 1333.0")
        .contains(
            "iceberg_top_tables_by_records{rank=\"1\",database=\"sales\",table=\"orders\",} 9.0");
  }

  @Test
  void growthWithoutBaselineOverwritesEarlierValuesWithNaN() {
    new PushGatewayExporter(gateway.address(), WAREHOUSE)
        .export(result(ORDERS), aggregate(Optional.empty()));

    assertThat(String.join("\n", aggregatePushes().stream().map(Request::body).toList()))
        .contains("iceberg_warehouse_growth_bytes NaN")
        .contains("iceberg_namespace_growth_bytes{database=\"sales\",} NaN");
  }

  @Test
  void growthFamiliesCarryTheDeltaWithBaseline() {
    GrowthDelta growth = new GrowthDelta(333, new TreeMap<>(Map.of("sales", 333L)));

    new PushGatewayExporter(gateway.address(), WAREHOUSE)
        .export(result(ORDERS), aggregate(Optional.of(growth)));

    List<Request> aggregatePushes = aggregatePushes();
    assertThat(aggregatePushes).hasSize(9);
    assertThat(String.join("\n", aggregatePushes.stream().map(Request::body).toList()))
        .contains("iceberg_warehouse_growth_bytes 333.0")
        .contains("iceberg_namespace_growth_bytes{database=\"sales\",} 333.0");
  }

  @Test
  void acceptsUrlFormAddress() {
    List<ExportFailure> failures =
        new PushGatewayExporter("http://" + gateway.address() + "/", WAREHOUSE)
            .export(result(ORDERS), aggregate(Optional.empty()));

    assertThat(failures).isEmpty();
    assertThat(gateway.requests())
        .extracting(Request::path)
        .contains("/metrics/job/iceberg_metrics/database/sales/table/orders");
  }

  @Test
  void rejectedFamilyDoesNotStopTheOthers() {
    gateway.reject(r -> r.body().contains("# TYPE iceberg_table_count gauge"));

    List<ExportFailure> failures =
        new PushGatewayExporter(gateway.address(), WAREHOUSE)
            .export(result(ORDERS), aggregate(Optional.empty()));

    assertThat(failures).extracting(ExportFailure::family).containsExactly("iceberg_table_count");
    assertThat(aggregatePushes()).hasSize(9);
  }

  @Test
  void unreachableGatewayReportsEveryPush() throws Exception {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }

    List<ExportFailure> failures =
        new PushGatewayExporter("localhost:" + closedPort, WAREHOUSE)
            .export(result(ORDERS), aggregate(Optional.empty()));

    assertThat(failures).hasSize(10);
    assertThat(failures.get(0).family()).isEqualTo("iceberg_metrics/sales.orders");
  }

  private List<Request> aggregatePushes() {
    return gateway.requests().stream()
        .filter(r -> r.path().startsWith("/metrics/job/iceberg_metrics_aggregate/warehouse/lake"))
        .toList();
  }

  private static CollectionResult result(TableMetrics... metrics) {
    List<TableMetrics> list = List.of(metrics);
    List<TableRef> refs = list.stream().map(TableMetrics::ref).toList();
    List<String> namespaces = list.stream().map(TableMetrics::database).distinct().toList();
    return new CollectionResult(namespaces, refs, list, List.of());
  }

  private static AggregateMetrics aggregate(Optional<GrowthDelta> growth) {
    return new AggregateMetrics(
        1,
        1,
        0,
        new TreeMap<>(Map.of("sales", 1333L)),
        1333,
        List.of(new RankedTable(1, "sales", "orders", 9)),
        List.of(new RankedTable(1, "sales", "orders", 1333)),
        growth);
  }
}
