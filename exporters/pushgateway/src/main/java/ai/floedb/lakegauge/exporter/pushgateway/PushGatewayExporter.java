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

import ai.floedb.lakegauge.collector.model.AggregateMetrics;
import ai.floedb.lakegauge.collector.model.AggregateMetrics.RankedTable;
import ai.floedb.lakegauge.collector.model.CollectionResult;
import ai.floedb.lakegauge.collector.model.GrowthDelta;
import ai.floedb.lakegauge.collector.model.TableMetrics;
import ai.floedb.lakegauge.collector.spi.ExportFailure;
import ai.floedb.lakegauge.collector.spi.MetricsExporter;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Gauge;
import io.prometheus.client.exporter.PushGateway;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Pushes run results to a Prometheus Pushgateway.
 *
 * <p>Each table is pushed as its own group under job {@value #TABLE_JOB}, keyed by database and
 * table. Aggregate families go to job {@value #AGGREGATE_JOB}, keyed by warehouse, one family per
 * request so a rejected family does not hold back the others. Growth families carry NaN when
 * there is no baseline.
 */
public final class PushGatewayExporter implements MetricsExporter {
  private static final Logger LOG = Logger.getLogger(PushGatewayExporter.class);

  public static final String TABLE_JOB = "iceberg_metrics";
  public static final String AGGREGATE_JOB = "iceberg_metrics_aggregate";

  static final String WAREHOUSE_TOTAL_BYTES = "iceberg_warehouse_total_bytes";
  static final String NAMESPACE_TOTAL_BYTES = "iceberg_namespace_total_bytes";

  private static final String[] TABLE_LABELS = {"database", "table"};
  private static final String[] RANK_LABELS = {"rank", "database", "table"};

  private final PushGateway gateway;
  private final String warehouse;

  public PushGatewayExporter(String address, String warehouse) {
    this(new PushGateway(gatewayUrl(address)), warehouse);
  }

  PushGatewayExporter(PushGateway gateway, String warehouse) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.warehouse = Objects.requireNonNull(warehouse, "warehouse");
  }

  private static URL gatewayUrl(String address) {
    String base = PushGatewayBaselineProvider.baseUrl(address);
    try {
      return new URL(base);
    } catch (MalformedURLException e) {
      throw new IllegalArgumentException("Invalid Pushgateway address " + address, e);
    }
  }

  @Override
  public List<ExportFailure> export(CollectionResult result, AggregateMetrics aggregate) {
    List<ExportFailure> failures = new ArrayList<>();
    for (TableMetrics metrics : result.metrics()) {
      pushTable(metrics, failures);
    }
    pushAggregate(aggregate, failures);
    LOG.infof(
        "Pushed %d tables and aggregates for %s, %d failed pushes",
        result.metrics().size(),
        warehouse,
        failures.size());
    return failures;
  }

  private void pushTable(TableMetrics metrics, List<ExportFailure> failures) {
    CollectorRegistry registry = new CollectorRegistry();
    String db = metrics.database();
    String table = metrics.table();
    gauge(registry, "iceberg_table_partitions", "Total partitions", TABLE_LABELS)
        .labels(db, table)
        .set(metrics.partitionCount());
    gauge(registry, "iceberg_table_files", "Total files", TABLE_LABELS)
        .labels(db, table)
        .set(metrics.fileCount());
    gauge(registry, "iceberg_storage_total_bytes", "Total bytes", TABLE_LABELS)
        .labels(db, table)
        .set(metrics.totalBytes());
    gauge(registry, "iceberg_table_records", "Total records", TABLE_LABELS)
        .labels(db, table)
        .set(metrics.totalRecords());
    gauge(
            registry,
            "iceberg_table_avg_partition_size",
            "Average partition size in bytes",
            TABLE_LABELS)
        .labels(db, table)
        .set(metrics.avgPartitionSize());
    gauge(registry, "iceberg_table_info", "Iceberg table info", TABLE_LABELS)
        .labels(db, table)
        .set(1);

    Map<String, String> key = new LinkedHashMap<>();
    key.put("database", db);
    key.put("table", table);
    try {
      gateway.push(registry, TABLE_JOB, key);
      LOG.debugf("Pushed metrics for %s.%s", db, table);
    } catch (IOException e) {
      failures.add(new ExportFailure(TABLE_JOB + "/" + db + "." + table, e.getMessage()));
    }
  }

  private void pushAggregate(AggregateMetrics aggregate, List<ExportFailure> failures) {
    Map<String, String> key = Map.of("warehouse", warehouse);

    push(
        single("iceberg_database_count", "Enumerated namespaces", aggregate.totalDatabaseCount()),
        key,
        failures);
    push(
        single("iceberg_table_count", "Successfully measured tables", aggregate.totalTableCount()),
        key,
        failures);
    push(
        single("iceberg_table_failures", "Tables not measured", aggregate.failedTableCount()),
        key,
        failures);
    push(
        single(
            WAREHOUSE_TOTAL_BYTES, "Data bytes in the warehouse", aggregate.warehouseTotalBytes()),
        key,
        failures);
    push(
        perNamespace(
            NAMESPACE_TOTAL_BYTES, "Data bytes per namespace", aggregate.perNamespaceTotalBytes()),
        key,
        failures);
    push(
        ranking(
            "iceberg_top_tables_by_records",
            "Largest tables by record count",
            aggregate.top5ByRecordCount()),
        key,
        failures);
    push(
        ranking("iceberg_top_tables_by_size", "Largest tables by bytes", aggregate.top5BySize()),
        key,
        failures);

    // No baseline: growth is NaN, replacing whatever an earlier run left in the group.
    Map<String, Double> namespaceGrowth = new LinkedHashMap<>();
    double warehouseGrowth;
    if (aggregate.growthDelta().isPresent()) {
      GrowthDelta growth = aggregate.growthDelta().get();
      warehouseGrowth = growth.warehouseBytesDelta();
      growth.perNamespaceBytes().forEach((db, bytes) -> namespaceGrowth.put(db, (double) bytes));
    } else {
      warehouseGrowth = Double.NaN;
      for (String db : aggregate.perNamespaceTotalBytes().keySet()) {
        namespaceGrowth.put(db, Double.NaN);
      }
    }
    push(
        single(
            "iceberg_warehouse_growth_bytes",
            "Warehouse byte change since the previous run",
            warehouseGrowth),
        key,
        failures);
    push(
        perNamespace(
            "iceberg_namespace_growth_bytes",
            "Namespace byte change since the previous run",
            namespaceGrowth),
        key,
        failures);
  }

  private void push(Gauge family, Map<String, String> key, List<ExportFailure> failures) {
    String name = family.collect().get(0).name;
    try {
      gateway.pushAdd(family, AGGREGATE_JOB, key);
    } catch (IOException e) {
      failures.add(new ExportFailure(name, e.getMessage()));
    }
  }

  private static Gauge single(String name, String help, double value) {
    Gauge gauge = Gauge.build().name(name).help(help).create();
    gauge.set(value);
    return gauge;
  }

  private static Gauge perNamespace(
      String name, String help, Map<String, ? extends Number> values) {
    Gauge gauge = Gauge.build().name(name).help(help).labelNames("database").create();
    values.forEach((database, value) -> gauge.labels(database).set(value.doubleValue()));
    return gauge;
  }

  private static Gauge ranking(String name, String help, List<RankedTable> ranked) {
    Gauge gauge = Gauge.build().name(name).help(help).labelNames(RANK_LABELS).create();
    for (RankedTable entry : ranked) {
      gauge
          .labels(String.valueOf(entry.rank()), entry.database(), entry.table())
          .set(entry.value());
    }
    return gauge;
  }

  private static Gauge gauge(
      CollectorRegistry registry, String name, String help, String... labelNames) {
    return Gauge.build().name(name).help(help).labelNames(labelNames).register(registry);
  }
}
