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

package ai.floedb.lakegauge.collector;

import ai.floedb.lakegauge.collector.model.AggregateMetrics;
import ai.floedb.lakegauge.collector.model.CollectionResult;
import ai.floedb.lakegauge.collector.model.PreviousAggregate;
import ai.floedb.lakegauge.collector.model.TableFailure;
import ai.floedb.lakegauge.collector.model.TableMetrics;
import ai.floedb.lakegauge.collector.spi.BaselineProvider;
import ai.floedb.lakegauge.collector.spi.CatalogClient;
import ai.floedb.lakegauge.collector.spi.CatalogUnavailableException;
import ai.floedb.lakegauge.collector.spi.ExportFailure;
import ai.floedb.lakegauge.collector.spi.MetadataReader;
import ai.floedb.lakegauge.collector.spi.MetricsExporter;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/**
 * Runs one collection: enumerate the catalog, measure every table, aggregate, export.
 *
 * <p>A catalog that cannot be enumerated aborts the run before anything is exported. Tables that
 * cannot be measured are reported and excluded from the totals. Export failures are reported in
 * the {@link RunReport} but leave the computed result intact.
 */
public final class MetricsCollector {
  private static final Logger LOG = Logger.getLogger(MetricsCollector.class);

  private final CatalogClient catalog;
  private final MetadataReader reader;
  private final BaselineProvider baseline;
  private final MetricsExporter exporter;
  private final CollectorOptions options;
  private final CollectionTelemetry telemetry;
  private final Consumer<TableMetrics> tableListener;

  private volatile TableWorkerPool activePool;
  private volatile boolean stopRequested;

  public MetricsCollector(
      CatalogClient catalog,
      MetadataReader reader,
      BaselineProvider baseline,
      MetricsExporter exporter,
      CollectorOptions options,
      CollectionTelemetry telemetry,
      Consumer<TableMetrics> tableListener) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.baseline = baseline == null ? BaselineProvider.NONE : baseline;
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.options = options == null ? CollectorOptions.defaults() : options;
    this.telemetry = telemetry == null ? CollectionTelemetry.detached() : telemetry;
    this.tableListener = tableListener == null ? m -> {} : tableListener;
  }

  public RunReport run() {
    long started = System.nanoTime();

    final CatalogListing listing;
    try {
      listing = new CatalogEnumerator(catalog).enumerate();
    } catch (CatalogUnavailableException e) {
      LOG.errorf(e, "Catalog unavailable, aborting run: %s", e.getMessage());
      return RunReport.aborted(RunStatus.CATALOG_UNAVAILABLE, e.getMessage(), since(started));
    }

    TableWorkerPool pool =
        new TableWorkerPool(reader, options.maxWorkers(), options.tableReadTimeout(), telemetry);
    activePool = pool;
    if (stopRequested) {
      pool.requestStop();
    }
    final CollectionResult result;
    try {
      result = pool.collect(listing);
    } finally {
      activePool = null;
    }
    telemetry.collectionFinished(since(started));

    for (TableMetrics metrics : result.metrics()) {
      tableListener.accept(metrics);
    }
    for (TableFailure failure : result.failures()) {
      LOG.warnf(
          "Table %s not measured (%s): %s", failure.table(), failure.kind(), failure.reason());
    }

    AggregateMetrics aggregate = Aggregator.aggregate(result, previousAggregate());
    List<ExportFailure> exportFailures = export(result, aggregate);

    Duration elapsed = since(started);
    LOG.infof(
        "Collection finished in %s: databases=%d tables=%d failed=%d bytes=%d",
        elapsed,
        aggregate.totalDatabaseCount(),
        aggregate.totalTableCount(),
        aggregate.failedTableCount(),
        aggregate.warehouseTotalBytes());

    if (!exportFailures.isEmpty()) {
      return new RunReport(
          RunStatus.EXPORT_FAILED,
          Optional.of(result),
          Optional.of(aggregate),
          exportFailures,
          exportFailures.size() + " metric pushes failed",
          elapsed);
    }
    return new RunReport(
        RunStatus.COMPLETED,
        Optional.of(result),
        Optional.of(aggregate),
        List.of(),
        "",
        elapsed);
  }

  /** Stops dispatching tables; tables already being read are finished. */
  public void requestStop() {
    stopRequested = true;
    TableWorkerPool pool = activePool;
    if (pool != null) {
      pool.requestStop();
    }
  }

  private Optional<PreviousAggregate> previousAggregate() {
    try {
      Optional<PreviousAggregate> previous = baseline.previous();
      if (previous.isEmpty()) {
        LOG.info("No previous run found, growth is not reported for this run");
      }
      return previous;
    } catch (RuntimeException e) {
      LOG.warnf(e, "Could not read previous run totals, growth is not reported for this run");
      return Optional.empty();
    }
  }

  private List<ExportFailure> export(CollectionResult result, AggregateMetrics aggregate) {
    try {
      List<ExportFailure> failures = exporter.export(result, aggregate);
      for (ExportFailure failure : failures) {
        LOG.errorf("Failed to push %s: %s", failure.family(), failure.reason());
      }
      return failures;
    } catch (RuntimeException e) {
      LOG.errorf(e, "Metrics export failed");
      return List.of(new ExportFailure("export", String.valueOf(e.getMessage())));
    }
  }

  private static Duration since(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos);
  }
}
