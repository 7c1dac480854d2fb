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

package ai.floedb.lakegauge.app;

import ai.floedb.lakegauge.collector.CollectionTelemetry;
import ai.floedb.lakegauge.collector.CollectorOptions;
import ai.floedb.lakegauge.collector.MetricsCollector;
import ai.floedb.lakegauge.collector.RunReport;
import ai.floedb.lakegauge.collector.RunStatus;
import ai.floedb.lakegauge.collector.TableMetricsJson;
import ai.floedb.lakegauge.collector.model.TableMetrics;
import ai.floedb.lakegauge.collector.spi.BaselineProvider;
import ai.floedb.lakegauge.collector.spi.CatalogClient;
import ai.floedb.lakegauge.collector.spi.MetadataReader;
import ai.floedb.lakegauge.collector.spi.MetricsExporter;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/** Runs a single collection over the configured warehouse and exits with the run's status. */
@QuarkusMain
public class CollectorMain implements QuarkusApplication {
  private static final Logger LOG = Logger.getLogger(CollectorMain.class);

  @Inject LakegaugeConfig config;
  @Inject Instance<CatalogClient> catalogClient;
  @Inject Instance<MetadataReader> metadataReader;
  @Inject BaselineProvider baseline;
  @Inject MetricsExporter exporter;
  @Inject CollectionTelemetry telemetry;

  @Override
  public int run(String... args) {
    final CollectorOptions options;
    try {
      options = options(config);
    } catch (IllegalArgumentException e) {
      LOG.errorf("Invalid configuration: %s", e.getMessage());
      return RunStatus.INVALID_CONFIGURATION.exitCode();
    }

    final CatalogClient catalog;
    final MetadataReader reader;
    try {
      catalog = catalogClient.get();
      reader = metadataReader.get();
    } catch (RuntimeException e) {
      LOG.errorf(e, "Could not connect to the catalog of %s", config.warehouse());
      return RunStatus.CATALOG_UNAVAILABLE.exitCode();
    }

    LOG.infof(
        "Collecting metrics for %s with %d workers, table read timeout %s",
        config.warehouse(),
        options.maxWorkers(),
        options.tableReadTimeout());
    MetricsCollector collector =
        new MetricsCollector(
            catalog, reader, baseline, exporter, options, telemetry, tableListener());

    Thread stopHook = new Thread(collector::requestStop, "lakegauge-stop");
    Runtime.getRuntime().addShutdownHook(stopHook);
    RunReport report;
    try {
      report = collector.run();
    } finally {
      removeHook(stopHook);
    }

    LOG.infof(
        "Run %s: %d tables measured, %d failed, mean table read %s",
        report.status(),
        telemetry.collectedCount(),
        telemetry.failedCount(),
        telemetry.meanTableRead());
    return report.exitCode();
  }

  static CollectorOptions options(LakegaugeConfig config) {
    if (config.warehouse() == null || config.warehouse().isBlank()) {
      throw new IllegalArgumentException("lakegauge.warehouse must not be blank");
    }
    if (config.pushgateway() == null || config.pushgateway().isBlank()) {
      throw new IllegalArgumentException("lakegauge.pushgateway must not be blank");
    }
    return new CollectorOptions(config.maxWorkers(), config.tableReadTimeout());
  }

  private Consumer<TableMetrics> tableListener() {
    if (!config.report().stdout()) {
      return metrics -> {};
    }
    return metrics -> System.out.println(TableMetricsJson.render(metrics));
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException e) {
      LOG.debug("JVM is shutting down, stop hook stays registered");
    }
  }
}
