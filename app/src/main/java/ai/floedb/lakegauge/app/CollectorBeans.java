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
import ai.floedb.lakegauge.collector.spi.BaselineProvider;
import ai.floedb.lakegauge.collector.spi.CatalogClient;
import ai.floedb.lakegauge.collector.spi.MetadataReader;
import ai.floedb.lakegauge.collector.spi.MetricsExporter;
import ai.floedb.lakegauge.connector.iceberg.IcebergCatalogClient;
import ai.floedb.lakegauge.connector.iceberg.IcebergCatalogFactory;
import ai.floedb.lakegauge.connector.iceberg.IcebergMetadataReader;
import ai.floedb.lakegauge.connector.iceberg.S3TablesCatalogClient;
import ai.floedb.lakegauge.exporter.pushgateway.PushGatewayBaselineProvider;
import ai.floedb.lakegauge.exporter.pushgateway.PushGatewayExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import org.apache.iceberg.catalog.Catalog;
import org.jboss.logging.Logger;

@ApplicationScoped
public class CollectorBeans {
  private static final Logger LOG = Logger.getLogger(CollectorBeans.class);

  @Inject LakegaugeConfig config;

  @Produces
  @Singleton
  MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Produces
  @Singleton
  CollectionTelemetry telemetry(MeterRegistry registry) {
    return new CollectionTelemetry(registry);
  }

  @Produces
  @Singleton
  Catalog icebergCatalog() {
    return IcebergCatalogFactory.s3TablesCatalog(
        config.warehouse(),
        config.region(),
        config.catalog().uri().orElse(null),
        config.catalog().properties());
  }

  void closeCatalog(@Disposes Catalog catalog) {
    if (catalog instanceof Closeable closeable) {
      try {
        closeable.close();
      } catch (IOException e) {
        LOG.warnf(e, "Failed to close catalog %s", catalog.name());
      }
    }
  }

  @Produces
  @Singleton
  CatalogClient catalogClient(Instance<Catalog> catalog) {
    return switch (config.catalog().listing()) {
      case S3TABLES ->
          new S3TablesCatalogClient(
              IcebergCatalogFactory.s3TablesClient(config.region()), config.warehouse());
      case ICEBERG -> new IcebergCatalogClient(catalog.get());
    };
  }

  void closeCatalogClient(@Disposes CatalogClient client) {
    if (client instanceof S3TablesCatalogClient) {
      client.close();
    }
  }

  @Produces
  @Singleton
  MetadataReader metadataReader(Catalog catalog) {
    return new IcebergMetadataReader(catalog);
  }

  @Produces
  @Singleton
  MetricsExporter exporter() {
    if (!config.export().enabled()) {
      LOG.info("Metrics export disabled");
      return (result, aggregate) -> List.of();
    }
    return new PushGatewayExporter(config.pushgateway(), config.warehouse());
  }

  @Produces
  @Singleton
  BaselineProvider baseline() {
    if (!config.export().enabled()) {
      return BaselineProvider.NONE;
    }
    return new PushGatewayBaselineProvider(
        config.pushgateway(), config.warehouse(), config.pushgatewayTimeout());
  }
}
