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

package ai.floedb.lakegauge.connector.iceberg;

import ai.floedb.lakegauge.collector.model.TableRef;
import ai.floedb.lakegauge.collector.spi.CatalogClient;
import ai.floedb.lakegauge.collector.spi.CatalogUnavailableException;
import ai.floedb.lakegauge.collector.spi.NamespaceNotFoundException;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.apache.iceberg.catalog.Catalog;
import org.apache.iceberg.catalog.Namespace;
import org.apache.iceberg.catalog.SupportsNamespaces;
import org.apache.iceberg.catalog.TableIdentifier;
import org.apache.iceberg.exceptions.NoSuchNamespaceException;
import org.jboss.logging.Logger;

/** Lists namespaces and tables through an Iceberg catalog, e.g. the S3 Tables REST endpoint. */
public final class IcebergCatalogClient implements CatalogClient {
  private static final Logger LOG = Logger.getLogger(IcebergCatalogClient.class);

  private final Catalog catalog;
  private final SupportsNamespaces namespaces;

  public IcebergCatalogClient(Catalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    if (!(catalog instanceof SupportsNamespaces supportsNamespaces)) {
      throw new IllegalArgumentException(
          "Catalog " + catalog.name() + " does not support namespaces");
    }
    this.namespaces = supportsNamespaces;
  }

  @Override
  public List<String> listNamespaces() throws CatalogUnavailableException {
    try {
      return namespaces.listNamespaces().stream().map(IcebergCatalogClient::name).toList();
    } catch (RuntimeException e) {
      throw new CatalogUnavailableException(
          "Failed to list namespaces of " + catalog.name() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public List<TableRef> listTables(String namespace)
      throws CatalogUnavailableException, NamespaceNotFoundException {
    try {
      return catalog.listTables(namespace(namespace)).stream()
          .map(IcebergCatalogClient::ref)
          .toList();
    } catch (NoSuchNamespaceException e) {
      throw new NamespaceNotFoundException(namespace, e);
    } catch (RuntimeException e) {
      throw new CatalogUnavailableException(
          "Failed to list tables in " + namespace + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    if (catalog instanceof Closeable closeable) {
      try {
        closeable.close();
      } catch (IOException e) {
        LOG.warnf(e, "Failed to close catalog %s", catalog.name());
      }
    }
  }

  /** Dotted names address nested namespaces, one level per segment. */
  static Namespace namespace(String name) {
    return Namespace.of(name.split("\\."));
  }

  private static String name(Namespace namespace) {
    return String.join(".", namespace.levels());
  }

  private static TableRef ref(TableIdentifier id) {
    return new TableRef(name(id.namespace()), id.name());
  }
}
