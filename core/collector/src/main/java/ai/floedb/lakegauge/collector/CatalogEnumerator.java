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

import ai.floedb.lakegauge.collector.model.TableRef;
import ai.floedb.lakegauge.collector.spi.CatalogClient;
import ai.floedb.lakegauge.collector.spi.CatalogUnavailableException;
import ai.floedb.lakegauge.collector.spi.NamespaceNotFoundException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Walks the two-level namespace/table hierarchy of a catalog.
 *
 * <p>A namespace that disappears between listing namespaces and listing its tables contributes no
 * tables. Any other listing failure aborts the enumeration.
 */
public final class CatalogEnumerator {
  private static final Logger LOG = Logger.getLogger(CatalogEnumerator.class);

  private final CatalogClient catalog;

  public CatalogEnumerator(CatalogClient catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  public CatalogListing enumerate() throws CatalogUnavailableException {
    SortedSet<String> namespaces = new TreeSet<>();
    for (String namespace : catalog.listNamespaces()) {
      if (namespace != null && !namespace.isBlank()) {
        namespaces.add(namespace);
      }
    }
    LOG.infof("Found %d namespaces: %s", namespaces.size(), namespaces);

    Set<TableRef> tables = new LinkedHashSet<>();
    for (String namespace : namespaces) {
      final List<TableRef> inNamespace;
      try {
        inNamespace = catalog.listTables(namespace);
      } catch (NamespaceNotFoundException e) {
        LOG.warnf("Namespace %s disappeared before its tables were listed, skipping", namespace);
        continue;
      }
      for (TableRef ref : inNamespace) {
        tables.add(new TableRef(namespace, ref.table()));
      }
      LOG.infof("Found %d tables in %s", inNamespace.size(), namespace);
      if (LOG.isDebugEnabled()) {
        LOG.debugf("Tables in %s: %s", namespace, inNamespace);
      }
    }
    return new CatalogListing(namespaces, List.copyOf(tables));
  }
}
