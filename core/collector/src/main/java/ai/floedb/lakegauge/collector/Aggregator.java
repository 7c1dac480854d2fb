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
import ai.floedb.lakegauge.collector.model.AggregateMetrics.RankedTable;
import ai.floedb.lakegauge.collector.model.CollectionResult;
import ai.floedb.lakegauge.collector.model.GrowthDelta;
import ai.floedb.lakegauge.collector.model.PreviousAggregate;
import ai.floedb.lakegauge.collector.model.TableMetrics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.ToLongFunction;

/**
 * Folds a {@link CollectionResult} and the previous run's totals into {@link AggregateMetrics}.
 *
 * <p>Every reduction here is commutative, so the outcome does not depend on the order in which
 * tables finished.
 */
public final class Aggregator {
  public static final int TOP_N = 5;

  private Aggregator() {}

  public static AggregateMetrics aggregate(
      CollectionResult result, Optional<PreviousAggregate> previous) {
    SortedMap<String, Long> perNamespace = new TreeMap<>();
    for (String namespace : result.namespaces()) {
      perNamespace.put(namespace, 0L);
    }
    long warehouseBytes = 0;
    for (TableMetrics metrics : result.metrics()) {
      perNamespace.merge(metrics.database(), metrics.totalBytes(), Math::addExact);
      warehouseBytes = Math.addExact(warehouseBytes, metrics.totalBytes());
    }
    final long totalBytes = warehouseBytes;

    return new AggregateMetrics(
        result.namespaces().size(),
        result.metrics().size(),
        result.failures().size(),
        perNamespace,
        totalBytes,
        topN(result.metrics(), TableMetrics::totalRecords),
        topN(result.metrics(), TableMetrics::totalBytes),
        previous.map(p -> growth(totalBytes, perNamespace, p)));
  }

  /** Largest tables by {@code key}, descending, ties broken by {@code (database, table)}. */
  static List<RankedTable> topN(List<TableMetrics> metrics, ToLongFunction<TableMetrics> key) {
    Comparator<TableMetrics> order =
        Comparator.comparingLong(key)
            .reversed()
            .thenComparing(TableMetrics::database)
            .thenComparing(TableMetrics::table);

    List<TableMetrics> sorted = metrics.stream().sorted(order).limit(TOP_N).toList();
    List<RankedTable> ranked = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      TableMetrics m = sorted.get(i);
      ranked.add(new RankedTable(i + 1, m.database(), m.table(), key.applyAsLong(m)));
    }
    return ranked;
  }

  private static GrowthDelta growth(
      long warehouseBytes, Map<String, Long> perNamespace, PreviousAggregate previous) {
    SortedMap<String, Long> deltas = new TreeMap<>();
    perNamespace.forEach(
        (namespace, bytes) -> {
          Long before = previous.perNamespaceBytes().get(namespace);
          if (before != null) {
            deltas.put(namespace, Math.subtractExact(bytes, before));
          }
        });
    return new GrowthDelta(
        Math.subtractExact(warehouseBytes, previous.warehouseTotalBytes()), deltas);
  }
}
