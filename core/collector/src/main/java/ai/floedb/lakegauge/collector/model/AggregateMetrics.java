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

package ai.floedb.lakegauge.collector.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Warehouse level rollup of a run.
 *
 * @param totalDatabaseCount enumerated namespaces, empty ones included
 * @param totalTableCount successfully measured tables
 * @param failedTableCount tables that could not be measured
 * @param perNamespaceTotalBytes data bytes per namespace, every enumerated namespace present
 * @param warehouseTotalBytes data bytes across all measured tables
 * @param top5ByRecordCount largest tables by record count
 * @param top5BySize largest tables by data bytes
 * @param growthDelta change against the previous run, empty when there is no previous run
 */
public record AggregateMetrics(
    int totalDatabaseCount,
    int totalTableCount,
    int failedTableCount,
    SortedMap<String, Long> perNamespaceTotalBytes,
    long warehouseTotalBytes,
    List<RankedTable> top5ByRecordCount,
    List<RankedTable> top5BySize,
    Optional<GrowthDelta> growthDelta) {

  public AggregateMetrics {
    perNamespaceTotalBytes =
        Collections.unmodifiableSortedMap(new TreeMap<>(perNamespaceTotalBytes));
    top5ByRecordCount = List.copyOf(top5ByRecordCount);
    top5BySize = List.copyOf(top5BySize);
    growthDelta = growthDelta == null ? Optional.empty() : growthDelta;
  }

  /** One entry of a top-N ranking; {@code rank} starts at 1. */
  public record RankedTable(int rank, String database, String table, long value) {}
}
