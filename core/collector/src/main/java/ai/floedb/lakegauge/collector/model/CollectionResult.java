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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of measuring every table discovered in one run.
 *
 * <p>Every discovered table appears exactly once, either in {@link #metrics()} or in {@link
 * #failures()}. The constructor rejects results that break this.
 */
public final class CollectionResult {
  private final SortedSet<String> namespaces;
  private final List<TableMetrics> metrics;
  private final List<TableFailure> failures;

  public CollectionResult(
      Collection<String> namespaces,
      Collection<TableRef> discovered,
      Collection<TableMetrics> metrics,
      Collection<TableFailure> failures) {
    this.namespaces = Collections.unmodifiableSortedSet(new TreeSet<>(namespaces));
    this.metrics =
        metrics.stream().sorted((a, b) -> TableRef.ORDER.compare(a.ref(), b.ref())).toList();
    this.failures =
        failures.stream().sorted((a, b) -> TableRef.ORDER.compare(a.table(), b.table())).toList();
    checkComplete(discovered);
  }

  /** Namespaces enumerated in this run, including those without tables. */
  public SortedSet<String> namespaces() {
    return namespaces;
  }

  /** Metrics of successfully measured tables, ordered by {@code (database, table)}. */
  public List<TableMetrics> metrics() {
    return metrics;
  }

  /** Tables that could not be measured, ordered by {@code (database, table)}. */
  public List<TableFailure> failures() {
    return failures;
  }

  public int discoveredTableCount() {
    return metrics.size() + failures.size();
  }

  private void checkComplete(Collection<TableRef> discovered) {
    Set<TableRef> expected = new HashSet<>(discovered);
    Set<TableRef> seen = new HashSet<>();
    for (TableMetrics m : metrics) {
      if (!seen.add(m.ref())) {
        throw new IllegalStateException("table reported more than once: " + m.ref());
      }
    }
    for (TableFailure f : failures) {
      if (!seen.add(f.table())) {
        throw new IllegalStateException("table reported more than once: " + f.table());
      }
    }
    if (!seen.equals(expected)) {
      Set<TableRef> missing = new TreeSet<>(expected);
      missing.removeAll(seen);
      Set<TableRef> unexpected = new TreeSet<>(seen);
      unexpected.removeAll(expected);
      throw new IllegalStateException(
          "collection result does not match discovered tables, missing="
              + missing
              + " unexpected="
              + unexpected);
    }
    for (TableRef ref : seen) {
      if (!namespaces.contains(ref.database())) {
        throw new IllegalStateException("table outside enumerated namespaces: " + ref);
      }
    }
  }
}
