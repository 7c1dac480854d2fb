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

import ai.floedb.lakegauge.collector.model.TableFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public final class CollectionTelemetry {
  static final String TABLES_COLLECTED = "lakegauge.tables.collected";
  static final String TABLES_FAILED = "lakegauge.tables.failed";
  static final String TABLE_READ = "lakegauge.table.read";
  static final String COLLECTION_DURATION = "lakegauge.collection.duration";

  private final MeterRegistry registry;
  private final Counter collected;
  private final Timer tableRead;
  private final Timer collection;

  public CollectionTelemetry(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.collected =
        Counter.builder(TABLES_COLLECTED)
            .description("Tables whose metrics were computed")
            .register(registry);
    this.tableRead =
        Timer.builder(TABLE_READ)
            .description("Metadata read and metric computation per table")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    this.collection =
        Timer.builder(COLLECTION_DURATION)
            .description("Wall time of a full collection run")
            .register(registry);
  }

  public static CollectionTelemetry detached() {
    return new CollectionTelemetry(new SimpleMeterRegistry());
  }

  void tableCollected(long elapsedNanos) {
    collected.increment();
    tableRead.record(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  void tableFailed(TableFailure.Kind kind, long elapsedNanos) {
    failures(kind).increment();
    if (kind != TableFailure.Kind.STOPPED) {
      tableRead.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }
  }

  void collectionFinished(Duration elapsed) {
    collection.record(elapsed);
  }

  public long collectedCount() {
    return (long) collected.count();
  }

  public long failedCount() {
    long total = 0;
    for (TableFailure.Kind kind : TableFailure.Kind.values()) {
      Counter counter = registry.find(TABLES_FAILED).tag("kind", tagOf(kind)).counter();
      if (counter != null) {
        total += (long) counter.count();
      }
    }
    return total;
  }

  public Duration meanTableRead() {
    return Duration.ofNanos((long) tableRead.mean(TimeUnit.NANOSECONDS));
  }

  private Counter failures(TableFailure.Kind kind) {
    return Counter.builder(TABLES_FAILED)
        .description("Tables that could not be measured")
        .tag("kind", tagOf(kind))
        .register(registry);
  }

  private static String tagOf(TableFailure.Kind kind) {
    return kind.name().toLowerCase(Locale.ROOT);
  }
}
