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

import ai.floedb.lakegauge.collector.model.DataFileFact;
import ai.floedb.lakegauge.collector.model.PartitionKey;
import ai.floedb.lakegauge.collector.model.TableMetrics;
import ai.floedb.lakegauge.collector.model.TableSnapshotFacts;
import java.util.HashSet;
import java.util.Set;

/** Derives {@link TableMetrics} from the data-file facts of one table. Pure and deterministic. */
public final class MetricComputer {

  private MetricComputer() {}

  /**
   * @throws ArithmeticException if a byte or record sum overflows a {@code long}
   */
  public static TableMetrics compute(TableSnapshotFacts facts) {
    Set<PartitionKey> partitions = new HashSet<>();
    long files = 0;
    long bytes = 0;
    long records = 0;
    for (DataFileFact file : facts.files()) {
      partitions.add(file.partition());
      files++;
      bytes = Math.addExact(bytes, file.sizeBytes());
      records = Math.addExact(records, file.recordCount());
    }

    long partitionCount = partitions.size();
    double avgPartitionSize = partitionCount > 0 ? (double) bytes / partitionCount : 0.0d;

    return new TableMetrics(
        facts.table().database(),
        facts.table().table(),
        partitionCount,
        files,
        bytes,
        records,
        avgPartitionSize);
  }
}
