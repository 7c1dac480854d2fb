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

import java.time.Duration;

/**
 * Tuning of a collection run.
 *
 * @param maxWorkers tables measured concurrently, at least 1
 * @param tableReadTimeout upper bound on reading one table's metadata
 */
public record CollectorOptions(int maxWorkers, Duration tableReadTimeout) {
  public static final Duration DEFAULT_TABLE_READ_TIMEOUT = Duration.ofMinutes(5);

  public CollectorOptions {
    if (maxWorkers < 1) {
      throw new IllegalArgumentException("max-workers must be >= 1, got " + maxWorkers);
    }
    tableReadTimeout = tableReadTimeout == null ? DEFAULT_TABLE_READ_TIMEOUT : tableReadTimeout;
    if (tableReadTimeout.isZero() || tableReadTimeout.isNegative()) {
      throw new IllegalArgumentException(
          "table-read-timeout must be positive, got " + tableReadTimeout);
    }
  }

  public static CollectorOptions defaults() {
    return new CollectorOptions(1, DEFAULT_TABLE_READ_TIMEOUT);
  }
}
