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
import ai.floedb.lakegauge.collector.model.CollectionResult;
import ai.floedb.lakegauge.collector.spi.ExportFailure;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one run. {@code result} and {@code aggregate} are empty only when the catalog could
 * not be enumerated.
 */
public record RunReport(
    RunStatus status,
    Optional<CollectionResult> result,
    Optional<AggregateMetrics> aggregate,
    List<ExportFailure> exportFailures,
    String message,
    Duration elapsed) {

  public RunReport {
    result = result == null ? Optional.empty() : result;
    aggregate = aggregate == null ? Optional.empty() : aggregate;
    exportFailures = exportFailures == null ? List.of() : List.copyOf(exportFailures);
    message = message == null ? "" : message;
  }

  static RunReport aborted(RunStatus status, String message, Duration elapsed) {
    return new RunReport(
        status, Optional.empty(), Optional.empty(), List.of(), message, elapsed);
  }

  public int exitCode() {
    return status.exitCode();
  }
}
