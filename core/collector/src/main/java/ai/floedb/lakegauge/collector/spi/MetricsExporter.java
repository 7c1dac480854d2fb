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

package ai.floedb.lakegauge.collector.spi;

import ai.floedb.lakegauge.collector.model.AggregateMetrics;
import ai.floedb.lakegauge.collector.model.CollectionResult;
import java.util.List;

public interface MetricsExporter {

  /**
   * Publishes per-table and aggregate metrics. A rejected push is reported in the returned list
   * and does not stop the remaining pushes.
   *
   * @return failed pushes, empty when everything was accepted
   */
  List<ExportFailure> export(CollectionResult result, AggregateMetrics aggregate);
}
