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
import ai.floedb.lakegauge.collector.model.TableMetrics;

/** Result a worker hands to the collecting thread for one table. Exactly one side is set. */
record TableOutcome(TableMetrics metrics, TableFailure failure) {

  static TableOutcome measured(TableMetrics metrics) {
    return new TableOutcome(metrics, null);
  }

  static TableOutcome failed(TableFailure failure) {
    return new TableOutcome(null, failure);
  }

  boolean succeeded() {
    return metrics != null;
  }
}
