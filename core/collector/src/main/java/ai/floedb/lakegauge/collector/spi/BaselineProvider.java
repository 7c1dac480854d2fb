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

import ai.floedb.lakegauge.collector.model.PreviousAggregate;
import java.util.Optional;

/** Supplies the storage totals published by the previous run. */
@FunctionalInterface
public interface BaselineProvider {

  BaselineProvider NONE = Optional::empty;

  /** Returns the previous aggregate, or empty when this is the first run. */
  Optional<PreviousAggregate> previous();
}
