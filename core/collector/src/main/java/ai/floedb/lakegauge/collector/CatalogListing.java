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

import ai.floedb.lakegauge.collector.model.TableRef;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/** Namespaces and tables discovered at the start of a run. */
public record CatalogListing(SortedSet<String> namespaces, List<TableRef> tables) {

  public CatalogListing {
    namespaces = Collections.unmodifiableSortedSet(new TreeSet<>(namespaces));
    tables = List.copyOf(tables);
  }
}
