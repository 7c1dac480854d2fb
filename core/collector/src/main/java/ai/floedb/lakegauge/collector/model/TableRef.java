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

import java.util.Comparator;
import java.util.Objects;

/** A table addressed by its namespace (database) and name for the duration of one run. */
public record TableRef(String database, String table) implements Comparable<TableRef> {

  public static final Comparator<TableRef> ORDER =
      Comparator.comparing(TableRef::database).thenComparing(TableRef::table);

  public TableRef {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(table, "table");
  }

  public static TableRef of(String database, String table) {
    return new TableRef(database, table);
  }

  @Override
  public int compareTo(TableRef other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return database + "." + table;
  }
}
