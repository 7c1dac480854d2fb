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

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Live data files of a table's current snapshot, as read from its manifest chain.
 *
 * @param table the table the facts were read from
 * @param formatVersion table metadata format version
 * @param snapshotId current snapshot id, empty when the table has never been written
 * @param files one entry per live data file
 */
public record TableSnapshotFacts(
    TableRef table, int formatVersion, OptionalLong snapshotId, List<DataFileFact> files) {

  public TableSnapshotFacts {
    Objects.requireNonNull(table, "table");
    snapshotId = snapshotId == null ? OptionalLong.empty() : snapshotId;
    files = files == null ? List.of() : List.copyOf(files);
  }

  public static TableSnapshotFacts empty(TableRef table, int formatVersion) {
    return new TableSnapshotFacts(table, formatVersion, OptionalLong.empty(), List.of());
  }
}
