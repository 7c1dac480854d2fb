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

package ai.floedb.lakegauge.connector.iceberg;

import java.util.List;
import java.util.Optional;
import org.apache.iceberg.ManifestFile;
import org.apache.iceberg.Snapshot;
import org.apache.iceberg.io.FileIO;

/**
 * Table metadata format versions this collector understands, and where each keeps its data file
 * manifests.
 */
enum MetadataFormat {
  /** Format v1 has no delete files; every manifest of a snapshot lists data files. */
  V1(1) {
    @Override
    List<ManifestFile> dataManifests(Snapshot snapshot, FileIO io) {
      return snapshot.allManifests(io);
    }
  },
  V2(2) {
    @Override
    List<ManifestFile> dataManifests(Snapshot snapshot, FileIO io) {
      return snapshot.dataManifests(io);
    }
  },
  V3(3) {
    @Override
    List<ManifestFile> dataManifests(Snapshot snapshot, FileIO io) {
      return snapshot.dataManifests(io);
    }
  };

  private final int version;

  MetadataFormat(int version) {
    this.version = version;
  }

  int version() {
    return version;
  }

  abstract List<ManifestFile> dataManifests(Snapshot snapshot, FileIO io);

  static Optional<MetadataFormat> of(int formatVersion) {
    for (MetadataFormat format : values()) {
      if (format.version == formatVersion) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
