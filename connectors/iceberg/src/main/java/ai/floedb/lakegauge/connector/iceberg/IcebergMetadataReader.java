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

import ai.floedb.lakegauge.collector.model.DataFileFact;
import ai.floedb.lakegauge.collector.model.PartitionKey;
import ai.floedb.lakegauge.collector.model.TableRef;
import ai.floedb.lakegauge.collector.model.TableSnapshotFacts;
import ai.floedb.lakegauge.collector.spi.MetadataReader;
import ai.floedb.lakegauge.collector.spi.MetadataUnreadableException;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import org.apache.iceberg.DataFile;
import org.apache.iceberg.HasTableOperations;
import org.apache.iceberg.ManifestFile;
import org.apache.iceberg.ManifestFiles;
import org.apache.iceberg.ManifestReader;
import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Snapshot;
import org.apache.iceberg.StructLike;
import org.apache.iceberg.Table;
import org.apache.iceberg.TableMetadata;
import org.apache.iceberg.catalog.Catalog;
import org.apache.iceberg.catalog.TableIdentifier;
import org.apache.iceberg.exceptions.NoSuchTableException;
import org.apache.iceberg.io.FileIO;
import org.jboss.logging.Logger;

/**
 * Reads the live data files of a table's current snapshot straight from its manifests.
 *
 * <p>Only manifest metadata is read; data files are never opened. Deleted manifest entries and
 * delete files do not contribute.
 */
public final class IcebergMetadataReader implements MetadataReader {
  private static final Logger LOG = Logger.getLogger(IcebergMetadataReader.class);

  private final Catalog catalog;

  public IcebergMetadataReader(Catalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  @Override
  public TableSnapshotFacts read(TableRef ref) throws MetadataUnreadableException {
    try {
      return readCurrentSnapshot(ref);
    } catch (NoSuchTableException e) {
      throw new MetadataUnreadableException(ref, "table no longer exists: " + ref, e);
    } catch (IOException e) {
      throw new MetadataUnreadableException(ref, "failed to close manifest: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new MetadataUnreadableException(
          ref, "failed to read table metadata: " + e.getMessage(), e);
    }
  }

  private TableSnapshotFacts readCurrentSnapshot(TableRef ref)
      throws MetadataUnreadableException, IOException {
    TableIdentifier id =
        TableIdentifier.of(IcebergCatalogClient.namespace(ref.database()), ref.table());
    Table table = catalog.loadTable(id);
    if (!(table instanceof HasTableOperations withOps)) {
      throw new MetadataUnreadableException(ref, "table metadata is not accessible");
    }
    TableMetadata metadata = withOps.operations().current();
    int formatVersion = metadata.formatVersion();
    MetadataFormat format =
        MetadataFormat.of(formatVersion)
            .orElseThrow(
                () ->
                    new MetadataUnreadableException(
                        ref, "unsupported format version " + formatVersion));

    Snapshot snapshot = metadata.currentSnapshot();
    if (snapshot == null) {
      LOG.debugf("%s has no snapshot", ref);
      return TableSnapshotFacts.empty(ref, formatVersion);
    }

    FileIO io = table.io();
    Map<Integer, PartitionSpec> specs = metadata.specsById();
    List<DataFileFact> files = new ArrayList<>();
    List<ManifestFile> manifests = format.dataManifests(snapshot, io);
    int skipped = 0;
    for (ManifestFile manifest : manifests) {
      if (!hasLiveFiles(manifest)) {
        skipped++;
        continue;
      }
      try (ManifestReader<DataFile> reader = ManifestFiles.read(manifest, io, specs)) {
        for (DataFile file : reader) {
          files.add(
              new DataFileFact(
                  partitionKey(specs.get(file.specId()), file.partition()),
                  file.fileSizeInBytes(),
                  file.recordCount()));
        }
      }
    }
    LOG.debugf(
        "%s snapshot %d (v%d): %d manifests, %d skipped, %d live data files",
        ref,
        snapshot.snapshotId(),
        format.version(),
        manifests.size(),
        skipped,
        files.size());
    return new TableSnapshotFacts(
        ref, formatVersion, OptionalLong.of(snapshot.snapshotId()), files);
  }

  @Override
  public void close() {
    if (catalog instanceof Closeable closeable) {
      try {
        closeable.close();
      } catch (IOException e) {
        LOG.warnf(e, "Failed to close catalog %s", catalog.name());
      }
    }
  }

  /** A manifest summary without added or existing files holds only deleted entries. */
  static boolean hasLiveFiles(ManifestFile manifest) {
    return manifest.hasAddedFiles() || manifest.hasExistingFiles();
  }

  static PartitionKey partitionKey(PartitionSpec spec, StructLike partition) {
    if (spec == null || spec.isUnpartitioned() || partition == null) {
      return PartitionKey.unpartitioned();
    }
    int size = spec.fields().size();
    List<Integer> fieldIds = new ArrayList<>(size);
    List<Object> values = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      fieldIds.add(spec.fields().get(i).fieldId());
      values.add(partition.get(i, Object.class));
    }
    return new PartitionKey(fieldIds, values);
  }
}
