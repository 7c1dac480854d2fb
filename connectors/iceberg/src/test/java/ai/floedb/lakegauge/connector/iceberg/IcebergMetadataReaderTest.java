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

import static org.apache.iceberg.types.Types.NestedField.required;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.lakegauge.collector.model.DataFileFact;
import ai.floedb.lakegauge.collector.model.PartitionKey;
import ai.floedb.lakegauge.collector.model.TableRef;
import ai.floedb.lakegauge.collector.model.TableSnapshotFacts;
import ai.floedb.lakegauge.collector.spi.MetadataUnreadableException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.apache.iceberg.CatalogProperties;
import org.apache.iceberg.DataFile;
import org.apache.iceberg.DataFiles;
import org.apache.iceberg.DeleteFile;
import org.apache.iceberg.FileMetadata;
import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Schema;
import org.apache.iceberg.Table;
import org.apache.iceberg.TableProperties;
import org.apache.iceberg.catalog.Namespace;
import org.apache.iceberg.catalog.TableIdentifier;
import org.apache.iceberg.inmemory.InMemoryCatalog;
import org.apache.iceberg.types.Types;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IcebergMetadataReaderTest {
  private static final Schema SCHEMA =
      new Schema(
          required(1, "id", Types.LongType.get()), required(2, "p", Types.StringType.get()));
  private static final PartitionSpec BY_P = PartitionSpec.builderFor(SCHEMA).identity("p").build();
  private static final TableRef ORDERS = TableRef.of("sales", "orders");

  private InMemoryCatalog catalog;
  private IcebergMetadataReader reader;

  @BeforeEach
  void setUp() {
    catalog = new InMemoryCatalog();
    catalog.initialize(
        "test",
        Map.of(CatalogProperties.WAREHOUSE_LOCATION, "/tmp/lakegauge-" + UUID.randomUUID()));
    catalog.createNamespace(Namespace.of("sales"));
    reader = new IcebergMetadataReader(catalog);
  }

  @AfterEach
  void tearDown() {
    reader.close();
  }

  @Test
  void readsLiveDataFilesOfCurrentSnapshot() throws Exception {
    Table table = createOrders("2");
    table
        .newAppend()
        .appendFile(dataFile(table, "a.parquet", "p1", 500, 4))
        .appendFile(dataFile(table, "b.parquet", "p1", 833, 5))
        .commit();

    TableSnapshotFacts facts = reader.read(ORDERS);

    assertThat(facts.table()).isEqualTo(ORDERS);
    assertThat(facts.formatVersion()).isEqualTo(2);
    assertThat(facts.snapshotId()).hasValue(table.currentSnapshot().snapshotId());
    assertThat(facts.files())
        .extracting(DataFileFact::sizeBytes)
        .containsExactlyInAnyOrder(500L, 833L);
    assertThat(facts.files())
        .extracting(DataFileFact::partition)
        .containsOnly(new PartitionKey(List.of(1000), List.of("p1")));
  }

  @Test
  void nestedNamespaceIsAddressedLevelByLevel() throws Exception {
    catalog.createNamespace(Namespace.of("sales", "eu"));
    Table table =
        catalog.createTable(
            TableIdentifier.of(Namespace.of("sales", "eu"), "orders"),
            SCHEMA,
            BY_P,
            Map.of(TableProperties.FORMAT_VERSION, "2"));
    table.newAppend().appendFile(dataFile(table, "a.parquet", "p1", 42, 3)).commit();

    TableSnapshotFacts facts = reader.read(TableRef.of("sales.eu", "orders"));

    assertThat(facts.files()).extracting(DataFileFact::sizeBytes).containsExactly(42L);
  }

  @Test
  void filesAcrossSeveralCommitsAreAllCounted() throws Exception {
    Table table = createOrders("2");
    table.newAppend().appendFile(dataFile(table, "a.parquet", "p1", 10, 1)).commit();
    table.newAppend().appendFile(dataFile(table, "b.parquet", "p2", 20, 2)).commit();
    table.newAppend().appendFile(dataFile(table, "c.parquet", "p3", 30, 3)).commit();

    TableSnapshotFacts facts = reader.read(ORDERS);

    assertThat(facts.files()).hasSize(3);
    assertThat(facts.files()).extracting(DataFileFact::recordCount).containsOnly(1L, 2L, 3L);
  }

  @Test
  void deletedDataFilesAreExcluded() throws Exception {
    Table table = createOrders("2");
    DataFile gone = dataFile(table, "a.parquet", "p1", 500, 4);
    table
        .newAppend()
        .appendFile(gone)
        .appendFile(dataFile(table, "b.parquet", "p2", 833, 5))
        .commit();
    table.newDelete().deleteFile(gone).commit();

    TableSnapshotFacts facts = reader.read(ORDERS);

    assertThat(facts.files()).singleElement().extracting(DataFileFact::sizeBytes).isEqualTo(833L);
  }

  @Test
  void deleteFilesDoNotCountAsData() throws Exception {
    Table table = createOrders("2");
    table.newAppend().appendFile(dataFile(table, "a.parquet", "p1", 500, 4)).commit();
    DeleteFile positionDeletes =
        FileMetadata.deleteFileBuilder(table.spec())
            .ofPositionDeletes()
            .withPath(table.location() + "/data/p=p1/deletes.parquet")
            .withFileSizeInBytes(77)
            .withRecordCount(1)
            .withPartitionPath("p=p1")
            .build();
    table.newRowDelta().addDeletes(positionDeletes).commit();

    TableSnapshotFacts facts = reader.read(ORDERS);

    assertThat(facts.files()).singleElement().extracting(DataFileFact::sizeBytes).isEqualTo(500L);
  }

  @Test
  void formatV1TablesAreRead() throws Exception {
    Table table = createOrders("1");
    table
        .newAppend()
        .appendFile(dataFile(table, "a.parquet", "p1", 100, 1))
        .appendFile(dataFile(table, "b.parquet", "p2", 200, 2))
        .commit();

    TableSnapshotFacts facts = reader.read(ORDERS);

    assertThat(facts.formatVersion()).isEqualTo(1);
    assertThat(facts.files()).hasSize(2);
  }

  @Test
  void unpartitionedTableUsesEmptyPartition() throws Exception {
    Table table =
        catalog.createTable(
            TableIdentifier.of("sales", "flat"), SCHEMA, PartitionSpec.unpartitioned());
    table
        .newAppend()
        .appendFile(
            DataFiles.builder(PartitionSpec.unpartitioned())
                .withPath(table.location() + "/data/a.parquet")
                .withFileSizeInBytes(42)
                .withRecordCount(3)
                .build())
        .commit();

    TableSnapshotFacts facts = reader.read(TableRef.of("sales", "flat"));

    assertThat(facts.files())
        .singleElement()
        .extracting(DataFileFact::partition)
        .isEqualTo(PartitionKey.unpartitioned());
  }

  @Test
  void tableWithoutSnapshotHasNoFiles() throws Exception {
    createOrders("2");

    TableSnapshotFacts facts = reader.read(ORDERS);

    assertThat(facts.snapshotId()).isEmpty();
    assertThat(facts.files()).isEmpty();
  }

  @Test
  void missingTableIsUnreadable() {
    assertThatThrownBy(() -> reader.read(TableRef.of("sales", "nope")))
        .isInstanceOf(MetadataUnreadableException.class)
        .hasMessageContaining("no longer exists")
        .satisfies(
            e ->
                assertThat(((MetadataUnreadableException) e).table())
                    .isEqualTo(TableRef.of("sales", "nope")));
  }

  @Test
  void missingManifestListIsUnreadable() {
    Table table = createOrders("2");
    table.newAppend().appendFile(dataFile(table, "a.parquet", "p1", 1, 1)).commit();
    table.io().deleteFile(table.currentSnapshot().manifestListLocation());

    assertThatThrownBy(() -> reader.read(ORDERS))
        .isInstanceOf(MetadataUnreadableException.class)
        .hasMessageContaining("failed to read table metadata");
  }

  @Test
  void formatDispatchCoversKnownVersionsOnly() {
    assertThat(MetadataFormat.of(1)).contains(MetadataFormat.V1);
    assertThat(MetadataFormat.of(2)).contains(MetadataFormat.V2);
    assertThat(MetadataFormat.of(3)).contains(MetadataFormat.V3);
    assertThat(MetadataFormat.of(4)).isEmpty();
  }

  private Table createOrders(String formatVersion) {
    return catalog.createTable(
        TableIdentifier.of("sales", "orders"),
        SCHEMA,
        BY_P,
        Map.of(TableProperties.FORMAT_VERSION, formatVersion));
  }

  private static DataFile dataFile(
      Table table, String name, String partition, long bytes, long records) {
    return DataFiles.builder(table.spec())
        .withPath(table.location() + "/data/p=" + partition + "/" + name)
        .withFileSizeInBytes(bytes)
        .withRecordCount(records)
        .withPartitionPath("p=" + partition)
        .build();
  }
}
