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

import ai.floedb.lakegauge.collector.model.TableMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;

/**
 * Renders a table's metrics as the per-table record of the metrics pipeline:
 *
 * <pre>
 * {"database": ..., "table": ...,
 *  "metrics": {"partition_count": ..., "file_count": ..., "total_bytes": ...,
 *              "total_records": ..., "avg_partition_size": ...}}
 * </pre>
 */
public final class TableMetricsJson {
  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private TableMetricsJson() {}

  public static ObjectNode toJson(TableMetrics metrics) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("database", metrics.database());
    root.put("table", metrics.table());
    ObjectNode values = root.putObject("metrics");
    values.put("partition_count", metrics.partitionCount());
    values.put("file_count", metrics.fileCount());
    values.put("total_bytes", metrics.totalBytes());
    values.put("total_records", metrics.totalRecords());
    values.put("avg_partition_size", metrics.avgPartitionSize());
    return root;
  }

  public static String render(TableMetrics metrics) {
    try {
      return MAPPER.writeValueAsString(toJson(metrics));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
