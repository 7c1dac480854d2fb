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

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partition tuple of a data file. Two keys are equal when they carry the same partition field ids
 * and equal values at every position.
 *
 * <p>Values are normalized on construction so that equality is structural: character sequences
 * become {@link String}s and binary values are copied into read-only {@link ByteBuffer}s, which
 * compare by content.
 */
public record PartitionKey(List<Integer> fieldIds, List<Object> values) {

  private static final PartitionKey UNPARTITIONED = new PartitionKey(List.of(), List.of());

  public PartitionKey {
    if (fieldIds.size() != values.size()) {
      throw new IllegalArgumentException(
          "partition field ids and values differ in size: "
              + fieldIds.size()
              + " != "
              + values.size());
    }
    fieldIds = List.copyOf(fieldIds);
    List<Object> normalized = new ArrayList<>(values.size());
    for (Object value : values) {
      normalized.add(normalize(value));
    }
    values = Collections.unmodifiableList(normalized);
  }

  public static PartitionKey unpartitioned() {
    return UNPARTITIONED;
  }

  public boolean isUnpartitioned() {
    return fieldIds.isEmpty();
  }

  private static Object normalize(Object value) {
    if (value instanceof CharSequence chars) {
      return chars.toString();
    }
    if (value instanceof ByteBuffer buffer) {
      ByteBuffer dup = buffer.duplicate();
      byte[] bytes = new byte[dup.remaining()];
      dup.get(bytes);
      return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    }
    if (value instanceof byte[] raw) {
      return ByteBuffer.wrap(raw.clone()).asReadOnlyBuffer();
    }
    return value;
  }
}
