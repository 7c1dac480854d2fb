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

import ai.floedb.lakegauge.collector.model.TableRef;
import ai.floedb.lakegauge.collector.model.TableSnapshotFacts;
import java.io.Closeable;

/**
 * Resolves a table's current metadata and folds its manifest chain into {@link
 * TableSnapshotFacts}. Implementations are called concurrently from several workers and must be
 * thread-safe.
 */
public interface MetadataReader extends Closeable {

  TableSnapshotFacts read(TableRef table) throws MetadataUnreadableException;

  @Override
  default void close() {}
}
