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
import java.io.Closeable;
import java.util.List;

/**
 * Read-only view of a warehouse catalog. Implementations make no ordering promise; callers must
 * only rely on membership.
 */
public interface CatalogClient extends Closeable {

  List<String> listNamespaces() throws CatalogUnavailableException;

  List<TableRef> listTables(String namespace)
      throws CatalogUnavailableException, NamespaceNotFoundException;

  @Override
  default void close() {}
}
