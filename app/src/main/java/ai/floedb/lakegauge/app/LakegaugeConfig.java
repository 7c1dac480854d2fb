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

package ai.floedb.lakegauge.app;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

@ConfigMapping(prefix = "lakegauge")
public interface LakegaugeConfig {
  /** Table bucket ARN of the warehouse to measure. */
  String warehouse();

  @WithDefault("us-east-1")
  String region();

  /** Pushgateway address, {@code host:port} or a URL. */
  @WithDefault("localhost:9091")
  String pushgateway();

  @WithDefault("PT10S")
  Duration pushgatewayTimeout();

  @WithDefault("1")
  int maxWorkers();

  @WithDefault("PT5M")
  Duration tableReadTimeout();

  Catalog catalog();

  Export export();

  Report report();

  interface Catalog {
    /** How namespaces and tables are listed. */
    @WithDefault("s3tables")
    Listing listing();

    /** Iceberg REST endpoint; the regional S3 Tables endpoint when unset. */
    Optional<String> uri();

    /** Extra Iceberg catalog properties, applied last. */
    Map<String, String> properties();
  }

  enum Listing {
    S3TABLES,
    ICEBERG
  }

  interface Export {
    @WithDefault("true")
    boolean enabled();
  }

  interface Report {
    /** Print each table's metrics as JSON on standard output. */
    @WithDefault("true")
    boolean stdout();
  }
}
