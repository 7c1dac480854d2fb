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

import static org.assertj.core.api.Assertions.assertThat;

import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.quarkus.test.junit.main.Launch;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainTest;
import java.util.Map;
import org.junit.jupiter.api.Test;

@QuarkusMainTest
@TestProfile(CatalogUnavailableLaunchTest.UnreachableCatalog.class)
class CatalogUnavailableLaunchTest {

  @Test
  @Launch(exitCode = 2)
  void exitsWithCatalogError(LaunchResult result) {
    assertThat(result.exitCode()).isEqualTo(2);
  }

  public static class UnreachableCatalog implements QuarkusTestProfile {
    @Override
    public Map<String, String> getConfigOverrides() {
      return Map.of(
          "lakegauge.warehouse", "arn:aws:s3tables:us-east-1:123456789012:bucket/lake",
          "lakegauge.catalog.listing", "iceberg",
          "lakegauge.catalog.uri", "http://localhost:1/iceberg",
          "lakegauge.export.enabled", "false");
    }
  }
}
