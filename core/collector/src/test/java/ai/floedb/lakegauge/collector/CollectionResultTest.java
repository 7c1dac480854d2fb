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

import static ai.floedb.lakegauge.collector.AggregatorTest.metrics;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.lakegauge.collector.model.CollectionResult;
import ai.floedb.lakegauge.collector.model.TableFailure;
import ai.floedb.lakegauge.collector.model.TableRef;
import java.util.List;
import org.junit.jupiter.api.Test;

class CollectionResultTest {

  @Test
  void ordersMetricsAndFailuresByTable() {
    CollectionResult result =
        new CollectionResult(
            List.of("b", "a"),
            List.of(TableRef.of("b", "x"), TableRef.of("a", "y"), TableRef.of("a", "b")),
            List.of(metrics("b", "x", 1, 1), metrics("a", "y", 1, 1)),
            List.of(new TableFailure(TableRef.of("a", "b"), TableFailure.Kind.TIMEOUT, "slow")));

    assertThat(result.namespaces()).containsExactly("a", "b");
    assertThat(result.metrics()).extracting(m -> m.ref().toString()).containsExactly("a.y", "b.x");
    assertThat(result.discoveredTableCount()).isEqualTo(3);
  }

  @Test
  void rejectsTableReportedTwice() {
    assertThatThrownBy(
            () ->
                new CollectionResult(
                    List.of("a"),
                    List.of(TableRef.of("a", "t")),
                    List.of(metrics("a", "t", 1, 1)),
                    List.of(
                        new TableFailure(
                            TableRef.of("a", "t"), TableFailure.Kind.METADATA_UNREADABLE, "x"))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("more than once");
  }

  @Test
  void rejectsMissingTable() {
    assertThatThrownBy(
            () ->
                new CollectionResult(
                    List.of("a"),
                    List.of(TableRef.of("a", "t"), TableRef.of("a", "u")),
                    List.of(metrics("a", "t", 1, 1)),
                    List.of()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("missing=[a.u]");
  }

  @Test
  void rejectsTableOutsideEnumeratedNamespaces() {
    assertThatThrownBy(
            () ->
                new CollectionResult(
                    List.of("a"),
                    List.of(TableRef.of("z", "t")),
                    List.of(metrics("z", "t", 1, 1)),
                    List.of()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("outside enumerated namespaces");
  }
}
