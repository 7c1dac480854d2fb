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

import ai.floedb.lakegauge.collector.model.TableRef;
import ai.floedb.lakegauge.collector.spi.CatalogClient;
import ai.floedb.lakegauge.collector.spi.CatalogUnavailableException;
import ai.floedb.lakegauge.collector.spi.NamespaceNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3tables.S3TablesClient;
import software.amazon.awssdk.services.s3tables.model.ListNamespacesRequest;
import software.amazon.awssdk.services.s3tables.model.ListNamespacesResponse;
import software.amazon.awssdk.services.s3tables.model.ListTablesRequest;
import software.amazon.awssdk.services.s3tables.model.ListTablesResponse;
import software.amazon.awssdk.services.s3tables.model.NamespaceSummary;
import software.amazon.awssdk.services.s3tables.model.NotFoundException;
import software.amazon.awssdk.services.s3tables.model.TableSummary;

/** Lists namespaces and tables of an S3 table bucket through the S3 Tables control plane API. */
public final class S3TablesCatalogClient implements CatalogClient {
  private static final Logger LOG = Logger.getLogger(S3TablesCatalogClient.class);

  private final S3TablesClient client;
  private final String tableBucketArn;

  public S3TablesCatalogClient(S3TablesClient client, String tableBucketArn) {
    this.client = Objects.requireNonNull(client, "client");
    this.tableBucketArn = Objects.requireNonNull(tableBucketArn, "tableBucketArn");
  }

  @Override
  public List<String> listNamespaces() throws CatalogUnavailableException {
    var request = ListNamespacesRequest.builder().tableBucketARN(tableBucketArn).build();

    var out = new ArrayList<String>();
    String token = null;
    try {
      do {
        var builder = request.toBuilder();
        if (token != null) {
          builder.continuationToken(token);
        }

        ListNamespacesResponse response = client.listNamespaces(builder.build());
        for (NamespaceSummary summary : response.namespaces()) {
          List<String> levels = summary.namespace();
          if (levels != null && !levels.isEmpty()) {
            out.add(levels.get(0));
          }
        }
        token = response.continuationToken();
      } while (token != null && !token.isEmpty());
    } catch (SdkException e) {
      throw new CatalogUnavailableException(
          "Failed to list namespaces of " + tableBucketArn + ": " + e.getMessage(), e);
    }
    LOG.debugf("Listed %d namespaces in %s", out.size(), tableBucketArn);
    return out;
  }

  @Override
  public List<TableRef> listTables(String namespace)
      throws CatalogUnavailableException, NamespaceNotFoundException {
    var request =
        ListTablesRequest.builder().tableBucketARN(tableBucketArn).namespace(namespace).build();

    var out = new ArrayList<TableRef>();
    String token = null;
    try {
      do {
        var builder = request.toBuilder();
        if (token != null) {
          builder.continuationToken(token);
        }

        ListTablesResponse response = client.listTables(builder.build());
        for (TableSummary table : response.tables()) {
          out.add(new TableRef(namespace, table.name()));
        }
        token = response.continuationToken();
      } while (token != null && !token.isEmpty());
    } catch (NotFoundException e) {
      throw new NamespaceNotFoundException(namespace, e);
    } catch (SdkException e) {
      throw new CatalogUnavailableException(
          "Failed to list tables in " + namespace + ": " + e.getMessage(), e);
    }
    return out;
  }

  @Override
  public void close() {
    client.close();
  }
}
