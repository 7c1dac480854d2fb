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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.apache.iceberg.CatalogProperties;
import org.apache.iceberg.rest.RESTCatalog;
import org.jboss.logging.Logger;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3tables.S3TablesClient;

/** Builds the clients used to reach an S3 table bucket. */
public final class IcebergCatalogFactory {
  private static final Logger LOG = Logger.getLogger(IcebergCatalogFactory.class);

  static final String CATALOG_NAME = "lakegauge";
  static final String SIGNING_NAME = "s3tables";
  private static final String REDACTED = "****";

  private IcebergCatalogFactory() {}

  /** Iceberg REST endpoint of S3 Tables in {@code region}. */
  public static String defaultUri(String region) {
    return "https://s3tables." + region + ".amazonaws.com/iceberg";
  }

  /**
   * Opens the Iceberg REST catalog of a table bucket, signing requests with SigV4.
   *
   * @param warehouseArn table bucket ARN, used as the REST warehouse
   * @param region AWS region of the bucket
   * @param uri REST endpoint, {@link #defaultUri(String)} when null or blank
   * @param extra additional catalog properties, applied last
   */
  public static RESTCatalog s3TablesCatalog(
      String warehouseArn, String region, String uri, Map<String, String> extra) {
    Map<String, String> props = restProperties(warehouseArn, region, uri, extra);
    LOG.infof("Opening Iceberg REST catalog %s", redact(props));

    RESTCatalog catalog = new RESTCatalog();
    catalog.initialize(CATALOG_NAME, Collections.unmodifiableMap(props));
    return catalog;
  }

  public static S3TablesClient s3TablesClient(String region) {
    return S3TablesClient.builder()
        .region(Region.of(region))
        .httpClientBuilder(UrlConnectionHttpClient.builder())
        .build();
  }

  static Map<String, String> restProperties(
      String warehouseArn, String region, String uri, Map<String, String> extra) {
    Objects.requireNonNull(warehouseArn, "warehouseArn");
    Objects.requireNonNull(region, "region");

    Map<String, String> props = new HashMap<>();
    props.put(CatalogProperties.URI, uri == null || uri.isBlank() ? defaultUri(region) : uri);
    props.put(CatalogProperties.WAREHOUSE_LOCATION, warehouseArn);
    props.put("rest.sigv4-enabled", "true");
    props.put("rest.signing-name", SIGNING_NAME);
    props.put("rest.signing-region", region);
    props.put("rest.client.user-agent", "lakegauge");
    props.put(CatalogProperties.FILE_IO_IMPL, "org.apache.iceberg.aws.s3.S3FileIO");
    props.put("client.region", region);
    props.put("http-client.type", "urlconnection");
    if (extra != null) {
      props.putAll(extra);
    }
    return props;
  }

  static Map<String, String> redact(Map<String, String> props) {
    Map<String, String> out = new TreeMap<>();
    props.forEach((k, v) -> out.put(k, isSecret(k) ? REDACTED : v));
    return out;
  }

  private static boolean isSecret(String key) {
    String k = key.toLowerCase(Locale.ROOT);
    return k.contains("secret")
        || k.contains("token")
        || k.contains("password")
        || k.contains("credential")
        || k.endsWith("access-key-id")
        || k.endsWith("session-token");
  }
}
