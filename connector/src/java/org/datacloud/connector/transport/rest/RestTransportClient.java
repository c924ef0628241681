/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.datacloud.connector.transport.rest;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.http.HttpStatus;
import org.apache.http.NoHttpResponseException;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.util.EntityUtils;
import org.datacloud.connector.ApiException;
import org.datacloud.connector.AuthenticationException;
import org.datacloud.connector.ConnectorConfig;
import org.datacloud.connector.QueryException;
import org.datacloud.connector.auth.AuthStrategy;
import org.datacloud.connector.auth.TokenStore;
import org.datacloud.connector.metadata.TableFilter;
import org.datacloud.connector.metadata.TableMetadata;
import org.datacloud.connector.transport.AbstractTransportClient;
import org.datacloud.connector.transport.AuthExpiredException;
import org.datacloud.connector.transport.ColumnMetadata;
import org.datacloud.connector.transport.QueryParameters;
import org.datacloud.connector.transport.QueryPhase;
import org.datacloud.connector.transport.QueryStatus;
import org.datacloud.connector.transport.ResultPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.net.UrlEscapers;

/**
 * Query service over HTTP/JSON. One HTTP call per operation:
 * <pre>
 *   POST {instance}/services/data/{version}/ssot/query-sql
 *   GET  {instance}/services/data/{version}/ssot/query-sql/{queryId}
 *   GET  {instance}/services/data/{version}/ssot/query-sql/{queryId}/rows?offset=&amp;rowLimit=
 *   GET  {instance}/api/v1/metadata?entityName=&amp;entityCategory=&amp;entityType=
 * </pre>
 */
public class RestTransportClient extends AbstractTransportClient {

  private static final Logger LOG = LoggerFactory.getLogger(RestTransportClient.class);

  static final String QUERY_PATH = "/query-sql";
  static final String METADATA_PATH = "/api/v1/metadata";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private final CloseableHttpClient httpClient;
  private final String basePath;
  // column order of recent queries, used to align rows sent as JSON objects
  private final Cache<String, List<String>> columnNames =
      CacheBuilder.newBuilder().maximumSize(64).build();

  public RestTransportClient(AuthStrategy auth, ConnectorConfig config) {
    this(auth, config, createHttpClient(config));
  }

  @VisibleForTesting
  RestTransportClient(AuthStrategy auth, ConnectorConfig config, CloseableHttpClient httpClient) {
    super(auth);
    this.httpClient = httpClient;
    this.basePath = "/services/data/" + config.getApiVersion() + "/ssot";
  }

  static CloseableHttpClient createHttpClient(ConnectorConfig config) {
    RequestConfig requestConfig = RequestConfig.custom()
        .setConnectTimeout(config.getConnectTimeoutMs())
        .setSocketTimeout(config.getSocketTimeoutMs())
        .build();
    HttpClientBuilder httpClientBuilder = HttpClientBuilder.create()
        .setDefaultRequestConfig(requestConfig)
        .disableCookieManagement();
    // In case the server's idletimeout is set to a lower value, it might close it's side of
    // connection. However we retry one more time on NoHttpResponseException
    httpClientBuilder.setRetryHandler((exception, executionCount, context) -> {
      if (executionCount > 1) {
        LOG.info("Retry attempts to connect to server exceeded.");
        return false;
      }
      if (exception instanceof NoHttpResponseException) {
        LOG.info("Could not connect to the server. Retrying one more time.");
        return true;
      }
      return false;
    });
    // Add the request interceptor to the client builder
    httpClientBuilder.addInterceptorFirst(new HttpBearerAuthInterceptor(config.getHttpHeaders()));
    return httpClientBuilder.build();
  }

  @Override
  public QueryStatus submitQuery(String sql, QueryParameters params) throws SQLException {
    ObjectNode body = MAPPER.createObjectNode();
    body.put("sql", sql);
    if (params != null && !params.isEmpty()) {
      body.set("sqlParameters", MAPPER.valueToTree(params.toJsonValue()));
    }
    String payload;
    try {
      payload = MAPPER.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new ApiException("Cannot encode query parameters: " + e.getOriginalMessage(), e);
    }
    return invoke("submit query", token -> {
      HttpPost post = new HttpPost(uri(token, QUERY_PATH));
      post.setEntity(new StringEntity(payload, ContentType.APPLICATION_JSON));
      QueryStatus status = parseStatus(execute(post, token), null);
      LOG.debug("Submitted query {}", status.getQueryId());
      return status;
    });
  }

  @Override
  public QueryStatus getQueryStatus(String queryId) throws SQLException {
    return invoke("get query status", token -> parseStatus(
        execute(new HttpGet(uri(token, QUERY_PATH + "/" + escape(queryId))), token), queryId));
  }

  @Override
  public ResultPage getQueryResults(String queryId, long offset, int limit) throws SQLException {
    return invoke("get query results", token -> {
      URI rows;
      try {
        rows = new URIBuilder(uri(token, QUERY_PATH + "/" + escape(queryId) + "/rows"))
            .addParameter("offset", Long.toString(offset))
            .addParameter("rowLimit", Integer.toString(limit))
            .build();
      } catch (URISyntaxException e) {
        throw new ApiException("Invalid results url: " + e.getMessage(), e);
      }
      return parsePage(execute(new HttpGet(rows), token), queryId, offset, limit);
    });
  }

  @Override
  public List<TableMetadata> getTableMetadata(TableFilter filter) throws SQLException {
    TableFilter criteria = filter == null ? TableFilter.all() : filter;
    return invoke("get table metadata", token -> {
      URI metadata;
      try {
        URIBuilder builder = new URIBuilder(token.getInstanceUrl() + METADATA_PATH);
        for (Map.Entry<String, String> param : criteria.toRequestParameters().entrySet()) {
          builder.addParameter(param.getKey(), param.getValue());
        }
        metadata = builder.build();
      } catch (URISyntaxException e) {
        throw new ApiException("Invalid metadata url: " + e.getMessage(), e);
      }
      LOG.debug("Requesting table metadata for {}", criteria);
      return TableMetadataParser.parseTables(execute(new HttpGet(metadata), token));
    });
  }

  @Override
  protected void doClose() {
    columnNames.invalidateAll();
    try {
      httpClient.close();
    } catch (IOException e) {
      LOG.warn("Error closing http client", e);
    }
  }

  private URI uri(TokenStore token, String path) throws ApiException {
    try {
      return new URI(token.getInstanceUrl() + basePath + path);
    } catch (URISyntaxException e) {
      throw new ApiException("Invalid service url: " + e.getMessage(), e);
    }
  }

  private static String escape(String queryId) {
    return UrlEscapers.urlPathSegmentEscaper().escape(queryId);
  }

  private JsonNode execute(HttpRequestBase request, TokenStore token)
      throws SQLException, AuthExpiredException {
    HttpClientContext context = HttpClientContext.create();
    context.setAttribute(HttpBearerAuthInterceptor.ACCESS_TOKEN_ATTR, token.getAccessToken());
    int status;
    String body;
    try (CloseableHttpResponse response = httpClient.execute(request, context)) {
      status = response.getStatusLine().getStatusCode();
      body = response.getEntity() == null ? ""
          : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ApiException(request.getMethod() + " " + request.getURI().getPath() + " failed: "
          + e.getMessage(), e);
    }
    if (status == HttpStatus.SC_UNAUTHORIZED) {
      throw new AuthExpiredException("HTTP 401 from " + request.getURI().getPath());
    }
    JsonNode json;
    try {
      json = body.trim().isEmpty() ? MAPPER.createObjectNode() : MAPPER.readTree(body);
    } catch (IOException e) {
      if (status >= 200 && status < 300) {
        throw new ApiException("Malformed response from " + request.getURI().getPath() + ": "
            + e.getMessage(), status, e);
      }
      json = null;
    }
    if (status == HttpStatus.SC_FORBIDDEN) {
      throw new AuthenticationException("Access denied: " + errorMessage(json, body));
    }
    if (status < 200 || status >= 300) {
      throw mapError(status, json, body);
    }
    return json;
  }

  private static SQLException mapError(int status, JsonNode json, String body) {
    JsonNode error = json != null && json.isArray() && json.size() > 0 ? json.get(0) : json;
    String errorCode = error == null ? null : error.path("errorCode").asText(null);
    String message = errorMessage(json, body);
    if (errorCode != null
        && (errorCode.contains("QUERY_PARSER_ERROR") || errorCode.contains("INVALID_QUERY"))) {
      return new QueryException(message, null);
    }
    return new ApiException("HTTP " + status + ": " + message, status);
  }

  private static String errorMessage(JsonNode json, String body) {
    JsonNode error = json != null && json.isArray() && json.size() > 0 ? json.get(0) : json;
    if (error != null && error.hasNonNull("message")) {
      return error.get("message").asText();
    }
    return body == null || body.isEmpty() ? "no details"
        : body.substring(0, Math.min(body.length(), 200));
  }

  private QueryStatus parseStatus(JsonNode root, String knownQueryId) throws ApiException {
    JsonNode status = root.path("status").isObject() ? root.get("status") : root;
    String queryId = status.path("queryId").asText(knownQueryId);
    if (queryId == null || queryId.isEmpty()) {
      throw new ApiException("Response carries no queryId");
    }
    String state = status.hasNonNull("completionStatus")
        ? status.get("completionStatus").asText() : status.path("state").asText(null);
    QueryPhase phase = QueryPhase.fromServerState(state);
    Long rowCount = status.path("rowCount").isNumber() ? status.get("rowCount").asLong() : null;
    String errorMessage = status.hasNonNull("errorMessage")
        ? status.get("errorMessage").asText() : status.path("message").asText(null);
    List<ColumnMetadata> columns = parseColumns(root.get("metadata"));
    if (columns != null) {
      List<String> names = new ArrayList<>(columns.size());
      for (ColumnMetadata column : columns) {
        names.add(column.getName());
      }
      columnNames.put(queryId, names);
    }
    return new QueryStatus(queryId, phase, columns, rowCount, errorMessage);
  }

  private static List<ColumnMetadata> parseColumns(JsonNode metadata) throws ApiException {
    if (metadata == null || metadata.isNull()) {
      return null;
    }
    List<ColumnMetadata> columns = new ArrayList<>();
    if (metadata.isArray()) {
      for (JsonNode column : metadata) {
        columns.add(toColumn(column.path("name").asText(null), column));
      }
      return columns;
    }
    if (metadata.isObject()) {
      // {"Id": {"type": "TEXT", "placeInOrder": 0}, ...}
      List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
      metadata.fields().forEachRemaining(entries::add);
      entries.sort(Comparator.comparingInt(e -> e.getValue().path("placeInOrder").asInt(0)));
      for (Map.Entry<String, JsonNode> entry : entries) {
        columns.add(toColumn(entry.getKey(), entry.getValue()));
      }
      return columns;
    }
    throw new ApiException("Malformed column metadata: " + metadata);
  }

  private static ColumnMetadata toColumn(String name, JsonNode column) throws ApiException {
    if (name == null || name.isEmpty()) {
      throw new ApiException("Column metadata without a name: " + column);
    }
    return new ColumnMetadata(name, column.path("type").asText(null),
        column.path("precision").isNumber() ? column.get("precision").asInt() : null,
        column.path("scale").isNumber() ? column.get("scale").asInt() : null,
        column.path("nullable").asBoolean(true));
  }

  private ResultPage parsePage(JsonNode root, String queryId, long offset, int limit)
      throws ApiException {
    JsonNode data = root.path("data");
    if (!data.isMissingNode() && !data.isNull() && !data.isArray()) {
      throw new ApiException("Malformed results page for query " + queryId);
    }
    List<List<Object>> rows = new ArrayList<>();
    List<String> names = columnNames.getIfPresent(queryId);
    for (JsonNode row : data) {
      rows.add(toRow(row, names));
    }
    int returned = root.path("returnedRows").isNumber()
        ? root.get("returnedRows").asInt() : rows.size();
    Long totalRows = root.path("totalRows").isNumber() ? root.get("totalRows").asLong() : null;
    return new ResultPage(rows, offset, isLastPage(root, offset, rows.size(), returned, limit,
        totalRows), totalRows);
  }

  /**
   * An empty page ends the result. Otherwise a disclosed total decides alone,
   * since pages can be capped below the requested limit. Without a total the
   * done flag decides, then a missing next offset or a short page.
   */
  private static boolean isLastPage(JsonNode root, long offset, int received, int returned,
      int limit, Long totalRows) {
    if (received == 0) {
      return true;
    }
    if (totalRows != null) {
      return offset + received >= totalRows;
    }
    if (root.path("done").isBoolean()) {
      return root.get("done").asBoolean();
    }
    JsonNode nextOffset = root.get("nextOffset");
    return nextOffset == null || nextOffset.isNull() || nextOffset.asLong(-1) < 0
        || returned < limit;
  }

  private static List<Object> toRow(JsonNode row, List<String> names) throws ApiException {
    List<Object> values = new ArrayList<>();
    if (row.isArray()) {
      for (JsonNode value : row) {
        values.add(toValue(value));
      }
    } else if (row.isObject()) {
      if (names != null) {
        for (String name : names) {
          values.add(toValue(row.get(name)));
        }
      } else {
        Iterator<JsonNode> it = row.elements();
        while (it.hasNext()) {
          values.add(toValue(it.next()));
        }
      }
    } else {
      throw new ApiException("Malformed row: " + row);
    }
    return values;
  }

  private static Object toValue(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    if (value.isTextual()) {
      return value.asText();
    }
    if (value.isBoolean()) {
      return value.asBoolean();
    }
    if (value.isNumber()) {
      return value.numberValue();
    }
    return value.toString();
  }
}
