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

package org.datacloud.connector.transport.grpc;

import java.util.List;
import java.util.Map;

/**
 * Request and response messages of the query service.
 */
public final class QueryMessages {

  private QueryMessages() {
  }

  public static class SubmitQueryRequest {
    private String sql;
    private List<Object> positionalParameters;
    private Map<String, Object> namedParameters;

    public String getSql() {
      return sql;
    }

    public void setSql(String sql) {
      this.sql = sql;
    }

    public List<Object> getPositionalParameters() {
      return positionalParameters;
    }

    public void setPositionalParameters(List<Object> positionalParameters) {
      this.positionalParameters = positionalParameters;
    }

    public Map<String, Object> getNamedParameters() {
      return namedParameters;
    }

    public void setNamedParameters(Map<String, Object> namedParameters) {
      this.namedParameters = namedParameters;
    }
  }

  public static class GetQueryStatusRequest {
    private String queryId;

    public GetQueryStatusRequest() {
    }

    public GetQueryStatusRequest(String queryId) {
      this.queryId = queryId;
    }

    public String getQueryId() {
      return queryId;
    }

    public void setQueryId(String queryId) {
      this.queryId = queryId;
    }
  }

  public static class Column {
    private String name;
    private String type;
    private Integer precision;
    private Integer scale;
    private Boolean nullable;

    public Column() {
    }

    public Column(String name, String type) {
      this.name = name;
      this.type = type;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public Integer getPrecision() {
      return precision;
    }

    public void setPrecision(Integer precision) {
      this.precision = precision;
    }

    public Integer getScale() {
      return scale;
    }

    public void setScale(Integer scale) {
      this.scale = scale;
    }

    public Boolean getNullable() {
      return nullable;
    }

    public void setNullable(Boolean nullable) {
      this.nullable = nullable;
    }
  }

  /**
   * Reply of SubmitQuery and GetQueryStatus.
   */
  public static class QueryStatusResponse {
    private String queryId;
    private String state;
    private List<Column> columns;
    private Long totalRows;
    private String errorMessage;

    public String getQueryId() {
      return queryId;
    }

    public void setQueryId(String queryId) {
      this.queryId = queryId;
    }

    public String getState() {
      return state;
    }

    public void setState(String state) {
      this.state = state;
    }

    public List<Column> getColumns() {
      return columns;
    }

    public void setColumns(List<Column> columns) {
      this.columns = columns;
    }

    public Long getTotalRows() {
      return totalRows;
    }

    public void setTotalRows(Long totalRows) {
      this.totalRows = totalRows;
    }

    public String getErrorMessage() {
      return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
    }
  }

  public static class GetQueryResultsRequest {
    private String queryId;
    private long offset;
    private int limit;

    public GetQueryResultsRequest() {
    }

    public GetQueryResultsRequest(String queryId, long offset, int limit) {
      this.queryId = queryId;
      this.offset = offset;
      this.limit = limit;
    }

    public String getQueryId() {
      return queryId;
    }

    public void setQueryId(String queryId) {
      this.queryId = queryId;
    }

    public long getOffset() {
      return offset;
    }

    public void setOffset(long offset) {
      this.offset = offset;
    }

    public int getLimit() {
      return limit;
    }

    public void setLimit(int limit) {
      this.limit = limit;
    }
  }

  public static class QueryResultsResponse {
    private List<List<Object>> rows;
    // null when the server leaves it to the client to decide
    private Boolean last;
    private Long totalRows;

    public List<List<Object>> getRows() {
      return rows;
    }

    public void setRows(List<List<Object>> rows) {
      this.rows = rows;
    }

    public Boolean getLast() {
      return last;
    }

    public void setLast(Boolean last) {
      this.last = last;
    }

    public Long getTotalRows() {
      return totalRows;
    }

    public void setTotalRows(Long totalRows) {
      this.totalRows = totalRows;
    }
  }
}
