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

package org.datacloud.connector.transport;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Submit and status response shared by all transports.
 */
public final class QueryStatus {

  private final String queryId;
  private final QueryPhase phase;
  private final List<ColumnMetadata> columns;
  private final Long totalRows;
  private final String errorMessage;

  public QueryStatus(String queryId, QueryPhase phase, List<ColumnMetadata> columns,
      Long totalRows, String errorMessage) {
    this.queryId = queryId;
    this.phase = phase;
    this.columns = columns == null ? null : ImmutableList.copyOf(columns);
    this.totalRows = totalRows;
    this.errorMessage = errorMessage;
  }

  public String getQueryId() {
    return queryId;
  }

  public QueryPhase getPhase() {
    return phase;
  }

  /**
   * @return the result columns, or null while the server has not disclosed them
   */
  public List<ColumnMetadata> getColumns() {
    return columns;
  }

  /**
   * @return the total row count, or null when unknown
   */
  public Long getTotalRows() {
    return totalRows;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues()
        .add("queryId", queryId)
        .add("phase", phase)
        .add("columns", columns)
        .add("totalRows", totalRows)
        .add("errorMessage", errorMessage)
        .toString();
  }
}
