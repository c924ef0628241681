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

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.List;

import org.datacloud.connector.metadata.TableFilter;
import org.datacloud.connector.metadata.TableMetadata;

/**
 * The three remote operations every transport provides. A new transport only
 * implements this interface and registers in {@link TransportRegistry}.
 */
public interface TransportClient extends AutoCloseable {

  /**
   * Submit a query.
   *
   * @return the assigned query id and the initial phase
   */
  QueryStatus submitQuery(String sql, QueryParameters params) throws SQLException;

  /**
   * @return the current phase, with the columns once the server knows them
   */
  QueryStatus getQueryStatus(String queryId) throws SQLException;

  /**
   * Fetch one page of results.
   *
   * @param offset zero based row offset
   * @param limit maximum number of rows in the page
   */
  ResultPage getQueryResults(String queryId, long offset, int limit) throws SQLException;

  /**
   * Describe the tables matching {@code filter}.
   *
   * @throws SQLFeatureNotSupportedException if the transport offers no table metadata
   */
  default List<TableMetadata> getTableMetadata(TableFilter filter) throws SQLException {
    throw new SQLFeatureNotSupportedException("Table metadata is not supported by "
        + getClass().getSimpleName());
  }

  /**
   * Release the channel or HTTP client. Calling it again has no effect.
   */
  @Override
  void close();
}
