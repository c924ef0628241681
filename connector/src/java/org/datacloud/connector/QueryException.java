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

package org.datacloud.connector;

import java.sql.SQLException;

/**
 * The server reported that the query itself failed.
 */
public class QueryException extends SQLException {

  private static final long serialVersionUID = 1L;

  public static final String SQL_STATE = "42000";

  private final String queryId;

  public QueryException(String reason, String queryId) {
    super(reason, SQL_STATE);
    this.queryId = queryId;
  }

  public QueryException(String reason, String queryId, Throwable cause) {
    super(reason, SQL_STATE, cause);
    this.queryId = queryId;
  }

  /**
   * @return the server assigned query id, or null when the query was rejected at submit
   */
  public String getQueryId() {
    return queryId;
  }
}
