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

import java.sql.SQLTimeoutException;

/**
 * The poll loop hit its attempt or wall clock ceiling. The query may still be
 * running on the server.
 */
public class QueryTimeoutException extends SQLTimeoutException {

  private static final long serialVersionUID = 1L;

  public static final String SQL_STATE = "HYT00";

  private final String queryId;

  public QueryTimeoutException(String reason, String queryId) {
    super(reason, SQL_STATE);
    this.queryId = queryId;
  }

  public String getQueryId() {
    return queryId;
  }
}
