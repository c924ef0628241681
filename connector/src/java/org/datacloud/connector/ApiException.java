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
 * Generic transport level failure: a non-auth HTTP or RPC error, a malformed
 * payload or an I/O failure. The status code is the HTTP status or the gRPC
 * status code value, or -1 when the failure happened before any response.
 */
public class ApiException extends SQLException {

  private static final long serialVersionUID = 1L;

  public static final String SQL_STATE = "08S01";
  public static final int NO_STATUS = -1;

  private final int statusCode;
  private final boolean transientFailure;

  public ApiException(String reason) {
    this(reason, NO_STATUS, null);
  }

  public ApiException(String reason, Throwable cause) {
    this(reason, NO_STATUS, cause);
  }

  public ApiException(String reason, int statusCode) {
    this(reason, statusCode, null);
  }

  public ApiException(String reason, int statusCode, Throwable cause) {
    this(reason, statusCode, statusCode == NO_STATUS || statusCode >= 500, cause);
  }

  public ApiException(String reason, int statusCode, boolean transientFailure, Throwable cause) {
    super(reason, SQL_STATE, statusCode, cause);
    this.statusCode = statusCode;
    this.transientFailure = transientFailure;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean hasStatusCode() {
    return statusCode != NO_STATUS;
  }

  /**
   * Failures the poll loop may retry. By default a failure without any
   * response, or with an HTTP 5xx status.
   */
  public boolean isTransient() {
    return transientFailure;
  }
}
