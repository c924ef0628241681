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

import java.sql.SQLInvalidAuthorizationSpecException;

/**
 * Raised when the token endpoint rejects the configured credentials, or when a
 * call is still rejected as unauthenticated right after a forced re-authentication.
 */
public class AuthenticationException extends SQLInvalidAuthorizationSpecException {

  private static final long serialVersionUID = 1L;

  public static final String SQL_STATE = "28000";

  public AuthenticationException(String reason) {
    super(reason, SQL_STATE);
  }

  public AuthenticationException(String reason, Throwable cause) {
    super(reason, SQL_STATE, cause);
  }
}
