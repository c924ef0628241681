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

package org.datacloud.connector.auth;

import java.util.Map;

import org.datacloud.connector.AuthenticationException;

/**
 * Acquires and refreshes the bearer token of one connection.
 */
public interface AuthStrategy extends AutoCloseable {

  /**
   * Run the strategy's token exchange unconditionally. On failure the
   * previously held token is left untouched.
   *
   * @return a snapshot of the new token
   */
  TokenStore authenticate() throws AuthenticationException;

  /**
   * Authenticate if no token is held or the held one has expired, otherwise
   * return the current token without any network call.
   */
  TokenStore ensureValid() throws AuthenticationException;

  /**
   * @return request headers carrying a currently valid token
   */
  Map<String, String> headers() throws AuthenticationException;

  /**
   * @return the instance endpoint subsequent service calls go to
   */
  String instanceUrl() throws AuthenticationException;

  /**
   * Release the token endpoint HTTP client. Safe to call more than once.
   */
  @Override
  void close();
}
