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
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

/**
 * Recognized connection option keys and connection URL parsing.
 *
 * A connection URL has the form
 *   datacloud://&lt;login-host&gt;[:port][;key=value]*
 * e.g. datacloud://login.example.com;user=foo;clientId=bar;transport=grpc
 */
public final class ConnectionParams {

  public static final String URL_PREFIX = "datacloud://";

  // Login endpoint and credentials
  public static final String LOGIN_URL = "loginUrl";
  public static final String AUTH_TYPE = "authType";
  public static final String AUTH_TYPE_PASSWORD = "password";
  public static final String AUTH_TYPE_REFRESH_TOKEN = "refresh_token";
  public static final String AUTH_TYPE_CLIENT_CREDENTIALS = "client_credentials";
  public static final String AUTH_TYPE_JWT = "jwt";
  public static final String AUTH_USER = "user";
  public static final String AUTH_PASSWD = "password";
  public static final String CLIENT_ID = "clientId";
  public static final String CLIENT_SECRET = "clientSecret";
  public static final String CORE_TOKEN = "coreToken";
  public static final String REFRESH_TOKEN = "refreshToken";
  public static final String PRIVATE_KEY = "privateKey";
  public static final String JWT_EXPIRY_SECONDS = "jwtExpirySeconds";
  // Exchange the core token for a Data Cloud token
  public static final String TOKEN_EXCHANGE = "tokenExchange";
  public static final String DATASPACE = "dataspace";
  // Token lifetime assumed when the token endpoint does not send expires_in
  public static final String TOKEN_TIMEOUT_SECONDS = "tokenTimeoutSeconds";

  // Transport selection
  public static final String TRANSPORT = "transport";
  public static final String API_VERSION = "apiVersion";
  public static final String GRPC_TARGET = "grpcTarget";
  public static final String GRPC_PLAINTEXT = "grpcPlaintext";
  public static final String CONNECT_TIMEOUT_MS = "connectTimeoutMs";
  public static final String SOCKET_TIMEOUT_MS = "socketTimeoutMs";
  // Any key with this prefix is sent as an extra header on every REST call
  public static final String HTTP_HEADER_PREFIX = "http.header.";

  // Cursor paging and polling
  public static final String PAGE_SIZE = "pageSize";
  public static final String POLL_INITIAL_INTERVAL_MS = "pollInitialIntervalMs";
  public static final String POLL_MAX_INTERVAL_MS = "pollMaxIntervalMs";
  public static final String POLL_MULTIPLIER = "pollMultiplier";
  public static final String POLL_MAX_ATTEMPTS = "pollMaxAttempts";
  public static final String POLL_TIMEOUT_MS = "pollTimeoutMs";

  private ConnectionParams() {
  }

  public static boolean acceptsURL(String url) {
    return url != null && url.startsWith(URL_PREFIX);
  }

  /**
   * Parse a connection URL into connection properties. Values in {@code info}
   * override the ones given in the URL.
   *
   * @param url connection URL
   * @param info explicit properties, may be null
   * @return merged properties, with {@link #LOGIN_URL} set from the URL authority
   *         unless given explicitly
   * @throws SQLException if the URL is malformed
   */
  public static Properties parseURL(String url, Properties info) throws SQLException {
    if (!acceptsURL(url)) {
      throw new SQLException("Bad URL format: Missing prefix " + URL_PREFIX, "08001");
    }
    Properties merged = new Properties();
    String rest = url.substring(URL_PREFIX.length());
    String[] parts = rest.split(";");
    String authority = StringUtils.stripEnd(parts[0], "/");
    if (!authority.isEmpty()) {
      merged.setProperty(LOGIN_URL, "https://" + authority);
    }
    for (int i = 1; i < parts.length; i++) {
      String part = parts[i];
      if (part.isEmpty()) {
        continue;
      }
      int eq = part.indexOf('=');
      if (eq <= 0) {
        throw new SQLException("Bad URL format: expected key=value but found '" + part + "'",
            "08001");
      }
      merged.setProperty(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
    }
    if (info != null) {
      for (Map.Entry<Object, Object> entry : info.entrySet()) {
        merged.setProperty(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
      }
    }
    return merged;
  }
}
