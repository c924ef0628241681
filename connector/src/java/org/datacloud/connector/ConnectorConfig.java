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
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.datacloud.connector.auth.AuthType;
import org.datacloud.connector.transport.TransportRegistry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Validated, immutable connection configuration. Built from connection
 * properties keyed by the constants in {@link ConnectionParams}; nothing is
 * read from the environment.
 */
public final class ConnectorConfig {

  public static final String DEFAULT_API_VERSION = "v60.0";
  public static final int DEFAULT_PAGE_SIZE = 1000;
  public static final long DEFAULT_JWT_EXPIRY_SECONDS = 180;
  public static final long MAX_JWT_EXPIRY_SECONDS = 300;
  public static final int DEFAULT_CONNECT_TIMEOUT_MS = 30_000;
  public static final int DEFAULT_SOCKET_TIMEOUT_MS = 60_000;

  private final String loginUrl;
  private final AuthType authType;
  private final String user;
  private final String password;
  private final String clientId;
  private final String clientSecret;
  private final String coreToken;
  private final String refreshToken;
  private final String privateKey;
  private final Duration jwtExpiry;
  private final boolean tokenExchange;
  private final String dataspace;
  private final Duration tokenTimeout;
  private final String transport;
  private final String apiVersion;
  private final int pageSize;
  private final PollPolicy pollPolicy;
  private final String grpcTarget;
  private final boolean grpcPlaintext;
  private final int connectTimeoutMs;
  private final int socketTimeoutMs;
  private final Map<String, String> httpHeaders;

  private ConnectorConfig(Map<String, String> props) throws SQLException {
    String login = props.get(ConnectionParams.LOGIN_URL);
    if (StringUtils.isBlank(login)) {
      throw new SQLException("Missing required option " + ConnectionParams.LOGIN_URL, "08001");
    }
    loginUrl = normalizeUrl(login);
    user = StringUtils.trimToNull(props.get(ConnectionParams.AUTH_USER));
    password = props.get(ConnectionParams.AUTH_PASSWD);
    clientId = StringUtils.trimToNull(props.get(ConnectionParams.CLIENT_ID));
    clientSecret = props.get(ConnectionParams.CLIENT_SECRET);
    coreToken = StringUtils.trimToNull(props.get(ConnectionParams.CORE_TOKEN));
    refreshToken = StringUtils.trimToNull(props.get(ConnectionParams.REFRESH_TOKEN));
    privateKey = StringUtils.trimToNull(props.get(ConnectionParams.PRIVATE_KEY));
    authType = resolveAuthType(props.get(ConnectionParams.AUTH_TYPE));
    long jwtExpirySecs = getLong(props, ConnectionParams.JWT_EXPIRY_SECONDS,
        DEFAULT_JWT_EXPIRY_SECONDS);
    try {
      checkJwtExpiry(jwtExpirySecs);
    } catch (IllegalArgumentException e) {
      throw new SQLException(e.getMessage(), "08001", e);
    }
    jwtExpiry = Duration.ofSeconds(jwtExpirySecs);
    tokenExchange = Boolean.parseBoolean(props.get(ConnectionParams.TOKEN_EXCHANGE));
    dataspace = StringUtils.trimToNull(props.get(ConnectionParams.DATASPACE));
    long timeoutSecs = getLong(props, ConnectionParams.TOKEN_TIMEOUT_SECONDS, -1);
    tokenTimeout = timeoutSecs > 0 ? Duration.ofSeconds(timeoutSecs) : null;
    transport = StringUtils.defaultIfBlank(props.get(ConnectionParams.TRANSPORT),
        TransportRegistry.DEFAULT_TRANSPORT).trim();
    apiVersion = StringUtils.defaultIfBlank(props.get(ConnectionParams.API_VERSION),
        DEFAULT_API_VERSION).trim();
    pageSize = (int) getLong(props, ConnectionParams.PAGE_SIZE, DEFAULT_PAGE_SIZE);
    if (pageSize <= 0) {
      throw new SQLException(ConnectionParams.PAGE_SIZE + " must be positive", "08001");
    }
    try {
      pollPolicy = new PollPolicy(
          Duration.ofMillis(getLong(props, ConnectionParams.POLL_INITIAL_INTERVAL_MS,
              PollPolicy.DEFAULT_INITIAL_INTERVAL_MS)),
          Duration.ofMillis(getLong(props, ConnectionParams.POLL_MAX_INTERVAL_MS,
              PollPolicy.DEFAULT_MAX_INTERVAL_MS)),
          getDouble(props, ConnectionParams.POLL_MULTIPLIER, PollPolicy.DEFAULT_MULTIPLIER),
          (int) getLong(props, ConnectionParams.POLL_MAX_ATTEMPTS,
              PollPolicy.DEFAULT_MAX_ATTEMPTS),
          Duration.ofMillis(getLong(props, ConnectionParams.POLL_TIMEOUT_MS,
              PollPolicy.DEFAULT_TIMEOUT_MS)));
    } catch (IllegalArgumentException e) {
      throw new SQLException("Invalid poll configuration: " + e.getMessage(), "08001", e);
    }
    grpcTarget = StringUtils.trimToNull(props.get(ConnectionParams.GRPC_TARGET));
    grpcPlaintext = Boolean.parseBoolean(props.get(ConnectionParams.GRPC_PLAINTEXT));
    connectTimeoutMs = (int) getLong(props, ConnectionParams.CONNECT_TIMEOUT_MS,
        DEFAULT_CONNECT_TIMEOUT_MS);
    socketTimeoutMs = (int) getLong(props, ConnectionParams.SOCKET_TIMEOUT_MS,
        DEFAULT_SOCKET_TIMEOUT_MS);

    ImmutableMap.Builder<String, String> headers = ImmutableMap.builder();
    for (Map.Entry<String, String> entry : props.entrySet()) {
      if (entry.getKey().startsWith(ConnectionParams.HTTP_HEADER_PREFIX)) {
        headers.put(entry.getKey().substring(ConnectionParams.HTTP_HEADER_PREFIX.length()),
            entry.getValue());
      }
    }
    httpHeaders = headers.build();
    validateCredentials();
  }

  /**
   * Lifetime of a JWT assertion, between one second and five minutes.
   */
  static void checkJwtExpiry(long seconds) {
    Preconditions.checkArgument(seconds > 0 && seconds <= MAX_JWT_EXPIRY_SECONDS,
        "%s must be between 1 and %s seconds, got %s", ConnectionParams.JWT_EXPIRY_SECONDS,
        MAX_JWT_EXPIRY_SECONDS, seconds);
  }

  public static ConnectorConfig fromProperties(Properties info) throws SQLException {
    Map<String, String> props = new HashMap<>();
    for (String name : info.stringPropertyNames()) {
      props.put(name, info.getProperty(name));
    }
    return new ConnectorConfig(props);
  }

  public static ConnectorConfig fromMap(Map<String, String> props) throws SQLException {
    return new ConnectorConfig(new HashMap<>(props));
  }

  /**
   * Prefix https:// when the URL has no scheme and drop trailing slashes.
   */
  public static String normalizeUrl(String url) {
    String trimmed = StringUtils.stripEnd(url.trim(), "/");
    if (!trimmed.contains("://")) {
      trimmed = "https://" + trimmed;
    }
    return trimmed;
  }

  private AuthType resolveAuthType(String configured) throws SQLException {
    if (StringUtils.isNotBlank(configured)) {
      AuthType type = AuthType.fromConfigName(configured);
      if (type == null) {
        throw new SQLException("Unsupported " + ConnectionParams.AUTH_TYPE + " '" + configured
            + "'", "08001");
      }
      return type;
    }
    if (user != null && password != null) {
      return AuthType.PASSWORD;
    }
    if (privateKey != null) {
      return AuthType.JWT;
    }
    return AuthType.REFRESH_TOKEN;
  }

  private void validateCredentials() throws SQLException {
    switch (authType) {
    case PASSWORD:
      require(user, ConnectionParams.AUTH_USER);
      require(password, ConnectionParams.AUTH_PASSWD);
      require(clientId, ConnectionParams.CLIENT_ID);
      require(clientSecret, ConnectionParams.CLIENT_SECRET);
      break;
    case REFRESH_TOKEN:
      require(clientId, ConnectionParams.CLIENT_ID);
      if (coreToken == null && refreshToken == null && clientSecret == null) {
        throw new SQLException("Auth type " + authType.getConfigName() + " needs one of "
            + ConnectionParams.CORE_TOKEN + ", " + ConnectionParams.REFRESH_TOKEN + " or "
            + ConnectionParams.CLIENT_SECRET, "08001");
      }
      break;
    case JWT:
      require(clientId, ConnectionParams.CLIENT_ID);
      require(user, ConnectionParams.AUTH_USER);
      require(privateKey, ConnectionParams.PRIVATE_KEY);
      break;
    default:
      throw new IllegalStateException("Unhandled auth type " + authType);
    }
  }

  private void require(String value, String key) throws SQLException {
    if (value == null) {
      throw new SQLException("Auth type " + authType.getConfigName() + " requires option "
          + key, "08001");
    }
  }

  private static long getLong(Map<String, String> props, String key, long defaultValue)
      throws SQLException {
    String value = props.get(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new SQLException("Option " + key + " is not a number: " + value, "08001", e);
    }
  }

  private static double getDouble(Map<String, String> props, String key, double defaultValue)
      throws SQLException {
    String value = props.get(key);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new SQLException("Option " + key + " is not a number: " + value, "08001", e);
    }
  }

  public String getLoginUrl() {
    return loginUrl;
  }

  public AuthType getAuthType() {
    return authType;
  }

  public String getUser() {
    return user;
  }

  public String getPassword() {
    return password;
  }

  public String getClientId() {
    return clientId;
  }

  public String getClientSecret() {
    return clientSecret;
  }

  public String getCoreToken() {
    return coreToken;
  }

  public String getRefreshToken() {
    return refreshToken;
  }

  public String getPrivateKey() {
    return privateKey;
  }

  public Duration getJwtExpiry() {
    return jwtExpiry;
  }

  public boolean isTokenExchange() {
    return tokenExchange;
  }

  public String getDataspace() {
    return dataspace;
  }

  /**
   * @return the assumed token lifetime when the server sends none, or null
   */
  public Duration getTokenTimeout() {
    return tokenTimeout;
  }

  public String getTransport() {
    return transport;
  }

  public String getApiVersion() {
    return apiVersion;
  }

  public int getPageSize() {
    return pageSize;
  }

  public PollPolicy getPollPolicy() {
    return pollPolicy;
  }

  public String getGrpcTarget() {
    return grpcTarget;
  }

  public boolean isGrpcPlaintext() {
    return grpcPlaintext;
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public int getSocketTimeoutMs() {
    return socketTimeoutMs;
  }

  public Map<String, String> getHttpHeaders() {
    return httpHeaders;
  }
}
