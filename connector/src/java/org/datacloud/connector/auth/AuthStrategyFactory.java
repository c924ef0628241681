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

import java.io.IOException;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.datacloud.connector.AuthenticationException;
import org.datacloud.connector.ConnectorConfig;

/**
 * Selects the strategy by the configured auth type.
 */
public final class AuthStrategyFactory {

  private AuthStrategyFactory() {
  }

  public static AuthStrategy create(ConnectorConfig config) throws AuthenticationException {
    CloseableHttpClient httpClient = createHttpClient(config);
    try {
      return create(config, httpClient);
    } catch (AuthenticationException | RuntimeException e) {
      try {
        httpClient.close();
      } catch (IOException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  /**
   * @param httpClient client for the token endpoint, owned by the returned strategy
   */
  public static AuthStrategy create(ConnectorConfig config, CloseableHttpClient httpClient)
      throws AuthenticationException {
    switch (config.getAuthType()) {
    case PASSWORD:
      return new PasswordGrantAuthStrategy(config, httpClient);
    case REFRESH_TOKEN:
      return new ClientCredentialsAuthStrategy(config, httpClient);
    case JWT:
      return new JwtBearerAuthStrategy(config, httpClient);
    default:
      throw new IllegalStateException("Unhandled auth type " + config.getAuthType());
    }
  }

  static CloseableHttpClient createHttpClient(ConnectorConfig config) {
    RequestConfig requestConfig = RequestConfig.custom()
        .setConnectTimeout(config.getConnectTimeoutMs())
        .setSocketTimeout(config.getSocketTimeoutMs())
        .build();
    return HttpClientBuilder.create()
        .setDefaultRequestConfig(requestConfig)
        .disableCookieManagement()
        .build();
  }
}
