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

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.apache.http.NameValuePair;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicNameValuePair;
import org.datacloud.connector.AuthenticationException;
import org.datacloud.connector.ConnectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works from pre-obtained tokens and connected app credentials, never from a
 * user's primary credentials.
 * <ul>
 * <li>A configured core token is used first, as is or exchanged.</li>
 * <li>Afterwards a refresh token grant runs, preferring the most recently
 * issued refresh token.</li>
 * <li>Without any refresh token the client credentials grant runs.</li>
 * </ul>
 */
public class ClientCredentialsAuthStrategy extends AbstractOAuthStrategy {

  private static final Logger LOG = LoggerFactory.getLogger(ClientCredentialsAuthStrategy.class);

  private boolean coreTokenConsumed;

  public ClientCredentialsAuthStrategy(ConnectorConfig config, CloseableHttpClient httpClient) {
    this(config, httpClient, Clock.systemUTC());
  }

  public ClientCredentialsAuthStrategy(ConnectorConfig config, CloseableHttpClient httpClient,
      Clock clock) {
    super(config, httpClient, clock);
    this.coreTokenConsumed = config.getCoreToken() == null;
  }

  @Override
  protected TokenResponse obtainToken() throws AuthenticationException {
    if (!coreTokenConsumed) {
      coreTokenConsumed = true;
      TokenResponse seed = new TokenResponse(config.getCoreToken(), config.getLoginUrl(), null,
          config.getRefreshToken());
      if (!isTokenExchangeEnabled()) {
        return seed;
      }
      try {
        return exchangeIfEnabled(seed);
      } catch (AuthenticationException e) {
        if (!canRequestToken()) {
          throw e;
        }
        LOG.warn("Exchange of the configured core token failed, requesting a new one: {}",
            e.getMessage());
      }
    }
    return super.obtainToken();
  }

  @Override
  protected TokenResponse requestToken() throws AuthenticationException {
    String refreshToken = currentRefreshToken() != null ? currentRefreshToken()
        : config.getRefreshToken();
    List<NameValuePair> form = new ArrayList<>();
    if (refreshToken != null) {
      form.add(new BasicNameValuePair("grant_type", "refresh_token"));
      form.add(new BasicNameValuePair("refresh_token", refreshToken));
    } else if (config.getClientSecret() != null) {
      form.add(new BasicNameValuePair("grant_type", "client_credentials"));
    } else {
      throw new AuthenticationException(
          "Core token expired and neither a refresh token nor a client secret is configured");
    }
    form.add(new BasicNameValuePair("client_id", config.getClientId()));
    if (config.getClientSecret() != null) {
      form.add(new BasicNameValuePair("client_secret", config.getClientSecret()));
    }
    return endpoint.post(tokenUrl(), form, config.getLoginUrl());
  }

  private boolean canRequestToken() {
    return currentRefreshToken() != null || config.getRefreshToken() != null
        || config.getClientSecret() != null;
  }
}
