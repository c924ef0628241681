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
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.http.impl.client.CloseableHttpClient;
import org.datacloud.connector.AuthenticationException;
import org.datacloud.connector.ConnectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;

/**
 * Token lifecycle shared by the OAuth based strategies. All mutation of the
 * token store happens under one lock, so cursors sharing a connection never
 * run two token exchanges at once.
 */
public abstract class AbstractOAuthStrategy implements AuthStrategy {

  private static final Logger LOG = LoggerFactory.getLogger(AbstractOAuthStrategy.class);

  // Tokens are treated as expired this long before the server's expiry
  static final Duration EXPIRY_SKEW = Duration.ofSeconds(30);

  protected final ConnectorConfig config;
  protected final TokenEndpointClient endpoint;
  private final TokenExchange tokenExchange;
  private final Clock clock;
  private final TokenStore tokenStore = new TokenStore();
  private final ReentrantLock lock = new ReentrantLock();

  protected AbstractOAuthStrategy(ConnectorConfig config, CloseableHttpClient httpClient,
      Clock clock) {
    this.config = config;
    this.endpoint = new TokenEndpointClient(httpClient);
    this.tokenExchange = config.isTokenExchange()
        ? new TokenExchange(endpoint, config.getLoginUrl(), config.getDataspace()) : null;
    this.clock = clock;
  }

  /**
   * Run this strategy's grant against the token endpoint.
   */
  protected abstract TokenResponse requestToken() throws AuthenticationException;

  /**
   * Produce the next token: the strategy's grant followed by the optional
   * Data Cloud token exchange.
   */
  protected TokenResponse obtainToken() throws AuthenticationException {
    return exchangeIfEnabled(requestToken());
  }

  protected final TokenResponse exchangeIfEnabled(TokenResponse core)
      throws AuthenticationException {
    return tokenExchange == null ? core : tokenExchange.exchange(core);
  }

  protected final boolean isTokenExchangeEnabled() {
    return tokenExchange != null;
  }

  protected final String tokenUrl() {
    return config.getLoginUrl() + TokenEndpointClient.TOKEN_PATH;
  }

  /**
   * @return the refresh token currently held, or null
   */
  protected final String currentRefreshToken() {
    return tokenStore.getRefreshToken();
  }

  @Override
  public TokenStore authenticate() throws AuthenticationException {
    lock.lock();
    try {
      TokenResponse response = obtainToken();
      Instant expiresAt = expiresAt(response.getExpiresInSeconds());
      String refreshToken = response.getRefreshToken() != null ? response.getRefreshToken()
          : tokenStore.getRefreshToken();
      tokenStore.update(response.getAccessToken(), response.getInstanceUrl(), expiresAt,
          refreshToken);
      LOG.info("Authenticated against {} (expires at {})", response.getInstanceUrl(),
          expiresAt == null ? "unknown" : expiresAt);
      return tokenStore.snapshot();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public TokenStore ensureValid() throws AuthenticationException {
    lock.lock();
    try {
      if (tokenStore.isValid(clock.instant())) {
        return tokenStore.snapshot();
      }
      if (tokenStore.hasToken()) {
        LOG.debug("Access token expired at {}, re-authenticating", tokenStore.getExpiresAt());
      }
      return authenticate();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Map<String, String> headers() throws AuthenticationException {
    TokenStore token = ensureValid();
    return ImmutableMap.of(
        "Authorization", "Bearer " + token.getAccessToken(),
        "Accept", "application/json");
  }

  @Override
  public String instanceUrl() throws AuthenticationException {
    return ensureValid().getInstanceUrl();
  }

  @Override
  public void close() {
    endpoint.close();
  }

  @VisibleForTesting
  TokenStore currentToken() {
    return tokenStore.snapshot();
  }

  private Instant expiresAt(Long expiresInSeconds) {
    Instant now = clock.instant();
    if (expiresInSeconds != null) {
      Duration lifetime = Duration.ofSeconds(expiresInSeconds);
      Duration skew = lifetime.dividedBy(2).compareTo(EXPIRY_SKEW) < 0
          ? lifetime.dividedBy(2) : EXPIRY_SKEW;
      return now.plus(lifetime).minus(skew);
    }
    Duration timeout = config.getTokenTimeout();
    return timeout == null ? null : now.plus(timeout);
  }
}
