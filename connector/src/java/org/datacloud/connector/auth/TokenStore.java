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

import java.time.Instant;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Current bearer token of a connection, with the instance endpoint it is valid
 * for. Only the owning {@link AuthStrategy} mutates it; everyone else sees
 * {@link #snapshot()} copies.
 */
public final class TokenStore {

  private String accessToken;
  private String instanceUrl;
  private Instant expiresAt;
  private String refreshToken;

  public TokenStore() {
  }

  private TokenStore(TokenStore other) {
    this.accessToken = other.accessToken;
    this.instanceUrl = other.instanceUrl;
    this.expiresAt = other.expiresAt;
    this.refreshToken = other.refreshToken;
  }

  /**
   * Replace all fields at once.
   *
   * @param expiresAt expiry instant, or null when unknown (valid until rejected)
   * @param refreshToken refresh token, may be null
   */
  public synchronized void update(String accessToken, String instanceUrl, Instant expiresAt,
      String refreshToken) {
    Preconditions.checkArgument(accessToken != null && !accessToken.isEmpty(),
        "access token must not be empty");
    Preconditions.checkArgument(instanceUrl != null && !instanceUrl.isEmpty(),
        "an access token requires an instance url");
    this.accessToken = accessToken;
    this.instanceUrl = instanceUrl;
    this.expiresAt = expiresAt;
    this.refreshToken = refreshToken;
  }

  public synchronized void clear() {
    accessToken = null;
    instanceUrl = null;
    expiresAt = null;
    refreshToken = null;
  }

  public synchronized boolean hasToken() {
    return accessToken != null;
  }

  /**
   * @return true if a token is held and its known expiry, if any, is after {@code now}
   */
  public synchronized boolean isValid(Instant now) {
    return accessToken != null && (expiresAt == null || now.isBefore(expiresAt));
  }

  public synchronized TokenStore snapshot() {
    return new TokenStore(this);
  }

  public synchronized String getAccessToken() {
    return accessToken;
  }

  public synchronized String getInstanceUrl() {
    return instanceUrl;
  }

  public synchronized Instant getExpiresAt() {
    return expiresAt;
  }

  public synchronized String getRefreshToken() {
    return refreshToken;
  }

  @Override
  public synchronized String toString() {
    return MoreObjects.toStringHelper(this)
        .add("hasToken", accessToken != null)
        .add("instanceUrl", instanceUrl)
        .add("expiresAt", expiresAt)
        .add("hasRefreshToken", refreshToken != null)
        .toString();
  }
}
