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
import java.util.ArrayList;
import java.util.List;

import org.apache.http.NameValuePair;
import org.apache.http.message.BasicNameValuePair;
import org.datacloud.connector.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchanges a core platform token for a Data Cloud token, then revokes the
 * core token.
 */
public class TokenExchange {

  private static final Logger LOG = LoggerFactory.getLogger(TokenExchange.class);

  public static final String EXCHANGE_PATH = "/services/a360/token";
  public static final String GRANT_TYPE = "urn:salesforce:grant-type:external:cdp";
  public static final String SUBJECT_TOKEN_TYPE = "urn:ietf:params:oauth:token-type:access_token";

  private final TokenEndpointClient endpoint;
  private final String loginUrl;
  private final String dataspace;

  TokenExchange(TokenEndpointClient endpoint, String loginUrl, String dataspace) {
    this.endpoint = endpoint;
    this.loginUrl = loginUrl;
    this.dataspace = dataspace;
  }

  /**
   * @param core token issued by the login endpoint; its instance url hosts the exchange
   * @return the Data Cloud token, keeping the core refresh token
   */
  TokenResponse exchange(TokenResponse core) throws AuthenticationException {
    List<NameValuePair> form = new ArrayList<>();
    form.add(new BasicNameValuePair("grant_type", GRANT_TYPE));
    form.add(new BasicNameValuePair("subject_token_type", SUBJECT_TOKEN_TYPE));
    form.add(new BasicNameValuePair("subject_token", core.getAccessToken()));
    if (dataspace != null) {
      form.add(new BasicNameValuePair("dataspace", dataspace));
    }
    TokenResponse exchanged = endpoint.post(core.getInstanceUrl() + EXCHANGE_PATH, form,
        core.getInstanceUrl());
    LOG.debug("Exchanged core token for a Data Cloud token on {}", exchanged.getInstanceUrl());
    try {
      endpoint.revoke(loginUrl, core.getAccessToken());
    } catch (IOException e) {
      LOG.warn("Could not revoke the core token after exchange: {}", e.getMessage());
    }
    return new TokenResponse(exchanged.getAccessToken(), exchanged.getInstanceUrl(),
        exchanged.getExpiresInSeconds(),
        exchanged.getRefreshToken() != null ? exchanged.getRefreshToken() : core.getRefreshToken());
  }
}
