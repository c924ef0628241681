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

/**
 * OAuth username/password grant. There is no refresh token in this flow, so
 * an expired token is replaced by running the same grant again.
 */
public class PasswordGrantAuthStrategy extends AbstractOAuthStrategy {

  public PasswordGrantAuthStrategy(ConnectorConfig config, CloseableHttpClient httpClient) {
    this(config, httpClient, Clock.systemUTC());
  }

  public PasswordGrantAuthStrategy(ConnectorConfig config, CloseableHttpClient httpClient,
      Clock clock) {
    super(config, httpClient, clock);
  }

  @Override
  protected TokenResponse requestToken() throws AuthenticationException {
    List<NameValuePair> form = new ArrayList<>();
    form.add(new BasicNameValuePair("grant_type", "password"));
    form.add(new BasicNameValuePair("client_id", config.getClientId()));
    form.add(new BasicNameValuePair("client_secret", config.getClientSecret()));
    form.add(new BasicNameValuePair("username", config.getUser()));
    form.add(new BasicNameValuePair("password", config.getPassword()));
    return endpoint.post(tokenUrl(), form, config.getLoginUrl());
  }
}
