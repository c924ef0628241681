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
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpStatus;
import org.apache.http.NameValuePair;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.util.EntityUtils;
import org.datacloud.connector.AuthenticationException;
import org.datacloud.connector.ConnectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Form-encoded POSTs against OAuth token endpoints.
 */
final class TokenEndpointClient {

  private static final Logger LOG = LoggerFactory.getLogger(TokenEndpointClient.class);

  static final String TOKEN_PATH = "/services/oauth2/token";
  static final String REVOKE_PATH = "/services/oauth2/revoke";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final CloseableHttpClient httpClient;

  TokenEndpointClient(CloseableHttpClient httpClient) {
    this.httpClient = httpClient;
  }

  /**
   * POST the form to {@code url} and parse the token reply.
   *
   * @param defaultInstanceUrl instance url to use when the reply carries none
   */
  TokenResponse post(String url, List<NameValuePair> form, String defaultInstanceUrl)
      throws AuthenticationException {
    HttpPost post = new HttpPost(url);
    post.setHeader("Accept", "application/json");
    post.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));
    LOG.debug("Requesting token from {}", url);
    try (CloseableHttpResponse response = httpClient.execute(post)) {
      int status = response.getStatusLine().getStatusCode();
      String body = response.getEntity() == null ? ""
          : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
      JsonNode json = parse(body);
      if (status != HttpStatus.SC_OK) {
        throw new AuthenticationException("Authentication failed (HTTP " + status + "): "
            + describeError(json, body));
      }
      if (json == null || StringUtils.isBlank(json.path("access_token").asText(null))) {
        throw new AuthenticationException("Token endpoint " + url + " returned no access_token");
      }
      String instanceUrl = json.path("instance_url").asText(null);
      instanceUrl = StringUtils.isBlank(instanceUrl) ? defaultInstanceUrl
          : ConnectorConfig.normalizeUrl(instanceUrl);
      JsonNode expiresIn = json.get("expires_in");
      Long expiresInSeconds = null;
      if (expiresIn != null && !expiresIn.isNull()) {
        expiresInSeconds = expiresIn.isNumber() ? expiresIn.asLong()
            : parseLong(expiresIn.asText());
      }
      return new TokenResponse(json.get("access_token").asText(), instanceUrl, expiresInSeconds,
          StringUtils.trimToNull(json.path("refresh_token").asText(null)));
    } catch (IOException e) {
      throw new AuthenticationException("Could not reach token endpoint " + url + ": "
          + e.getMessage(), e);
    }
  }

  /**
   * Revoke a token at the login endpoint.
   *
   * @throws IOException if the endpoint cannot be reached or refuses the revocation
   */
  void revoke(String loginUrl, String token) throws IOException {
    HttpPost post = new HttpPost(loginUrl + REVOKE_PATH);
    post.setEntity(new UrlEncodedFormEntity(
        Collections.singletonList(new BasicNameValuePair("token", token)),
        StandardCharsets.UTF_8));
    try (CloseableHttpResponse response = httpClient.execute(post)) {
      int status = response.getStatusLine().getStatusCode();
      EntityUtils.consumeQuietly(response.getEntity());
      if (status != HttpStatus.SC_OK) {
        throw new IOException("Token revocation returned HTTP " + status);
      }
    }
  }

  void close() {
    try {
      httpClient.close();
    } catch (IOException e) {
      LOG.warn("Error closing token endpoint client", e);
    }
  }

  private static JsonNode parse(String body) {
    if (StringUtils.isBlank(body)) {
      return null;
    }
    try {
      return MAPPER.readTree(body);
    } catch (IOException e) {
      LOG.debug("Token endpoint reply is not JSON", e);
      return null;
    }
  }

  private static String describeError(JsonNode json, String body) {
    if (json != null && json.has("error")) {
      String error = json.path("error").asText();
      String description = json.path("error_description").asText(null);
      return description == null ? error : error + " - " + description;
    }
    return StringUtils.abbreviate(StringUtils.defaultIfBlank(body, "no details"), 200);
  }

  private static Long parseLong(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      LOG.warn("Ignoring non numeric expires_in '{}'", value);
      return null;
    }
  }
}
