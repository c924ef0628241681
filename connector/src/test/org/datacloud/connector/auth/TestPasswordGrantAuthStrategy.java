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

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;
import org.datacloud.connector.AuthenticationException;
import org.datacloud.connector.ConnectionParams;
import org.datacloud.connector.ConnectorConfig;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import com.github.tomakehurst.wiremock.junit.WireMockRule;
import com.github.tomakehurst.wiremock.verification.LoggedRequest;

public class TestPasswordGrantAuthStrategy {

  private static final String TOKEN_PATH = TokenEndpointClient.TOKEN_PATH;

  @Rule
  public WireMockRule wireMock = new WireMockRule(wireMockConfig().dynamicPort());

  private final AtomicReference<Instant> now =
      new AtomicReference<>(Instant.parse("2024-05-01T10:00:00Z"));
  private Clock clock;
  private PasswordGrantAuthStrategy strategy;

  @Before
  public void setUp() {
    clock = mock(Clock.class);
    when(clock.instant()).thenAnswer(invocation -> now.get());
  }

  @After
  public void tearDown() {
    if (strategy != null) {
      strategy.close();
    }
  }

  private PasswordGrantAuthStrategy newStrategy(Map<String, String> overrides) throws Exception {
    Map<String, String> props = new HashMap<>();
    props.put(ConnectionParams.LOGIN_URL, wireMock.baseUrl());
    props.put(ConnectionParams.AUTH_USER, "alice@example.com");
    props.put(ConnectionParams.AUTH_PASSWD, "pw");
    props.put(ConnectionParams.CLIENT_ID, "cid");
    props.put(ConnectionParams.CLIENT_SECRET, "csecret");
    props.putAll(overrides);
    ConnectorConfig config = ConnectorConfig.fromMap(props);
    strategy = new PasswordGrantAuthStrategy(config, AuthStrategyFactory.createHttpClient(config),
        clock);
    return strategy;
  }

  private PasswordGrantAuthStrategy newStrategy() throws Exception {
    return newStrategy(new HashMap<>());
  }

  private void stubToken(String accessToken, Object expiresIn) {
    String expiry = expiresIn == null ? "" : ", \"expires_in\": " + expiresIn;
    wireMock.stubFor(post(urlEqualTo(TOKEN_PATH)).willReturn(okJson(
        "{\"access_token\": \"" + accessToken + "\", \"instance_url\": \"" + wireMock.baseUrl()
            + "/\", \"token_type\": \"Bearer\"" + expiry + "}")));
  }

  static Map<String, String> formOf(LoggedRequest request) {
    Map<String, String> form = new HashMap<>();
    List<NameValuePair> pairs =
        URLEncodedUtils.parse(request.getBodyAsString(), StandardCharsets.UTF_8);
    for (NameValuePair pair : pairs) {
      form.put(pair.getName(), pair.getValue());
    }
    return form;
  }

  @Test
  public void testValidCredentials() throws Exception {
    stubToken("tok1", 3600);
    PasswordGrantAuthStrategy auth = newStrategy();

    TokenStore token = auth.authenticate();
    assertEquals("tok1", token.getAccessToken());
    assertEquals(wireMock.baseUrl(), token.getInstanceUrl());
    assertEquals(wireMock.baseUrl(), auth.instanceUrl());
    assertEquals("Bearer tok1", auth.headers().get("Authorization"));

    List<LoggedRequest> requests = wireMock.findAll(postRequestedFor(urlEqualTo(TOKEN_PATH)));
    assertEquals(1, requests.size());
    Map<String, String> form = formOf(requests.get(0));
    assertEquals("password", form.get("grant_type"));
    assertEquals("cid", form.get("client_id"));
    assertEquals("csecret", form.get("client_secret"));
    assertEquals("alice@example.com", form.get("username"));
    assertEquals("pw", form.get("password"));
  }

  @Test
  public void testInvalidCredentialsKeepPreviousToken() throws Exception {
    stubToken("tok1", 3600);
    PasswordGrantAuthStrategy auth = newStrategy();
    auth.authenticate();

    wireMock.stubFor(post(urlEqualTo(TOKEN_PATH)).willReturn(aResponse().withStatus(400)
        .withHeader("Content-Type", "application/json")
        .withBody("{\"error\": \"invalid_grant\", \"error_description\": \"authentication failure\"}")));
    try {
      auth.authenticate();
      fail("Expected AuthenticationException");
    } catch (AuthenticationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("invalid_grant - authentication failure"));
      assertEquals("28000", e.getSQLState());
    }
    assertEquals("tok1", auth.currentToken().getAccessToken());
  }

  @Test
  public void testEnsureValidReusesToken() throws Exception {
    stubToken("tok1", 3600);
    PasswordGrantAuthStrategy auth = newStrategy();
    assertEquals("tok1", auth.ensureValid().getAccessToken());
    assertEquals("tok1", auth.ensureValid().getAccessToken());
    wireMock.verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH)));
  }

  @Test
  public void testExpiredTokenIsRenewed() throws Exception {
    stubToken("tok1", 120);
    PasswordGrantAuthStrategy auth = newStrategy();
    TokenStore first = auth.ensureValid();
    // 120s lifetime minus 30s skew
    assertEquals(now.get().plusSeconds(90), first.getExpiresAt());

    now.set(now.get().plusSeconds(89));
    assertEquals("tok1", auth.ensureValid().getAccessToken());

    stubToken("tok2", 120);
    now.set(now.get().plusSeconds(2));
    assertEquals("tok2", auth.ensureValid().getAccessToken());
    wireMock.verify(2, postRequestedFor(urlEqualTo(TOKEN_PATH)));
  }

  @Test
  public void testShortLifetimeUsesHalfAsSkew() throws Exception {
    stubToken("tok1", "\"40\"");
    PasswordGrantAuthStrategy auth = newStrategy();
    assertEquals(now.get().plusSeconds(20), auth.authenticate().getExpiresAt());
  }

  @Test
  public void testConfiguredTokenTimeout() throws Exception {
    stubToken("tok1", null);
    Map<String, String> overrides = new HashMap<>();
    overrides.put(ConnectionParams.TOKEN_TIMEOUT_SECONDS, "600");
    PasswordGrantAuthStrategy auth = newStrategy(overrides);
    assertEquals(now.get().plusSeconds(600), auth.authenticate().getExpiresAt());
  }

  @Test
  public void testUnknownExpiryValidUntilRejected() throws Exception {
    stubToken("tok1", null);
    PasswordGrantAuthStrategy auth = newStrategy();
    assertNull(auth.authenticate().getExpiresAt());
    now.set(now.get().plusSeconds(86400));
    auth.ensureValid();
    wireMock.verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH)));
  }

  @Test
  public void testMissingAccessToken() throws Exception {
    wireMock.stubFor(post(urlEqualTo(TOKEN_PATH))
        .withRequestBody(containing("grant_type=password"))
        .willReturn(okJson("{\"instance_url\": \"https://na1.example.com\"}")));
    try {
      newStrategy().authenticate();
      fail("Expected AuthenticationException");
    } catch (AuthenticationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("no access_token"));
    }
  }

  @Test
  public void testMissingInstanceUrlFallsBackToLoginUrl() throws Exception {
    wireMock.stubFor(post(urlEqualTo(TOKEN_PATH)).willReturn(okJson("{\"access_token\": \"tok1\"}")));
    assertEquals(wireMock.baseUrl(), newStrategy().authenticate().getInstanceUrl());
  }

  @Test
  public void testUnreachableEndpoint() throws Exception {
    int unusedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      unusedPort = socket.getLocalPort();
    }
    Map<String, String> overrides = new HashMap<>();
    overrides.put(ConnectionParams.LOGIN_URL, "http://localhost:" + unusedPort);
    PasswordGrantAuthStrategy auth = newStrategy(overrides);
    try {
      auth.authenticate();
      fail("Expected AuthenticationException");
    } catch (AuthenticationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("Could not reach"));
    }
  }
}
