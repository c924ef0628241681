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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.Instant;

import org.junit.Test;

public class TestTokenStore {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  public void testEmptyStore() {
    TokenStore store = new TokenStore();
    assertFalse(store.hasToken());
    assertFalse(store.isValid(NOW));
    assertNull(store.getAccessToken());
    assertNull(store.getInstanceUrl());
  }

  @Test
  public void testValidity() {
    TokenStore store = new TokenStore();
    store.update("tok", "https://na1.example.com", NOW.plusSeconds(60), "rt");
    assertTrue(store.isValid(NOW));
    assertTrue(store.isValid(NOW.plusSeconds(59)));
    assertFalse(store.isValid(NOW.plusSeconds(60)));
    assertEquals("rt", store.getRefreshToken());
  }

  @Test
  public void testUnknownExpiryStaysValid() {
    TokenStore store = new TokenStore();
    store.update("tok", "https://na1.example.com", null, null);
    assertTrue(store.isValid(NOW.plusSeconds(365L * 24 * 3600)));
  }

  @Test
  public void testSnapshotIsIndependent() {
    TokenStore store = new TokenStore();
    store.update("tok1", "https://na1.example.com", null, null);
    TokenStore snapshot = store.snapshot();
    store.update("tok2", "https://na2.example.com", null, null);
    assertEquals("tok1", snapshot.getAccessToken());
    assertEquals("https://na1.example.com", snapshot.getInstanceUrl());
    store.clear();
    assertFalse(store.hasToken());
    assertTrue(snapshot.hasToken());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTokenRequiresInstanceUrl() {
    new TokenStore().update("tok", "", null, null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyTokenRejected() {
    new TokenStore().update("", "https://na1.example.com", null, null);
  }

  @Test
  public void testToStringHidesTokens() {
    TokenStore store = new TokenStore();
    store.update("secret-token", "https://na1.example.com", null, "secret-refresh");
    assertFalse(store.toString().contains("secret"));
  }
}
