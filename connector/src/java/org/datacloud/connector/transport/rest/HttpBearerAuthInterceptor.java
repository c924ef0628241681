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

package org.datacloud.connector.transport.rest;

import java.util.Map;

import org.apache.http.HttpHeaders;
import org.apache.http.HttpRequest;
import org.apache.http.protocol.HttpContext;

/**
 * Adds the bearer token the caller put in the request context under
 * {@link #ACCESS_TOKEN_ATTR}.
 */
public class HttpBearerAuthInterceptor extends HttpRequestInterceptorBase {

  public static final String ACCESS_TOKEN_ATTR = "datacloud.accessToken";

  public HttpBearerAuthInterceptor(Map<String, String> additionalHeaders) {
    super(additionalHeaders);
  }

  @Override
  protected void addHttpAuthHeader(HttpRequest httpRequest, HttpContext httpContext)
    throws Exception {
    Object token = httpContext.getAttribute(ACCESS_TOKEN_ATTR);
    if (token == null) {
      throw new IllegalStateException("No access token in the request context");
    }
    httpRequest.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    httpRequest.setHeader(HttpHeaders.ACCEPT, "application/json");
  }
}
