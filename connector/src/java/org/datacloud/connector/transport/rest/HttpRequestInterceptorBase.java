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

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.apache.http.HttpException;
import org.apache.http.HttpRequest;
import org.apache.http.HttpRequestInterceptor;
import org.apache.http.protocol.HttpContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class HttpRequestInterceptorBase implements HttpRequestInterceptor {
  protected final Logger LOG = LoggerFactory.getLogger(getClass());

  Map<String, String> additionalHeaders;

  // Abstract function to add HttpAuth Header
  protected abstract void addHttpAuthHeader(HttpRequest httpRequest, HttpContext httpContext)
    throws Exception;

  public HttpRequestInterceptorBase(Map<String, String> additionalHeaders) {
    this.additionalHeaders = additionalHeaders == null ? new HashMap<>() : additionalHeaders;
  }

  @Override
  public void process(HttpRequest httpRequest, HttpContext httpContext)
    throws HttpException, IOException {
    try {
      addHttpAuthHeader(httpRequest, httpContext);
      // Insert the additional http headers
      for (Map.Entry<String, String> entry : additionalHeaders.entrySet()) {
        httpRequest.addHeader(entry.getKey(), entry.getValue());
      }
      if (LOG.isTraceEnabled()) {
        LOG.trace("Sending {}", httpRequest.getRequestLine());
      }
    } catch (Exception e) {
      throw new HttpException(e.getMessage(), e);
    }
  }
}
