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

package org.datacloud.connector.transport;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.datacloud.connector.AuthenticationException;
import org.datacloud.connector.ConnectionClosedException;
import org.datacloud.connector.auth.AuthStrategy;
import org.datacloud.connector.auth.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the transports. Every remote call goes through
 * {@link #invoke(String, AuthorizedCall)}, which supplies a valid token and, when
 * the service rejects it, forces one re-authentication and repeats the call once.
 */
public abstract class AbstractTransportClient implements TransportClient {

  private static final Logger LOG = LoggerFactory.getLogger(AbstractTransportClient.class);

  /**
   * A remote call made with a given token.
   */
  @FunctionalInterface
  protected interface AuthorizedCall<T> {
    T execute(TokenStore token) throws SQLException, AuthExpiredException;
  }

  protected final AuthStrategy auth;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  protected AbstractTransportClient(AuthStrategy auth) {
    this.auth = auth;
  }

  protected final <T> T invoke(String operation, AuthorizedCall<T> call) throws SQLException {
    checkOpen(operation);
    TokenStore token = auth.ensureValid();
    try {
      return call.execute(token);
    } catch (AuthExpiredException e) {
      LOG.info("{} was rejected as unauthenticated ({}), re-authenticating", operation,
          e.getMessage());
    }
    checkOpen(operation);
    token = auth.authenticate();
    try {
      return call.execute(token);
    } catch (AuthExpiredException e) {
      throw new AuthenticationException(operation
          + " was rejected as unauthenticated right after re-authentication: " + e.getMessage());
    }
  }

  protected final void checkOpen(String operation) throws ConnectionClosedException {
    if (closed.get()) {
      throw new ConnectionClosedException("Can't " + operation + " after transport has been closed");
    }
  }

  public final boolean isClosed() {
    return closed.get();
  }

  @Override
  public final void close() {
    if (closed.compareAndSet(false, true)) {
      doClose();
    }
  }

  /**
   * Release transport resources. Called at most once.
   */
  protected abstract void doClose();
}
