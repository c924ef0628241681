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

package org.datacloud.connector;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.commons.lang3.StringUtils;
import org.datacloud.connector.auth.AuthStrategy;
import org.datacloud.connector.metadata.TableFilter;
import org.datacloud.connector.metadata.TableMetadata;
import org.datacloud.connector.transport.TransportClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * A connection owns one {@link AuthStrategy} and one {@link TransportClient}.
 * All cursors it creates share them; their transport calls are serialized.
 */
public class DataCloudConnection implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(DataCloudConnection.class);

  private final ConnectorConfig config;
  private final AuthStrategy auth;
  private final TransportClient transport;
  private final TransportClient client;
  private volatile boolean isClosed = false;

  public DataCloudConnection(ConnectorConfig config, AuthStrategy auth,
      TransportClient transport) {
    this.config = config;
    this.auth = auth;
    this.transport = transport;
    this.client = newSynchronizedClient(transport);
  }

  /**
   * @return a new cursor sharing this connection's transport
   * @throws ConnectionClosedException if the connection is closed
   */
  public QueryCursor cursor() throws ConnectionClosedException {
    if (isClosed) {
      throw new ConnectionClosedException("Can't create cursor after connection has been closed");
    }
    return new QueryCursor(this, client, config.getPollPolicy(), config.getPageSize());
  }

  /**
   * @return the tables matching the given name, category and type; null or
   *         blank criteria match every table
   */
  public List<TableMetadata> listTables(String tableName, String category, String type)
      throws SQLException {
    return listTables(TableFilter.of(tableName, category, type));
  }

  public List<TableMetadata> listTables(TableFilter filter) throws SQLException {
    if (isClosed) {
      throw new ConnectionClosedException("Can't list tables after connection has been closed");
    }
    return client.getTableMetadata(filter);
  }

  /**
   * @return the display names of all tables, in server order
   */
  public List<String> getTableNames() throws SQLException {
    List<String> names = new ArrayList<>();
    for (TableMetadata table : listTables(TableFilter.all())) {
      if (table.getDisplayName() != null) {
        names.add(table.getDisplayName());
      }
    }
    return names;
  }

  /**
   * @return the table named {@code tableName}, or null if there is none
   */
  public TableMetadata describeTable(String tableName) throws SQLException {
    Preconditions.checkArgument(StringUtils.isNotBlank(tableName), "table name is required");
    List<TableMetadata> tables = listTables(TableFilter.byName(tableName));
    return tables.isEmpty() ? null : tables.get(0);
  }

  /**
   * Close the transport, then release the authentication client. Cursors of
   * this connection reject every further operation. Calling it again has no
   * effect.
   */
  @Override
  public void close() {
    if (isClosed) {
      return;
    }
    isClosed = true;
    try {
      transport.close();
    } finally {
      auth.close();
      LOG.debug("Closed connection to {}", config.getLoginUrl());
    }
  }

  public boolean isClosed() {
    return isClosed;
  }

  public ConnectorConfig getConfig() {
    return config;
  }

  @VisibleForTesting
  AuthStrategy getAuthStrategy() {
    return auth;
  }

  /**
   * Wrap a transport so that only one call runs on it at a time, in arrival order.
   */
  public static TransportClient newSynchronizedClient(TransportClient client) {
    return (TransportClient) Proxy.newProxyInstance(
        DataCloudConnection.class.getClassLoader(),
        new Class [] { TransportClient.class },
        new SynchronizedHandler(client));
  }

  private static class SynchronizedHandler implements InvocationHandler {
    private final TransportClient client;
    private final ReentrantLock lock = new ReentrantLock(true);

    SynchronizedHandler(TransportClient client) {
      this.client = client;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object [] args)
        throws Throwable {
      lock.lock();
      try {
        return method.invoke(client, args);
      } catch (InvocationTargetException e) {
        // rethrow what the transport threw, all TransportClient methods declare SQLException
        throw e.getTargetException();
      } finally {
        lock.unlock();
      }
    }
  }
}
