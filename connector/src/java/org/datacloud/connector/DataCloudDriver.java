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

import java.sql.SQLException;
import java.util.Properties;

import org.datacloud.connector.auth.AuthStrategy;
import org.datacloud.connector.auth.AuthStrategyFactory;
import org.datacloud.connector.transport.TransportClient;
import org.datacloud.connector.transport.TransportRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds connections: configuration, then the auth strategy, then the
 * transport picked from the registry by name. Authentication happens on the
 * first remote call, not here.
 */
public class DataCloudDriver {

  private static final Logger LOG = LoggerFactory.getLogger(DataCloudDriver.class);

  private final TransportRegistry registry;

  public DataCloudDriver() {
    this(TransportRegistry.defaultRegistry());
  }

  public DataCloudDriver(TransportRegistry registry) {
    this.registry = registry;
  }

  public boolean acceptsURL(String url) {
    return ConnectionParams.acceptsURL(url);
  }

  /**
   * @param url connection url, see {@link ConnectionParams}
   * @param info properties overriding values in the url, may be null
   */
  public DataCloudConnection connect(String url, Properties info) throws SQLException {
    return connect(ConnectorConfig.fromProperties(ConnectionParams.parseURL(url, info)));
  }

  public DataCloudConnection connect(Properties info) throws SQLException {
    return connect(ConnectorConfig.fromProperties(info));
  }

  public DataCloudConnection connect(ConnectorConfig config) throws SQLException {
    AuthStrategy auth = AuthStrategyFactory.create(config);
    try {
      TransportClient transport = registry.create(config.getTransport(), auth, config);
      LOG.info("Connecting to {} using {} transport and {} authentication",
          config.getLoginUrl(), config.getTransport(), config.getAuthType().getConfigName());
      return new DataCloudConnection(config, auth, transport);
    } catch (SQLException | RuntimeException e) {
      auth.close();
      throw e;
    }
  }
}
