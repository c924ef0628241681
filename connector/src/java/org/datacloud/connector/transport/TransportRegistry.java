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
import java.util.Map;
import java.util.Set;

import org.datacloud.connector.ConnectorConfig;
import org.datacloud.connector.auth.AuthStrategy;
import org.datacloud.connector.transport.grpc.GrpcTransportClient;
import org.datacloud.connector.transport.rest.RestTransportClient;

import com.google.common.collect.ImmutableMap;

/**
 * Compiled-in table of transports by name.
 */
public final class TransportRegistry {

  public static final String DEFAULT_TRANSPORT = "rest";

  /**
   * Constructor of a transport.
   */
  @FunctionalInterface
  public interface TransportFactory {
    TransportClient create(AuthStrategy auth, ConnectorConfig config) throws SQLException;
  }

  private static final TransportRegistry DEFAULT = new TransportRegistry(
      ImmutableMap.<String, TransportFactory>of(
          "rest", RestTransportClient::new,
          "grpc", GrpcTransportClient::new));

  private final ImmutableMap<String, TransportFactory> factories;

  private TransportRegistry(ImmutableMap<String, TransportFactory> factories) {
    this.factories = factories;
  }

  public static TransportRegistry defaultRegistry() {
    return DEFAULT;
  }

  /**
   * @return a registry with {@code name} added, or replaced if already present
   */
  public TransportRegistry with(String name, TransportFactory factory) {
    ImmutableMap.Builder<String, TransportFactory> builder = ImmutableMap.builder();
    for (Map.Entry<String, TransportFactory> entry : factories.entrySet()) {
      if (!entry.getKey().equals(name)) {
        builder.put(entry);
      }
    }
    builder.put(name, factory);
    return new TransportRegistry(builder.build());
  }

  public Set<String> names() {
    return factories.keySet();
  }

  public TransportClient create(String name, AuthStrategy auth, ConnectorConfig config)
      throws SQLException {
    TransportFactory factory = factories.get(name);
    if (factory == null) {
      throw new SQLException("Unknown transport '" + name + "', available transports: "
          + factories.keySet(), "08001");
    }
    return factory.create(auth, config);
  }
}
