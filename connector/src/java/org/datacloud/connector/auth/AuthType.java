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

import java.util.Locale;

import org.datacloud.connector.ConnectionParams;

/**
 * The closed set of credential strategies, selected by the {@code authType} option.
 */
public enum AuthType {
  PASSWORD(ConnectionParams.AUTH_TYPE_PASSWORD),
  REFRESH_TOKEN(ConnectionParams.AUTH_TYPE_REFRESH_TOKEN),
  JWT(ConnectionParams.AUTH_TYPE_JWT);

  private final String configName;

  AuthType(String configName) {
    this.configName = configName;
  }

  public String getConfigName() {
    return configName;
  }

  /**
   * @return the auth type for a configured name, or null if the name is unknown
   */
  public static AuthType fromConfigName(String name) {
    if (name == null) {
      return null;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    if (ConnectionParams.AUTH_TYPE_CLIENT_CREDENTIALS.equals(normalized)) {
      return REFRESH_TOKEN;
    }
    for (AuthType type : values()) {
      if (type.configName.equals(normalized)) {
        return type;
      }
    }
    return null;
  }
}
