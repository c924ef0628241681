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

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optional bind parameters of a query, either positional or named.
 */
public final class QueryParameters {

  private static final QueryParameters NONE = new QueryParameters(null, null);

  private final List<Object> positional;
  private final Map<String, Object> named;

  private QueryParameters(List<Object> positional, Map<String, Object> named) {
    this.positional = positional;
    this.named = named;
  }

  public static QueryParameters none() {
    return NONE;
  }

  public static QueryParameters positional(List<?> values) {
    if (values == null || values.isEmpty()) {
      return NONE;
    }
    return new QueryParameters(Collections.unmodifiableList(new ArrayList<>(values)), null);
  }

  public static QueryParameters named(Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      return NONE;
    }
    return new QueryParameters(null, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
  }

  public boolean isEmpty() {
    return positional == null && named == null;
  }

  public boolean isNamed() {
    return named != null;
  }

  public List<Object> getPositional() {
    return positional == null ? Collections.emptyList() : positional;
  }

  public Map<String, Object> getNamed() {
    return named == null ? Collections.emptyMap() : named;
  }

  /**
   * @return the parameters as a JSON-ready list or map, or null when there are none.
   *         Dates and times become their ISO-8601 text.
   */
  public Object toJsonValue() {
    if (named != null) {
      Map<String, Object> json = new LinkedHashMap<>();
      named.forEach((name, value) -> json.put(name, toJsonScalar(value)));
      return json;
    }
    if (positional != null) {
      List<Object> json = new ArrayList<>(positional.size());
      for (Object value : positional) {
        json.add(toJsonScalar(value));
      }
      return json;
    }
    return null;
  }

  private static Object toJsonScalar(Object value) {
    return value instanceof TemporalAccessor ? value.toString() : value;
  }
}
