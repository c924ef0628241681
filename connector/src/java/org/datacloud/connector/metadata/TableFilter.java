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

package org.datacloud.connector.metadata;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.MoreObjects;

/**
 * Narrows a table metadata request by table name, category ({@code Profile},
 * {@code Engagement}, {@code Related}) and type ({@code dll}, {@code dlm},
 * {@code dlo}). Blank criteria match everything.
 */
public final class TableFilter {

  public static final String ENTITY_NAME = "entityName";
  public static final String ENTITY_CATEGORY = "entityCategory";
  public static final String ENTITY_TYPE = "entityType";

  private static final TableFilter ALL = new TableFilter(null, null, null);

  private final String name;
  private final String category;
  private final String type;

  private TableFilter(String name, String category, String type) {
    this.name = StringUtils.trimToNull(name);
    this.category = StringUtils.trimToNull(category);
    this.type = StringUtils.trimToNull(type);
  }

  public static TableFilter all() {
    return ALL;
  }

  public static TableFilter of(String name, String category, String type) {
    return new TableFilter(name, category, type);
  }

  public static TableFilter byName(String name) {
    return new TableFilter(name, null, null);
  }

  public String getName() {
    return name;
  }

  public String getCategory() {
    return category;
  }

  public String getType() {
    return type;
  }

  /**
   * @return the request parameters for the criteria that are set
   */
  public Map<String, String> toRequestParameters() {
    Map<String, String> params = new LinkedHashMap<>();
    if (name != null) {
      params.put(ENTITY_NAME, name);
    }
    if (category != null) {
      params.put(ENTITY_CATEGORY, category);
    }
    if (type != null) {
      params.put(ENTITY_TYPE, type);
    }
    return params;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TableFilter)) {
      return false;
    }
    TableFilter that = (TableFilter) o;
    return Objects.equals(name, that.name) && Objects.equals(category, that.category)
        && Objects.equals(type, that.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, category, type);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues()
        .add("name", name)
        .add("category", category)
        .add("type", type)
        .toString();
  }
}
