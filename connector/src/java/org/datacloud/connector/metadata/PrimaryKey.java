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

import java.util.Objects;

import com.google.common.base.MoreObjects;

public final class PrimaryKey {

  private final String name;
  private final String displayName;
  private final Integer indexOrder;

  public PrimaryKey(String name, String displayName, Integer indexOrder) {
    this.name = Objects.requireNonNull(name, "primary key name");
    this.displayName = displayName;
    this.indexOrder = indexOrder;
  }

  public String getName() {
    return name;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * @return position of the field within a composite key, one based, or null
   */
  public Integer getIndexOrder() {
    return indexOrder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PrimaryKey)) {
      return false;
    }
    PrimaryKey that = (PrimaryKey) o;
    return name.equals(that.name) && Objects.equals(displayName, that.displayName)
        && Objects.equals(indexOrder, that.indexOrder);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, displayName, indexOrder);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues()
        .add("name", name)
        .add("displayName", displayName)
        .add("indexOrder", indexOrder)
        .toString();
  }
}
