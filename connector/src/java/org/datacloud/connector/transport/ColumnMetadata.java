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

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Name and declared type of a result column.
 */
public final class ColumnMetadata {

  private final String name;
  private final String typeName;
  private final ColumnType type;
  private final Integer precision;
  private final Integer scale;
  private final boolean nullable;

  public ColumnMetadata(String name, String typeName) {
    this(name, typeName, null, null, true);
  }

  public ColumnMetadata(String name, String typeName, Integer precision, Integer scale,
      boolean nullable) {
    this.name = Objects.requireNonNull(name, "column name");
    this.typeName = typeName == null ? "TEXT" : typeName;
    this.type = ColumnType.fromTypeName(this.typeName);
    this.precision = precision;
    this.scale = scale;
    this.nullable = nullable;
  }

  public String getName() {
    return name;
  }

  /**
   * @return the type name as declared by the server
   */
  public String getTypeName() {
    return typeName;
  }

  public ColumnType getType() {
    return type;
  }

  public Integer getPrecision() {
    return precision;
  }

  public Integer getScale() {
    return scale;
  }

  public boolean isNullable() {
    return nullable;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnMetadata)) {
      return false;
    }
    ColumnMetadata that = (ColumnMetadata) o;
    return nullable == that.nullable && name.equals(that.name) && typeName.equals(that.typeName)
        && Objects.equals(precision, that.precision) && Objects.equals(scale, that.scale);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeName, precision, scale, nullable);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues()
        .add("name", name)
        .add("type", typeName)
        .add("precision", precision)
        .add("scale", scale)
        .toString();
  }
}
