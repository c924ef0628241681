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

import org.datacloud.connector.transport.ColumnType;

import com.google.common.base.MoreObjects;

/**
 * A field of a data model or data lake object.
 */
public final class FieldMetadata {

  private final String name;
  private final String displayName;
  private final String typeName;
  private final boolean measure;
  private final boolean dimension;

  public FieldMetadata(String name, String displayName, String typeName, boolean measure,
      boolean dimension) {
    this.name = Objects.requireNonNull(name, "field name");
    this.displayName = displayName;
    this.typeName = typeName;
    this.measure = measure;
    this.dimension = dimension;
  }

  public String getName() {
    return name;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getTypeName() {
    return typeName;
  }

  public ColumnType getType() {
    return ColumnType.fromTypeName(typeName);
  }

  public boolean isMeasure() {
    return measure;
  }

  public boolean isDimension() {
    return dimension;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldMetadata)) {
      return false;
    }
    FieldMetadata that = (FieldMetadata) o;
    return measure == that.measure && dimension == that.dimension && name.equals(that.name)
        && Objects.equals(displayName, that.displayName)
        && Objects.equals(typeName, that.typeName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, displayName, typeName, measure, dimension);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues()
        .add("name", name)
        .add("displayName", displayName)
        .add("type", typeName)
        .add("measure", measure)
        .add("dimension", dimension)
        .toString();
  }
}
