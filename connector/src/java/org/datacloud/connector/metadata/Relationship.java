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

/**
 * A join path from a field of one table to a field of another.
 */
public final class Relationship {

  private final String fromTable;
  private final String toTable;
  private final String fromEntityAttribute;
  private final String toEntityAttribute;
  private final String cardinality;

  public Relationship(String fromTable, String toTable, String fromEntityAttribute,
      String toEntityAttribute, String cardinality) {
    this.fromTable = fromTable;
    this.toTable = toTable;
    this.fromEntityAttribute = fromEntityAttribute;
    this.toEntityAttribute = toEntityAttribute;
    this.cardinality = cardinality;
  }

  public String getFromTable() {
    return fromTable;
  }

  public String getToTable() {
    return toTable;
  }

  public String getFromEntityAttribute() {
    return fromEntityAttribute;
  }

  public String getToEntityAttribute() {
    return toEntityAttribute;
  }

  /**
   * @return the cardinality as sent by the server, e.g. {@code ONETOMANY}
   */
  public String getCardinality() {
    return cardinality;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Relationship)) {
      return false;
    }
    Relationship that = (Relationship) o;
    return Objects.equals(fromTable, that.fromTable) && Objects.equals(toTable, that.toTable)
        && Objects.equals(fromEntityAttribute, that.fromEntityAttribute)
        && Objects.equals(toEntityAttribute, that.toEntityAttribute)
        && Objects.equals(cardinality, that.cardinality);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromTable, toTable, fromEntityAttribute, toEntityAttribute, cardinality);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues()
        .add("from", fromTable + "." + fromEntityAttribute)
        .add("to", toTable + "." + toEntityAttribute)
        .add("cardinality", cardinality)
        .toString();
  }
}
