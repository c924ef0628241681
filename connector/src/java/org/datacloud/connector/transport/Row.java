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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.datacloud.connector.ApiException;

/**
 * One result row: typed values aligned positionally with the column metadata.
 */
public final class Row {

  private final List<ColumnMetadata> columns;
  private final List<Object> values;

  private Row(List<ColumnMetadata> columns, List<Object> values) {
    this.columns = columns;
    this.values = Collections.unmodifiableList(values);
  }

  /**
   * Build a row from raw wire values, converting each to its column's type.
   *
   * @throws ApiException if the value count does not match the columns or a
   *         value cannot be converted
   */
  public static Row of(List<ColumnMetadata> columns, List<?> raw) throws ApiException {
    if (columns.isEmpty()) {
      // columns were never disclosed, keep the wire values
      return new Row(columns, new ArrayList<>(raw));
    }
    if (raw.size() != columns.size()) {
      throw new ApiException("Row has " + raw.size() + " values but the result has "
          + columns.size() + " columns");
    }
    List<Object> typed = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      ColumnMetadata column = columns.get(i);
      try {
        typed.add(column.getType().convert(raw.get(i)));
      } catch (IllegalArgumentException e) {
        throw new ApiException("Malformed value for column " + column.getName() + ": "
            + e.getMessage(), e);
      }
    }
    return new Row(columns, typed);
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    return values.get(index);
  }

  public Object get(String columnName) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getName().equalsIgnoreCase(columnName)) {
        return values.get(i);
      }
    }
    throw new IllegalArgumentException("No column named " + columnName);
  }

  public List<Object> getValues() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Row && values.equals(((Row) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
