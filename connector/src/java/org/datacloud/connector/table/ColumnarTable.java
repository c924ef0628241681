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

package org.datacloud.connector.table;

import java.util.Collections;
import java.util.List;

import org.datacloud.connector.transport.ColumnMetadata;

/**
 * A fully fetched result, stored column by column.
 */
public final class ColumnarTable {

  private final List<ColumnMetadata> columns;
  private final List<List<Object>> data;
  private final int rowCount;

  ColumnarTable(List<ColumnMetadata> columns, List<List<Object>> data, int rowCount) {
    this.columns = Collections.unmodifiableList(columns);
    this.data = data;
    this.rowCount = rowCount;
  }

  public List<ColumnMetadata> getColumns() {
    return columns;
  }

  public int columnCount() {
    return columns.size();
  }

  public int rowCount() {
    return rowCount;
  }

  /**
   * @return the values of column {@code index}, zero based
   */
  public List<Object> column(int index) {
    return data.get(index);
  }

  /**
   * @return the values of the column named {@code name}, matched case insensitively
   */
  public List<Object> column(String name) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getName().equalsIgnoreCase(name)) {
        return data.get(i);
      }
    }
    throw new IllegalArgumentException("No column named " + name);
  }

  public Object get(int row, int column) {
    return data.get(column).get(row);
  }
}
