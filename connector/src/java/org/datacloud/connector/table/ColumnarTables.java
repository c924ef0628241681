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

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.datacloud.connector.QueryCursor;
import org.datacloud.connector.transport.ColumnMetadata;
import org.datacloud.connector.transport.Row;

import com.google.common.base.Preconditions;

public final class ColumnarTables {

  static final String POSITIONAL_PREFIX = "col";

  private ColumnarTables() {
  }

  /**
   * Drain the cursor and pivot the remaining rows into columns.
   */
  public static ColumnarTable fromCursor(QueryCursor cursor) throws SQLException {
    List<Row> rows = cursor.fetchAll();
    return of(cursor.getDescription(), rows);
  }

  /**
   * Pivot {@code rows} into columns. When the server disclosed no columns the
   * columns are named by position, {@code col0} to {@code colN}, typed as text.
   */
  public static ColumnarTable of(List<ColumnMetadata> columns, List<Row> rows) {
    if (columns.isEmpty() && !rows.isEmpty()) {
      columns = positionalColumns(rows.get(0).size());
    }
    List<List<Object>> data = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      data.add(new ArrayList<>(rows.size()));
    }
    for (Row row : rows) {
      Preconditions.checkArgument(row.size() == columns.size(),
          "row %s does not match %s columns", row, columns.size());
      for (int i = 0; i < columns.size(); i++) {
        data.get(i).add(row.get(i));
      }
    }
    List<List<Object>> frozen = new ArrayList<>(data.size());
    for (List<Object> column : data) {
      frozen.add(Collections.unmodifiableList(column));
    }
    return new ColumnarTable(new ArrayList<>(columns), Collections.unmodifiableList(frozen),
        rows.size());
  }

  private static List<ColumnMetadata> positionalColumns(int count) {
    List<ColumnMetadata> columns = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      columns.add(new ColumnMetadata(POSITIONAL_PREFIX + i, null));
    }
    return columns;
  }
}
