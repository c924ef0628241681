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

import com.google.common.base.MoreObjects;

/**
 * One offset/limit slice of a result set, with raw wire values.
 */
public final class ResultPage {

  private final List<List<Object>> rows;
  private final long offset;
  private final boolean last;
  private final Long totalRows;

  public ResultPage(List<List<Object>> rows, long offset, boolean last, Long totalRows) {
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
    this.offset = offset;
    this.last = last;
    this.totalRows = totalRows;
  }

  public List<List<Object>> getRows() {
    return rows;
  }

  public long getOffset() {
    return offset;
  }

  public boolean isLast() {
    return last;
  }

  public Long getTotalRows() {
    return totalRows;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues()
        .add("rows", rows.size())
        .add("offset", offset)
        .add("last", last)
        .add("totalRows", totalRows)
        .toString();
  }
}
