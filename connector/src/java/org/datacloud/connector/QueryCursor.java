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

package org.datacloud.connector;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.datacloud.connector.transport.ColumnMetadata;
import org.datacloud.connector.transport.QueryParameters;
import org.datacloud.connector.transport.QueryPhase;
import org.datacloud.connector.transport.QueryStatus;
import org.datacloud.connector.transport.ResultPage;
import org.datacloud.connector.transport.Row;
import org.datacloud.connector.transport.TransportClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.AbstractIterator;

/**
 * Runs one query at a time against the connection's transport: submit, poll
 * until the server finishes, then hand out rows fetched page by page.
 *
 * A cursor is used by one thread at a time. {@link #close()} may be called
 * from another thread; a call in flight at that moment completes but its
 * result is discarded.
 */
public class QueryCursor implements Iterable<Row>, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(QueryCursor.class);

  private final DataCloudConnection connection;
  private final TransportClient client;
  private final PollPolicy pollPolicy;
  private int arraySize;

  private CursorState state = CursorState.IDLE;
  private String queryId;
  private List<ColumnMetadata> columns = Collections.emptyList();
  private Long totalRows;
  // rows requested from the server so far
  private long nextOffset;
  // rows handed to the caller so far
  private long rowsReturned;
  private boolean lastPageFetched;
  private final Deque<Row> buffer = new ArrayDeque<>();

  private volatile boolean isClosed = false;

  QueryCursor(DataCloudConnection connection, TransportClient client, PollPolicy pollPolicy,
      int arraySize) {
    this.connection = connection;
    this.client = client;
    this.pollPolicy = pollPolicy;
    this.arraySize = arraySize;
  }

  /**
   * Submit the query and wait until the server finished it.
   */
  public void execute(String sql) throws SQLException {
    execute(sql, QueryParameters.none());
  }

  public void execute(String sql, List<?> params) throws SQLException {
    execute(sql, QueryParameters.positional(params));
  }

  public void execute(String sql, Map<String, ?> params) throws SQLException {
    execute(sql, QueryParameters.named(params));
  }

  public void execute(String sql, QueryParameters params) throws SQLException {
    executeAsync(sql, params);
    waitForCompletion();
  }

  /**
   * Submit the query and return immediately. The first fetch, or
   * {@link #waitForCompletion()}, blocks until the server finished it.
   * Any state of a previous query on this cursor is discarded.
   */
  public void executeAsync(String sql) throws SQLException {
    executeAsync(sql, QueryParameters.none());
  }

  public void executeAsync(String sql, QueryParameters params) throws SQLException {
    Objects.requireNonNull(sql, "sql");
    checkConnection("execute");
    reInitState();

    QueryStatus status;
    try {
      LOG.debug("Submitting query: {}", sql);
      status = client.submitQuery(sql, params == null ? QueryParameters.none() : params);
    } catch (SQLException e) {
      throw failed(e, "execute");
    }
    checkConnection("execute");
    queryId = status.getQueryId();
    state = CursorState.SUBMITTED;
    LOG.debug("Running with query id: {}", queryId);
    if (status.getPhase() == QueryPhase.FINISHED && status.getColumns() != null) {
      ready(status);
    } else if (status.getPhase() == QueryPhase.FAILED) {
      throw queryFailed(status);
    }
  }

  /**
   * Poll the query status until the server finished the query, backing off
   * between polls as configured. Returns immediately if the query already
   * finished.
   *
   * @throws QueryException if the server reports the query failed
   * @throws QueryTimeoutException if the poll ceiling is reached first
   */
  public void waitForCompletion() throws SQLException {
    checkConnection("wait for completion");
    switch (state) {
    case SUBMITTED:
    case POLLING:
      break;
    case IDLE:
      throw new SQLException("No query has been executed", "HY010");
    case FAILED:
      throw new SQLException("The last query on this cursor failed", "HY010");
    default:
      return;
    }
    state = CursorState.POLLING;
    LOG.debug("Waiting on query {} to complete: Polling query status", queryId);

    Stopwatch stopwatch = Stopwatch.createStarted();
    long interval = pollPolicy.getInitialInterval().toMillis();
    int attempts = 0;
    while (true) {
      if (attempts >= pollPolicy.getMaxAttempts()
          || stopwatch.elapsed().compareTo(pollPolicy.getTimeout()) >= 0) {
        state = CursorState.FAILED;
        throw new QueryTimeoutException("Query " + queryId + " did not complete after "
            + attempts + " status checks in " + stopwatch, queryId);
      }
      if (Thread.currentThread().isInterrupted()) {
        state = CursorState.FAILED;
        throw new SQLException("Interrupted while polling status of query " + queryId, "HY008");
      }
      attempts++;
      QueryStatus status = null;
      try {
        status = client.getQueryStatus(queryId);
      } catch (ApiException e) {
        if (!e.isTransient() || isClosed || connection.isClosed()) {
          throw failed(e, "wait for completion");
        }
        LOG.warn("Status check {} of query {} failed, retrying: {}", attempts, queryId,
            e.getMessage());
      } catch (SQLException e) {
        throw failed(e, "wait for completion");
      }
      checkConnection("wait for completion");
      if (status != null) {
        LOG.debug("Status response: {}", status);
        if (status.getPhase() == QueryPhase.FINISHED) {
          ready(status);
          return;
        }
        if (status.getPhase() == QueryPhase.FAILED) {
          throw queryFailed(status);
        }
      }
      sleep(interval);
      interval = pollPolicy.nextIntervalMillis(interval);
    }
  }

  /**
   * @return the next row, or null at the end of the result
   */
  public Row fetchOne() throws SQLException {
    List<Row> rows = fetch(1, "fetch");
    return rows.isEmpty() ? null : rows.get(0);
  }

  /**
   * @return up to {@link #getArraySize()} rows, empty at the end of the result
   */
  public List<Row> fetchMany() throws SQLException {
    return fetchMany(arraySize);
  }

  /**
   * @return up to {@code size} rows, empty at the end of the result
   */
  public List<Row> fetchMany(int size) throws SQLException {
    Preconditions.checkArgument(size >= 0, "fetch size must not be negative: %s", size);
    return fetch(size, "fetch");
  }

  /**
   * @return all remaining rows
   */
  public List<Row> fetchAll() throws SQLException {
    return fetch(Long.MAX_VALUE, "fetch");
  }

  private List<Row> fetch(long max, String action) throws SQLException {
    checkConnection(action);
    switch (state) {
    case IDLE:
      throw new SQLException("No query has been executed", "HY010");
    case FAILED:
      throw new SQLException("The last query on this cursor failed", "HY010");
    case SUBMITTED:
    case POLLING:
      waitForCompletion();
      break;
    case EXHAUSTED:
      return Collections.emptyList();
    default:
      break;
    }

    List<Row> rows = new ArrayList<>();
    while (rows.size() < max) {
      if (buffer.isEmpty()) {
        if (lastPageFetched) {
          break;
        }
        fetchNextPage(action);
        continue;
      }
      rows.add(buffer.poll());
      rowsReturned++;
    }
    if (buffer.isEmpty() && lastPageFetched) {
      state = CursorState.EXHAUSTED;
      LOG.debug("Query {} exhausted after {} rows", queryId, rowsReturned);
    } else if (!rows.isEmpty()) {
      state = CursorState.DRAINING;
    }
    return rows;
  }

  private void fetchNextPage(String action) throws SQLException {
    ResultPage page;
    try {
      page = client.getQueryResults(queryId, nextOffset, arraySize);
    } catch (SQLException e) {
      throw failed(e, action);
    }
    checkConnection(action);
    if (page.getTotalRows() != null) {
      totalRows = page.getTotalRows();
    }
    try {
      for (List<Object> raw : page.getRows()) {
        buffer.add(Row.of(columns, raw));
      }
    } catch (ApiException e) {
      buffer.clear();
      throw failed(e, action);
    }
    nextOffset += page.getRows().size();
    if (page.getRows().isEmpty()) {
      if (totalRows != null && nextOffset < totalRows) {
        LOG.warn("Query {} returned no rows at offset {} of {}", queryId, nextOffset, totalRows);
      }
      lastPageFetched = true;
    } else if (totalRows != null) {
      lastPageFetched = nextOffset >= totalRows;
    } else {
      lastPageFetched = page.isLast();
    }
  }

  /**
   * @return the result columns once the query finished, empty before
   */
  public List<ColumnMetadata> getDescription() throws SQLException {
    checkConnection("get description");
    switch (state) {
    case READY:
    case DRAINING:
    case EXHAUSTED:
      return columns;
    default:
      return Collections.emptyList();
    }
  }

  /**
   * @return the rows handed out so far, which is the final count once the
   *         result is exhausted, or -1 while no result is available
   */
  public long getRowCount() throws SQLException {
    checkConnection("get row count");
    switch (state) {
    case READY:
    case DRAINING:
    case EXHAUSTED:
      return rowsReturned;
    default:
      return -1;
    }
  }

  public String getQueryId() {
    return queryId;
  }

  public CursorState getState() {
    return isClosed || connection.isClosed() ? CursorState.CLOSED : state;
  }

  public int getArraySize() {
    return arraySize;
  }

  /**
   * Rows requested per page, and the default size of {@link #fetchMany()}.
   */
  public void setArraySize(int arraySize) {
    Preconditions.checkArgument(arraySize > 0, "array size must be positive: %s", arraySize);
    this.arraySize = arraySize;
  }

  public DataCloudConnection getConnection() {
    return connection;
  }

  public boolean isClosed() {
    return isClosed;
  }

  /**
   * Iterate over the remaining rows. A failing fetch surfaces as an
   * {@link IllegalStateException} wrapping the {@link SQLException}.
   */
  @Override
  public Iterator<Row> iterator() {
    return new AbstractIterator<Row>() {
      @Override
      protected Row computeNext() {
        try {
          Row row = fetchOne();
          return row == null ? endOfData() : row;
        } catch (SQLException e) {
          throw new IllegalStateException(e.getMessage(), e);
        }
      }
    };
  }

  @Override
  public void close() {
    if (isClosed) {
      return;
    }
    isClosed = true;
    state = CursorState.CLOSED;
    buffer.clear();
    LOG.debug("Closed cursor (last query id {})", queryId);
  }

  private void reInitState() {
    state = CursorState.IDLE;
    queryId = null;
    columns = Collections.emptyList();
    totalRows = null;
    nextOffset = 0;
    rowsReturned = 0;
    lastPageFetched = false;
    buffer.clear();
  }

  private void ready(QueryStatus status) {
    columns = status.getColumns() == null ? Collections.emptyList() : status.getColumns();
    totalRows = status.getTotalRows();
    state = CursorState.READY;
    LOG.debug("Query {} finished with {} columns", queryId, columns.size());
  }

  private QueryException queryFailed(QueryStatus status) {
    state = CursorState.FAILED;
    String reason = status.getErrorMessage() == null
        ? "Query " + status.getQueryId() + " failed" : status.getErrorMessage();
    return new QueryException(reason, status.getQueryId());
  }

  /**
   * Mark the cursor failed after a call failed, unless it was closed
   * meanwhile, in which case the caller sees the close instead.
   */
  private SQLException failed(SQLException e, String action) {
    if (isClosed || connection.isClosed()) {
      ConnectionClosedException closed = new ConnectionClosedException(
          "Can't " + action + " after cursor has been closed");
      closed.initCause(e);
      return closed;
    }
    state = CursorState.FAILED;
    return e;
  }

  private void sleep(long millis) throws SQLException {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      state = CursorState.FAILED;
      throw new SQLException("Interrupted while polling status of query " + queryId, "HY008", e);
    }
  }

  private void checkConnection(String action) throws ConnectionClosedException {
    if (isClosed) {
      throw new ConnectionClosedException("Can't " + action + " after cursor has been closed");
    }
    if (connection.isClosed()) {
      throw new ConnectionClosedException("Can't " + action + " after connection has been closed");
    }
  }
}
