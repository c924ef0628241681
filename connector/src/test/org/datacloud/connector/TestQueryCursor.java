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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.datacloud.connector.auth.AuthStrategy;
import org.datacloud.connector.transport.ColumnMetadata;
import org.datacloud.connector.transport.QueryParameters;
import org.datacloud.connector.transport.QueryPhase;
import org.datacloud.connector.transport.QueryStatus;
import org.datacloud.connector.transport.ResultPage;
import org.datacloud.connector.transport.Row;
import org.datacloud.connector.transport.TransportClient;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

public class TestQueryCursor {

  private static final List<ColumnMetadata> CONTACT_COLUMNS = Arrays.asList(
      new ColumnMetadata("Id", "TEXT"), new ColumnMetadata("Name", "TEXT"));

  private TransportClient transport;
  private AuthStrategy auth;
  private DataCloudConnection connection;

  @Before
  public void setUp() throws Exception {
    transport = mock(TransportClient.class);
    auth = mock(AuthStrategy.class);
    connection = newConnection(Collections.emptyMap());
  }

  @After
  public void tearDown() {
    connection.close();
  }

  private DataCloudConnection newConnection(Map<String, String> overrides) throws SQLException {
    Map<String, String> props = new HashMap<>();
    props.put(ConnectionParams.LOGIN_URL, "https://login.example.com");
    props.put(ConnectionParams.AUTH_USER, "alice");
    props.put(ConnectionParams.AUTH_PASSWD, "pw");
    props.put(ConnectionParams.CLIENT_ID, "cid");
    props.put(ConnectionParams.CLIENT_SECRET, "csecret");
    props.put(ConnectionParams.PAGE_SIZE, "2");
    props.put(ConnectionParams.POLL_INITIAL_INTERVAL_MS, "1");
    props.put(ConnectionParams.POLL_MAX_INTERVAL_MS, "4");
    props.put(ConnectionParams.POLL_MAX_ATTEMPTS, "50");
    props.put(ConnectionParams.POLL_TIMEOUT_MS, "10000");
    props.putAll(overrides);
    return new DataCloudConnection(ConnectorConfig.fromMap(props), auth, transport);
  }

  private static QueryStatus running(String queryId) {
    return new QueryStatus(queryId, QueryPhase.RUNNING, null, null, null);
  }

  private static QueryStatus finished(String queryId, List<ColumnMetadata> columns, Long total) {
    return new QueryStatus(queryId, QueryPhase.FINISHED, columns, total, null);
  }

  private static List<Object> row(Object... values) {
    return Arrays.asList(values);
  }

  private static ResultPage page(long offset, boolean last, Long total, List<?>... rows) {
    List<List<Object>> list = new ArrayList<>();
    for (List<?> r : rows) {
      list.add(new ArrayList<>(r));
    }
    return new ResultPage(list, offset, last, total);
  }

  private void givenContactQuery() throws SQLException {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    when(transport.getQueryStatus("q1"))
        .thenReturn(running("q1"), running("q1"), finished("q1", CONTACT_COLUMNS, 3L));
    when(transport.getQueryResults("q1", 0, 2))
        .thenReturn(page(0, false, 3L, row("001", "Ada"), row("002", "Grace")));
    when(transport.getQueryResults("q1", 2, 2))
        .thenReturn(page(2, true, 3L, row("003", "Linus")));
  }

  @Test
  public void testExecuteAndFetchAll() throws Exception {
    givenContactQuery();
    QueryCursor cursor = connection.cursor();
    assertEquals(CursorState.IDLE, cursor.getState());

    cursor.execute("SELECT Id, Name FROM Contact");
    assertEquals(CursorState.READY, cursor.getState());
    assertEquals("q1", cursor.getQueryId());
    assertEquals(CONTACT_COLUMNS, cursor.getDescription());
    // two running replies, then finished
    verify(transport, times(3)).getQueryStatus("q1");

    List<Row> rows = cursor.fetchAll();
    assertEquals(3, rows.size());
    assertEquals("Ada", rows.get(0).get("name"));
    assertEquals("003", rows.get(2).get(0));
    assertEquals(CursorState.EXHAUSTED, cursor.getState());
    assertEquals(3, cursor.getRowCount());
    assertTrue(cursor.fetchAll().isEmpty());
    assertNull(cursor.fetchOne());
    verify(transport, times(2)).getQueryResults(eq("q1"), anyLong(), anyInt());
  }

  @Test
  public void testPollCountIsRunningRepliesPlusOne() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    when(transport.getQueryStatus("q1")).thenReturn(running("q1"), running("q1"), running("q1"),
        running("q1"), running("q1"), finished("q1", CONTACT_COLUMNS, 0L));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT 1");
    verify(transport, times(6)).getQueryStatus("q1");
  }

  @Test
  public void testAttemptCeiling() throws Exception {
    Map<String, String> overrides = new HashMap<>();
    overrides.put(ConnectionParams.POLL_MAX_ATTEMPTS, "3");
    connection = newConnection(overrides);
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    when(transport.getQueryStatus("q1")).thenReturn(running("q1"));
    QueryCursor cursor = connection.cursor();
    try {
      cursor.execute("SELECT 1");
      fail("Expected QueryTimeoutException");
    } catch (QueryTimeoutException e) {
      assertEquals("HYT00", e.getSQLState());
    }
    verify(transport, times(3)).getQueryStatus("q1");
    assertEquals(CursorState.FAILED, cursor.getState());
  }

  @Test(expected = QueryTimeoutException.class)
  public void testWallClockCeiling() throws Exception {
    Map<String, String> overrides = new HashMap<>();
    overrides.put(ConnectionParams.POLL_INITIAL_INTERVAL_MS, "5");
    overrides.put(ConnectionParams.POLL_MAX_INTERVAL_MS, "5");
    overrides.put(ConnectionParams.POLL_MAX_ATTEMPTS, "100000");
    overrides.put(ConnectionParams.POLL_TIMEOUT_MS, "30");
    connection = newConnection(overrides);
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    when(transport.getQueryStatus("q1")).thenReturn(running("q1"));
    connection.cursor().execute("SELECT 1");
  }

  @Test
  public void testServerReportsFailure() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    when(transport.getQueryStatus("q1")).thenReturn(
        new QueryStatus("q1", QueryPhase.FAILED, null, null, "column Foo does not exist"));
    QueryCursor cursor = connection.cursor();
    try {
      cursor.execute("SELECT Foo FROM Contact");
      fail("Expected QueryException");
    } catch (QueryException e) {
      assertEquals("column Foo does not exist", e.getMessage());
      assertEquals("q1", e.getQueryId());
    }
    assertEquals(CursorState.FAILED, cursor.getState());
    try {
      cursor.fetchOne();
      fail("Expected SQLException");
    } catch (SQLException e) {
      assertEquals("HY010", e.getSQLState());
    }
  }

  @Test
  public void testFailedAtSubmit() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class))).thenReturn(
        new QueryStatus("q1", QueryPhase.FAILED, null, null, null));
    QueryCursor cursor = connection.cursor();
    try {
      cursor.executeAsync("SELECT 1");
      fail("Expected QueryException");
    } catch (QueryException e) {
      assertEquals("Query q1 failed", e.getMessage());
    }
    verify(transport, never()).getQueryStatus(anyString());
  }

  @Test
  public void testFinishedAtSubmitSkipsPolling() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(finished("q1", CONTACT_COLUMNS, 0L));
    when(transport.getQueryResults("q1", 0, 2)).thenReturn(page(0, true, 0L));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id, Name FROM Contact WHERE 1 = 0");
    assertEquals(CursorState.READY, cursor.getState());
    assertTrue(cursor.fetchAll().isEmpty());
    assertEquals(CursorState.EXHAUSTED, cursor.getState());
    assertEquals(0, cursor.getRowCount());
    verify(transport, never()).getQueryStatus(anyString());
  }

  @Test
  public void testPagesSumToTotal() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(finished("q1", CONTACT_COLUMNS, 5L));
    when(transport.getQueryResults("q1", 0, 2))
        .thenReturn(page(0, false, 5L, row("1", "a"), row("2", "b")));
    when(transport.getQueryResults("q1", 2, 2))
        .thenReturn(page(2, false, 5L, row("3", "c"), row("4", "d")));
    when(transport.getQueryResults("q1", 4, 2))
        .thenReturn(page(4, true, 5L, row("5", "e")));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id, Name FROM Contact");

    int total = 0;
    List<Integer> sizes = new ArrayList<>();
    List<Row> batch;
    while (!(batch = cursor.fetchMany()).isEmpty()) {
      sizes.add(batch.size());
      total += batch.size();
    }
    assertEquals(Arrays.asList(2, 2, 1), sizes);
    assertEquals(5, total);
    assertEquals(5, cursor.getRowCount());
    assertEquals(CursorState.EXHAUSTED, cursor.getState());
  }

  @Test
  public void testTotalKeepsPagingPastLastFlag() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(finished("q1", CONTACT_COLUMNS, 5L));
    // server caps each page at two rows and flags every page as last
    when(transport.getQueryResults("q1", 0, 2))
        .thenReturn(page(0, true, 5L, row("1", "a"), row("2", "b")));
    when(transport.getQueryResults("q1", 2, 2))
        .thenReturn(page(2, true, null, row("3", "c"), row("4", "d")));
    when(transport.getQueryResults("q1", 4, 2))
        .thenReturn(page(4, true, 5L, row("5", "e")));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id, Name FROM Contact");

    List<Row> rows = cursor.fetchAll();
    assertEquals(5, rows.size());
    assertEquals("5", rows.get(4).get("Id"));
    assertEquals(5, cursor.getRowCount());
    assertEquals(CursorState.EXHAUSTED, cursor.getState());
    verify(transport, times(3)).getQueryResults(eq("q1"), anyLong(), anyInt());
  }

  @Test
  public void testEmptyPageEndsResultShortOfTotal() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(finished("q1", CONTACT_COLUMNS, 4L));
    when(transport.getQueryResults("q1", 0, 2))
        .thenReturn(page(0, false, 4L, row("1", "a"), row("2", "b")));
    when(transport.getQueryResults("q1", 2, 2)).thenReturn(page(2, false, 4L));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id, Name FROM Contact");

    assertEquals(2, cursor.fetchAll().size());
    assertEquals(2, cursor.getRowCount());
    assertEquals(CursorState.EXHAUSTED, cursor.getState());
  }

  @Test
  public void testFetchOneAcrossPages() throws Exception {
    givenContactQuery();
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id, Name FROM Contact");
    assertEquals("001", cursor.fetchOne().get("Id"));
    assertEquals(CursorState.DRAINING, cursor.getState());
    assertEquals(1, cursor.getRowCount());
    assertEquals("002", cursor.fetchOne().get("Id"));
    assertEquals("003", cursor.fetchOne().get("Id"));
    assertEquals(CursorState.EXHAUSTED, cursor.getState());
    assertNull(cursor.fetchOne());
  }

  @Test
  public void testFetchWaitsForCompletion() throws Exception {
    givenContactQuery();
    QueryCursor cursor = connection.cursor();
    cursor.executeAsync("SELECT Id, Name FROM Contact");
    assertEquals(CursorState.SUBMITTED, cursor.getState());
    assertTrue(cursor.getDescription().isEmpty());
    assertEquals(-1, cursor.getRowCount());
    verify(transport, never()).getQueryStatus(anyString());

    List<Row> rows = cursor.fetchMany();
    assertEquals(2, rows.size());
    verify(transport, times(3)).getQueryStatus("q1");
    assertEquals(CONTACT_COLUMNS, cursor.getDescription());
  }

  @Test
  public void testExecuteWithParameters() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(finished("q1", CONTACT_COLUMNS, 0L));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id FROM Contact WHERE Name = ?", Arrays.asList("Ada"));
    ArgumentCaptor<QueryParameters> params = ArgumentCaptor.forClass(QueryParameters.class);
    verify(transport).submitQuery(eq("SELECT Id FROM Contact WHERE Name = ?"), params.capture());
    assertFalse(params.getValue().isNamed());
    assertEquals(Arrays.asList("Ada"), params.getValue().getPositional());

    cursor.execute("SELECT Id FROM Contact WHERE Name = :name",
        Collections.singletonMap("name", "Grace"));
    verify(transport).submitQuery(eq("SELECT Id FROM Contact WHERE Name = :name"),
        params.capture());
    assertTrue(params.getValue().isNamed());
    assertEquals("Grace", params.getValue().getNamed().get("name"));
  }

  @Test
  public void testReexecuteResetsState() throws Exception {
    givenContactQuery();
    when(transport.submitQuery(eq("SELECT 2"), any(QueryParameters.class)))
        .thenReturn(finished("q2", Collections.singletonList(new ColumnMetadata("n", "NUMBER")),
            1L));
    when(transport.getQueryResults("q2", 0, 2)).thenReturn(page(0, true, 1L, row(2)));

    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id, Name FROM Contact");
    cursor.fetchOne();
    cursor.execute("SELECT 2");
    assertEquals("q2", cursor.getQueryId());
    assertEquals(CursorState.READY, cursor.getState());
    assertEquals(0, cursor.getRowCount());
    List<Row> rows = cursor.fetchAll();
    assertEquals(1, rows.size());
    assertEquals(new BigDecimal("2"), rows.get(0).get(0));
  }

  @Test
  public void testFetchBeforeExecute() throws Exception {
    QueryCursor cursor = connection.cursor();
    try {
      cursor.fetchAll();
      fail("Expected SQLException");
    } catch (SQLException e) {
      assertEquals("HY010", e.getSQLState());
    }
    try {
      cursor.waitForCompletion();
      fail("Expected SQLException");
    } catch (SQLException e) {
      assertEquals("HY010", e.getSQLState());
    }
  }

  @Test
  public void testTransientStatusErrorIsRetried() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    when(transport.getQueryStatus("q1"))
        .thenThrow(new ApiException("HTTP 503: busy", 503))
        .thenReturn(finished("q1", CONTACT_COLUMNS, 0L));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT 1");
    assertEquals(CursorState.READY, cursor.getState());
    verify(transport, times(2)).getQueryStatus("q1");
  }

  @Test
  public void testNonTransientStatusErrorPropagates() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    ApiException badRequest = new ApiException("HTTP 400: bad request", 400);
    when(transport.getQueryStatus("q1")).thenThrow(badRequest);
    QueryCursor cursor = connection.cursor();
    try {
      cursor.execute("SELECT 1");
      fail("Expected ApiException");
    } catch (ApiException e) {
      assertSame(badRequest, e);
    }
    assertEquals(CursorState.FAILED, cursor.getState());
    verify(transport, times(1)).getQueryStatus("q1");
  }

  @Test
  public void testMalformedRowFailsCursor() throws Exception {
    List<ColumnMetadata> columns = Collections.singletonList(new ColumnMetadata("n", "BIGINT"));
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(finished("q1", columns, 1L));
    when(transport.getQueryResults("q1", 0, 2)).thenReturn(page(0, true, 1L, row("abc")));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT n FROM t");
    try {
      cursor.fetchAll();
      fail("Expected ApiException");
    } catch (ApiException e) {
      assertTrue(e.getMessage().contains("column n"));
    }
    assertEquals(CursorState.FAILED, cursor.getState());
  }

  @Test
  public void testCloseCursor() throws Exception {
    givenContactQuery();
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id, Name FROM Contact");
    cursor.close();
    cursor.close();
    assertTrue(cursor.isClosed());
    assertEquals(CursorState.CLOSED, cursor.getState());
    try {
      cursor.fetchOne();
      fail("Expected ConnectionClosedException");
    } catch (ConnectionClosedException e) {
      assertEquals("08003", e.getSQLState());
    }
    try {
      cursor.execute("SELECT 1");
      fail("Expected ConnectionClosedException");
    } catch (ConnectionClosedException e) {
      assertTrue(e.getMessage().contains("cursor has been closed"));
    }
    assertFalse(connection.isClosed());
  }

  @Test
  public void testConnectionCloseInvalidatesCursors() throws Exception {
    givenContactQuery();
    QueryCursor first = connection.cursor();
    QueryCursor second = connection.cursor();
    first.execute("SELECT Id, Name FROM Contact");
    connection.close();
    assertEquals(CursorState.CLOSED, first.getState());
    assertEquals(CursorState.CLOSED, second.getState());
    try {
      first.fetchOne();
      fail("Expected ConnectionClosedException");
    } catch (ConnectionClosedException e) {
      assertTrue(e.getMessage().contains("connection has been closed"));
    }
    verify(transport).close();
    verify(auth).close();
  }

  @Test
  public void testResultDiscardedWhenClosedDuringCall() throws Exception {
    AtomicReference<QueryCursor> ref = new AtomicReference<>();
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    when(transport.getQueryStatus("q1")).thenAnswer(invocation -> {
      ref.get().close();
      return finished("q1", CONTACT_COLUMNS, 3L);
    });
    QueryCursor cursor = connection.cursor();
    ref.set(cursor);
    try {
      cursor.execute("SELECT Id, Name FROM Contact");
      fail("Expected ConnectionClosedException");
    } catch (ConnectionClosedException e) {
      assertEquals(CursorState.CLOSED, cursor.getState());
    }
    verify(transport, never()).getQueryResults(anyString(), anyLong(), anyInt());
  }

  @Test
  public void testIteratorReturnsTypedValues() throws Exception {
    List<ColumnMetadata> columns = Arrays.asList(new ColumnMetadata("Id", "BIGINT"),
        new ColumnMetadata("Amount", "DECIMAL(18,2)"), new ColumnMetadata("Active", "BOOLEAN"));
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(finished("q1", columns, 3L));
    when(transport.getQueryResults("q1", 0, 2)).thenReturn(
        page(0, false, 3L, row(1, "12.50", true), row(2L, new BigDecimal("7"), "false")));
    when(transport.getQueryResults("q1", 2, 2)).thenReturn(
        page(2, true, 3L, row(3, null, null)));
    QueryCursor cursor = connection.cursor();
    cursor.execute("SELECT Id, Amount, Active FROM Opportunity");

    Iterator<Row> it = cursor.iterator();
    Row first = it.next();
    assertEquals(1L, first.get("Id"));
    assertEquals(new BigDecimal("12.50"), first.get("Amount"));
    assertEquals(Boolean.TRUE, first.get("Active"));
    Row second = it.next();
    assertEquals(Boolean.FALSE, second.get(2));
    Row third = it.next();
    assertNull(third.get("Amount"));
    assertFalse(it.hasNext());
  }

  @Test
  public void testInterruptedWhilePolling() throws Exception {
    when(transport.submitQuery(anyString(), any(QueryParameters.class)))
        .thenReturn(running("q1"));
    when(transport.getQueryStatus("q1")).thenReturn(running("q1"));
    QueryCursor cursor = connection.cursor();
    Thread.currentThread().interrupt();
    try {
      cursor.execute("SELECT 1");
      fail("Expected SQLException");
    } catch (SQLException e) {
      assertEquals("HY008", e.getSQLState());
    } finally {
      Thread.interrupted();
    }
    assertEquals(CursorState.FAILED, cursor.getState());
  }

  @Test
  public void testArraySize() throws Exception {
    QueryCursor cursor = connection.cursor();
    assertEquals(2, cursor.getArraySize());
    cursor.setArraySize(10);
    assertEquals(10, cursor.getArraySize());
    try {
      cursor.setArraySize(0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertEquals(10, cursor.getArraySize());
    }
  }
}
