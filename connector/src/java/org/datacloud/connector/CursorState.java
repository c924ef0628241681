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

/**
 * Lifecycle of a {@link QueryCursor}.
 */
public enum CursorState {
  /** No query has been executed yet. */
  IDLE,
  /** The query was accepted by the server and has an id. */
  SUBMITTED,
  /** Waiting for the server to finish the query. */
  POLLING,
  /** The query finished; columns are known and no row has been handed out. */
  READY,
  /** Rows are being handed out page by page. */
  DRAINING,
  /** The last page has been fetched and handed out. */
  EXHAUSTED,
  /** The query failed, timed out, or a call made for it failed. */
  FAILED,
  CLOSED
}
