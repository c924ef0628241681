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

import java.util.Locale;

import org.datacloud.connector.ApiException;

import com.google.common.collect.ImmutableSet;

/**
 * Server reported lifecycle stage of a submitted query.
 */
public enum QueryPhase {
  RUNNING,
  FINISHED,
  FAILED;

  private static final ImmutableSet<String> RUNNING_STATES =
      ImmutableSet.of("UNSPECIFIED", "QUEUED", "RUNNING", "IN_PROGRESS", "SUBMITTED");
  private static final ImmutableSet<String> FINISHED_STATES =
      ImmutableSet.of("COMPLETED", "FINISHED", "SUCCESS", "SUCCEEDED");
  private static final ImmutableSet<String> FAILED_STATES =
      ImmutableSet.of("FAILED", "ERROR", "CANCELLED", "CANCELED");

  /**
   * Map a server state name to a phase. A missing state means the server has
   * not picked the query up yet.
   *
   * @throws ApiException if the state is not one the connector knows
   */
  public static QueryPhase fromServerState(String state) throws ApiException {
    if (state == null || state.trim().isEmpty()) {
      return RUNNING;
    }
    String normalized = state.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    if (RUNNING_STATES.contains(normalized)) {
      return RUNNING;
    }
    if (FINISHED_STATES.contains(normalized)) {
      return FINISHED;
    }
    if (FAILED_STATES.contains(normalized)) {
      return FAILED;
    }
    throw new ApiException("Unknown query state from server: " + state);
  }
}
