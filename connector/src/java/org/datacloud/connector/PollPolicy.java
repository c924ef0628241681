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

import java.time.Duration;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Backoff and ceiling for the status poll loop. The wait before poll n
 * (zero based) is {@code initialInterval * multiplier^n} capped at
 * {@code maxInterval}, so the sequence never decreases.
 */
public final class PollPolicy {

  public static final long DEFAULT_INITIAL_INTERVAL_MS = 100;
  public static final long DEFAULT_MAX_INTERVAL_MS = 2000;
  public static final double DEFAULT_MULTIPLIER = 2.0;
  public static final int DEFAULT_MAX_ATTEMPTS = 600;
  public static final long DEFAULT_TIMEOUT_MS = 300_000;

  private final Duration initialInterval;
  private final Duration maxInterval;
  private final double multiplier;
  private final int maxAttempts;
  private final Duration timeout;

  public PollPolicy(Duration initialInterval, Duration maxInterval, double multiplier,
      int maxAttempts, Duration timeout) {
    Preconditions.checkArgument(!initialInterval.isNegative(),
        "initial poll interval must not be negative");
    Preconditions.checkArgument(maxInterval.compareTo(initialInterval) >= 0,
        "max poll interval %s is below the initial interval %s", maxInterval, initialInterval);
    Preconditions.checkArgument(multiplier >= 1.0, "poll multiplier must be >= 1.0 but was %s",
        multiplier);
    Preconditions.checkArgument(maxAttempts > 0, "poll max attempts must be positive");
    Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(),
        "poll timeout must be positive");
    this.initialInterval = initialInterval;
    this.maxInterval = maxInterval;
    this.multiplier = multiplier;
    this.maxAttempts = maxAttempts;
    this.timeout = timeout;
  }

  public static PollPolicy defaults() {
    return new PollPolicy(Duration.ofMillis(DEFAULT_INITIAL_INTERVAL_MS),
        Duration.ofMillis(DEFAULT_MAX_INTERVAL_MS), DEFAULT_MULTIPLIER, DEFAULT_MAX_ATTEMPTS,
        Duration.ofMillis(DEFAULT_TIMEOUT_MS));
  }

  public Duration getInitialInterval() {
    return initialInterval;
  }

  public Duration getMaxInterval() {
    return maxInterval;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Duration getTimeout() {
    return timeout;
  }

  /**
   * @return the wait that follows a wait of {@code currentMillis}
   */
  public long nextIntervalMillis(long currentMillis) {
    double next = currentMillis * multiplier;
    long max = maxInterval.toMillis();
    return next >= max ? max : Math.max(currentMillis, (long) next);
  }

  /**
   * @return the wait before poll number {@code attempt}, zero based
   */
  public long intervalMillis(int attempt) {
    long interval = Math.min(initialInterval.toMillis(), maxInterval.toMillis());
    for (int i = 0; i < attempt && interval < maxInterval.toMillis(); i++) {
      interval = nextIntervalMillis(interval);
    }
    return interval;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("initialInterval", initialInterval)
        .add("maxInterval", maxInterval)
        .add("multiplier", multiplier)
        .add("maxAttempts", maxAttempts)
        .add("timeout", timeout)
        .toString();
  }
}
