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

import java.math.BigDecimal;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

/**
 * Local representation of a declared column type, with its java.sql.Types code
 * and the Java class row values are converted to.
 */
public enum ColumnType {
  STRING(Types.VARCHAR, String.class),
  BOOLEAN(Types.BOOLEAN, Boolean.class),
  DECIMAL(Types.DECIMAL, BigDecimal.class),
  BIGINT(Types.BIGINT, Long.class),
  DOUBLE(Types.DOUBLE, Double.class),
  DATE(Types.DATE, LocalDate.class),
  TIMESTAMP(Types.TIMESTAMP_WITH_TIMEZONE, OffsetDateTime.class),
  TIME(Types.TIME, LocalTime.class);

  private static final Map<String, ColumnType> BY_NAME = ImmutableMap.<String, ColumnType>builder()
      .put("TEXT", STRING)
      .put("STRING", STRING)
      .put("ID", STRING)
      .put("URL", STRING)
      .put("EMAIL", STRING)
      .put("PHONE", STRING)
      .put("PICKLIST", STRING)
      .put("MULTIPICKLIST", STRING)
      .put("TEXTAREA", STRING)
      .put("VARCHAR", STRING)
      .put("CHAR", STRING)
      .put("BOOLEAN", BOOLEAN)
      .put("NUMBER", DECIMAL)
      .put("DECIMAL", DECIMAL)
      .put("CURRENCY", DECIMAL)
      .put("PERCENT", DECIMAL)
      .put("INTEGER", BIGINT)
      .put("INT", BIGINT)
      .put("LONG", BIGINT)
      .put("BIGINT", BIGINT)
      .put("DOUBLE", DOUBLE)
      .put("FLOAT", DOUBLE)
      .put("DATE", DATE)
      .put("DATETIME", TIMESTAMP)
      .put("DATE_TIME", TIMESTAMP)
      .put("TIMESTAMP", TIMESTAMP)
      .put("TIMESTAMP WITH TIME ZONE", TIMESTAMP)
      .put("TIME", TIME)
      .build();

  private static final Logger LOG = LoggerFactory.getLogger(ColumnType.class);

  // e.g. 2024-01-31T10:15:30.000+0000
  private static final DateTimeFormatter COMPACT_OFFSET_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss[.SSS]XX");

  private final int sqlType;
  private final Class<?> javaClass;

  ColumnType(int sqlType, Class<?> javaClass) {
    this.sqlType = sqlType;
    this.javaClass = javaClass;
  }

  public int getSqlType() {
    return sqlType;
  }

  public Class<?> getJavaClass() {
    return javaClass;
  }

  /**
   * Resolve a declared type name such as {@code TEXT} or {@code DECIMAL(18,2)}.
   * Unknown names are read as strings.
   */
  public static ColumnType fromTypeName(String typeName) {
    if (typeName == null) {
      return STRING;
    }
    String normalized = typeName.trim().toUpperCase(Locale.ROOT);
    int paren = normalized.indexOf('(');
    if (paren > 0) {
      normalized = normalized.substring(0, paren).trim();
    }
    ColumnType type = BY_NAME.get(normalized);
    return type == null ? STRING : type;
  }

  /**
   * Convert a raw JSON scalar to this type's Java class.
   *
   * @throws IllegalArgumentException if the value cannot be represented
   */
  public Object convert(Object raw) {
    if (raw == null) {
      return null;
    }
    try {
      switch (this) {
      case STRING:
        if (raw instanceof BigDecimal) {
          return ((BigDecimal) raw).toPlainString();
        }
        return raw.toString();
      case BOOLEAN:
        return toBoolean(raw);
      case DECIMAL:
        return raw instanceof BigDecimal ? raw : new BigDecimal(raw.toString().trim());
      case BIGINT:
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short) {
          return ((Number) raw).longValue();
        }
        return new BigDecimal(raw.toString().trim()).longValueExact();
      case DOUBLE:
        return raw instanceof Number ? ((Number) raw).doubleValue()
            : Double.parseDouble(raw.toString().trim());
      case DATE:
        return toDate(raw);
      case TIMESTAMP:
        return toTimestamp(raw);
      case TIME:
        return LocalTime.parse(raw.toString().trim());
      default:
        throw new IllegalStateException("Unhandled column type " + this);
      }
    } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
      throw new IllegalArgumentException("Cannot convert '" + raw + "' to " + this, e);
    }
  }

  private static Boolean toBoolean(Object raw) {
    if (raw instanceof Boolean) {
      return (Boolean) raw;
    }
    if (raw instanceof Number) {
      return ((Number) raw).intValue() != 0;
    }
    String value = raw.toString().trim();
    if ("true".equalsIgnoreCase(value)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(value)) {
      return Boolean.FALSE;
    }
    throw new IllegalArgumentException("Cannot convert '" + raw + "' to BOOLEAN");
  }

  private static LocalDate toDate(Object raw) {
    if (raw instanceof Number) {
      return toTimestamp(raw).toLocalDate();
    }
    String value = raw.toString().trim();
    if (value.length() == 10) {
      return LocalDate.parse(value);
    }
    return toTimestamp(value).toLocalDate();
  }

  private static OffsetDateTime toTimestamp(Object raw) {
    if (raw instanceof Number) {
      return Instant.ofEpochMilli(((Number) raw).longValue()).atOffset(ZoneOffset.UTC);
    }
    String value = raw.toString().trim().replace(' ', 'T');
    try {
      return OffsetDateTime.parse(value);
    } catch (DateTimeParseException e) {
      LOG.trace("Not an ISO offset timestamp: {}", value);
    }
    try {
      return OffsetDateTime.parse(value, COMPACT_OFFSET_TIMESTAMP);
    } catch (DateTimeParseException e) {
      // no offset, the service reports UTC
      return LocalDateTime.parse(value).atOffset(ZoneOffset.UTC);
    }
  }
}
