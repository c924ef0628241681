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

package org.datacloud.connector.transport.rest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.datacloud.connector.ApiException;
import org.datacloud.connector.metadata.FieldMetadata;
import org.datacloud.connector.metadata.PrimaryKey;
import org.datacloud.connector.metadata.Relationship;
import org.datacloud.connector.metadata.TableMetadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.primitives.Ints;

/**
 * Reads the {@code metadata} array of a metadata response.
 */
final class TableMetadataParser {

  private TableMetadataParser() {
  }

  static List<TableMetadata> parseTables(JsonNode root) throws ApiException {
    JsonNode metadata = root.path("metadata");
    if (metadata.isMissingNode() || metadata.isNull()) {
      return Collections.emptyList();
    }
    if (!metadata.isArray()) {
      throw new ApiException("Malformed table metadata: " + abbreviate(metadata));
    }
    List<TableMetadata> tables = new ArrayList<>(metadata.size());
    for (JsonNode table : metadata) {
      tables.add(parseTable(table));
    }
    return tables;
  }

  private static TableMetadata parseTable(JsonNode table) throws ApiException {
    String name = text(table, "name");
    if (name == null) {
      name = text(table, "displayName");
    }
    if (name == null) {
      throw new ApiException("Table metadata without a name: " + abbreviate(table));
    }
    TableMetadata.Builder builder = TableMetadata.builder(name)
        .displayName(text(table, "displayName"))
        .category(text(table, "category"))
        .partitionBy(text(table, "partitionBy"));
    for (JsonNode field : table.path("fields")) {
      String fieldName = text(field, "name");
      if (fieldName == null) {
        throw new ApiException("Field without a name in table " + name);
      }
      builder.addField(new FieldMetadata(fieldName, text(field, "displayName"),
          text(field, "type"), field.path("isMeasure").asBoolean(false),
          field.path("isDimension").asBoolean(false)));
    }
    for (JsonNode key : table.path("primaryKeys")) {
      String keyName = text(key, "name");
      if (keyName == null) {
        throw new ApiException("Primary key without a name in table " + name);
      }
      // indexOrder comes as a number or as text
      String order = text(key, "indexOrder");
      builder.addPrimaryKey(new PrimaryKey(keyName, text(key, "displayName"),
          order == null ? null : Ints.tryParse(order)));
    }
    for (JsonNode relationship : table.path("relationships")) {
      builder.addRelationship(new Relationship(text(relationship, "fromTable"),
          text(relationship, "toTable"), text(relationship, "fromEntityAttribute"),
          text(relationship, "toEntityAttribute"), text(relationship, "cardinality")));
    }
    for (JsonNode index : table.path("indexes")) {
      List<String> fieldNames = new ArrayList<>();
      for (JsonNode field : index.path("fields")) {
        fieldNames.add(field.isTextual() ? field.asText() : field.path("name").asText());
      }
      builder.addIndex(fieldNames);
    }
    return builder.build();
  }

  private static String text(JsonNode node, String key) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  private static String abbreviate(JsonNode node) {
    return StringUtils.abbreviate(node.toString(), 200);
  }
}
