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

package org.datacloud.connector.metadata;

import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Description of one queryable table: its fields, primary keys, partitioning,
 * indexes and relationships to other tables.
 */
public final class TableMetadata {

  private final String name;
  private final String displayName;
  private final String category;
  private final String partitionBy;
  private final List<PrimaryKey> primaryKeys;
  private final List<FieldMetadata> fields;
  private final List<Relationship> relationships;
  private final List<List<String>> indexes;

  private TableMetadata(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "table name");
    this.displayName = builder.displayName;
    this.category = builder.category;
    this.partitionBy = builder.partitionBy;
    this.primaryKeys = builder.primaryKeys.build();
    this.fields = builder.fields.build();
    this.relationships = builder.relationships.build();
    this.indexes = builder.indexes.build();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getCategory() {
    return category;
  }

  public String getPartitionBy() {
    return partitionBy;
  }

  public List<PrimaryKey> getPrimaryKeys() {
    return primaryKeys;
  }

  public List<FieldMetadata> getFields() {
    return fields;
  }

  /**
   * @return the field named {@code fieldName}, matched case insensitively, or null
   */
  public FieldMetadata getField(String fieldName) {
    for (FieldMetadata field : fields) {
      if (field.getName().equalsIgnoreCase(fieldName)) {
        return field;
      }
    }
    return null;
  }

  public List<Relationship> getRelationships() {
    return relationships;
  }

  /**
   * @return the field names of each index
   */
  public List<List<String>> getIndexes() {
    return indexes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TableMetadata)) {
      return false;
    }
    TableMetadata that = (TableMetadata) o;
    return name.equals(that.name) && Objects.equals(displayName, that.displayName)
        && Objects.equals(category, that.category)
        && Objects.equals(partitionBy, that.partitionBy)
        && primaryKeys.equals(that.primaryKeys) && fields.equals(that.fields)
        && relationships.equals(that.relationships) && indexes.equals(that.indexes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, displayName, category, partitionBy, primaryKeys, fields,
        relationships, indexes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues()
        .add("name", name)
        .add("displayName", displayName)
        .add("category", category)
        .add("partitionBy", partitionBy)
        .add("fields", fields.size())
        .add("primaryKeys", primaryKeys)
        .toString();
  }

  public static final class Builder {
    private final String name;
    private String displayName;
    private String category;
    private String partitionBy;
    private final ImmutableList.Builder<PrimaryKey> primaryKeys = ImmutableList.builder();
    private final ImmutableList.Builder<FieldMetadata> fields = ImmutableList.builder();
    private final ImmutableList.Builder<Relationship> relationships = ImmutableList.builder();
    private final ImmutableList.Builder<List<String>> indexes = ImmutableList.builder();

    private Builder(String name) {
      this.name = name;
    }

    public Builder displayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    public Builder partitionBy(String partitionBy) {
      this.partitionBy = partitionBy;
      return this;
    }

    public Builder addPrimaryKey(PrimaryKey primaryKey) {
      primaryKeys.add(primaryKey);
      return this;
    }

    public Builder addField(FieldMetadata field) {
      fields.add(field);
      return this;
    }

    public Builder addRelationship(Relationship relationship) {
      relationships.add(relationship);
      return this;
    }

    public Builder addIndex(List<String> fieldNames) {
      indexes.add(ImmutableList.copyOf(fieldNames));
      return this;
    }

    public TableMetadata build() {
      return new TableMetadata(this);
    }
  }
}
