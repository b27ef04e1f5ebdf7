// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.cascades.catalog;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only table metadata supplied by the catalog. A table scan returns rows in primary key
 * order, ascending.
 */
public class Table {
    private final long id;
    private final String name;
    private final List<Column> columns;
    private final List<String> primaryKeys;
    private final List<Index> indexes;

    /**
     * Constructor of Table.
     */
    public Table(long id, String name, List<Column> columns, List<String> primaryKeys, List<Index> indexes) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.columns = ImmutableList.copyOf(columns);
        this.primaryKeys = ImmutableList.copyOf(primaryKeys);
        this.indexes = ImmutableList.copyOf(indexes);
        for (String key : primaryKeys) {
            Preconditions.checkArgument(getColumn(key).isPresent(), "unknown primary key column %s", key);
        }
        for (Index index : indexes) {
            for (String key : index.getKeyColumns()) {
                Preconditions.checkArgument(getColumn(key).isPresent(),
                        "unknown column %s in index %s", key, index.getName());
            }
        }
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public Optional<Column> getColumn(String columnName) {
        return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
    }

    public List<String> getPrimaryKeys() {
        return primaryKeys;
    }

    public List<Index> getIndexes() {
        return indexes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Table table = (Table) o;
        return id == table.id && name.equals(table.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
