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

/**
 * Secondary index of a table. Rows read through the index come back ordered by its key columns,
 * ascending.
 */
public class Index {
    private final String name;
    private final List<String> keyColumns;

    public Index(String name, List<String> keyColumns) {
        Preconditions.checkArgument(!keyColumns.isEmpty(), "index %s has no key column", name);
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.keyColumns = ImmutableList.copyOf(keyColumns);
    }

    public String getName() {
        return name;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Index index = (Index) o;
        return name.equals(index.name) && keyColumns.equals(index.keyColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, keyColumns);
    }

    @Override
    public String toString() {
        return name + keyColumns;
    }
}
