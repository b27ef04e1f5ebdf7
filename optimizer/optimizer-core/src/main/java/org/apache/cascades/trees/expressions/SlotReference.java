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

package org.apache.cascades.trees.expressions;

import org.apache.cascades.types.DataType;

import java.util.Objects;

/**
 * Reference to slot in expression. Two references are the same slot iff they carry the same
 * {@link ExprId}; name and qualifier are only for display.
 */
public class SlotReference extends Expression {
    private final ExprId exprId;
    private final String name;
    private final DataType dataType;
    private final String qualifier;

    /**
     * Constructor for SlotReference.
     *
     * @param exprId UUID for this slot reference
     * @param name slot reference name
     * @param dataType slot reference data type
     * @param qualifier table or alias name the slot comes from, may be empty
     */
    public SlotReference(ExprId exprId, String name, DataType dataType, String qualifier) {
        this.exprId = Objects.requireNonNull(exprId, "exprId can not be null");
        this.name = Objects.requireNonNull(name, "name can not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType can not be null");
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier can not be null");
    }

    public ExprId getExprId() {
        return exprId;
    }

    public String getName() {
        return name;
    }

    public DataType getDataType() {
        return dataType;
    }

    public String getQualifier() {
        return qualifier;
    }

    @Override
    public String toSql() {
        return qualifier.isEmpty() ? name : qualifier + "." + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return exprId.equals(((SlotReference) o).exprId);
    }

    @Override
    public int hashCode() {
        return exprId.hashCode();
    }

    @Override
    public String toString() {
        return name + "#" + exprId;
    }
}
