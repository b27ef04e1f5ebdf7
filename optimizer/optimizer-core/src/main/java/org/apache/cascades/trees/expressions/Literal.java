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
 * Constant value.
 */
public class Literal extends Expression {
    private final Object value;
    private final DataType dataType;

    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType can not be null");
    }

    public static Literal of(int value) {
        return new Literal(value, DataType.INT);
    }

    public static Literal of(String value) {
        return new Literal(value, DataType.VARCHAR);
    }

    public Object getValue() {
        return value;
    }

    public DataType getDataType() {
        return dataType;
    }

    @Override
    public String toSql() {
        if (value == null) {
            return "NULL";
        }
        return dataType == DataType.VARCHAR ? "'" + value + "'" : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Literal literal = (Literal) o;
        return Objects.equals(value, literal.value) && dataType == literal.dataType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }
}
