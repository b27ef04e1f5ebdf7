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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Aggregate call like {@code sum(x)} or {@code count(*)} (no arguments).
 */
public class AggregateFunction extends Expression {
    private final String name;

    public AggregateFunction(String name, List<Expression> arguments) {
        super(arguments);
        this.name = Objects.requireNonNull(name, "name can not be null");
    }

    public String getName() {
        return name;
    }

    @Override
    public String toSql() {
        if (children.isEmpty()) {
            return name + "(*)";
        }
        return name + children.stream().map(Expression::toSql).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && name.equals(((AggregateFunction) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, children);
    }
}
