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

import java.util.Objects;

/**
 * Expression for alias, such as {@code sum(x) AS s}. The alias introduces a new output slot.
 */
public class Alias extends Expression {
    private final SlotReference output;

    public Alias(Expression child, SlotReference output) {
        super(child);
        this.output = Objects.requireNonNull(output, "output can not be null");
    }

    public SlotReference toSlot() {
        return output;
    }

    @Override
    public String toSql() {
        return child(0).toSql() + " AS " + output.getName();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && output.equals(((Alias) o).output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(output, children);
    }
}
