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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract class for all Expression in the optimizer. Expressions are immutable values and only
 * describe operator parameters; the optimizer never evaluates them.
 */
public abstract class Expression {
    protected final List<Expression> children;

    protected Expression(Expression... children) {
        this.children = ImmutableList.copyOf(children);
    }

    protected Expression(List<Expression> children) {
        this.children = ImmutableList.copyOf(children);
    }

    public List<Expression> children() {
        return children;
    }

    public Expression child(int index) {
        return children.get(index);
    }

    public int arity() {
        return children.size();
    }

    /**
     * Collect all slots referenced by this expression tree, in first-visit order.
     */
    public Set<SlotReference> getInputSlots() {
        ImmutableSet.Builder<SlotReference> slots = ImmutableSet.builder();
        collectInputSlots(this, slots);
        return slots.build();
    }

    private static void collectInputSlots(Expression expression, ImmutableSet.Builder<SlotReference> slots) {
        if (expression instanceof SlotReference) {
            slots.add((SlotReference) expression);
            return;
        }
        for (Expression child : expression.children) {
            collectInputSlots(child, slots);
        }
    }

    public abstract String toSql();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Expression that = (Expression) o;
        return children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), children);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
