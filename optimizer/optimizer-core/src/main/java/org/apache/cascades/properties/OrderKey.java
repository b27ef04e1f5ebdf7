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

package org.apache.cascades.properties;

import org.apache.cascades.trees.expressions.SlotReference;

import java.util.Objects;

/**
 * One sort item: a column reference and a direction.
 */
public class OrderKey {
    private final SlotReference expr;
    private final boolean desc;

    public OrderKey(SlotReference expr, boolean desc) {
        this.expr = Objects.requireNonNull(expr, "expr can not be null");
        this.desc = desc;
    }

    public static OrderKey asc(SlotReference expr) {
        return new OrderKey(expr, false);
    }

    public static OrderKey desc(SlotReference expr) {
        return new OrderKey(expr, true);
    }

    public SlotReference getExpr() {
        return expr;
    }

    public boolean isDesc() {
        return desc;
    }

    public boolean isAsc() {
        return !desc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OrderKey that = (OrderKey) o;
        return desc == that.desc && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr, desc);
    }

    @Override
    public String toString() {
        return expr + (desc ? " desc" : " asc");
    }
}
