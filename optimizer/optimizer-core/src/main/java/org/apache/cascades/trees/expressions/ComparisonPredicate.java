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
 * Binary comparison such as {@code a = 1} or {@code t1.id < t2.id}.
 */
public class ComparisonPredicate extends Expression {

    /** comparison operator */
    public enum Op {
        EQ("="), NE("<>"), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }
    }

    private final Op op;

    public ComparisonPredicate(Op op, Expression left, Expression right) {
        super(left, right);
        this.op = Objects.requireNonNull(op, "op can not be null");
    }

    public static ComparisonPredicate equalTo(Expression left, Expression right) {
        return new ComparisonPredicate(Op.EQ, left, right);
    }

    public Op getOp() {
        return op;
    }

    public Expression left() {
        return child(0);
    }

    public Expression right() {
        return child(1);
    }

    @Override
    public String toSql() {
        return "(" + left().toSql() + " " + op.symbol + " " + right().toSql() + ")";
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && op == ((ComparisonPredicate) o).op;
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, children);
    }
}
