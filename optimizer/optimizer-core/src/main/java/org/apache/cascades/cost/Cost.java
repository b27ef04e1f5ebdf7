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

package org.apache.cascades.cost;

import java.text.DecimalFormat;

/**
 * Scalar cost of a plan. Costs are composable: the total cost of a plan is its own operator cost
 * plus the total costs of its children.
 */
public final class Cost implements Comparable<Cost> {
    private static final Cost ZERO = new Cost(0);
    private static final Cost INFINITE = new Cost(Double.POSITIVE_INFINITY);
    private static final DecimalFormat FORMAT = new DecimalFormat("#,##0.##");

    private final double value;

    private Cost(double value) {
        this.value = value;
    }

    public static Cost of(double value) {
        return value == 0 ? ZERO : new Cost(value);
    }

    public static Cost zero() {
        return ZERO;
    }

    public static Cost infinite() {
        return INFINITE;
    }

    public double getValue() {
        return value;
    }

    public boolean isInfinite() {
        return value == Double.POSITIVE_INFINITY;
    }

    public Cost plus(Cost other) {
        return of(value + other.value);
    }

    @Override
    public int compareTo(Cost o) {
        return Double.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Double.compare(value, ((Cost) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return isInfinite() ? "INF" : FORMAT.format(value);
    }
}
