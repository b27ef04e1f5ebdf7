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

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.Objects;

/**
 * Physical properties a parent requires from (or a plan delivers on) its output: a sort order and
 * an expected row count hint. The hint tells the child that its parent only consumes that many
 * rows, so a plan which can stop early may be costed cheaper. It never makes a plan unacceptable.
 */
public class PhysicalProperties {
    public static final PhysicalProperties ANY = new PhysicalProperties(OrderSpec.EMPTY, Double.POSITIVE_INFINITY);

    private final OrderSpec orderSpec;
    private final double expectedRowCount;

    private PhysicalProperties(OrderSpec orderSpec, double expectedRowCount) {
        Preconditions.checkArgument(expectedRowCount >= 0 && !Double.isNaN(expectedRowCount),
                "expected row count must be non-negative, but is %s", expectedRowCount);
        this.orderSpec = Objects.requireNonNull(orderSpec, "orderSpec can not be null");
        this.expectedRowCount = expectedRowCount;
    }

    public static PhysicalProperties of(OrderSpec orderSpec, double expectedRowCount) {
        if (orderSpec.isEmpty() && expectedRowCount == Double.POSITIVE_INFINITY) {
            return ANY;
        }
        return new PhysicalProperties(orderSpec, expectedRowCount);
    }

    public static PhysicalProperties of(OrderSpec orderSpec) {
        return of(orderSpec, Double.POSITIVE_INFINITY);
    }

    public static PhysicalProperties ordered(List<OrderKey> orderKeys) {
        return of(OrderSpec.of(orderKeys));
    }

    public OrderSpec getOrderSpec() {
        return orderSpec;
    }

    public double getExpectedRowCount() {
        return expectedRowCount;
    }

    public boolean hasExpectedRowCount() {
        return expectedRowCount != Double.POSITIVE_INFINITY;
    }

    public boolean isOrderEmpty() {
        return orderSpec.isEmpty();
    }

    public boolean isAny() {
        return orderSpec.isEmpty() && !hasExpectedRowCount();
    }

    /**
     * Whether the properties a plan delivers satisfy the required properties. Only the order is
     * checked; the expected row count is advisory.
     */
    public boolean satisfy(PhysicalProperties required) {
        return orderSpec.satisfy(required.orderSpec);
    }

    public PhysicalProperties withOrderSpec(OrderSpec orderSpec) {
        return of(orderSpec, expectedRowCount);
    }

    public PhysicalProperties withoutOrder() {
        return of(OrderSpec.EMPTY, expectedRowCount);
    }

    public PhysicalProperties withExpectedRowCount(double expectedRowCount) {
        return of(orderSpec, expectedRowCount);
    }

    public PhysicalProperties withoutExpectedRowCount() {
        return of(orderSpec, Double.POSITIVE_INFINITY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PhysicalProperties that = (PhysicalProperties) o;
        return Double.compare(expectedRowCount, that.expectedRowCount) == 0 && orderSpec.equals(that.orderSpec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderSpec, expectedRowCount);
    }

    @Override
    public String toString() {
        if (isAny()) {
            return "ANY";
        }
        if (!hasExpectedRowCount()) {
            return "PhysicalProperties{order=" + orderSpec + "}";
        }
        return "PhysicalProperties{order=" + orderSpec + ", expectedRowCount=" + expectedRowCount + "}";
    }
}
