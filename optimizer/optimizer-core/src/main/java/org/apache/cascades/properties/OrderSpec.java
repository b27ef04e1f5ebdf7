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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Spec of sort order.
 */
public class OrderSpec {
    public static final OrderSpec EMPTY = new OrderSpec(ImmutableList.of());

    private final List<OrderKey> orderKeys;

    public OrderSpec(List<OrderKey> orderKeys) {
        this.orderKeys = ImmutableList.copyOf(orderKeys);
    }

    public static OrderSpec of(List<OrderKey> orderKeys) {
        return orderKeys.isEmpty() ? EMPTY : new OrderSpec(orderKeys);
    }

    /**
     * Whether output's order satisfies the required order: the required keys must be a prefix of
     * this spec's keys, with the same columns and directions at the same positions.
     *
     * @param required required order
     * @return true if satisfy
     */
    public boolean satisfy(OrderSpec required) {
        if (required.orderKeys.size() > orderKeys.size()) {
            return false;
        }
        for (int i = 0; i < required.orderKeys.size(); i++) {
            if (!required.orderKeys.get(i).equals(orderKeys.get(i))) {
                return false;
            }
        }
        return true;
    }

    public List<OrderKey> getOrderKeys() {
        return orderKeys;
    }

    public boolean isEmpty() {
        return orderKeys.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return orderKeys.equals(((OrderSpec) o).orderKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderKeys);
    }

    @Override
    public String toString() {
        return orderKeys.toString();
    }
}
