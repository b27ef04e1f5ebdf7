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

package org.apache.cascades.trees.plans.physical;

import org.apache.cascades.cost.Cost;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract class for all physical sort node.
 */
public abstract class AbstractPhysicalSort extends AbstractPhysicalPlan {
    protected final List<OrderKey> orderKeys;

    protected AbstractPhysicalSort(PlanType type, List<OrderKey> orderKeys, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, Plan child) {
        super(type, engineType, groupExpression, statistics, physicalProperties, cost, ImmutableList.of(child));
        Preconditions.checkArgument(!orderKeys.isEmpty(), "sort must have at least one order key");
        this.orderKeys = ImmutableList.copyOf(orderKeys);
    }

    public List<OrderKey> getOrderKeys() {
        return orderKeys;
    }

    @Override
    public List<SlotReference> getOutput() {
        return child(0).getOutput();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && orderKeys.equals(((AbstractPhysicalSort) o).orderKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), orderKeys);
    }
}
