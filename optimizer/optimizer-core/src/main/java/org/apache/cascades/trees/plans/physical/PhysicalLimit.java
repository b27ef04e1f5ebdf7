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
import org.apache.cascades.util.Utils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Physical limit plan. Stops pulling from its child after {@code limit + offset} rows.
 * <p>
 * With order keys it implements a top-N: the child must then deliver its rows in that order,
 * and is told that only {@code limit + offset} of them are consumed.
 */
public class PhysicalLimit extends AbstractPhysicalPlan {
    private final long limit;
    private final long offset;
    private final List<OrderKey> orderKeys;

    public PhysicalLimit(long limit, long offset, EngineType engineType, Plan child) {
        this(limit, offset, ImmutableList.of(), engineType, child);
    }

    public PhysicalLimit(long limit, long offset, List<OrderKey> orderKeys, EngineType engineType, Plan child) {
        this(limit, offset, orderKeys, engineType, Optional.empty(), Optional.empty(), PhysicalProperties.ANY,
                Optional.empty(), child);
    }

    /**
     * Constructor for PhysicalLimit.
     */
    public PhysicalLimit(long limit, long offset, List<OrderKey> orderKeys, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, Plan child) {
        super(PlanType.PHYSICAL_LIMIT, engineType, groupExpression, statistics, physicalProperties, cost,
                ImmutableList.of(child));
        this.limit = limit;
        this.offset = offset;
        this.orderKeys = ImmutableList.copyOf(orderKeys);
    }

    public long getLimit() {
        return limit;
    }

    public long getOffset() {
        return offset;
    }

    /**
     * Order the child must deliver, empty for a plain limit.
     */
    public List<OrderKey> getOrderKeys() {
        return orderKeys;
    }

    @Override
    public List<SlotReference> getOutput() {
        return child(0).getOutput();
    }

    @Override
    protected PhysicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1, "PhysicalLimit should have 1 child");
        return new PhysicalLimit(limit, offset, orderKeys, engineType, groupExpression, statistics,
                physicalProperties, cost, children.get(0));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        PhysicalLimit that = (PhysicalLimit) o;
        return limit == that.limit && offset == that.offset && orderKeys.equals(that.orderKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), limit, offset, orderKeys);
    }

    @Override
    public String toString() {
        if (orderKeys.isEmpty()) {
            return Utils.toSqlString("PhysicalLimit", "limit", limit, "offset", offset, "engine", engineType);
        }
        return Utils.toSqlString("PhysicalLimit", "limit", limit, "offset", offset,
                "orderKeys", Utils.join(orderKeys), "engine", engineType);
    }
}
