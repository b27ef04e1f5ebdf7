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

package org.apache.cascades.trees.plans.logical;

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.OrderKey;
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
 * Logical Sort plan.
 * <p>
 * eg: select * from table order by a, b desc;
 * orderKeys: list of column information after order by. eg:[a, asc],[b, desc].
 */
public class LogicalSort extends AbstractLogicalPlan {
    private final List<OrderKey> orderKeys;

    public LogicalSort(List<OrderKey> orderKeys, EngineType engineType, Plan child) {
        this(orderKeys, engineType, Optional.empty(), Optional.empty(), child);
    }

    /**
     * Constructor for LogicalSort.
     */
    public LogicalSort(List<OrderKey> orderKeys, EngineType engineType, Optional<GroupExpression> groupExpression,
            Optional<Statistics> statistics, Plan child) {
        super(PlanType.LOGICAL_SORT, engineType, groupExpression, statistics, ImmutableList.of(child));
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
    protected LogicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1, "LogicalSort should have 1 child");
        return new LogicalSort(orderKeys, engineType, groupExpression, statistics, children.get(0));
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && orderKeys.equals(((LogicalSort) o).orderKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), orderKeys);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("LogicalSort", "orderKeys", Utils.join(orderKeys), "engine", engineType);
    }
}
