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
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.Alias;
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
 * Logical aggregation plan. Outputs the group by keys followed by the aggregate aliases.
 */
public class LogicalAggregate extends AbstractLogicalPlan {
    private final List<SlotReference> groupByKeys;
    private final List<Alias> aggregates;

    public LogicalAggregate(List<SlotReference> groupByKeys, List<Alias> aggregates, EngineType engineType,
            Plan child) {
        this(groupByKeys, aggregates, engineType, Optional.empty(), Optional.empty(), child);
    }

    /**
     * Constructor for LogicalAggregate.
     */
    public LogicalAggregate(List<SlotReference> groupByKeys, List<Alias> aggregates, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics, Plan child) {
        super(PlanType.LOGICAL_AGGREGATE, engineType, groupExpression, statistics, ImmutableList.of(child));
        this.groupByKeys = ImmutableList.copyOf(groupByKeys);
        this.aggregates = ImmutableList.copyOf(aggregates);
    }

    public List<SlotReference> getGroupByKeys() {
        return groupByKeys;
    }

    public List<Alias> getAggregates() {
        return aggregates;
    }

    @Override
    public List<SlotReference> getOutput() {
        ImmutableList.Builder<SlotReference> output = ImmutableList.builder();
        output.addAll(groupByKeys);
        aggregates.forEach(alias -> output.add(alias.toSlot()));
        return output.build();
    }

    @Override
    protected LogicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1, "LogicalAggregate should have 1 child");
        return new LogicalAggregate(groupByKeys, aggregates, engineType, groupExpression, statistics,
                children.get(0));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        LogicalAggregate that = (LogicalAggregate) o;
        return groupByKeys.equals(that.groupByKeys) && aggregates.equals(that.aggregates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), groupByKeys, aggregates);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("LogicalAggregate", "groupBy", Utils.join(groupByKeys),
                "aggregates", Utils.join(aggregates), "engine", engineType);
    }
}
