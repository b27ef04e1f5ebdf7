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
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.Alias;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract class for the physical aggregations.
 */
public abstract class AbstractPhysicalAggregate extends AbstractPhysicalPlan {
    protected final List<SlotReference> groupByKeys;
    protected final List<Alias> aggregates;

    protected AbstractPhysicalAggregate(PlanType type, List<SlotReference> groupByKeys, List<Alias> aggregates,
            EngineType engineType, Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, Plan child) {
        super(type, engineType, groupExpression, statistics, physicalProperties, cost, ImmutableList.of(child));
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
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        AbstractPhysicalAggregate that = (AbstractPhysicalAggregate) o;
        return groupByKeys.equals(that.groupByKeys) && aggregates.equals(that.aggregates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), groupByKeys, aggregates);
    }
}
