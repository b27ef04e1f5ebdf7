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
import org.apache.cascades.trees.plans.AbstractPlan;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract class for all concrete physical plan.
 */
public abstract class AbstractPhysicalPlan extends AbstractPlan implements PhysicalPlan {
    protected final PhysicalProperties physicalProperties;
    protected final Optional<Cost> cost;

    protected AbstractPhysicalPlan(PlanType type, EngineType engineType, Optional<GroupExpression> groupExpression,
            Optional<Statistics> statistics, PhysicalProperties physicalProperties, Optional<Cost> cost,
            List<Plan> children) {
        super(type, engineType, groupExpression, statistics, children);
        this.physicalProperties = Objects.requireNonNull(physicalProperties, "physicalProperties can not be null");
        this.cost = Objects.requireNonNull(cost, "cost can not be null");
    }

    protected abstract PhysicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, List<Plan> children);

    @Override
    public PhysicalProperties getPhysicalProperties() {
        return physicalProperties;
    }

    @Override
    public Optional<Cost> getCost() {
        return cost;
    }

    @Override
    public PhysicalPlan withChildren(List<Plan> children) {
        return copy(Optional.empty(), statistics, physicalProperties, cost, children);
    }

    @Override
    public PhysicalPlan withGroupExpression(Optional<GroupExpression> groupExpression) {
        return copy(groupExpression, statistics, physicalProperties, cost, children);
    }

    @Override
    public PhysicalPlan withChosenPlanInfo(PhysicalProperties physicalProperties, Statistics statistics,
            Cost cost, List<Plan> children) {
        return copy(groupExpression, Optional.ofNullable(statistics), physicalProperties, Optional.of(cost),
                children);
    }

    @Override
    protected String treeLabel() {
        if (!cost.isPresent()) {
            return toString();
        }
        StringBuilder label = new StringBuilder(toString());
        label.append(" cost=").append(cost.get());
        statistics.ifPresent(stats -> label.append(" rows=").append(stats.getRowCount()));
        if (!physicalProperties.isAny()) {
            label.append(" props=").append(physicalProperties);
        }
        return label.toString();
    }
}
