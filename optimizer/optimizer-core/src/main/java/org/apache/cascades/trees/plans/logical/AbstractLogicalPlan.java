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
import org.apache.cascades.trees.plans.AbstractPlan;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;

import java.util.List;
import java.util.Optional;

/**
 * Abstract class for all concrete logical plan.
 */
public abstract class AbstractLogicalPlan extends AbstractPlan implements LogicalPlan {

    protected AbstractLogicalPlan(PlanType type, EngineType engineType, Optional<GroupExpression> groupExpression,
            Optional<Statistics> statistics, List<Plan> children) {
        super(type, engineType, groupExpression, statistics, children);
    }

    protected abstract LogicalPlan copy(Optional<GroupExpression> groupExpression,
            Optional<Statistics> statistics, List<Plan> children);

    @Override
    public LogicalPlan withChildren(List<Plan> children) {
        return copy(Optional.empty(), statistics, children);
    }

    @Override
    public LogicalPlan withGroupExpression(Optional<GroupExpression> groupExpression) {
        return copy(groupExpression, statistics, children);
    }

    @Override
    public LogicalPlan withStats(Statistics statistics) {
        return copy(groupExpression, Optional.of(statistics), children);
    }

    /**
     * Rebuild the plan with new children while keeping the group expression it was matched from.
     */
    @Override
    public LogicalPlan withGroupExprAndChildren(Optional<GroupExpression> groupExpression, List<Plan> children) {
        return copy(groupExpression, statistics, children);
    }
}
