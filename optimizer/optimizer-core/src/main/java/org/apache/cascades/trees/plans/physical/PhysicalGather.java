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
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;
import org.apache.cascades.util.Utils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Moves rows from the storage engine to the compute engine. Keeps the order of its input.
 */
public class PhysicalGather extends AbstractPhysicalPlan {

    public PhysicalGather(Plan child) {
        this(Optional.empty(), Optional.empty(), PhysicalProperties.ANY, Optional.empty(), child);
    }

    public PhysicalGather(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, Plan child) {
        super(PlanType.PHYSICAL_GATHER, EngineType.COMPUTE, groupExpression, statistics, physicalProperties, cost,
                ImmutableList.of(child));
    }

    @Override
    public List<SlotReference> getOutput() {
        return child(0).getOutput();
    }

    @Override
    protected PhysicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1, "PhysicalGather should have 1 child");
        return new PhysicalGather(groupExpression, statistics, physicalProperties, cost, children.get(0));
    }

    @Override
    public String toString() {
        return Utils.toSqlString("PhysicalGather", "engine", engineType);
    }
}
