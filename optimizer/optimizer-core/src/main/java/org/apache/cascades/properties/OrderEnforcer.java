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

import org.apache.cascades.cost.Cost;
import org.apache.cascades.cost.CostContext;
import org.apache.cascades.cost.CostModel;
import org.apache.cascades.memo.Group;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.physical.PhysicalPlan;
import org.apache.cascades.trees.plans.physical.PhysicalQuickSort;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Enforce a sort order by sorting the group's best unordered plan. Sorting only runs in the compute engine.
 */
public class OrderEnforcer implements Enforcer {
    public static final OrderEnforcer INSTANCE = new OrderEnforcer();

    @Override
    public EngineType getEngineType() {
        return EngineType.COMPUTE;
    }

    @Override
    public boolean isApplicable(PhysicalProperties requiredProperties) {
        return !requiredProperties.isOrderEmpty();
    }

    @Override
    public PhysicalProperties newProperty(PhysicalProperties requiredProperties) {
        return PhysicalProperties.ANY;
    }

    @Override
    public PhysicalPlan onEnforce(PhysicalProperties requiredProperties, Group childGroup) {
        Preconditions.checkArgument(isApplicable(requiredProperties), "nothing to enforce for %s",
                requiredProperties);
        return new PhysicalQuickSort(requiredProperties.getOrderSpec().getOrderKeys(), childGroup.getEngineType(),
                Optional.empty(), Optional.of(childGroup.getStatistics()), PhysicalProperties.ANY, Optional.empty(),
                new GroupPlan(childGroup));
    }

    @Override
    public Cost getEnforceCost(Group group, PhysicalProperties requiredProperties, CostModel costModel) {
        CostContext context = new CostContext(onEnforce(requiredProperties, group), group.getStatistics(),
                ImmutableList.of(group.getStatistics()), group.getLogicalProperties().getWidth(),
                requiredProperties);
        return costModel.estimate(context);
    }

    @Override
    public String toString() {
        return "OrderEnforcer";
    }
}
