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

import org.apache.cascades.cost.DefaultCostModel;
import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.Memo;
import org.apache.cascades.qe.SessionVariable;
import org.apache.cascades.rules.RuleSet;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.trees.plans.physical.PhysicalPlan;
import org.apache.cascades.trees.plans.physical.PhysicalQuickSort;
import org.apache.cascades.util.PlanConstructor;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class OrderEnforcerTest {
    private final PlanConstructor planConstructor = new PlanConstructor();
    private final DefaultCostModel costModel = new DefaultCostModel(new SessionVariable());

    private Group newGroup(EngineType engineType, double rowCount) {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), engineType, rowCount);
        return new Memo(scan).getRoot();
    }

    private static PhysicalProperties orderByFirstColumn(Group group) {
        SlotReference first = group.getLogicalProperties().getOutput().get(0);
        return PhysicalProperties.ordered(ImmutableList.of(OrderKey.desc(first)));
    }

    @Test
    public void testApplicability() {
        Group group = newGroup(EngineType.COMPUTE, 1000);
        Assertions.assertEquals(EngineType.COMPUTE, OrderEnforcer.INSTANCE.getEngineType());
        Assertions.assertFalse(OrderEnforcer.INSTANCE.isApplicable(PhysicalProperties.ANY));
        Assertions.assertFalse(OrderEnforcer.INSTANCE.isApplicable(PhysicalProperties.ANY.withExpectedRowCount(5)));
        Assertions.assertTrue(OrderEnforcer.INSTANCE.isApplicable(orderByFirstColumn(group)));
        Assertions.assertSame(PhysicalProperties.ANY, OrderEnforcer.INSTANCE.newProperty(
                orderByFirstColumn(group).withExpectedRowCount(5)));
    }

    @Test
    public void testOnlyOfferedToComputeGroups() {
        Group compute = newGroup(EngineType.COMPUTE, 1000);
        Group storage = newGroup(EngineType.STORAGE, 1000);
        RuleSet ruleSet = RuleSet.defaultRuleSet();

        Assertions.assertEquals(ImmutableList.of(OrderEnforcer.INSTANCE),
                ruleSet.getEnforcers(compute, orderByFirstColumn(compute)));
        Assertions.assertTrue(ruleSet.getEnforcers(storage, orderByFirstColumn(storage)).isEmpty());
        Assertions.assertTrue(ruleSet.getEnforcers(compute, PhysicalProperties.ANY).isEmpty());
    }

    @Test
    public void testOnEnforce() {
        Group group = newGroup(EngineType.COMPUTE, 1000);
        PhysicalProperties required = orderByFirstColumn(group);

        PhysicalPlan sort = OrderEnforcer.INSTANCE.onEnforce(required, group);

        Assertions.assertTrue(sort instanceof PhysicalQuickSort);
        Assertions.assertEquals(required.getOrderSpec().getOrderKeys(), ((PhysicalQuickSort) sort).getOrderKeys());
        Assertions.assertEquals(EngineType.COMPUTE, sort.getEngineType());
        Assertions.assertSame(group, ((GroupPlan) sort.child(0)).getGroup());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> OrderEnforcer.INSTANCE.onEnforce(PhysicalProperties.ANY, group));
    }

    @Test
    public void testEnforceCost() {
        Group group = newGroup(EngineType.COMPUTE, 1000);
        Assertions.assertEquals(costModel.sortCost(1000, 3),
                OrderEnforcer.INSTANCE.getEnforceCost(group, orderByFirstColumn(group), costModel).getValue(), 1e-6);
        Assertions.assertTrue(OrderEnforcer.INSTANCE.getEnforceCost(group, orderByFirstColumn(group), costModel)
                .getValue() > 0);

        Group twoRows = newGroup(EngineType.COMPUTE, 2);
        Assertions.assertTrue(OrderEnforcer.INSTANCE.getEnforceCost(twoRows, orderByFirstColumn(twoRows), costModel)
                .getValue() > 0);
    }
}
