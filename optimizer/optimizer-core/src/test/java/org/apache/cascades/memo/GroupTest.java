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

package org.apache.cascades.memo;

import org.apache.cascades.cost.Cost;
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.trees.plans.physical.PhysicalQuickSort;
import org.apache.cascades.trees.plans.physical.PhysicalTableScan;
import org.apache.cascades.util.PlanConstructor;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class GroupTest {
    private final PlanConstructor planConstructor = new PlanConstructor();
    private LogicalScan scan;
    private Memo memo;
    private Group group;

    @BeforeEach
    public void setUp() {
        scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        memo = new Memo(scan);
        group = memo.getRoot();
    }

    @Test
    public void testBestPlanOnlyReplacedByCheaper() {
        GroupExpression first = memo.copyIn(new PhysicalTableScan(scan.getTable(), scan.getOutput(),
                EngineType.COMPUTE), group).correspondingExpression;
        GroupExpression second = group.getFirstLogicalExpression();

        Assertions.assertFalse(group.getLowestCostPlan(PhysicalProperties.ANY).isPresent());
        Assertions.assertTrue(group.setBestPlan(first, Cost.of(10), PhysicalProperties.ANY));
        // ties keep the first winner
        Assertions.assertFalse(group.setBestPlan(second, Cost.of(10), PhysicalProperties.ANY));
        Assertions.assertSame(first, group.getLowestCostPlan(PhysicalProperties.ANY).get().second);
        Assertions.assertFalse(group.setBestPlan(second, Cost.of(11), PhysicalProperties.ANY));
        Assertions.assertTrue(group.setBestPlan(second, Cost.of(5), PhysicalProperties.ANY));
        Assertions.assertSame(second, group.getLowestCostPlan(PhysicalProperties.ANY).get().second);
        Assertions.assertEquals(Cost.of(5), group.getLowestCosts().get(PhysicalProperties.ANY));
        Assertions.assertEquals(ImmutableList.of(PhysicalProperties.ANY), group.getAllProperties());
    }

    @Test
    public void testWinnersAreKeptPerProperties() {
        GroupExpression expression = group.getFirstLogicalExpression();
        SlotReference a = PlanConstructor.slot(scan, "a");
        PhysicalProperties byA = PhysicalProperties.ordered(ImmutableList.of(OrderKey.asc(a)));

        group.setBestPlan(expression, Cost.of(10), PhysicalProperties.ANY);

        Assertions.assertFalse(group.getLowestCostPlan(byA).isPresent());
        Assertions.assertFalse(group.getLowestCostPlan(byA.withExpectedRowCount(10)).isPresent());
        Assertions.assertFalse(group.getLowestCostPlan(null).isPresent());
    }

    @Test
    public void testEnforcersAreDeduplicated() {
        SlotReference a = PlanConstructor.slot(scan, "a");
        GroupExpression first = group.addEnforcer(new GroupExpression(
                new PhysicalQuickSort(ImmutableList.of(OrderKey.asc(a)), EngineType.COMPUTE, new GroupPlan(group)),
                ImmutableList.of(group)));
        GroupExpression second = group.addEnforcer(new GroupExpression(
                new PhysicalQuickSort(ImmutableList.of(OrderKey.asc(a)), EngineType.COMPUTE, new GroupPlan(group)),
                ImmutableList.of(group)));

        Assertions.assertSame(first, second);
        Assertions.assertSame(group, first.getOwnerGroup());
        Assertions.assertSame(group, first.child(0));
        Assertions.assertEquals(1, group.getEnforcers().size());
        Assertions.assertTrue(group.getPhysicalExpressions().isEmpty());
    }
}
