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

package org.apache.cascades.pattern;

import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.memo.Memo;
import org.apache.cascades.trees.expressions.ComparisonPredicate;
import org.apache.cascades.trees.expressions.Expression;
import org.apache.cascades.trees.expressions.Literal;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.logical.LogicalFilter;
import org.apache.cascades.trees.plans.logical.LogicalProject;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.trees.plans.physical.PhysicalTableScan;
import org.apache.cascades.util.PlanConstructor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class GroupExpressionMatchingTest implements Patterns {
    private LogicalScan scan;
    private Memo memo;

    @BeforeEach
    public void setUp() {
        PlanConstructor planConstructor = new PlanConstructor();
        scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        LogicalProject project = PlanConstructor.withRows(
                new LogicalProject(scan.getOutput(), EngineType.COMPUTE, scan), 1000);
        memo = new Memo(PlanConstructor.withRows(new LogicalFilter(greaterThan(1), EngineType.COMPUTE, project), 100));
    }

    private List<Expression> greaterThan(int value) {
        return ImmutableList.of(new ComparisonPredicate(ComparisonPredicate.Op.GT,
                PlanConstructor.slot(scan, "a"), Literal.of(value)));
    }

    private List<Plan> bind(PatternDescriptor<? extends Plan> descriptor, GroupExpression groupExpression) {
        return Lists.newArrayList(new GroupExpressionMatching(descriptor.pattern, groupExpression));
    }

    private GroupExpression rootExpression() {
        return memo.getRoot().getFirstLogicalExpression();
    }

    private Group projectGroup() {
        return rootExpression().child(0);
    }

    private Group scanGroup() {
        return projectGroup().getFirstLogicalExpression().child(0);
    }

    @Test
    public void testLeafPatternKeepsChildGroups() {
        List<Plan> bindings = bind(logicalFilter(), rootExpression());

        Assertions.assertEquals(1, bindings.size());
        Assertions.assertTrue(bindings.get(0).child(0) instanceof GroupPlan);
        Assertions.assertSame(projectGroup(), ((GroupPlan) bindings.get(0).child(0)).getGroup());
    }

    @Test
    public void testNestedPattern() {
        List<Plan> bindings = bind(logicalFilter(logicalProject()), rootExpression());

        Assertions.assertEquals(1, bindings.size());
        Plan project = bindings.get(0).child(0);
        Assertions.assertTrue(project instanceof LogicalProject);
        Assertions.assertTrue(project.child(0) instanceof GroupPlan);
        Assertions.assertSame(rootExpression(), bindings.get(0).getGroupExpression().get());

        Assertions.assertTrue(bind(logicalFilter(logicalScan()), rootExpression()).isEmpty());
    }

    @Test
    public void testEveryLogicalExpressionOfChildGroupIsBound() {
        LogicalFilter filterOverScan = new LogicalFilter(greaterThan(2), EngineType.COMPUTE,
                new GroupPlan(scanGroup()));
        Assertions.assertTrue(memo.copyIn(filterOverScan, projectGroup()).generateNewExpression);

        Assertions.assertEquals(2, bind(logicalFilter(any()), rootExpression()).size());
        Assertions.assertEquals(1, bind(logicalFilter(logicalProject()), rootExpression()).size());
        Assertions.assertEquals(1, bind(logicalFilter(logicalFilter()), rootExpression()).size());
    }

    @Test
    public void testPredicatesAndEngines() {
        Assertions.assertTrue(bind(logicalFilter().when(filter -> filter.getConjuncts().size() > 1),
                rootExpression()).isEmpty());
        Assertions.assertEquals(1, bind(logicalFilter().when(filter -> filter.getConjuncts().size() == 1),
                rootExpression()).size());
        Assertions.assertTrue(bind(logicalFilter().onEngines(ImmutableSet.of(EngineType.STORAGE)),
                rootExpression()).isEmpty());
    }

    @Test
    public void testPhysicalExpressionsAreNotBound() {
        Group scanGroup = scanGroup();
        GroupExpression physicalScan = memo.copyIn(new PhysicalTableScan(scan.getTable(), scan.getOutput(),
                EngineType.COMPUTE), scanGroup).correspondingExpression;

        Assertions.assertTrue(bind(any(), physicalScan).isEmpty());
        Assertions.assertEquals(1, GroupMatching.getAllMatchingPlans(any().pattern, scanGroup).size());
        Assertions.assertEquals(1, GroupMatching.getAllMatchingPlans(group().pattern, scanGroup).size());
    }
}
