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

import org.apache.cascades.catalog.Table;
import org.apache.cascades.trees.expressions.ComparisonPredicate;
import org.apache.cascades.trees.expressions.Expression;
import org.apache.cascades.trees.expressions.Literal;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.JoinType;
import org.apache.cascades.trees.plans.logical.LogicalFilter;
import org.apache.cascades.trees.plans.logical.LogicalJoin;
import org.apache.cascades.trees.plans.logical.LogicalProject;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.trees.plans.physical.PhysicalTableScan;
import org.apache.cascades.util.PlanConstructor;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class MemoTest {
    private final PlanConstructor planConstructor = new PlanConstructor();

    private List<Expression> greaterThan(LogicalScan scan, int value) {
        return ImmutableList.of(new ComparisonPredicate(ComparisonPredicate.Op.GT,
                PlanConstructor.slot(scan, "a"), Literal.of(value)));
    }

    @Test
    public void testInitMemo() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        LogicalFilter filter = PlanConstructor.withRows(
                new LogicalFilter(greaterThan(scan, 1), EngineType.COMPUTE, scan), 100);

        Memo memo = new Memo(filter);

        Assertions.assertEquals(2, memo.getGroups().size());
        Assertions.assertEquals(2, memo.getGroupExpressionsSize());
        Group root = memo.getRoot();
        Assertions.assertEquals(100, root.getStatistics().getRowCount());
        Assertions.assertEquals(EngineType.COMPUTE, root.getEngineType());
        GroupExpression rootExpression = root.getFirstLogicalExpression();
        Assertions.assertTrue(rootExpression.getPlan().child(0) instanceof GroupPlan);
        Assertions.assertEquals(1000, rootExpression.child(0).getStatistics().getRowCount());
        Assertions.assertSame(root, rootExpression.getOwnerGroup());
    }

    @Test
    public void testIdenticalSubtreesShareOneGroup() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        LogicalJoin join = PlanConstructor.withRows(
                new LogicalJoin(JoinType.CROSS_JOIN, ImmutableList.of(), EngineType.COMPUTE, scan, scan), 1000000);

        Memo memo = new Memo(join);

        Assertions.assertEquals(2, memo.getGroups().size());
        GroupExpression rootExpression = memo.getRoot().getFirstLogicalExpression();
        Assertions.assertSame(rootExpression.child(0), rootExpression.child(1));
    }

    @Test
    public void testCopyInTargetGroup() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        Memo memo = new Memo(PlanConstructor.withRows(
                new LogicalFilter(greaterThan(scan, 1), EngineType.COMPUTE, scan), 100));
        Group root = memo.getRoot();
        Group scanGroup = root.getFirstLogicalExpression().child(0);
        LogicalFilter other = new LogicalFilter(greaterThan(scan, 2), EngineType.COMPUTE, new GroupPlan(scanGroup));

        CopyInResult first = memo.copyIn(other, root);
        Assertions.assertTrue(first.generateNewExpression);
        Assertions.assertSame(root, first.correspondingExpression.getOwnerGroup());
        Assertions.assertEquals(2, root.getLogicalExpressions().size());

        CopyInResult second = memo.copyIn(other, root);
        Assertions.assertFalse(second.generateNewExpression);
        Assertions.assertSame(first.correspondingExpression, second.correspondingExpression);
        Assertions.assertEquals(2, root.getLogicalExpressions().size());
    }

    @Test
    public void testCopyInPhysicalPlan() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        Memo memo = new Memo(scan);

        CopyInResult result = memo.copyIn(new PhysicalTableScan(scan.getTable(), scan.getOutput(),
                EngineType.COMPUTE), memo.getRoot());

        Assertions.assertTrue(result.generateNewExpression);
        Assertions.assertEquals(1, memo.getRoot().getPhysicalExpressions().size());
        Assertions.assertEquals(1, memo.getRoot().getLogicalExpressions().size());
    }

    @Test
    public void testGroupsAreNeverMerged() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        LogicalProject project = PlanConstructor.withRows(
                new LogicalProject(scan.getOutput(), EngineType.COMPUTE, scan), 1000);
        Memo memo = new Memo(project);
        Group root = memo.getRoot();
        Group scanGroup = root.getFirstLogicalExpression().child(0);

        // same output as the project, but already present in the scan group
        LogicalScan sameScan = new LogicalScan(scan.getTable(), scan.getOutput(), EngineType.COMPUTE);
        CopyInResult result = memo.copyIn(sameScan, root);

        Assertions.assertFalse(result.generateNewExpression);
        Assertions.assertSame(scanGroup, result.correspondingExpression.getOwnerGroup());
        Assertions.assertEquals(1, root.getLogicalExpressions().size());
        Assertions.assertEquals(2, memo.getGroups().size());
    }

    @Test
    public void testNewGroupNeedsStatistics() {
        Table table = planConstructor.newPkTable("t");
        LogicalScan scan = planConstructor.newLogicalScan(table, EngineType.COMPUTE, 1000);
        LogicalScan withoutStats = new LogicalScan(table, scan.getOutput(), EngineType.COMPUTE);

        Assertions.assertThrows(IllegalArgumentException.class, () -> new Memo(withoutStats));
    }

    @Test
    public void testEngineOfTargetGroupIsChecked() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        Memo memo = new Memo(scan);
        PhysicalTableScan storageScan = new PhysicalTableScan(scan.getTable(), scan.getOutput(), EngineType.STORAGE);

        Assertions.assertThrows(IllegalStateException.class, () -> memo.copyIn(storageScan, memo.getRoot()));
    }
}
