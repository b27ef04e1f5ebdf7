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

package org.apache.cascades;

import org.apache.cascades.catalog.Index;
import org.apache.cascades.catalog.Table;
import org.apache.cascades.common.CancellationHandle;
import org.apache.cascades.cost.CostModel;
import org.apache.cascades.cost.DefaultCostModel;
import org.apache.cascades.exceptions.NoFeasiblePlanException;
import org.apache.cascades.exceptions.OptimizationCancelledException;
import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.memo.Memo;
import org.apache.cascades.pattern.GroupExpressionMatching;
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.qe.SessionVariable;
import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleSet;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.expressions.AggregateFunction;
import org.apache.cascades.trees.expressions.Alias;
import org.apache.cascades.trees.expressions.ComparisonPredicate;
import org.apache.cascades.trees.expressions.Expression;
import org.apache.cascades.trees.expressions.Literal;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.JoinType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.logical.LogicalAggregate;
import org.apache.cascades.trees.plans.logical.LogicalFilter;
import org.apache.cascades.trees.plans.logical.LogicalGather;
import org.apache.cascades.trees.plans.logical.LogicalJoin;
import org.apache.cascades.trees.plans.logical.LogicalLimit;
import org.apache.cascades.trees.plans.logical.LogicalPlan;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.trees.plans.logical.LogicalTopN;
import org.apache.cascades.trees.plans.physical.PhysicalGather;
import org.apache.cascades.trees.plans.physical.PhysicalHashAggregate;
import org.apache.cascades.trees.plans.physical.PhysicalIndexScan;
import org.apache.cascades.trees.plans.physical.PhysicalLimit;
import org.apache.cascades.trees.plans.physical.PhysicalMergeJoin;
import org.apache.cascades.trees.plans.physical.PhysicalPlan;
import org.apache.cascades.trees.plans.physical.PhysicalQuickSort;
import org.apache.cascades.trees.plans.physical.PhysicalStreamAggregate;
import org.apache.cascades.trees.plans.physical.PhysicalTableScan;
import org.apache.cascades.util.MemoTestUtils;
import org.apache.cascades.types.DataType;
import org.apache.cascades.util.PlanConstructor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

public class CascadesPlannerTest {
    private static final double DELTA = 1e-6;

    private final PlanConstructor planConstructor = new PlanConstructor();
    private final DefaultCostModel costModel = new DefaultCostModel(MemoTestUtils.createSessionVariable());

    private static PhysicalProperties orderBy(SlotReference slot) {
        return PhysicalProperties.ordered(ImmutableList.of(OrderKey.asc(slot)));
    }

    private static double cost(PhysicalPlan plan) {
        return plan.getCost().get().getValue();
    }

    /**
     * t1.a = t2.a over two gathered storage scans of 1000 rows.
     */
    private LogicalJoin joinOnA() {
        LogicalScan t1 = planConstructor.newLogicalScan(planConstructor.newPkTable("t1"), EngineType.STORAGE, 1000);
        LogicalScan t2 = planConstructor.newLogicalScan(planConstructor.newPkTable("t2"), EngineType.STORAGE, 1000);
        List<Expression> conjuncts = ImmutableList.of(
                ComparisonPredicate.equalTo(PlanConstructor.slot(t1, "a"), PlanConstructor.slot(t2, "a")));
        return PlanConstructor.withRows(new LogicalJoin(JoinType.INNER_JOIN, conjuncts, EngineType.COMPUTE,
                PlanConstructor.withRows(new LogicalGather(t1), 1000),
                PlanConstructor.withRows(new LogicalGather(t2), 1000)), 1000);
    }

    /**
     * A compute filter keeping 100 rows over a gather of a storage scan of 1000 rows.
     */
    private LogicalFilter filterOverGather(LogicalScan storageScan) {
        List<Expression> conjuncts = ImmutableList.of(new ComparisonPredicate(ComparisonPredicate.Op.GT,
                PlanConstructor.slot(storageScan, "a"), Literal.of(5)));
        return PlanConstructor.withRows(new LogicalFilter(conjuncts, EngineType.COMPUTE,
                PlanConstructor.withRows(new LogicalGather(storageScan), 1000)), 100);
    }

    @Test
    public void testScanUnderDifferentOrders() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        CascadesPlanner planner = MemoTestUtils.createPlanner();
        CascadesContext cascadesContext = planner.newContext(scan, CancellationHandle.create());
        double scanCost = 1000 * 3;

        PhysicalPlan any = planner.plan(cascadesContext, PhysicalProperties.ANY);
        Assertions.assertTrue(any instanceof PhysicalTableScan);
        Assertions.assertEquals(scanCost, cost(any), DELTA);

        PhysicalProperties byA = orderBy(PlanConstructor.slot(scan, "a"));
        PhysicalPlan sorted = planner.plan(cascadesContext, byA);
        Assertions.assertTrue(sorted instanceof PhysicalQuickSort);
        Assertions.assertTrue(sorted.child(0) instanceof PhysicalTableScan);
        Assertions.assertEquals(scanCost + costModel.sortCost(1000, 3), cost(sorted), DELTA);
        Assertions.assertTrue(sorted.getPhysicalProperties().satisfy(byA));

        PhysicalProperties byPk = orderBy(PlanConstructor.slot(scan, "pk"));
        PhysicalPlan ordered = planner.plan(cascadesContext, byPk);
        Assertions.assertTrue(ordered instanceof PhysicalTableScan);
        Assertions.assertEquals(scanCost, cost(ordered), DELTA);
        Assertions.assertTrue(ordered.getPhysicalProperties().satisfy(byPk));
    }

    @Test
    public void testRepeatedRequestsAreServedFromMemo() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        CascadesPlanner planner = MemoTestUtils.createPlanner();
        CascadesContext cascadesContext = planner.newContext(scan, CancellationHandle.create());
        List<PhysicalProperties> requests = ImmutableList.of(PhysicalProperties.ANY,
                orderBy(PlanConstructor.slot(scan, "a")), orderBy(PlanConstructor.slot(scan, "pk")));
        List<String> firstPlans = Lists.newArrayList();
        for (PhysicalProperties request : requests) {
            firstPlans.add(planner.plan(cascadesContext, request).treeString());
        }
        Memo memo = cascadesContext.getMemo();
        Map<GroupExpression, Integer> counts = MemoTestUtils.jobExecutionCounts(memo);
        int memoSize = memo.getGroupExpressionsSize();

        for (int i = 0; i < requests.size(); i++) {
            Assertions.assertEquals(firstPlans.get(i), planner.plan(cascadesContext, requests.get(i)).treeString());
        }
        Assertions.assertEquals(counts, MemoTestUtils.jobExecutionCounts(memo));
        Assertions.assertEquals(memoSize, memo.getGroupExpressionsSize());
    }

    @Test
    public void testTopNUsesIndexOrder() {
        Table table = planConstructor.newPkTable("t", new Index("idx_a", ImmutableList.of("a")));
        LogicalScan scan = planConstructor.newLogicalScan(table, EngineType.COMPUTE, 1000);
        SlotReference a = PlanConstructor.slot(scan, "a");
        LogicalTopN topN = PlanConstructor.withRows(
                new LogicalTopN(ImmutableList.of(OrderKey.asc(a)), 10, 0, EngineType.COMPUTE, scan), 10);

        PhysicalPlan plan = MemoTestUtils.createPlanner().plan(topN, PhysicalProperties.ANY,
                CancellationHandle.create());

        Assertions.assertTrue(plan instanceof PhysicalLimit, plan.treeString());
        Assertions.assertEquals(ImmutableList.of(OrderKey.asc(a)), ((PhysicalLimit) plan).getOrderKeys());
        Assertions.assertTrue(plan.child(0) instanceof PhysicalIndexScan, plan.treeString());
        // limit reads 10 rows, the index scan stops after 10 rows
        Assertions.assertEquals(10 + 10 * 3 * 1.5, cost(plan), DELTA);
    }

    @Test
    public void testUnboundedLimitAndTopN() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        LogicalLimit limit = PlanConstructor.withRows(
                new LogicalLimit(Long.MAX_VALUE, 1, EngineType.COMPUTE, scan), 999);
        LogicalScan storageScan = planConstructor.newLogicalScan(planConstructor.newPkTable("s"),
                EngineType.STORAGE, 1000);
        LogicalTopN topN = PlanConstructor.withRows(new LogicalTopN(
                ImmutableList.of(OrderKey.asc(PlanConstructor.slot(storageScan, "a"))), Long.MAX_VALUE, 1,
                EngineType.COMPUTE, PlanConstructor.withRows(new LogicalGather(storageScan), 1000)), 999);
        CascadesPlanner planner = MemoTestUtils.createPlanner();

        PhysicalPlan limitPlan = planner.plan(limit, PhysicalProperties.ANY, CancellationHandle.create());
        // the limit reads every row of the scan
        Assertions.assertEquals(1000 * 3 + 1000, cost(limitPlan), DELTA);

        PhysicalPlan topNPlan = planner.plan(topN, PhysicalProperties.ANY, CancellationHandle.create());
        for (Plan node : MemoTestUtils.flatten(topNPlan)) {
            double nodeCost = ((PhysicalPlan) node).getCost().get().getValue();
            Assertions.assertTrue(nodeCost >= 0 && !Double.isInfinite(nodeCost), topNPlan.treeString());
        }
    }

    @Test
    public void testEnforcerStaysInComputeEngine() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.STORAGE, 1000);
        LogicalFilter filter = filterOverGather(scan);
        CascadesPlanner planner = MemoTestUtils.createPlanner();
        CascadesContext cascadesContext = planner.newContext(filter, CancellationHandle.create());

        PhysicalPlan plan = planner.plan(cascadesContext, orderBy(PlanConstructor.slot(scan, "a")));

        Assertions.assertTrue(plan instanceof PhysicalQuickSort, plan.treeString());
        Assertions.assertEquals(EngineType.COMPUTE, plan.getEngineType());
        Plan gather = plan.child(0);
        Assertions.assertTrue(gather instanceof PhysicalGather, plan.treeString());
        // the filter was pushed below the gather, so only 100 rows are shipped and sorted
        for (Plan node : MemoTestUtils.flatten(gather.child(0))) {
            Assertions.assertEquals(EngineType.STORAGE, node.getEngineType(), plan.treeString());
            Assertions.assertFalse(node instanceof PhysicalQuickSort, plan.treeString());
        }
        double expected = 1000 * 3 + 1000 + 100 * 3 * 1.5 + costModel.sortCost(100, 3);
        Assertions.assertEquals(expected, cost(plan), DELTA);

        for (Group group : cascadesContext.getMemo().getGroups()) {
            if (!group.getEnforcers().isEmpty()) {
                Assertions.assertEquals(EngineType.COMPUTE, group.getEngineType());
            }
        }
    }

    @Test
    public void testMergeJoinChildrenAreSortedInComputeEngine() {
        SessionVariable sessionVariable = MemoTestUtils.createSessionVariable();
        sessionVariable.setVar(SessionVariable.DISABLE_OPTIMIZER_RULES,
                RuleType.LOGICAL_JOIN_TO_HASH_JOIN_RULE.name());
        CascadesPlanner planner = CascadesPlanner.create(sessionVariable);
        CascadesContext cascadesContext = planner.newContext(joinOnA(), CancellationHandle.create());

        PhysicalPlan plan = planner.plan(cascadesContext, PhysicalProperties.ANY);

        Assertions.assertTrue(plan instanceof PhysicalMergeJoin, plan.treeString());
        for (Plan child : plan.children()) {
            Assertions.assertTrue(child instanceof PhysicalQuickSort, plan.treeString());
            Assertions.assertEquals(EngineType.COMPUTE, child.getEngineType());
            Assertions.assertTrue(child.child(0) instanceof PhysicalGather, plan.treeString());
            Assertions.assertEquals(EngineType.STORAGE, child.child(0).child(0).getEngineType());
        }

        int groupsWithEnforcers = 0;
        for (Group group : cascadesContext.getMemo().getGroups()) {
            if (!group.getEnforcers().isEmpty()) {
                groupsWithEnforcers++;
                Assertions.assertEquals(EngineType.COMPUTE, group.getEngineType());
            }
        }
        Assertions.assertEquals(2, groupsWithEnforcers);
    }

    @Test
    public void testPlanIsDeterministic() {
        LogicalJoin join = joinOnA();
        CascadesPlanner planner = MemoTestUtils.createPlanner();
        PhysicalPlan first = planner.plan(join, PhysicalProperties.ANY, CancellationHandle.create());
        PhysicalPlan second = planner.plan(join, PhysicalProperties.ANY, CancellationHandle.create());
        Assertions.assertEquals(first.treeString(), second.treeString());
        Assertions.assertEquals(cost(first), cost(second), 0);
    }

    /**
     * {@code select column, count(*) from scan group by column}, one row per input row.
     */
    private LogicalAggregate countBy(LogicalScan scan, String column) {
        Alias count = new Alias(new AggregateFunction("count", ImmutableList.of()),
                planConstructor.newSlot("cnt", DataType.BIGINT));
        return PlanConstructor.withRows(new LogicalAggregate(ImmutableList.of(PlanConstructor.slot(scan, column)),
                ImmutableList.of(count), EngineType.COMPUTE, scan), 1000);
    }

    @Test
    public void testStreamAggregateOverOrderedScan() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        CascadesPlanner planner = MemoTestUtils.createPlanner();

        PhysicalPlan byPk = planner.plan(countBy(scan, "pk"), PhysicalProperties.ANY, CancellationHandle.create());
        Assertions.assertTrue(byPk instanceof PhysicalStreamAggregate, byPk.treeString());
        Assertions.assertTrue(byPk.child(0) instanceof PhysicalTableScan, byPk.treeString());
        // scan 1000 * 3, aggregate 1000
        Assertions.assertEquals(4000, cost(byPk), DELTA);

        PhysicalPlan byA = planner.plan(countBy(scan, "a"), PhysicalProperties.ANY, CancellationHandle.create());
        Assertions.assertTrue(byA instanceof PhysicalHashAggregate, byA.treeString());
        // scan 1000 * 3, aggregate 1000 + 1000 * 2 * 0.5
        Assertions.assertEquals(5000, cost(byA), DELTA);
    }

    @Test
    public void testMemoSizeLimitStopsExploration() {
        SessionVariable sessionVariable = MemoTestUtils.createSessionVariable();
        sessionVariable.setVar(SessionVariable.MEMO_MAX_GROUP_EXPRESSION_SIZE, "1");
        CascadesPlanner planner = CascadesPlanner.create(sessionVariable);
        CascadesContext limited = planner.newContext(joinOnA(), CancellationHandle.create());
        CascadesContext unlimited = MemoTestUtils.createCascadesContext(joinOnA());

        PhysicalPlan plan = planner.plan(limited, PhysicalProperties.ANY);
        MemoTestUtils.createPlanner().plan(unlimited, PhysicalProperties.ANY);

        Assertions.assertNotNull(plan);
        Assertions.assertEquals(1, limited.getMemo().getRoot().getLogicalExpressions().size());
        Assertions.assertEquals(2, unlimited.getMemo().getRoot().getLogicalExpressions().size());
    }

    @Test
    public void testConcurrentCompilationsShareRuleSetAndCostModel() throws Exception {
        LogicalJoin join = joinOnA();
        CascadesPlanner planner = MemoTestUtils.createPlanner();
        String expected = planner.plan(join, PhysicalProperties.ANY, CancellationHandle.create()).treeString();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = Lists.newArrayList();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(
                        () -> planner.plan(join, PhysicalProperties.ANY, CancellationHandle.create()).treeString()));
            }
            for (Future<String> future : futures) {
                Assertions.assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testNoFeasiblePlan() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.STORAGE, 1000);
        PhysicalProperties byA = orderBy(PlanConstructor.slot(scan, "a"));
        CascadesPlanner planner = MemoTestUtils.createPlanner();

        NoFeasiblePlanException exception = Assertions.assertThrows(NoFeasiblePlanException.class,
                () -> planner.plan(scan, byA, CancellationHandle.create()));
        Assertions.assertEquals(byA, exception.getRequiredProperties());
        Assertions.assertThrows(NoFeasiblePlanException.class,
                () -> planner.planWithFallback(scan, byA, CancellationHandle.create()));
    }

    @Test
    public void testFallbackToAnyProperty() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.STORAGE, 1000);
        SessionVariable sessionVariable = MemoTestUtils.createSessionVariable();
        sessionVariable.setVar(SessionVariable.ENABLE_FALLBACK_TO_ANY_PROPERTY, "true");

        PhysicalPlan plan = CascadesPlanner.create(sessionVariable).planWithFallback(scan,
                orderBy(PlanConstructor.slot(scan, "a")), CancellationHandle.create());

        Assertions.assertTrue(plan instanceof PhysicalTableScan);
        Assertions.assertEquals(1000 * 3, cost(plan), DELTA);
    }

    @Test
    public void testCancelledBeforeStart() {
        CancellationHandle handle = CancellationHandle.create();
        handle.cancel("user abort");
        OptimizationCancelledException exception = Assertions.assertThrows(OptimizationCancelledException.class,
                () -> MemoTestUtils.createPlanner().plan(joinOnA(), PhysicalProperties.ANY, handle));
        Assertions.assertTrue(exception.getMessage().contains("user abort"), exception.getMessage());
    }

    @Test
    public void testCancelledDuringSearch() {
        CancellationHandle handle = CancellationHandle.create();
        CostModel cancelling = context -> {
            handle.cancel("user abort");
            return costModel.estimate(context);
        };
        SessionVariable sessionVariable = MemoTestUtils.createSessionVariable();
        CascadesPlanner planner = new CascadesPlanner(RuleSet.defaultRuleSet(), cancelling, sessionVariable);

        Assertions.assertThrows(OptimizationCancelledException.class,
                () -> planner.plan(joinOnA(), PhysicalProperties.ANY, handle));
    }

    @Test
    public void testCancelledContextServesNoPlan() {
        CancellationHandle handle = CancellationHandle.create();
        AtomicReference<CascadesContext> contextHolder = new AtomicReference<>();
        // cancel once the root holds a winner, while other alternatives are still pending
        CostModel cancelling = context -> {
            CascadesContext cascadesContext = contextHolder.get();
            if (cascadesContext.getMemo().getRoot().getLowestCostPlan(PhysicalProperties.ANY).isPresent()) {
                handle.cancel("user abort");
            }
            return costModel.estimate(context);
        };
        CascadesPlanner planner = new CascadesPlanner(RuleSet.defaultRuleSet(), cancelling,
                MemoTestUtils.createSessionVariable());
        CascadesContext cascadesContext = planner.newContext(joinOnA(), handle);
        contextHolder.set(cascadesContext);

        Assertions.assertThrows(OptimizationCancelledException.class,
                () -> planner.plan(cascadesContext, PhysicalProperties.ANY));

        Group root = cascadesContext.getMemo().getRoot();
        Assertions.assertTrue(root.getLowestCostPlan(PhysicalProperties.ANY).isPresent());
        Assertions.assertTrue(cascadesContext.isAborted());
        Assertions.assertTrue(cascadesContext.getJobPool().isEmpty());
        Assertions.assertThrows(OptimizationCancelledException.class,
                () -> CascadesPlanner.chooseBestPlan(root, PhysicalProperties.ANY, cascadesContext));
        OptimizationCancelledException exception = Assertions.assertThrows(OptimizationCancelledException.class,
                () -> planner.plan(cascadesContext, PhysicalProperties.ANY));
        Assertions.assertTrue(exception.getMessage().contains("user abort"), exception.getMessage());
    }

    @Test
    public void testDeadlineOfHandle() {
        SessionVariable sessionVariable = MemoTestUtils.createSessionVariable();
        CascadesPlanner planner = new CascadesPlanner(RuleSet.defaultRuleSet(), slow(costModel), sessionVariable);

        OptimizationCancelledException exception = Assertions.assertThrows(OptimizationCancelledException.class,
                () -> planner.plan(joinOnA(), PhysicalProperties.ANY, CancellationHandle.withTimeout(
                        Duration.ofMillis(1))));
        Assertions.assertTrue(exception.getMessage().contains("deadline"), exception.getMessage());
    }

    @Test
    public void testOptimizerTimeout() {
        SessionVariable sessionVariable = MemoTestUtils.createSessionVariable();
        sessionVariable.setVar(SessionVariable.OPTIMIZER_TIMEOUT_MS, "1");
        CascadesPlanner planner = new CascadesPlanner(RuleSet.defaultRuleSet(), slow(costModel), sessionVariable);

        OptimizationCancelledException exception = Assertions.assertThrows(OptimizationCancelledException.class,
                () -> planner.plan(joinOnA(), PhysicalProperties.ANY, CancellationHandle.create()));
        Assertions.assertTrue(exception.getMessage().contains(SessionVariable.OPTIMIZER_TIMEOUT_MS),
                exception.getMessage());
    }

    @Test
    public void testRuleClosureIsIdempotent() {
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.STORAGE, 1000);
        for (LogicalPlan plan : ImmutableList.<LogicalPlan>of(joinOnA(), filterOverGather(scan))) {
            CascadesContext cascadesContext = MemoTestUtils.createCascadesContext(plan);
            MemoTestUtils.createPlanner().plan(cascadesContext, PhysicalProperties.ANY);
            Memo memo = cascadesContext.getMemo();
            int memoSize = memo.getGroupExpressionsSize();

            for (Group group : memo.getGroups()) {
                for (GroupExpression groupExpression : ImmutableList.copyOf(group.getLogicalExpressions())) {
                    for (Rule rule : cascadesContext.getRuleSet().getRules()) {
                        if (!groupExpression.hasApplied(rule)) {
                            continue;
                        }
                        for (Plan binding : new GroupExpressionMatching(rule.getPattern(),
                                groupExpression)) {
                            for (Plan newPlan : rule.transform(binding)) {
                                Assertions.assertFalse(memo.copyIn(newPlan, group).generateNewExpression,
                                        rule + " produced a new expression " + newPlan);
                            }
                        }
                    }
                }
            }
            Assertions.assertEquals(memoSize, memo.getGroupExpressionsSize());
        }
    }

    @Test
    public void testWinnersAreCheapestCandidates() {
        CascadesContext cascadesContext = MemoTestUtils.createCascadesContext(joinOnA());
        MemoTestUtils.createPlanner().plan(cascadesContext, PhysicalProperties.ANY);

        for (Group group : cascadesContext.getMemo().getGroups()) {
            group.getLowestCosts().forEach((properties, winnerCost) -> {
                List<GroupExpression> candidates = Lists.newArrayList(group.getPhysicalExpressions());
                candidates.addAll(group.getEnforcers());
                for (GroupExpression candidate : candidates) {
                    candidate.getLowestCostTable(properties).ifPresent(costAndInputs ->
                            Assertions.assertTrue(costAndInputs.first.compareTo(winnerCost) >= 0,
                                    candidate + " is cheaper than the winner for " + properties));
                }
            });
        }
    }

    private static CostModel slow(CostModel delegate) {
        return context -> {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return delegate.estimate(context);
        };
    }
}
