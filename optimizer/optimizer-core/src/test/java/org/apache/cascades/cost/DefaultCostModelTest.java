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

package org.apache.cascades.cost;

import org.apache.cascades.catalog.Index;
import org.apache.cascades.catalog.Table;
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.qe.SessionVariable;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.Expression;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.trees.plans.physical.PhysicalFilter;
import org.apache.cascades.trees.plans.physical.PhysicalIndexScan;
import org.apache.cascades.trees.plans.physical.PhysicalLimit;
import org.apache.cascades.trees.plans.physical.PhysicalPlan;
import org.apache.cascades.trees.plans.physical.PhysicalTableScan;
import org.apache.cascades.trees.plans.physical.PhysicalTopN;
import org.apache.cascades.util.PlanConstructor;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DefaultCostModelTest {
    private static final double DELTA = 1e-6;

    private final PlanConstructor planConstructor = new PlanConstructor();
    private final DefaultCostModel costModel = new DefaultCostModel(new SessionVariable());
    private Table table;
    private LogicalScan scan;

    @BeforeEach
    public void setUp() {
        table = planConstructor.newPkTable("t", new Index("idx_a", ImmutableList.of("a")));
        scan = planConstructor.newLogicalScan(table, EngineType.COMPUTE, 1000);
    }

    private double estimate(PhysicalPlan plan, double rowCount, PhysicalProperties required, double... childRows) {
        ImmutableList.Builder<Statistics> childrenStatistics = ImmutableList.builder();
        for (double childRowCount : childRows) {
            childrenStatistics.add(Statistics.of(childRowCount));
        }
        return costModel.estimate(new CostContext(plan, Statistics.of(rowCount), childrenStatistics.build(), 3,
                required)).getValue();
    }

    private PhysicalProperties orderBy(String column) {
        return PhysicalProperties.ordered(ImmutableList.of(OrderKey.asc(PlanConstructor.slot(scan, column))));
    }

    @Test
    public void testTableScan() {
        PhysicalTableScan tableScan = new PhysicalTableScan(table, scan.getOutput(), EngineType.COMPUTE);

        Assertions.assertEquals(3000, estimate(tableScan, 1000, PhysicalProperties.ANY), DELTA);
        // a scan in primary key order stops after the expected rows
        Assertions.assertEquals(30, estimate(tableScan, 1000, orderBy("pk").withExpectedRowCount(10)), DELTA);
        Assertions.assertEquals(3000, estimate(tableScan, 1000, orderBy("a").withExpectedRowCount(10)), DELTA);
    }

    @Test
    public void testIndexScan() {
        PhysicalIndexScan indexScan = new PhysicalIndexScan(table, table.getIndexes().get(0), scan.getOutput(),
                EngineType.COMPUTE);

        Assertions.assertEquals(4500, estimate(indexScan, 1000, PhysicalProperties.ANY), DELTA);
        Assertions.assertEquals(45, estimate(indexScan, 1000, orderBy("a").withExpectedRowCount(10)), DELTA);
        Assertions.assertEquals(45, estimate(indexScan, 1000, PhysicalProperties.ANY.withExpectedRowCount(10)), DELTA);
        Assertions.assertEquals(4500, estimate(indexScan, 1000, orderBy("b").withExpectedRowCount(10)), DELTA);
    }

    @Test
    public void testLimitAndFilter() {
        PhysicalTableScan tableScan = new PhysicalTableScan(table, scan.getOutput(), EngineType.COMPUTE);
        PhysicalLimit limit = new PhysicalLimit(10, 5, EngineType.COMPUTE, tableScan);
        PhysicalFilter filter = new PhysicalFilter(ImmutableList.<Expression>of(), EngineType.COMPUTE, tableScan);

        Assertions.assertEquals(15, estimate(limit, 10, PhysicalProperties.ANY, 1000), DELTA);
        Assertions.assertEquals(8, estimate(limit, 8, PhysicalProperties.ANY, 8), DELTA);
        Assertions.assertEquals(1000, estimate(filter, 100, PhysicalProperties.ANY, 1000), DELTA);
    }

    @Test
    public void testUnboundedLimit() {
        PhysicalTableScan tableScan = new PhysicalTableScan(table, scan.getOutput(), EngineType.COMPUTE);
        PhysicalLimit limit = new PhysicalLimit(Long.MAX_VALUE, 1, EngineType.COMPUTE, tableScan);
        PhysicalTopN topN = new PhysicalTopN(ImmutableList.of(OrderKey.asc(PlanConstructor.slot(scan, "a"))),
                Long.MAX_VALUE, 1, EngineType.COMPUTE, tableScan);

        Assertions.assertEquals(1000, estimate(limit, 1000, PhysicalProperties.ANY, 1000), DELTA);
        // input * log2(input) + input * width * memory factor
        Assertions.assertEquals(1000 * Math.log(1000) / Math.log(2) + 1000 * 3 * 0.5,
                estimate(topN, 1000, PhysicalProperties.ANY, 1000), DELTA);
    }

    @Test
    public void testSortCost() {
        Assertions.assertEquals(0, costModel.sortCost(0, 3), DELTA);
        Assertions.assertEquals(0, costModel.sortCost(1, 3), DELTA);
        // 2 * log2(2) * 3 + 2 * 3 * 0.5
        Assertions.assertEquals(9, costModel.sortCost(2, 3), DELTA);
        Assertions.assertTrue(costModel.sortCost(2000, 3) > costModel.sortCost(1000, 3));
    }

    @Test
    public void testFactorsFromSessionVariable() {
        SessionVariable sessionVariable = new SessionVariable();
        sessionVariable.setVar(SessionVariable.CPU_COST_FACTOR, "2");
        DefaultCostModel expensiveCpu = new DefaultCostModel(sessionVariable);
        PhysicalTableScan tableScan = new PhysicalTableScan(table, scan.getOutput(), EngineType.COMPUTE);
        PhysicalFilter filter = new PhysicalFilter(ImmutableList.<Expression>of(), EngineType.COMPUTE, tableScan);

        Assertions.assertEquals(2000, expensiveCpu.estimate(new CostContext(filter, Statistics.of(100),
                ImmutableList.of(Statistics.of(1000)), 3, PhysicalProperties.ANY)).getValue(), DELTA);
    }
}
