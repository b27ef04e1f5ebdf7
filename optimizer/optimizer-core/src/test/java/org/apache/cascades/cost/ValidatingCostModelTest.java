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

import org.apache.cascades.exceptions.CostModelContractException;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.qe.SessionVariable;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.trees.plans.physical.PhysicalTableScan;
import org.apache.cascades.util.PlanConstructor;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ValidatingCostModelTest {
    private final CostContext context;

    public ValidatingCostModelTest() {
        PlanConstructor planConstructor = new PlanConstructor();
        LogicalScan scan = planConstructor.newLogicalScan(planConstructor.newPkTable("t"), EngineType.COMPUTE, 1000);
        context = new CostContext(new PhysicalTableScan(scan.getTable(), scan.getOutput(), EngineType.COMPUTE),
                Statistics.of(1000), ImmutableList.of(), 3, PhysicalProperties.ANY);
    }

    @Test
    public void testValidEstimatePassesThrough() {
        CostModel rows = costContext -> Cost.of(costContext.getRowCount());
        Assertions.assertEquals(Cost.of(1000), new ValidatingCostModel(rows).estimate(context));
    }

    @Test
    public void testNegativeCost() {
        CostModel negative = costContext -> Cost.of(-1);
        Assertions.assertThrows(CostModelContractException.class,
                () -> new ValidatingCostModel(negative).estimate(context));
    }

    @Test
    public void testNaNCost() {
        CostModel nan = costContext -> Cost.of(Double.NaN);
        Assertions.assertThrows(CostModelContractException.class, () -> new ValidatingCostModel(nan).estimate(context));
    }

    @Test
    public void testMissingCost() {
        CostModel missing = costContext -> null;
        Assertions.assertThrows(CostModelContractException.class,
                () -> new ValidatingCostModel(missing).estimate(context));
    }

    @Test
    public void testCostDecreasingWithRows() {
        CostModel decreasing = costContext -> Cost.of(1_000_000 / costContext.getRowCount());
        CostModelContractException exception = Assertions.assertThrows(CostModelContractException.class,
                () -> new ValidatingCostModel(decreasing).estimate(context));
        Assertions.assertTrue(exception.getMessage().contains("decreases"), exception.getMessage());
    }

    @Test
    public void testDefaultCostModelHonorsContract() {
        CostModel validating = new ValidatingCostModel(new DefaultCostModel(new SessionVariable()));
        Assertions.assertEquals(3000, validating.estimate(context).getValue(), 1e-6);
    }
}
