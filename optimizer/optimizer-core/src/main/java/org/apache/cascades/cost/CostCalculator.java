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

import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.physical.PhysicalPlan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Calculate the cost of a physical group expression: the operator cost only, the children's
 * totals are added by the search.
 */
public class CostCalculator {

    private CostCalculator() {
    }

    /**
     * Estimate the operator cost of {@code groupExpression} when chosen for {@code requiredProperties}.
     */
    public static Cost calculateCost(GroupExpression groupExpression, PhysicalProperties requiredProperties,
            CostModel costModel) {
        Preconditions.checkArgument(groupExpression.getPlan() instanceof PhysicalPlan,
                "can only cost a physical expression, but got %s", groupExpression);
        ImmutableList.Builder<Statistics> childrenStatistics = ImmutableList.builder();
        for (Group child : groupExpression.children()) {
            childrenStatistics.add(child.getStatistics());
        }
        Group owner = groupExpression.getOwnerGroup();
        CostContext context = new CostContext((PhysicalPlan) groupExpression.getPlan(), owner.getStatistics(),
                childrenStatistics.build(), owner.getLogicalProperties().getWidth(), requiredProperties);
        return costModel.estimate(context);
    }
}
