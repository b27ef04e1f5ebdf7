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
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;
import org.apache.cascades.util.Utils;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.Optional;

/**
 * Physical full sort. Also the node the order enforcer puts on top of a group.
 */
public class PhysicalQuickSort extends AbstractPhysicalSort {

    public PhysicalQuickSort(List<OrderKey> orderKeys, EngineType engineType, Plan child) {
        this(orderKeys, engineType, Optional.empty(), Optional.empty(), PhysicalProperties.ANY, Optional.empty(),
                child);
    }

    /**
     * Constructor for PhysicalQuickSort.
     */
    public PhysicalQuickSort(List<OrderKey> orderKeys, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, Plan child) {
        super(PlanType.PHYSICAL_QUICK_SORT, orderKeys, engineType, groupExpression, statistics,
                physicalProperties, cost, child);
    }

    @Override
    protected PhysicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1, "PhysicalQuickSort should have 1 child");
        return new PhysicalQuickSort(orderKeys, engineType, groupExpression, statistics, physicalProperties, cost,
                children.get(0));
    }

    @Override
    public String toString() {
        return Utils.toSqlString("PhysicalQuickSort", "orderKeys", Utils.join(orderKeys), "engine", engineType);
    }
}
