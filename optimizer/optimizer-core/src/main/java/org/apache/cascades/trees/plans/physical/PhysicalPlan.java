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
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.Plan;

import java.util.List;
import java.util.Optional;

/**
 * interface for all physical plan.
 */
public interface PhysicalPlan extends Plan {

    /**
     * The properties this plan was chosen for. {@link PhysicalProperties#ANY} until the plan is
     * extracted from the memo.
     */
    PhysicalProperties getPhysicalProperties();

    /**
     * Total cost of the subtree rooted at this node, present only on extracted plans.
     */
    Optional<Cost> getCost();

    /**
     * Annotate a plan chosen out of the memo with its properties, group statistics, total cost and
     * its chosen children.
     */
    PhysicalPlan withChosenPlanInfo(PhysicalProperties physicalProperties, Statistics statistics,
            Cost cost, List<Plan> children);
}
