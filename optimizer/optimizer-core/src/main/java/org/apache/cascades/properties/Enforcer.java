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

import org.apache.cascades.cost.Cost;
import org.apache.cascades.cost.CostModel;
import org.apache.cascades.memo.Group;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.physical.PhysicalPlan;

/**
 * Adds a physical operator on top of a group's best plan so that the result delivers a property
 * no plan of the group delivers by itself.
 */
public interface Enforcer {

    /**
     * The only engine whose groups this enforcer may be placed on.
     */
    EngineType getEngineType();

    boolean isApplicable(PhysicalProperties requiredProperties);

    /**
     * The relaxed properties the group is optimized for below the enforcer.
     */
    PhysicalProperties newProperty(PhysicalProperties requiredProperties);

    /**
     * Build the enforcer operator over {@code childGroup}.
     */
    PhysicalPlan onEnforce(PhysicalProperties requiredProperties, Group childGroup);

    Cost getEnforceCost(Group group, PhysicalProperties requiredProperties, CostModel costModel);
}
