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

package org.apache.cascades.rules.implementation;

import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.physical.PhysicalQuickSort;

/**
 * Implementation rule that convert logical sort to physical sort.
 */
public class LogicalSortToPhysicalQuickSort extends OneImplementationRuleFactory {
    @Override
    public Rule build() {
        return logicalSort()
                .onEngines(EngineType.COMPUTE_ONLY)
                .then(sort -> new PhysicalQuickSort(sort.getOrderKeys(), sort.getEngineType(), sort.child(0)))
                .toRule(RuleType.LOGICAL_SORT_TO_PHYSICAL_QUICK_SORT_RULE);
    }
}
