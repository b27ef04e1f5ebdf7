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

package org.apache.cascades.rules.exploration;

import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.logical.LogicalFilter;
import org.apache.cascades.trees.plans.logical.LogicalGather;
import org.apache.cascades.util.PlanUtils;

/**
 * Push a compute filter into the storage engine, below the gather.
 * input:
 * filter(compute)
 * |
 * gather
 * output:
 * gather
 * |
 * filter(storage)
 */
public class PushDownFilterThroughGather extends OneExplorationRuleFactory {

    @Override
    public Rule build() {
        return logicalFilter(logicalGather())
                .onEngines(EngineType.COMPUTE_ONLY)
                .then(filter -> {
                    LogicalGather gather = (LogicalGather) filter.child(0);
                    LogicalFilter storageFilter = new LogicalFilter(filter.getConjuncts(), EngineType.STORAGE,
                            gather.child(0));
                    return new LogicalGather(storageFilter.withStats(PlanUtils.groupStatistics(filter)));
                })
                .toRule(RuleType.PUSH_DOWN_FILTER_THROUGH_GATHER);
    }
}
