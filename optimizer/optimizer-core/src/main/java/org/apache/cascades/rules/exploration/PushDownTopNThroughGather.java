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

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.logical.LogicalGather;
import org.apache.cascades.trees.plans.logical.LogicalTopN;
import org.apache.cascades.util.PlanUtils;

import com.google.common.math.LongMath;

/**
 * Push a partial top-n into the storage engine, the compute top-n stays on top.
 * input:
 * topN(limit, offset)
 * |
 * gather
 * output:
 * topN(limit, offset)
 * |
 * gather
 * |
 * topN(limit + offset, 0, storage)
 */
public class PushDownTopNThroughGather extends OneExplorationRuleFactory {

    @Override
    public Rule build() {
        return logicalTopN(logicalGather())
                .onEngines(EngineType.COMPUTE_ONLY)
                .when(topN -> !hasTopNBelow((LogicalGather) topN.child(0)))
                .then(topN -> {
                    LogicalGather gather = (LogicalGather) topN.child(0);
                    long limit = LongMath.saturatedAdd(topN.getLimit(), topN.getOffset());
                    Statistics gatherStats = PlanUtils.groupStatistics(gather);
                    Statistics pushedStats = gatherStats.withRowCount(Math.min(gatherStats.getRowCount(), limit));
                    LogicalTopN storageTopN = new LogicalTopN(topN.getOrderKeys(), limit, 0,
                            EngineType.STORAGE, gather.child(0));
                    LogicalGather newGather = new LogicalGather(storageTopN.withStats(pushedStats));
                    return new LogicalTopN(topN.getOrderKeys(), topN.getLimit(), topN.getOffset(),
                            topN.getEngineType(), newGather.withStats(pushedStats));
                })
                .toRule(RuleType.PUSH_DOWN_TOP_N_THROUGH_GATHER);
    }

    // the input of the gather is already a pushed top-n
    private static boolean hasTopNBelow(LogicalGather gather) {
        Plan child = gather.child(0);
        if (!(child instanceof GroupPlan)) {
            return child instanceof LogicalTopN;
        }
        for (GroupExpression groupExpression : ((GroupPlan) child).getGroup().getLogicalExpressions()) {
            if (groupExpression.getPlan() instanceof LogicalTopN) {
                return true;
            }
        }
        return false;
    }
}
