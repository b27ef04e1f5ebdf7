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

package org.apache.cascades.util;

import org.apache.cascades.CascadesContext;
import org.apache.cascades.CascadesPlanner;
import org.apache.cascades.common.CancellationHandle;
import org.apache.cascades.cost.DefaultCostModel;
import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.memo.Memo;
import org.apache.cascades.qe.SessionVariable;
import org.apache.cascades.rules.RuleSet;
import org.apache.cascades.trees.plans.Plan;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utils to create memos, contexts and planners in tests.
 */
public class MemoTestUtils {

    private MemoTestUtils() {
    }

    /**
     * Session variables for tests: cost model validation on, no time budget.
     */
    public static SessionVariable createSessionVariable() {
        SessionVariable sessionVariable = new SessionVariable();
        sessionVariable.setVar(SessionVariable.ENABLE_COST_MODEL_VALIDATION, "true");
        sessionVariable.setVar(SessionVariable.OPTIMIZER_TIMEOUT_MS, "0");
        return sessionVariable;
    }

    public static CascadesPlanner createPlanner() {
        return CascadesPlanner.create(createSessionVariable());
    }

    public static CascadesContext createCascadesContext(Plan plan) {
        SessionVariable sessionVariable = createSessionVariable();
        return CascadesContext.newContext(plan, RuleSet.defaultRuleSet(), new DefaultCostModel(sessionVariable),
                sessionVariable, CancellationHandle.create());
    }

    /**
     * Every node of a plan tree, pre-order.
     */
    public static List<Plan> flatten(Plan plan) {
        List<Plan> nodes = Lists.newArrayList();
        collect(plan, nodes);
        return nodes;
    }

    private static void collect(Plan plan, List<Plan> nodes) {
        nodes.add(plan);
        for (Plan child : plan.children()) {
            collect(child, nodes);
        }
    }

    /**
     * Every group expression of the memo, enforcers included.
     */
    public static List<GroupExpression> allGroupExpressions(Memo memo) {
        ImmutableList.Builder<GroupExpression> groupExpressions = ImmutableList.builder();
        for (Group group : memo.getGroups()) {
            groupExpressions.addAll(group.getLogicalExpressions());
            groupExpressions.addAll(group.getPhysicalExpressions());
            groupExpressions.addAll(group.getEnforcers());
        }
        return groupExpressions.build();
    }

    /**
     * Snapshot of how many jobs ran on each group expression.
     */
    public static Map<GroupExpression, Integer> jobExecutionCounts(Memo memo) {
        Map<GroupExpression, Integer> counts = new IdentityHashMap<>();
        for (GroupExpression groupExpression : allGroupExpressions(memo)) {
            counts.put(groupExpression, groupExpression.getJobExecutionCount());
        }
        return counts;
    }
}
