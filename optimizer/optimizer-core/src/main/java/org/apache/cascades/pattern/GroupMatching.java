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

package org.apache.cascades.pattern;

import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.Plan;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Get all pattern matching subtree in query plan from a group.
 */
public class GroupMatching {

    private GroupMatching() {
    }

    /**
     * Bind {@code pattern} against every logical expression of {@code group}.
     */
    public static List<Plan> getAllMatchingPlans(Pattern pattern, Group group) {
        if (pattern.isGroup()) {
            return ImmutableList.of(new GroupPlan(group));
        }
        ImmutableList.Builder<Plan> matchingPlans = ImmutableList.builder();
        // copy, the group may grow while the bindings are used
        for (GroupExpression groupExpression : ImmutableList.copyOf(group.getLogicalExpressions())) {
            for (Plan plan : new GroupExpressionMatching(pattern, groupExpression)) {
                matchingPlans.add(plan);
            }
        }
        return matchingPlans.build();
    }
}
