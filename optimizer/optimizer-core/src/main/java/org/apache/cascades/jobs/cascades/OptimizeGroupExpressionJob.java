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

package org.apache.cascades.jobs.cascades;

import org.apache.cascades.jobs.Job;
import org.apache.cascades.jobs.JobContext;
import org.apache.cascades.jobs.JobType;
import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.pattern.Pattern;
import org.apache.cascades.rules.Rule;

import com.google.common.collect.Lists;

import java.util.List;

/**
 * Job to optimize {@link GroupExpression} in {@link org.apache.cascades.memo.Memo}.
 * <p>
 * Schedules the applicable rules, and before them the exploration of every child group some rule
 * has to look into.
 */
public class OptimizeGroupExpressionJob extends Job {
    private final GroupExpression groupExpression;
    private final boolean exploreOnly;

    public OptimizeGroupExpressionJob(GroupExpression groupExpression, JobContext context, boolean exploreOnly) {
        super(JobType.OPTIMIZE_PLAN, context);
        this.groupExpression = groupExpression;
        this.exploreOnly = exploreOnly;
    }

    @Override
    public void execute() {
        countJobExecutionTimesOfGroupExpressions(groupExpression);
        List<Rule> rules = getRuleSet().getApplicableRules(groupExpression, exploreOnly, getDisabledRules());
        for (int i = rules.size() - 1; i >= 0; i--) {
            pushJob(new ApplyRuleJob(groupExpression, rules.get(i), context, exploreOnly));
        }

        List<Group> childrenToExplore = Lists.newArrayList();
        for (Rule rule : rules) {
            Pattern pattern = rule.getPattern();
            for (int i = 0; i < pattern.arity() && i < groupExpression.arity(); i++) {
                Group child = groupExpression.child(i);
                if (!pattern.child(i).isGroup() && !child.isExplored() && !containsGroup(childrenToExplore, child)) {
                    childrenToExplore.add(child);
                }
            }
        }
        for (int i = childrenToExplore.size() - 1; i >= 0; i--) {
            pushJob(new ExploreGroupJob(childrenToExplore.get(i), context));
        }
    }

    private static boolean containsGroup(List<Group> groups, Group group) {
        for (Group g : groups) {
            if (g == group) {
                return true;
            }
        }
        return false;
    }
}
