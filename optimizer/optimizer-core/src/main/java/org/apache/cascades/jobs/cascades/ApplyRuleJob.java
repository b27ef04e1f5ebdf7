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
import org.apache.cascades.memo.CopyInResult;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.memo.Memo;
import org.apache.cascades.pattern.GroupExpressionMatching;
import org.apache.cascades.rules.Rule;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.logical.LogicalPlan;

import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Job to apply rule on {@link GroupExpression}.
 */
public class ApplyRuleJob extends Job {
    private static final Logger LOG = LogManager.getLogger(ApplyRuleJob.class);

    private final GroupExpression groupExpression;
    private final Rule rule;
    private final boolean exploreOnly;

    /**
     * Constructor of ApplyRuleJob.
     *
     * @param groupExpression apply rule on this {@link GroupExpression}
     * @param rule rule to be applied
     * @param context context of current job
     * @param exploreOnly whether the new logical expressions are only explored
     */
    public ApplyRuleJob(GroupExpression groupExpression, Rule rule, JobContext context, boolean exploreOnly) {
        super(JobType.APPLY_RULE, context);
        this.groupExpression = groupExpression;
        this.rule = rule;
        this.exploreOnly = exploreOnly;
    }

    @Override
    public final void execute() {
        if (groupExpression.hasApplied(rule)) {
            return;
        }
        countJobExecutionTimesOfGroupExpressions(groupExpression);

        Memo memo = context.getCascadesContext().getMemo();
        int memoMaxGroupExpressionSize = context.getCascadesContext().getSessionVariable()
                .getMemoMaxGroupExpressionSize();
        List<GroupExpression> newPhysicalExpressions = Lists.newArrayList();
        GroupExpressionMatching groupExpressionMatching = new GroupExpressionMatching(rule.getPattern(),
                groupExpression);
        for (Plan plan : groupExpressionMatching) {
            if (rule.isExploration() && memo.getGroupExpressionsSize() > memoMaxGroupExpressionSize) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("memo holds more than {} group expressions, stop applying {}",
                            memoMaxGroupExpressionSize, rule);
                }
                break;
            }
            List<Plan> newPlans = rule.transform(plan);
            for (Plan newPlan : newPlans) {
                CopyInResult result = memo.copyIn(newPlan, groupExpression.getOwnerGroup());
                if (!result.generateNewExpression) {
                    continue;
                }
                GroupExpression newGroupExpression = result.correspondingExpression;
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{} on {} produced {}", rule, groupExpression, newGroupExpression);
                }
                if (newPlan instanceof LogicalPlan) {
                    pushJob(new OptimizeGroupExpressionJob(newGroupExpression, context, exploreOnly));
                } else {
                    newPhysicalExpressions.add(newGroupExpression);
                }
            }
        }
        // pushed in reverse, so they are costed in insertion order
        for (int i = newPhysicalExpressions.size() - 1; i >= 0; i--) {
            pushJob(new CostAndEnforcerJob(newPhysicalExpressions.get(i), context));
        }
        groupExpression.setApplied(rule);
    }
}
