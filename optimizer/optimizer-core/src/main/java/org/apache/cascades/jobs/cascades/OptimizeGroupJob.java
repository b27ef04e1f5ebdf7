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
import org.apache.cascades.properties.Enforcer;

import java.util.List;

/**
 * Job to optimize {@link Group} in {@link org.apache.cascades.memo.Memo}.
 * <p>
 * Jobs are popped in reverse push order: natural candidates are costed before the enforcers run,
 * and physical expressions are costed in the order they were inserted.
 */
public class OptimizeGroupJob extends Job {
    private final Group group;

    public OptimizeGroupJob(Group group, JobContext context) {
        super(JobType.OPTIMIZE_PLAN_SET, context);
        this.group = group;
    }

    @Override
    public void execute() {
        context.getCascadesContext().checkCancelled();
        if (group.getLowestCostPlan(context.getRequiredProperties()).isPresent()) {
            return;
        }
        List<Enforcer> enforcers = getRuleSet().getEnforcers(group, context.getRequiredProperties());
        for (int i = enforcers.size() - 1; i >= 0; i--) {
            pushJob(new EnforcePropertyJob(group, enforcers.get(i), context));
        }
        if (!group.isImplemented()) {
            List<GroupExpression> logicalExpressions = group.getLogicalExpressions();
            for (int i = logicalExpressions.size() - 1; i >= 0; i--) {
                pushJob(new OptimizeGroupExpressionJob(logicalExpressions.get(i), context, false));
            }
        }
        List<GroupExpression> physicalExpressions = group.getPhysicalExpressions();
        for (int i = physicalExpressions.size() - 1; i >= 0; i--) {
            pushJob(new CostAndEnforcerJob(physicalExpressions.get(i), context));
        }
        group.setImplemented(true);
        group.setExplored(true);
    }
}
