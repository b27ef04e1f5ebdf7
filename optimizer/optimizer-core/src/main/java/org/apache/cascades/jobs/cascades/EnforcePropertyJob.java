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

import org.apache.cascades.common.Pair;
import org.apache.cascades.cost.Cost;
import org.apache.cascades.jobs.Job;
import org.apache.cascades.jobs.JobContext;
import org.apache.cascades.jobs.JobType;
import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.Enforcer;
import org.apache.cascades.properties.PhysicalProperties;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Job to satisfy the required properties of a group with an enforcer: optimize the group for the
 * relaxed properties, then offer the enforcer on top of that winner as a candidate.
 */
public class EnforcePropertyJob extends Job {
    private static final Logger LOG = LogManager.getLogger(EnforcePropertyJob.class);

    private final Group group;
    private final Enforcer enforcer;
    private Cost enforceCost;
    private PhysicalProperties childProperties;
    private boolean childOptimized = false;

    public EnforcePropertyJob(Group group, Enforcer enforcer, JobContext context) {
        super(JobType.ENFORCE_PROPERTY, context);
        this.group = group;
        this.enforcer = enforcer;
    }

    @Override
    public void execute() {
        PhysicalProperties requiredProperties = context.getRequiredProperties();
        if (enforceCost == null) {
            enforceCost = enforcer.getEnforceCost(group, requiredProperties,
                    context.getCascadesContext().getCostModel());
            childProperties = enforcer.newProperty(requiredProperties);
        }
        if (enforceCost.getValue() > context.getCostUpperBound()) {
            return;
        }
        Optional<Pair<Cost, GroupExpression>> childWinner = group.getLowestCostPlan(childProperties);
        if (!childWinner.isPresent()) {
            if (childOptimized) {
                return;
            }
            childOptimized = true;
            pushJob(this);
            pushJob(new OptimizeGroupJob(group, new JobContext(context.getCascadesContext(), childProperties,
                    context.getCostUpperBound() - enforceCost.getValue())));
            return;
        }

        Cost totalCost = enforceCost.plus(childWinner.get().first);
        if (totalCost.getValue() > context.getCostUpperBound()) {
            return;
        }
        GroupExpression enforcerExpression = group.addEnforcer(
                new GroupExpression(enforcer.onEnforce(requiredProperties, group), ImmutableList.of(group)));
        enforcerExpression.setCost(enforceCost);
        if (enforcerExpression.updateLowestCostTable(requiredProperties, ImmutableList.of(childProperties),
                totalCost)) {
            enforcerExpression.putOutputPropertiesMap(requiredProperties, requiredProperties.withoutExpectedRowCount());
        }
        if (group.setBestPlan(enforcerExpression, totalCost, requiredProperties)) {
            context.setCostUpperBound(totalCost.getValue());
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} wins {} in group {} at {}", enforcer, requiredProperties, group.getGroupId(), totalCost);
            }
        }
    }
}
