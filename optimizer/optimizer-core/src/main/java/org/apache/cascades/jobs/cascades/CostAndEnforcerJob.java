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
import org.apache.cascades.cost.CostCalculator;
import org.apache.cascades.jobs.Job;
import org.apache.cascades.jobs.JobContext;
import org.apache.cascades.jobs.JobType;
import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.ChildOutputPropertyDeriver;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.properties.RequestPropertyDeriver;

import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Job to compute cost and add enforcer.
 * <p>
 * For every alternative of child requests the children are resolved one at a time, the one with
 * the lowest cost lower bound first. A child without a winner is optimized by pushing this job
 * back followed by an {@link OptimizeGroupJob} for the child, so the job resumes where it left off.
 * An alternative is abandoned as soon as its accumulated cost exceeds the upper bound.
 */
public class CostAndEnforcerJob extends Job {
    private static final Logger LOG = LogManager.getLogger(CostAndEnforcerJob.class);

    private final GroupExpression groupExpression;

    // derived on the first run
    private List<List<PhysicalProperties>> requestChildrenPropertiesList;
    private Cost curNodeCost;

    private int requestPropertiesIndex = 0;
    // position in childOrder, -1 before the current alternative is started
    private int curChildIndex = -1;
    // position of the child last sent to be optimized
    private int prevChildIndex = -1;
    private Cost curTotalCost;
    private List<Integer> childOrder;
    private double[] childLowerBounds;
    private PhysicalProperties[] childrenOutputProperties;

    public CostAndEnforcerJob(GroupExpression groupExpression, JobContext context) {
        super(JobType.OPTIMIZE_CHILDREN, context);
        this.groupExpression = groupExpression;
    }

    @Override
    public void execute() {
        PhysicalProperties requiredProperties = context.getRequiredProperties();
        if (requestChildrenPropertiesList == null) {
            countJobExecutionTimesOfGroupExpressions(groupExpression);
            requestChildrenPropertiesList = RequestPropertyDeriver.getRequestChildrenPropertyList(
                    groupExpression, requiredProperties);
            curNodeCost = CostCalculator.calculateCost(groupExpression, requiredProperties,
                    context.getCascadesContext().getCostModel());
            groupExpression.setCost(curNodeCost);
        }

        for (; requestPropertiesIndex < requestChildrenPropertiesList.size(); requestPropertiesIndex++) {
            List<PhysicalProperties> requestChildrenProperties
                    = requestChildrenPropertiesList.get(requestPropertiesIndex);
            if (curChildIndex == -1) {
                startAlternative(requestChildrenProperties);
            }
            for (; curChildIndex < groupExpression.arity(); curChildIndex++) {
                if (curTotalCost.getValue() > context.getCostUpperBound()) {
                    break;
                }
                int childIndex = childOrder.get(curChildIndex);
                PhysicalProperties requestChildProperty = requestChildrenProperties.get(childIndex);
                Group childGroup = groupExpression.child(childIndex);
                Optional<Pair<Cost, GroupExpression>> lowestCostPlanOpt
                        = childGroup.getLowestCostPlan(requestChildProperty);
                if (!lowestCostPlanOpt.isPresent()) {
                    if (prevChildIndex >= curChildIndex) {
                        // the child was optimized and has no plan within the budget
                        break;
                    }
                    prevChildIndex = curChildIndex;
                    pushJob(this);
                    double newCostUpperBound = context.getCostUpperBound() - curTotalCost.getValue()
                            - remainingLowerBound(curChildIndex + 1);
                    JobContext jobContext = new JobContext(context.getCascadesContext(), requestChildProperty,
                            newCostUpperBound);
                    pushJob(new OptimizeGroupJob(childGroup, jobContext));
                    return;
                }
                GroupExpression lowestCostExpr = lowestCostPlanOpt.get().second;
                childrenOutputProperties[childIndex] = lowestCostExpr.getOutputProperties(requestChildProperty);
                curTotalCost = curTotalCost.plus(lowestCostPlanOpt.get().first);
            }
            if (curChildIndex == groupExpression.arity()
                    && curTotalCost.getValue() <= context.getCostUpperBound()) {
                recordCandidate(requestChildrenProperties);
            } else if (LOG.isDebugEnabled()) {
                LOG.debug("prune {} under {}: cost {} exceeds {} or a child has no plan", groupExpression,
                        requiredProperties, curTotalCost, context.getCostUpperBound());
            }
            clear();
        }
    }

    private void startAlternative(List<PhysicalProperties> requestChildrenProperties) {
        int arity = groupExpression.arity();
        childLowerBounds = new double[arity];
        childrenOutputProperties = new PhysicalProperties[arity];
        List<Integer> order = Lists.newArrayListWithCapacity(arity);
        for (int i = 0; i < arity; i++) {
            childLowerBounds[i] = lowerBound(groupExpression.child(i), requestChildrenProperties.get(i));
            order.add(i);
        }
        order.sort(Comparator.comparingDouble(i -> childLowerBounds[i]));
        childOrder = order;
        curTotalCost = curNodeCost;
        curChildIndex = 0;
        prevChildIndex = -1;
    }

    /**
     * Any plan satisfying an order also satisfies ANY, so the ANY winner bounds the cost from below
     * unless the request carries an expected row count, which can make the child cheaper.
     */
    private static double lowerBound(Group child, PhysicalProperties request) {
        if (request.hasExpectedRowCount()) {
            return 0;
        }
        return child.getLowestCostPlan(PhysicalProperties.ANY).map(winner -> winner.first.getValue()).orElse(0.0);
    }

    private double remainingLowerBound(int fromPosition) {
        double sum = 0;
        for (int i = fromPosition; i < childOrder.size(); i++) {
            sum += childLowerBounds[childOrder.get(i)];
        }
        return sum;
    }

    private void recordCandidate(List<PhysicalProperties> requestChildrenProperties) {
        PhysicalProperties requiredProperties = context.getRequiredProperties();
        PhysicalProperties outputProperties = ChildOutputPropertyDeriver.getOutputProperties(groupExpression,
                Arrays.asList(childrenOutputProperties));
        if (!outputProperties.satisfy(requiredProperties)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} delivers {}, not {}", groupExpression, outputProperties, requiredProperties);
            }
            return;
        }
        if (groupExpression.updateLowestCostTable(requiredProperties, requestChildrenProperties, curTotalCost)) {
            groupExpression.putOutputPropertiesMap(requiredProperties, outputProperties);
        }
        if (groupExpression.getOwnerGroup().setBestPlan(groupExpression, curTotalCost, requiredProperties)) {
            context.setCostUpperBound(curTotalCost.getValue());
        }
    }

    private void clear() {
        curChildIndex = -1;
        prevChildIndex = -1;
        childOrder = null;
        childLowerBounds = null;
        childrenOutputProperties = null;
    }
}
