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

package org.apache.cascades;

import org.apache.cascades.common.CancellationHandle;
import org.apache.cascades.common.Pair;
import org.apache.cascades.cost.Cost;
import org.apache.cascades.cost.CostModel;
import org.apache.cascades.cost.DefaultCostModel;
import org.apache.cascades.exceptions.CascadesException;
import org.apache.cascades.exceptions.NoFeasiblePlanException;
import org.apache.cascades.exceptions.OptimizationCancelledException;
import org.apache.cascades.jobs.executor.Optimizer;
import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.qe.SessionVariable;
import org.apache.cascades.rules.RuleSet;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.physical.PhysicalPlan;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Planner to do query plan in cascades style: copy a logical plan into a memo, search it for the
 * cheapest physical plan delivering the required properties and extract that plan.
 * <p>
 * A planner only holds immutable collaborators and can be shared by concurrent compilations.
 */
public class CascadesPlanner {
    private static final Logger LOG = LogManager.getLogger(CascadesPlanner.class);

    private final RuleSet ruleSet;
    private final CostModel costModel;
    private final SessionVariable sessionVariable;

    public CascadesPlanner(RuleSet ruleSet, CostModel costModel, SessionVariable sessionVariable) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet can not be null");
        this.costModel = Objects.requireNonNull(costModel, "costModel can not be null");
        this.sessionVariable = Objects.requireNonNull(sessionVariable, "sessionVariable can not be null");
    }

    /**
     * Planner with the default rules and cost model, tuned by {@code sessionVariable}.
     */
    public static CascadesPlanner create(SessionVariable sessionVariable) {
        return new CascadesPlanner(RuleSet.defaultRuleSet(), new DefaultCostModel(sessionVariable), sessionVariable);
    }

    public CascadesContext newContext(Plan logicalPlan, CancellationHandle cancellationHandle) {
        return CascadesContext.newContext(logicalPlan, ruleSet, costModel, sessionVariable, cancellationHandle);
    }

    /**
     * Find the cheapest physical plan of {@code logicalPlan} that delivers {@code requiredProperties}.
     * Every node of the returned plan carries its total cost, statistics and delivered properties.
     *
     * @throws NoFeasiblePlanException if no plan delivers the required properties
     * @throws OptimizationCancelledException if the handle trips or the time budget runs out
     */
    public PhysicalPlan plan(Plan logicalPlan, PhysicalProperties requiredProperties,
            CancellationHandle cancellationHandle) {
        return plan(newContext(logicalPlan, cancellationHandle), requiredProperties);
    }

    /**
     * Optimize the memo of {@code cascadesContext} for {@code requiredProperties}. The context may be
     * planned several times; winners found earlier are served from the memo.
     */
    public PhysicalPlan plan(CascadesContext cascadesContext, PhysicalProperties requiredProperties) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Start optimize plan for {}", requiredProperties);
        }
        try {
            new Optimizer(cascadesContext).execute(requiredProperties);
            PhysicalPlan physicalPlan = chooseBestPlan(cascadesContext.getMemo().getRoot(), requiredProperties,
                    cascadesContext);
            if (LOG.isDebugEnabled()) {
                LOG.debug("End optimize plan in {}\n{}", cascadesContext.getStopwatch(), physicalPlan.treeString());
            }
            return physicalPlan;
        } catch (OptimizationCancelledException e) {
            LOG.warn("{} after {}", e.getMessage(), cascadesContext.getStopwatch());
            throw e;
        } catch (CascadesException e) {
            LOG.warn("Failed to optimize plan for {}: {}", requiredProperties, e.getMessage());
            if (LOG.isDebugEnabled()) {
                LOG.debug("memo structure:\n{}", cascadesContext.getMemo());
            }
            throw e;
        }
    }

    /**
     * Like {@link #plan(Plan, PhysicalProperties, CancellationHandle)}, but when no plan delivers the
     * required properties and {@value SessionVariable#ENABLE_FALLBACK_TO_ANY_PROPERTY} is set, plan for
     * {@link PhysicalProperties#ANY} instead.
     */
    public PhysicalPlan planWithFallback(Plan logicalPlan, PhysicalProperties requiredProperties,
            CancellationHandle cancellationHandle) {
        CascadesContext cascadesContext = newContext(logicalPlan, cancellationHandle);
        try {
            return plan(cascadesContext, requiredProperties);
        } catch (NoFeasiblePlanException e) {
            if (!sessionVariable.isEnableFallbackToAnyProperty() || requiredProperties.isAny()) {
                throw e;
            }
            LOG.warn("no plan delivers {}, fall back to {}", requiredProperties, PhysicalProperties.ANY);
            return plan(cascadesContext, PhysicalProperties.ANY);
        }
    }

    /**
     * Extract the winner of {@code rootGroup} for {@code physicalProperties} and, recursively, the
     * winners of its children for the properties it requested from them.
     *
     * @throws NoFeasiblePlanException if the root group has no winner
     * @throws OptimizationCancelledException if a search of the context was aborted
     */
    public static PhysicalPlan chooseBestPlan(Group rootGroup, PhysicalProperties physicalProperties,
            CascadesContext cascadesContext) {
        cascadesContext.checkNotAborted();
        Pair<Cost, GroupExpression> winner = rootGroup.getLowestCostPlan(physicalProperties)
                .orElseThrow(() -> new NoFeasiblePlanException(physicalProperties));
        return extract(rootGroup, physicalProperties, winner);
    }

    private static PhysicalPlan extract(Group group, PhysicalProperties physicalProperties,
            Pair<Cost, GroupExpression> winner) {
        GroupExpression groupExpression = winner.second;
        List<PhysicalProperties> inputPropertiesList = groupExpression.getInputPropertiesList(physicalProperties);
        List<Plan> planChildren = Lists.newArrayListWithCapacity(groupExpression.arity());
        for (int i = 0; i < groupExpression.arity(); i++) {
            Group child = groupExpression.child(i);
            PhysicalProperties childProperties = inputPropertiesList.get(i);
            Optional<Pair<Cost, GroupExpression>> childWinner = child.getLowestCostPlan(childProperties);
            Preconditions.checkState(childWinner.isPresent(),
                    "group %s has no winner for %s requested by %s", child.getGroupId(), childProperties,
                    groupExpression);
            planChildren.add(extract(child, childProperties, childWinner.get()));
        }
        Plan plan = groupExpression.getPlan();
        Preconditions.checkState(plan instanceof PhysicalPlan, "Result plan must be PhysicalPlan: %s", plan);
        return ((PhysicalPlan) plan).withChosenPlanInfo(groupExpression.getOutputProperties(physicalProperties),
                group.getStatistics(), winner.first, planChildren);
    }
}
