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

package org.apache.cascades.memo;

import org.apache.cascades.common.Pair;
import org.apache.cascades.cost.Cost;
import org.apache.cascades.properties.LogicalProperties;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.EngineType;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Optional;

/**
 * Representation for group in cascades optimizer.
 */
public class Group {
    private static final Logger LOG = LogManager.getLogger(Group.class);

    private final GroupId groupId;

    private final List<GroupExpression> logicalExpressions = Lists.newArrayList();
    private final List<GroupExpression> physicalExpressions = Lists.newArrayList();
    // enforcers are kept out of physicalExpressions, their only child is this group itself
    private final Map<GroupExpression, GroupExpression> enforcers = Maps.newLinkedHashMap();

    private final LogicalProperties logicalProperties;
    private final Statistics statistics;
    private final EngineType engineType;

    // Map of cost lower bounds
    // Map required plan props to cost lower bound of corresponding plan
    private final Map<PhysicalProperties, Pair<Cost, GroupExpression>> lowestCostPlans = Maps.newLinkedHashMap();

    // exploration rules were scheduled on every logical expression
    private boolean isExplored = false;
    // implementation rules were scheduled on every logical expression
    private boolean isImplemented = false;

    /**
     * Constructor for Group.
     *
     * @param groupExpression first {@link GroupExpression} in this Group
     */
    public Group(GroupId groupId, GroupExpression groupExpression, LogicalProperties logicalProperties,
            Statistics statistics, EngineType engineType) {
        this.groupId = Objects.requireNonNull(groupId, "groupId can not be null");
        this.logicalProperties = Objects.requireNonNull(logicalProperties, "logicalProperties can not be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics can not be null");
        this.engineType = Objects.requireNonNull(engineType, "engineType can not be null");
        addGroupExpression(groupExpression);
    }

    public GroupId getGroupId() {
        return groupId;
    }

    /**
     * Add new {@link GroupExpression} into this group.
     *
     * @param groupExpression {@link GroupExpression} to be added
     * @return added {@link GroupExpression}
     */
    public GroupExpression addGroupExpression(GroupExpression groupExpression) {
        if (groupExpression.isLogical()) {
            logicalExpressions.add(groupExpression);
        } else {
            physicalExpressions.add(groupExpression);
        }
        groupExpression.setOwnerGroup(this);
        return groupExpression;
    }

    public List<GroupExpression> getLogicalExpressions() {
        return logicalExpressions;
    }

    public GroupExpression getFirstLogicalExpression() {
        Preconditions.checkArgument(!logicalExpressions.isEmpty(),
                "There should be more than one Logical Expression in Group");
        return logicalExpressions.get(0);
    }

    public List<GroupExpression> getPhysicalExpressions() {
        return physicalExpressions;
    }

    /**
     * Register an enforcer expression. An equal enforcer registered earlier is kept and returned.
     */
    public GroupExpression addEnforcer(GroupExpression enforcer) {
        GroupExpression existing = enforcers.get(enforcer);
        if (existing != null) {
            return existing;
        }
        enforcer.setOwnerGroup(this);
        enforcers.put(enforcer, enforcer);
        return enforcer;
    }

    public List<GroupExpression> getEnforcers() {
        return ImmutableList.copyOf(enforcers.keySet());
    }

    public List<PhysicalProperties> getAllProperties() {
        return ImmutableList.copyOf(lowestCostPlans.keySet());
    }

    /**
     * Get the lowest cost {@link org.apache.cascades.trees.plans.physical.PhysicalPlan}
     * which meeting the physical property constraints in this Group.
     *
     * @param physicalProperties the physical property constraints
     * @return {@link Optional} of cost and {@link GroupExpression} of physical plan pair.
     */
    public Optional<Pair<Cost, GroupExpression>> getLowestCostPlan(PhysicalProperties physicalProperties) {
        if (physicalProperties == null || lowestCostPlans.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(lowestCostPlans.get(physicalProperties));
    }

    public Map<PhysicalProperties, Cost> getLowestCosts() {
        return lowestCostPlans.entrySet()
                .stream()
                .collect(ImmutableMap.toImmutableMap(Entry::getKey, kv -> kv.getValue().first));
    }

    /**
     * Set or update lowestCostPlans: properties --> Pair.of(cost, expression).
     * A winner is only replaced by a strictly cheaper one, so on ties the first installed stays.
     *
     * @return true if the winner changed
     */
    public boolean setBestPlan(GroupExpression expression, Cost cost, PhysicalProperties properties) {
        Pair<Cost, GroupExpression> current = lowestCostPlans.get(properties);
        if (current != null && current.first.compareTo(cost) <= 0) {
            return false;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("group {} new winner for {}: cost {} (was {}) {}", groupId, properties, cost,
                    current == null ? "none" : current.first, expression.getPlan());
        }
        lowestCostPlans.put(properties, Pair.of(cost, expression));
        return true;
    }

    public Statistics getStatistics() {
        return statistics;
    }

    public LogicalProperties getLogicalProperties() {
        return logicalProperties;
    }

    public EngineType getEngineType() {
        return engineType;
    }

    public boolean isExplored() {
        return isExplored;
    }

    public void setExplored(boolean explored) {
        isExplored = explored;
    }

    public boolean isImplemented() {
        return isImplemented;
    }

    public void setImplemented(boolean implemented) {
        isImplemented = implemented;
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder("Group[" + groupId + "] engine=" + engineType + "\n");
        appendExpressions(str, "logical", logicalExpressions);
        appendExpressions(str, "physical", physicalExpressions);
        appendExpressions(str, "enforcer", enforcers.keySet());
        str.append("  statistics\n").append(statistics.detail("    "));
        str.append("  winners (cost, properties, plan)\n");
        for (Entry<PhysicalProperties, Pair<Cost, GroupExpression>> winner : lowestCostPlans.entrySet()) {
            str.append("    ").append(winner.getValue().first).append(' ').append(winner.getKey())
                    .append(' ').append(winner.getValue().second.getPlan()).append('\n');
        }
        return str.toString();
    }

    private static void appendExpressions(StringBuilder str, String kind, Collection<GroupExpression> expressions) {
        str.append("  ").append(kind).append(" expressions (").append(expressions.size()).append(")\n");
        for (GroupExpression expression : expressions) {
            str.append("    ").append(expression).append('\n');
        }
    }
}
