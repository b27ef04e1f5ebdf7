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
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.rules.Rule;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.logical.LogicalPlan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Representation for group expression in cascades optimizer.
 */
public class GroupExpression {
    private Group ownerGroup;
    private final List<Group> children;
    private final Plan plan;
    private final BitSet ruleMasks;
    // operator cost of the plan itself, children excluded
    private Cost cost;
    private int jobExecutionCount = 0;

    // Mapping from required properties to the lowest cost of this expression for them,
    // with the properties requested from each child to reach that cost.
    private final Map<PhysicalProperties, Pair<Cost, List<PhysicalProperties>>> lowestCostTable;
    // Mapping from required properties to the properties this expression then delivers.
    private final Map<PhysicalProperties, PhysicalProperties> outputPropertiesMap;

    public GroupExpression(Plan plan) {
        this(plan, ImmutableList.of());
    }

    /**
     * Constructor for GroupExpression.
     *
     * @param plan {@link Plan} to reference
     * @param children children groups in memo
     */
    public GroupExpression(Plan plan, List<Group> children) {
        this.plan = Objects.requireNonNull(plan, "plan can not be null")
                .withGroupExpression(Optional.of(this));
        this.children = ImmutableList.copyOf(Objects.requireNonNull(children, "children can not be null"));
        this.ruleMasks = new BitSet();
        this.lowestCostTable = Maps.newLinkedHashMap();
        this.outputPropertiesMap = Maps.newLinkedHashMap();
    }

    public int arity() {
        return children.size();
    }

    public Group getOwnerGroup() {
        return ownerGroup;
    }

    public void setOwnerGroup(Group ownerGroup) {
        this.ownerGroup = ownerGroup;
    }

    public Plan getPlan() {
        return plan;
    }

    public Group child(int i) {
        return children.get(i);
    }

    public List<Group> children() {
        return children;
    }

    public boolean isLogical() {
        return plan instanceof LogicalPlan;
    }

    public boolean hasApplied(Rule rule) {
        return ruleMasks.get(rule.getRuleType().ordinal());
    }

    public void setApplied(Rule rule) {
        ruleMasks.set(rule.getRuleType().ordinal());
    }

    public Cost getCost() {
        return cost;
    }

    public void setCost(Cost cost) {
        this.cost = cost;
    }

    /**
     * Number of jobs that have run on this expression. A lookup served from the winner cache runs none.
     */
    public int getJobExecutionCount() {
        return jobExecutionCount;
    }

    public void incrementJobExecutionCount() {
        jobExecutionCount++;
    }

    /**
     * Record the cost of this expression under {@code requiredProperties}, keeping the cheapest.
     *
     * @return true if the table changed
     */
    public boolean updateLowestCostTable(PhysicalProperties requiredProperties,
            List<PhysicalProperties> childrenInputProperties, Cost cost) {
        Pair<Cost, List<PhysicalProperties>> current = lowestCostTable.get(requiredProperties);
        if (current != null && current.first.compareTo(cost) <= 0) {
            return false;
        }
        lowestCostTable.put(requiredProperties, Pair.of(cost, ImmutableList.copyOf(childrenInputProperties)));
        return true;
    }

    public Optional<Pair<Cost, List<PhysicalProperties>>> getLowestCostTable(PhysicalProperties requiredProperties) {
        return Optional.ofNullable(lowestCostTable.get(requiredProperties));
    }

    /**
     * Properties requested from the children when this expression was chosen for {@code requiredProperties}.
     */
    public List<PhysicalProperties> getInputPropertiesList(PhysicalProperties requiredProperties) {
        Pair<Cost, List<PhysicalProperties>> costAndInputs = lowestCostTable.get(requiredProperties);
        Preconditions.checkState(costAndInputs != null,
                "no cost recorded for %s under %s", this, requiredProperties);
        return costAndInputs.second;
    }

    public void putOutputPropertiesMap(PhysicalProperties requiredProperties, PhysicalProperties outputProperties) {
        outputPropertiesMap.put(requiredProperties, outputProperties);
    }

    /**
     * Properties this expression delivers when chosen for {@code requiredProperties}.
     */
    public PhysicalProperties getOutputProperties(PhysicalProperties requiredProperties) {
        PhysicalProperties outputProperties = outputPropertiesMap.get(requiredProperties);
        Preconditions.checkState(outputProperties != null,
                "no output properties recorded for %s under %s", this, requiredProperties);
        return outputProperties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GroupExpression that = (GroupExpression) o;
        // Plan equality never looks at children, the child groups are compared by identity here.
        if (children.size() != that.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) != that.children.get(i)) {
                return false;
            }
        }
        return plan.equals(that.plan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(children.stream().map(Group::getGroupId).collect(Collectors.toList()), plan);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (ownerGroup == null) {
            builder.append("OWNER GROUP IS NULL[]");
        } else {
            builder.append(ownerGroup.getGroupId());
        }
        if (cost != null) {
            builder.append(" cost=").append(cost);
        }
        builder.append(" children=[")
                .append(children.stream().map(group -> group.getGroupId().toString())
                        .collect(Collectors.joining(", ")))
                .append("] ")
                .append(plan);
        return builder.toString();
    }
}
