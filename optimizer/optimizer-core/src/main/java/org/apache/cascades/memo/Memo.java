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

import org.apache.cascades.common.IdGenerator;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.Plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Representation for memo in cascades optimizer.
 */
public class Memo {
    private static final Logger LOG = LogManager.getLogger(Memo.class);

    private final IdGenerator<GroupId> groupIdGenerator = GroupId.createGenerator();
    private final Map<GroupId, Group> groups = Maps.newLinkedHashMap();
    // we could not use Set, because Set does not have get method.
    private final Map<GroupExpression, GroupExpression> groupExpressions = Maps.newHashMap();
    private final Group root;

    /**
     * Build the memo of a logical plan. Every node of the plan must carry statistics.
     * Structurally identical subtrees share one group.
     */
    public Memo(Plan plan) {
        Preconditions.checkArgument(!(plan instanceof GroupPlan), "Cannot init memo by a GroupPlan");
        root = copyIn(plan, null).correspondingExpression.getOwnerGroup();
    }

    public Group getRoot() {
        return root;
    }

    public List<Group> getGroups() {
        return ImmutableList.copyOf(groups.values());
    }

    public Group getGroup(GroupId groupId) {
        return groups.get(groupId);
    }

    public int getGroupExpressionsSize() {
        return groupExpressions.size();
    }

    /**
     * Add plan to memo, the children of the plan are copied in first.
     * <p>
     * A plan structurally equal to an expression already in the memo is not added again. If that
     * expression lives in another group than {@code target}, the plan is dropped: groups are never merged.
     *
     * @param plan {@link Plan} or {@link org.apache.cascades.trees.expressions.Expression} to be added
     * @param target target group to add node. null to generate new Group
     * @return a pair, in which the first element is true if a newly generated groupExpression added into memo,
     *         and the second element is a reference of node in Memo
     */
    public CopyInResult copyIn(Plan plan, @Nullable Group target) {
        Preconditions.checkArgument(!(plan instanceof GroupPlan), "plan can not be GroupPlan");
        if (target != null) {
            Preconditions.checkState(plan.getLogicalProperties().equals(target.getLogicalProperties()),
                    "Insert a plan into targetGroup but differ in logical properties. plan: %s, target: %s",
                    plan.getLogicalProperties(), target.getLogicalProperties());
            Preconditions.checkState(plan.getEngineType() == target.getEngineType(),
                    "Insert a %s plan into a %s group %s", plan.getEngineType(), target.getEngineType(),
                    target.getGroupId());
        }
        Optional<GroupExpression> groupExpr = plan.getGroupExpression();
        if (groupExpr.isPresent()) {
            Preconditions.checkState(groupExpressions.containsKey(groupExpr.get()),
                    "group expression of %s is not in this memo", plan);
            return CopyInResult.of(false, groupExpr.get());
        }
        List<Group> childrenGroups = Lists.newArrayListWithCapacity(plan.arity());
        for (Plan child : plan.children()) {
            if (child instanceof GroupPlan) {
                childrenGroups.add(((GroupPlan) child).getGroup());
            } else if (child.getGroupExpression().isPresent()) {
                childrenGroups.add(child.getGroupExpression().get().getOwnerGroup());
            } else {
                childrenGroups.add(copyIn(child, null).correspondingExpression.getOwnerGroup());
            }
        }
        plan = replaceChildrenToGroupPlan(plan, childrenGroups);
        GroupExpression newGroupExpression = new GroupExpression(plan, childrenGroups);
        return insertGroupExpression(newGroupExpression, target, plan);
    }

    private Plan replaceChildrenToGroupPlan(Plan plan, List<Group> childrenGroups) {
        if (childrenGroups.isEmpty()) {
            return plan;
        }
        List<Plan> groupPlanChildren = Lists.newArrayListWithCapacity(childrenGroups.size());
        for (Group childrenGroup : childrenGroups) {
            groupPlanChildren.add(new GroupPlan(childrenGroup));
        }
        return plan.withChildren(groupPlanChildren);
    }

    private CopyInResult insertGroupExpression(GroupExpression groupExpression, @Nullable Group target, Plan plan) {
        GroupExpression existedGroupExpression = groupExpressions.get(groupExpression);
        if (existedGroupExpression != null) {
            if (target != null && existedGroupExpression.getOwnerGroup() != target && LOG.isDebugEnabled()) {
                LOG.debug("skip {}: equal to an expression of group {}, not of target group {}",
                        plan, existedGroupExpression.getOwnerGroup().getGroupId(), target.getGroupId());
            }
            return CopyInResult.of(false, existedGroupExpression);
        }
        if (target != null) {
            target.addGroupExpression(groupExpression);
        } else {
            Statistics statistics = plan.getStats().orElseThrow(() -> new IllegalArgumentException(
                    "plan must carry statistics to start a new group: " + plan));
            Group group = new Group(groupIdGenerator.getNextId(), groupExpression, plan.getLogicalProperties(),
                    statistics, plan.getEngineType());
            groups.put(group.getGroupId(), group);
        }
        groupExpressions.put(groupExpression, groupExpression);
        return CopyInResult.of(true, groupExpression);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("root:").append(root.getGroupId()).append("\n");
        for (Group group : groups.values()) {
            builder.append("\n\n").append(group).append("\n");
        }
        return builder.toString();
    }
}
