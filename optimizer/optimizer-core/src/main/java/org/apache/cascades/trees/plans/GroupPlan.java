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

package org.apache.cascades.trees.plans;

import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.SlotReference;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pseudo plan standing for a whole {@link Group} as the child of a plan in the memo.
 */
public class GroupPlan extends AbstractPlan {
    private final Group group;

    public GroupPlan(Group group) {
        super(PlanType.GROUP_PLAN, group.getEngineType(), Optional.empty(),
                Optional.ofNullable(group.getStatistics()), ImmutableList.of());
        this.group = group;
    }

    public Group getGroup() {
        return group;
    }

    @Override
    public List<SlotReference> getOutput() {
        return group.getLogicalProperties().getOutput();
    }

    @Override
    public Optional<Statistics> getStats() {
        return Optional.ofNullable(group.getStatistics());
    }

    @Override
    public Plan withChildren(List<Plan> children) {
        Preconditions.checkArgument(children.isEmpty(), "GroupPlan can not have children");
        return this;
    }

    @Override
    public Plan withGroupExpression(Optional<GroupExpression> groupExpression) {
        throw new IllegalStateException("GroupPlan can not bind to a group expression");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return group.getGroupId().equals(((GroupPlan) o).group.getGroupId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(group.getGroupId());
    }

    @Override
    public String toString() {
        return "GroupPlan(" + group.getGroupId() + ")";
    }
}
