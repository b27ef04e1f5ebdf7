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

package org.apache.cascades.trees.plans.logical;

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;
import org.apache.cascades.util.Utils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Logical project plan: keeps a subset of its child's slots, in the given order.
 */
public class LogicalProject extends AbstractLogicalPlan {
    private final List<SlotReference> projects;

    public LogicalProject(List<SlotReference> projects, EngineType engineType, Plan child) {
        this(projects, engineType, Optional.empty(), Optional.empty(), child);
    }

    /**
     * Constructor for LogicalProject.
     */
    public LogicalProject(List<SlotReference> projects, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics, Plan child) {
        super(PlanType.LOGICAL_PROJECT, engineType, groupExpression, statistics, ImmutableList.of(child));
        Preconditions.checkArgument(!projects.isEmpty(), "project must output at least one slot");
        this.projects = ImmutableList.copyOf(projects);
    }

    public List<SlotReference> getProjects() {
        return projects;
    }

    @Override
    public List<SlotReference> getOutput() {
        return projects;
    }

    @Override
    protected LogicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1, "LogicalProject should have 1 child");
        return new LogicalProject(projects, engineType, groupExpression, statistics, children.get(0));
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && projects.equals(((LogicalProject) o).projects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), projects);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("LogicalProject", "projects", Utils.join(projects), "engine", engineType);
    }
}
