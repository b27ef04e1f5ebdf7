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

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.statistics.Statistics;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract class for all concrete plan node.
 */
public abstract class AbstractPlan implements Plan {
    protected final PlanType type;
    protected final EngineType engineType;
    protected final Optional<GroupExpression> groupExpression;
    protected final Optional<Statistics> statistics;
    protected final List<Plan> children;

    protected AbstractPlan(PlanType type, EngineType engineType, Optional<GroupExpression> groupExpression,
            Optional<Statistics> statistics, List<Plan> children) {
        this.type = Objects.requireNonNull(type, "type can not be null");
        this.engineType = Objects.requireNonNull(engineType, "engineType can not be null");
        this.groupExpression = Objects.requireNonNull(groupExpression, "groupExpression can not be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics can not be null");
        this.children = ImmutableList.copyOf(children);
    }

    @Override
    public PlanType getType() {
        return type;
    }

    @Override
    public EngineType getEngineType() {
        return engineType;
    }

    @Override
    public List<Plan> children() {
        return children;
    }

    @Override
    public Optional<GroupExpression> getGroupExpression() {
        return groupExpression;
    }

    @Override
    public Optional<Statistics> getStats() {
        return statistics;
    }

    @Override
    public String treeString() {
        StringBuilder builder = new StringBuilder();
        appendTree(this, 0, builder);
        return builder.toString();
    }

    private static void appendTree(Plan plan, int depth, StringBuilder builder) {
        if (depth > 0) {
            for (int i = 1; i < depth; i++) {
                builder.append("   ");
            }
            builder.append("+--");
        }
        builder.append(plan instanceof AbstractPlan ? ((AbstractPlan) plan).treeLabel() : plan.toString())
                .append('\n');
        for (Plan child : plan.children()) {
            appendTree(child, depth + 1, builder);
        }
    }

    /**
     * Text of this node in {@link #treeString()}.
     */
    protected String treeLabel() {
        return toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AbstractPlan that = (AbstractPlan) o;
        return type == that.type && engineType == that.engineType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, engineType);
    }
}
