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

package org.apache.cascades.cost;

import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.physical.PhysicalPlan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Everything a {@link CostModel} may look at: the operator, its output and input statistics, the
 * width of its output schema and the properties it is costed for.
 */
public class CostContext {
    private final PhysicalPlan plan;
    private final Statistics statistics;
    private final List<Statistics> childrenStatistics;
    private final int width;
    private final PhysicalProperties requiredProperties;

    /**
     * Constructor for CostContext.
     */
    public CostContext(PhysicalPlan plan, Statistics statistics, List<Statistics> childrenStatistics, int width,
            PhysicalProperties requiredProperties) {
        Preconditions.checkArgument(childrenStatistics.size() == plan.arity(),
                "%s has %s children but %s child statistics", plan, plan.arity(), childrenStatistics.size());
        Preconditions.checkArgument(width > 0, "width must be positive");
        this.plan = Objects.requireNonNull(plan, "plan can not be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics can not be null");
        this.childrenStatistics = ImmutableList.copyOf(childrenStatistics);
        this.width = width;
        this.requiredProperties = Objects.requireNonNull(requiredProperties, "requiredProperties can not be null");
    }

    public PhysicalPlan getPlan() {
        return plan;
    }

    public Statistics getStatistics() {
        return statistics;
    }

    public double getRowCount() {
        return statistics.getRowCount();
    }

    public List<Statistics> getChildrenStatistics() {
        return childrenStatistics;
    }

    public double getChildRowCount(int index) {
        return childrenStatistics.get(index).getRowCount();
    }

    public int getWidth() {
        return width;
    }

    public PhysicalProperties getRequiredProperties() {
        return requiredProperties;
    }

    /**
     * The same operator with the output and every child row count multiplied by {@code factor}.
     */
    public CostContext withScaledRowCounts(double factor) {
        ImmutableList.Builder<Statistics> scaledChildren = ImmutableList.builder();
        for (Statistics childStatistics : childrenStatistics) {
            scaledChildren.add(childStatistics.withRowCount(childStatistics.getRowCount() * factor));
        }
        return new CostContext(plan, statistics.withRowCount(statistics.getRowCount() * factor),
                scaledChildren.build(), width, requiredProperties);
    }

    @Override
    public String toString() {
        return "CostContext{plan=" + plan + ", " + statistics + ", children=" + childrenStatistics
                + ", width=" + width + ", required=" + requiredProperties + "}";
    }
}
