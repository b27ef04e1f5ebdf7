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

package org.apache.cascades.pattern;

import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;
import org.apache.cascades.trees.plans.logical.LogicalAggregate;
import org.apache.cascades.trees.plans.logical.LogicalFilter;
import org.apache.cascades.trees.plans.logical.LogicalGather;
import org.apache.cascades.trees.plans.logical.LogicalJoin;
import org.apache.cascades.trees.plans.logical.LogicalLimit;
import org.apache.cascades.trees.plans.logical.LogicalProject;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.trees.plans.logical.LogicalSort;
import org.apache.cascades.trees.plans.logical.LogicalTopN;

/**
 * An interface provided some PatternDescriptor.
 * Child Interface(RuleFactory) can use to declare a pattern shape, then convert to a rule.
 * The children of a pattern default to {@link #group()}.
 */
public interface Patterns {

    default PatternDescriptor<GroupPlan> group() {
        return new PatternDescriptor<>(Pattern.GROUP);
    }

    default PatternDescriptor<Plan> any() {
        return new PatternDescriptor<>(Pattern.ANY);
    }

    default PatternDescriptor<LogicalScan> logicalScan() {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_SCAN));
    }

    default PatternDescriptor<LogicalFilter> logicalFilter() {
        return logicalFilter(group());
    }

    default PatternDescriptor<LogicalFilter> logicalFilter(PatternDescriptor<? extends Plan> child) {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_FILTER, child.pattern));
    }

    default PatternDescriptor<LogicalProject> logicalProject() {
        return logicalProject(group());
    }

    default PatternDescriptor<LogicalProject> logicalProject(PatternDescriptor<? extends Plan> child) {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_PROJECT, child.pattern));
    }

    default PatternDescriptor<LogicalJoin> logicalJoin() {
        return logicalJoin(group(), group());
    }

    default PatternDescriptor<LogicalJoin> logicalJoin(PatternDescriptor<? extends Plan> left,
            PatternDescriptor<? extends Plan> right) {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_JOIN, left.pattern, right.pattern));
    }

    default PatternDescriptor<LogicalAggregate> logicalAggregate() {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_AGGREGATE, Pattern.GROUP));
    }

    default PatternDescriptor<LogicalSort> logicalSort() {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_SORT, Pattern.GROUP));
    }

    default PatternDescriptor<LogicalTopN> logicalTopN() {
        return logicalTopN(group());
    }

    default PatternDescriptor<LogicalTopN> logicalTopN(PatternDescriptor<? extends Plan> child) {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_TOP_N, child.pattern));
    }

    default PatternDescriptor<LogicalLimit> logicalLimit() {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_LIMIT, Pattern.GROUP));
    }

    default PatternDescriptor<LogicalGather> logicalGather() {
        return logicalGather(group());
    }

    default PatternDescriptor<LogicalGather> logicalGather(PatternDescriptor<? extends Plan> child) {
        return new PatternDescriptor<>(new Pattern(PlanType.LOGICAL_GATHER, child.pattern));
    }
}
