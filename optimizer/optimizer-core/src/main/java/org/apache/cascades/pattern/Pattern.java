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

import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.GroupPlan;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Pattern node used in pattern matching: a plan kind (or a wildcard), the engines the plan may
 * run in, child patterns and extra predicates checked once the children are bound.
 */
public class Pattern {
    public static final Pattern ANY = new Pattern(PatternType.ANY, null, ImmutableList.of(), EngineType.ALL,
            ImmutableList.of());
    public static final Pattern GROUP = new Pattern(PatternType.GROUP, null, ImmutableList.of(), EngineType.ALL,
            ImmutableList.of());

    private final PatternType patternType;
    private final PlanType planType;
    private final List<Pattern> children;
    private final Set<EngineType> engineTypes;
    private final List<Predicate<Plan>> predicates;

    public Pattern(PlanType planType, Pattern... children) {
        this(PatternType.NORMAL, planType, ImmutableList.copyOf(children), EngineType.ALL, ImmutableList.of());
    }

    private Pattern(PatternType patternType, PlanType planType, List<Pattern> children,
            Set<EngineType> engineTypes, List<Predicate<Plan>> predicates) {
        Preconditions.checkArgument(patternType != PatternType.NORMAL || planType != null,
                "normal pattern must have a plan type");
        Preconditions.checkArgument(!engineTypes.isEmpty(), "pattern must accept at least one engine");
        this.patternType = patternType;
        this.planType = planType;
        this.children = ImmutableList.copyOf(children);
        this.engineTypes = ImmutableSet.copyOf(engineTypes);
        this.predicates = ImmutableList.copyOf(predicates);
    }

    public PatternType getPatternType() {
        return patternType;
    }

    public PlanType getPlanType() {
        return planType;
    }

    public Set<EngineType> getEngineTypes() {
        return engineTypes;
    }

    public List<Pattern> children() {
        return children;
    }

    public Pattern child(int index) {
        return children.get(index);
    }

    public int arity() {
        return children.size();
    }

    public boolean isAny() {
        return patternType == PatternType.ANY;
    }

    public boolean isGroup() {
        return patternType == PatternType.GROUP;
    }

    /**
     * Match the plan kind and engine of the root, without looking at children or predicates.
     */
    public boolean matchRoot(Plan root) {
        if (root == null) {
            return false;
        }
        switch (patternType) {
            case ANY:
                return !(root instanceof GroupPlan);
            case GROUP:
                return root instanceof GroupPlan;
            default:
                return root.getType() == planType && engineTypes.contains(root.getEngineType());
        }
    }

    /**
     * Whether the root and its bound children satisfy every predicate.
     */
    public boolean matchPredicates(Plan root) {
        for (Predicate<Plan> predicate : predicates) {
            if (!predicate.test(root)) {
                return false;
            }
        }
        return true;
    }

    public Pattern withPredicates(List<Predicate<Plan>> predicates) {
        return new Pattern(patternType, planType, children, engineTypes, predicates);
    }

    public Pattern withEngineTypes(Set<EngineType> engineTypes) {
        return new Pattern(patternType, planType, children, engineTypes, predicates);
    }

    List<Predicate<Plan>> getPredicates() {
        return predicates;
    }

    @Override
    public String toString() {
        String name = patternType == PatternType.NORMAL ? planType.name() : patternType.name();
        if (children.isEmpty()) {
            return name;
        }
        StringBuilder builder = new StringBuilder(name).append("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(children.get(i));
        }
        return builder.append(")").toString();
    }
}
