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

package org.apache.cascades.rules;

import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.Enforcer;
import org.apache.cascades.properties.OrderEnforcer;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.rules.exploration.JoinCommute;
import org.apache.cascades.rules.exploration.PushDownFilterThroughGather;
import org.apache.cascades.rules.exploration.PushDownFilterThroughProject;
import org.apache.cascades.rules.exploration.PushDownTopNThroughGather;
import org.apache.cascades.rules.implementation.LogicalAggToPhysicalHashAgg;
import org.apache.cascades.rules.implementation.LogicalAggToPhysicalStreamAgg;
import org.apache.cascades.rules.implementation.LogicalFilterToPhysicalFilter;
import org.apache.cascades.rules.implementation.LogicalGatherToPhysicalGather;
import org.apache.cascades.rules.implementation.LogicalJoinToHashJoin;
import org.apache.cascades.rules.implementation.LogicalJoinToMergeJoin;
import org.apache.cascades.rules.implementation.LogicalLimitToPhysicalLimit;
import org.apache.cascades.rules.implementation.LogicalProjectToPhysicalProject;
import org.apache.cascades.rules.implementation.LogicalScanToPhysicalIndexScan;
import org.apache.cascades.rules.implementation.LogicalScanToPhysicalTableScan;
import org.apache.cascades.rules.implementation.LogicalSortToPhysicalQuickSort;
import org.apache.cascades.rules.implementation.LogicalTopNToPhysicalLimit;
import org.apache.cascades.rules.implementation.LogicalTopNToPhysicalTopN;
import org.apache.cascades.trees.plans.PlanType;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Containers for set of different type rules, and the enforcers.
 * <p>
 * A rule set is immutable, so one instance can serve concurrent compilations.
 */
public class RuleSet {

    public static final List<Rule> EXPLORATION_RULES = planRuleFactories()
            .add(new JoinCommute())
            .add(new PushDownFilterThroughProject())
            .add(new PushDownFilterThroughGather())
            .add(new PushDownTopNThroughGather())
            .build();

    public static final List<Rule> IMPLEMENTATION_RULES = planRuleFactories()
            .add(new LogicalScanToPhysicalTableScan())
            .add(new LogicalScanToPhysicalIndexScan())
            .add(new LogicalFilterToPhysicalFilter())
            .add(new LogicalProjectToPhysicalProject())
            .add(new LogicalJoinToHashJoin())
            .add(new LogicalJoinToMergeJoin())
            .add(new LogicalAggToPhysicalHashAgg())
            .add(new LogicalAggToPhysicalStreamAgg())
            .add(new LogicalSortToPhysicalQuickSort())
            .add(new LogicalTopNToPhysicalTopN())
            .add(new LogicalTopNToPhysicalLimit())
            .add(new LogicalLimitToPhysicalLimit())
            .add(new LogicalGatherToPhysicalGather())
            .build();

    private static final RuleSet DEFAULT_RULE_SET = builder()
            .addRules(EXPLORATION_RULES)
            .addRules(IMPLEMENTATION_RULES)
            .addEnforcer(OrderEnforcer.INSTANCE)
            .build();

    // registration order
    private final List<Rule> rules;
    // rules indexed by the plan type at the root of their pattern
    private final ImmutableListMultimap<PlanType, Rule> rulesByRootType;
    // rules whose pattern root is a wildcard
    private final List<Rule> anyRootRules;
    private final List<Enforcer> enforcers;

    private RuleSet(List<Rule> rules, List<Enforcer> enforcers) {
        this.rules = ImmutableList.copyOf(rules);
        this.enforcers = ImmutableList.copyOf(enforcers);
        ImmutableListMultimap.Builder<PlanType, Rule> byRootType = ImmutableListMultimap.builder();
        ImmutableList.Builder<Rule> anyRoot = ImmutableList.builder();
        for (Rule rule : rules) {
            if (rule.getPattern().getPlanType() == null) {
                anyRoot.add(rule);
            } else {
                byRootType.put(rule.getPattern().getPlanType(), rule);
            }
        }
        this.rulesByRootType = byRootType.build();
        this.anyRootRules = anyRoot.build();
    }

    public static RuleSet defaultRuleSet() {
        return DEFAULT_RULE_SET;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Rule> getRules() {
        return rules;
    }

    public List<Rule> getExplorationRules() {
        return rules.stream().filter(Rule::isExploration).collect(ImmutableList.toImmutableList());
    }

    public List<Rule> getImplementationRules() {
        return rules.stream().filter(Rule::isImplementation).collect(ImmutableList.toImmutableList());
    }

    public List<Enforcer> getEnforcers() {
        return enforcers;
    }

    /**
     * Rules to schedule on {@code groupExpression}: the root pattern matches its kind and engine,
     * the rule was not applied to it yet and is not disabled. With {@code exploreOnly} only
     * exploration rules are returned.
     *
     * @return rules by descending promise, then in registration order
     */
    public List<Rule> getApplicableRules(GroupExpression groupExpression, boolean exploreOnly,
            Set<RuleType> disabledRules) {
        List<Rule> candidates = Lists.newArrayList();
        for (Rule rule : rules(groupExpression.getPlan().getType())) {
            if (exploreOnly && !rule.isExploration()) {
                continue;
            }
            if (rule.isInvalid(disabledRules, groupExpression)) {
                continue;
            }
            candidates.add(rule);
        }
        // List.sort is stable, equal promises keep registration order
        candidates.sort(Comparator.comparingInt((Rule rule) -> rule.getRulePromise().promise()).reversed());
        return candidates;
    }

    /**
     * Enforcers that may produce {@code requiredProperties} on top of {@code group}. Empty unless
     * the group runs in the enforcer's engine.
     */
    public List<Enforcer> getEnforcers(Group group, PhysicalProperties requiredProperties) {
        ImmutableList.Builder<Enforcer> applicable = ImmutableList.builder();
        for (Enforcer enforcer : enforcers) {
            if (enforcer.getEngineType() == group.getEngineType() && enforcer.isApplicable(requiredProperties)) {
                applicable.add(enforcer);
            }
        }
        return applicable.build();
    }

    private List<Rule> rules(PlanType rootType) {
        if (anyRootRules.isEmpty()) {
            return rulesByRootType.get(rootType);
        }
        // keep registration order across both lists
        return rules.stream()
                .filter(rule -> rule.getPattern().getPlanType() == null || rule.getPattern().getPlanType() == rootType)
                .collect(ImmutableList.toImmutableList());
    }

    public static RuleFactories planRuleFactories() {
        return new RuleFactories();
    }

    /**
     * Collect the rules of several factories.
     */
    public static class RuleFactories {
        final ImmutableList.Builder<Rule> rules = ImmutableList.builder();

        public RuleFactories add(RuleFactory ruleFactory) {
            rules.addAll(ruleFactory.buildRules());
            return this;
        }

        public RuleFactories addAll(List<Rule> rules) {
            this.rules.addAll(rules);
            return this;
        }

        public List<Rule> build() {
            return rules.build();
        }
    }

    /**
     * Builder of {@link RuleSet}.
     */
    public static class Builder {
        private final List<Rule> rules = Lists.newArrayList();
        private final Set<RuleType> ruleTypes = Sets.newHashSet();
        private final List<Enforcer> enforcers = Lists.newArrayList();

        public Builder addRule(Rule rule) {
            Preconditions.checkArgument(ruleTypes.add(rule.getRuleType()),
                    "rule %s is registered twice", rule.getRuleType());
            rules.add(rule);
            return this;
        }

        public Builder addRules(List<Rule> rules) {
            rules.forEach(this::addRule);
            return this;
        }

        public Builder addRules(RuleFactory ruleFactory) {
            return addRules(ruleFactory.buildRules());
        }

        public Builder addEnforcer(Enforcer enforcer) {
            enforcers.add(enforcer);
            return this;
        }

        public RuleSet build() {
            return new RuleSet(rules, enforcers);
        }
    }
}
