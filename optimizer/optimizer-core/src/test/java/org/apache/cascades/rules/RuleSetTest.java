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

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.memo.Memo;
import org.apache.cascades.pattern.Patterns;
import org.apache.cascades.properties.OrderEnforcer;
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.rules.exploration.JoinCommute;
import org.apache.cascades.trees.expressions.ComparisonPredicate;
import org.apache.cascades.trees.expressions.Expression;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.JoinType;
import org.apache.cascades.trees.plans.logical.LogicalJoin;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.util.PlanConstructor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

public class RuleSetTest implements Patterns {
    private Memo memo;
    private LogicalScan left;

    @BeforeEach
    public void setUp() {
        PlanConstructor planConstructor = new PlanConstructor();
        left = planConstructor.newLogicalScan(planConstructor.newPkTable("t1"), EngineType.COMPUTE, 1000);
        LogicalScan right = planConstructor.newLogicalScan(planConstructor.newPkTable("t2"), EngineType.COMPUTE, 1000);
        List<Expression> conjuncts = ImmutableList.of(
                ComparisonPredicate.equalTo(PlanConstructor.slot(left, "a"), PlanConstructor.slot(right, "a")));
        memo = new Memo(PlanConstructor.withRows(
                new LogicalJoin(JoinType.INNER_JOIN, conjuncts, EngineType.COMPUTE, left, right), 1000));
    }

    private GroupExpression join() {
        return memo.getRoot().getFirstLogicalExpression();
    }

    private static List<RuleType> types(List<Rule> rules) {
        return rules.stream().map(Rule::getRuleType).collect(Collectors.toList());
    }

    @Test
    public void testImplementationRulesComeFirst() {
        List<Rule> rules = RuleSet.defaultRuleSet().getApplicableRules(join(), false, ImmutableSet.of());

        Assertions.assertEquals(ImmutableList.of(RuleType.LOGICAL_JOIN_TO_HASH_JOIN_RULE,
                RuleType.LOGICAL_JOIN_TO_MERGE_JOIN_RULE, RuleType.JOIN_COMMUTE), types(rules));
    }

    @Test
    public void testExploreOnly() {
        List<Rule> rules = RuleSet.defaultRuleSet().getApplicableRules(join(), true, ImmutableSet.of());

        Assertions.assertEquals(ImmutableList.of(RuleType.JOIN_COMMUTE), types(rules));
    }

    @Test
    public void testDisabledAndAppliedRulesAreSkipped() {
        RuleSet ruleSet = RuleSet.defaultRuleSet();
        for (Rule rule : ruleSet.getApplicableRules(join(), true, ImmutableSet.of())) {
            join().setApplied(rule);
        }

        List<Rule> rules = ruleSet.getApplicableRules(join(), false,
                ImmutableSet.of(RuleType.LOGICAL_JOIN_TO_MERGE_JOIN_RULE));

        Assertions.assertEquals(ImmutableList.of(RuleType.LOGICAL_JOIN_TO_HASH_JOIN_RULE), types(rules));
    }

    @Test
    public void testRulesAreIndexedByRootType() {
        GroupExpression scan = join().child(0).getFirstLogicalExpression();
        List<Rule> rules = RuleSet.defaultRuleSet().getApplicableRules(scan, false, ImmutableSet.of());

        Assertions.assertEquals(ImmutableList.of(RuleType.LOGICAL_SCAN_TO_PHYSICAL_TABLE_SCAN_RULE,
                RuleType.LOGICAL_SCAN_TO_PHYSICAL_INDEX_SCAN_RULE), types(rules));
    }

    @Test
    public void testAnyRootRuleKeepsRegistrationOrder() {
        Rule anyRoot = any().then(plan -> plan).toRule(RuleType.PUSH_DOWN_TOP_N_THROUGH_GATHER);
        RuleSet ruleSet = RuleSet.builder()
                .addRule(anyRoot)
                .addRules(new JoinCommute())
                .build();

        Assertions.assertEquals(ImmutableList.of(RuleType.PUSH_DOWN_TOP_N_THROUGH_GATHER, RuleType.JOIN_COMMUTE),
                types(ruleSet.getApplicableRules(join(), false, ImmutableSet.of())));
        GroupExpression scan = join().child(0).getFirstLogicalExpression();
        Assertions.assertEquals(ImmutableList.of(RuleType.PUSH_DOWN_TOP_N_THROUGH_GATHER),
                types(ruleSet.getApplicableRules(scan, false, ImmutableSet.of())));
    }

    @Test
    public void testRuleTypeRegisteredOnce() {
        RuleSet.Builder builder = RuleSet.builder().addRules(RuleSet.EXPLORATION_RULES);

        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.addRules(RuleSet.EXPLORATION_RULES));
    }

    @Test
    public void testEnforcersFollowGroupEngine() {
        PhysicalProperties orderByA = PhysicalProperties.ordered(
                ImmutableList.of(OrderKey.asc(PlanConstructor.slot(left, "a"))));
        RuleSet ruleSet = RuleSet.defaultRuleSet();

        Assertions.assertEquals(ImmutableList.of(OrderEnforcer.INSTANCE),
                ruleSet.getEnforcers(memo.getRoot(), orderByA));
        Assertions.assertTrue(ruleSet.getEnforcers(memo.getRoot(), PhysicalProperties.ANY).isEmpty());
    }
}
