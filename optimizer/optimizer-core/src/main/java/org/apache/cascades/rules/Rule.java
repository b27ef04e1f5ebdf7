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
import org.apache.cascades.pattern.Pattern;
import org.apache.cascades.trees.plans.Plan;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract class for all rules.
 */
public abstract class Rule {
    private final RuleType ruleType;
    private final Pattern pattern;

    protected Rule(RuleType ruleType, Pattern pattern) {
        this.ruleType = Objects.requireNonNull(ruleType, "ruleType can not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern can not be null");
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    public RulePromise getRulePromise() {
        return ruleType.getRulePromise();
    }

    public Pattern getPattern() {
        return pattern;
    }

    public boolean isExploration() {
        return ruleType.getRuleTypeClass() == RuleType.RuleTypeClass.EXPLORATION;
    }

    public boolean isImplementation() {
        return ruleType.getRuleTypeClass() == RuleType.RuleTypeClass.IMPLEMENTATION;
    }

    /**
     * A rule is invalid on a group expression when it is disabled, already applied, or its root
     * pattern does not match the expression's kind and engine.
     */
    public boolean isInvalid(Set<RuleType> disableRules, GroupExpression groupExpression) {
        return disableRules.contains(ruleType)
                || groupExpression.hasApplied(this)
                || !pattern.matchRoot(groupExpression.getPlan());
    }

    /**
     * Transform a matched binding into its alternatives. Returning an empty list is how a rule
     * declines a binding.
     */
    public abstract List<Plan> transform(Plan node);

    @Override
    public String toString() {
        return ruleType.toString();
    }
}
