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

import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.plans.Plan;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Define a class that contains a pattern and an action to transform the matched plan.
 *
 * @param <INPUT_TYPE> input plan type
 * @param <OUTPUT_TYPE> output plan type
 */
public class PatternMatcher<INPUT_TYPE extends Plan, OUTPUT_TYPE extends Plan> {
    public final Pattern pattern;
    public final Function<INPUT_TYPE, Collection<OUTPUT_TYPE>> matchedAction;

    public PatternMatcher(Pattern pattern, Function<INPUT_TYPE, Collection<OUTPUT_TYPE>> matchedAction) {
        this.pattern = pattern;
        this.matchedAction = matchedAction;
    }

    /**
     * Convert the pattern and the matched action to a rule.
     *
     * @param ruleType which rule
     * @return Rule
     */
    public Rule toRule(RuleType ruleType) {
        return new Rule(ruleType, pattern) {
            @Override
            @SuppressWarnings("unchecked")
            public List<Plan> transform(Plan originPlan) {
                Collection<OUTPUT_TYPE> outputs = matchedAction.apply((INPUT_TYPE) originPlan);
                return ImmutableList.copyOf(outputs);
            }
        };
    }
}
