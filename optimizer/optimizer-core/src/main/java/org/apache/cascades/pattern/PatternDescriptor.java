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
import org.apache.cascades.trees.plans.Plan;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Define a descriptor to wrap a pattern tree to define a pattern shape.
 * It can support pattern generic type to MatchedAction.
 */
public class PatternDescriptor<INPUT_TYPE extends Plan> {
    public final Pattern pattern;

    public PatternDescriptor(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Add a predicate, checked on the root once its children are bound.
     */
    @SuppressWarnings("unchecked")
    public PatternDescriptor<INPUT_TYPE> when(Predicate<INPUT_TYPE> predicate) {
        List<Predicate<Plan>> predicates = ImmutableList.<Predicate<Plan>>builder()
                .addAll(pattern.getPredicates())
                .add(plan -> predicate.test((INPUT_TYPE) plan))
                .build();
        return new PatternDescriptor<>(pattern.withPredicates(predicates));
    }

    /**
     * Restrict the root of the pattern to plans running in one of {@code engineTypes}.
     */
    public PatternDescriptor<INPUT_TYPE> onEngines(Set<EngineType> engineTypes) {
        return new PatternDescriptor<>(pattern.withEngineTypes(engineTypes));
    }

    public <OUTPUT_TYPE extends Plan> PatternMatcher<INPUT_TYPE, OUTPUT_TYPE> then(
            Function<INPUT_TYPE, OUTPUT_TYPE> matchedAction) {
        return new PatternMatcher<>(pattern, input -> ImmutableList.of(matchedAction.apply(input)));
    }

    public <OUTPUT_TYPE extends Plan> PatternMatcher<INPUT_TYPE, OUTPUT_TYPE> thenMulti(
            Function<INPUT_TYPE, Collection<OUTPUT_TYPE>> matchedAction) {
        return new PatternMatcher<>(pattern, matchedAction);
    }
}
