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

package org.apache.cascades.rules.implementation;

import org.apache.cascades.common.Pair;
import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.logical.LogicalJoin;
import org.apache.cascades.trees.plans.physical.PhysicalMergeJoin;
import org.apache.cascades.util.JoinUtils;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Implementation rule that convert an equi join to physical merge join.
 * The merge join needs both inputs sorted on the join keys.
 */
public class LogicalJoinToMergeJoin extends OneImplementationRuleFactory {
    @Override
    public Rule build() {
        return logicalJoin()
                .onEngines(EngineType.COMPUTE_ONLY)
                .thenMulti(join -> {
                    Optional<Pair<List<SlotReference>, List<SlotReference>>> keys = equiKeys(join);
                    if (!keys.isPresent()) {
                        return ImmutableList.<PhysicalMergeJoin>of();
                    }
                    return ImmutableList.of(new PhysicalMergeJoin(join.getJoinType(), join.getHashJoinConjuncts(),
                            keys.get().first, keys.get().second, join.getEngineType(), join.left(), join.right()));
                })
                .toRule(RuleType.LOGICAL_JOIN_TO_MERGE_JOIN_RULE);
    }

    private static Optional<Pair<List<SlotReference>, List<SlotReference>>> equiKeys(LogicalJoin join) {
        return JoinUtils.extractEquiKeys(join.getHashJoinConjuncts(), join.left().getOutput(),
                join.right().getOutput());
    }
}
