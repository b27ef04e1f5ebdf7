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

package org.apache.cascades.util;

import org.apache.cascades.common.Pair;
import org.apache.cascades.trees.expressions.ComparisonPredicate;
import org.apache.cascades.trees.expressions.Expression;
import org.apache.cascades.trees.expressions.SlotReference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Utils for join
 */
public class JoinUtils {

    private JoinUtils() {
    }

    /**
     * Split the join conjuncts into left and right equi keys.
     * Every conjunct must be {@code slot = slot} with one side from each child; otherwise the join
     * has no usable keys and empty is returned.
     *
     * @return pair of (left keys, right keys), aligned by position
     */
    public static Optional<Pair<List<SlotReference>, List<SlotReference>>> extractEquiKeys(
            List<Expression> conjuncts, List<SlotReference> leftOutput, List<SlotReference> rightOutput) {
        if (conjuncts.isEmpty()) {
            return Optional.empty();
        }
        Set<SlotReference> leftSlots = ImmutableSet.copyOf(leftOutput);
        Set<SlotReference> rightSlots = ImmutableSet.copyOf(rightOutput);
        ImmutableList.Builder<SlotReference> leftKeys = ImmutableList.builder();
        ImmutableList.Builder<SlotReference> rightKeys = ImmutableList.builder();
        for (Expression conjunct : conjuncts) {
            if (!(conjunct instanceof ComparisonPredicate)
                    || ((ComparisonPredicate) conjunct).getOp() != ComparisonPredicate.Op.EQ) {
                return Optional.empty();
            }
            ComparisonPredicate equalTo = (ComparisonPredicate) conjunct;
            if (!(equalTo.left() instanceof SlotReference) || !(equalTo.right() instanceof SlotReference)) {
                return Optional.empty();
            }
            SlotReference left = (SlotReference) equalTo.left();
            SlotReference right = (SlotReference) equalTo.right();
            if (leftSlots.contains(left) && rightSlots.contains(right)) {
                leftKeys.add(left);
                rightKeys.add(right);
            } else if (leftSlots.contains(right) && rightSlots.contains(left)) {
                leftKeys.add(right);
                rightKeys.add(left);
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(Pair.of(leftKeys.build(), rightKeys.build()));
    }
}
