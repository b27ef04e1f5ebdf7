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
import org.apache.cascades.trees.expressions.Literal;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.logical.LogicalScan;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

public class JoinUtilsTest {
    private final PlanConstructor planConstructor = new PlanConstructor();
    private final LogicalScan left = planConstructor.newLogicalScan(planConstructor.newPkTable("t1"),
            EngineType.COMPUTE, 10);
    private final LogicalScan right = planConstructor.newLogicalScan(planConstructor.newPkTable("t2"),
            EngineType.COMPUTE, 10);

    private Optional<Pair<List<SlotReference>, List<SlotReference>>> extract(Expression... conjuncts) {
        return JoinUtils.extractEquiKeys(ImmutableList.copyOf(conjuncts), left.getOutput(), right.getOutput());
    }

    @Test
    public void testKeysAreAlignedWithChildren() {
        SlotReference leftA = PlanConstructor.slot(left, "a");
        SlotReference leftB = PlanConstructor.slot(left, "b");
        SlotReference rightA = PlanConstructor.slot(right, "a");
        SlotReference rightPk = PlanConstructor.slot(right, "pk");

        Optional<Pair<List<SlotReference>, List<SlotReference>>> keys = extract(
                ComparisonPredicate.equalTo(leftA, rightA), ComparisonPredicate.equalTo(rightPk, leftB));

        Assertions.assertTrue(keys.isPresent());
        Assertions.assertEquals(ImmutableList.of(leftA, leftB), keys.get().first);
        Assertions.assertEquals(ImmutableList.of(rightA, rightPk), keys.get().second);
    }

    @Test
    public void testNoEquiKeys() {
        SlotReference leftA = PlanConstructor.slot(left, "a");
        SlotReference rightA = PlanConstructor.slot(right, "a");

        Assertions.assertFalse(extract().isPresent());
        Assertions.assertFalse(extract(new ComparisonPredicate(ComparisonPredicate.Op.LT, leftA, rightA)).isPresent());
        Assertions.assertFalse(extract(ComparisonPredicate.equalTo(leftA, Literal.of(1))).isPresent());
        Assertions.assertFalse(extract(ComparisonPredicate.equalTo(leftA, PlanConstructor.slot(left, "b")))
                .isPresent());
        Assertions.assertFalse(extract(ComparisonPredicate.equalTo(leftA, rightA),
                new ComparisonPredicate(ComparisonPredicate.Op.GT, leftA, Literal.of(1))).isPresent());
    }
}
