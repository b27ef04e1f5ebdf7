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

package org.apache.cascades.trees.plans.physical;

import org.apache.cascades.cost.Cost;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.Expression;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.JoinType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;
import org.apache.cascades.util.Utils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Physical sort-merge join plan. Both inputs must arrive sorted ascending on their join keys,
 * {@code leftKeys.get(i)} pairing with {@code rightKeys.get(i)}.
 */
public class PhysicalMergeJoin extends AbstractPhysicalJoin {
    private final List<SlotReference> leftKeys;
    private final List<SlotReference> rightKeys;

    public PhysicalMergeJoin(JoinType joinType, List<Expression> hashJoinConjuncts, List<SlotReference> leftKeys,
            List<SlotReference> rightKeys, EngineType engineType, Plan left, Plan right) {
        this(joinType, hashJoinConjuncts, leftKeys, rightKeys, engineType, Optional.empty(), Optional.empty(),
                PhysicalProperties.ANY, Optional.empty(), left, right);
    }

    /**
     * Constructor for PhysicalMergeJoin.
     */
    public PhysicalMergeJoin(JoinType joinType, List<Expression> hashJoinConjuncts, List<SlotReference> leftKeys,
            List<SlotReference> rightKeys, EngineType engineType, Optional<GroupExpression> groupExpression,
            Optional<Statistics> statistics, PhysicalProperties physicalProperties, Optional<Cost> cost,
            Plan left, Plan right) {
        super(PlanType.PHYSICAL_MERGE_JOIN, joinType, hashJoinConjuncts, engineType, groupExpression, statistics,
                physicalProperties, cost, left, right);
        Preconditions.checkArgument(!leftKeys.isEmpty() && leftKeys.size() == rightKeys.size(),
                "merge join needs the same non-zero number of keys on both sides");
        this.leftKeys = ImmutableList.copyOf(leftKeys);
        this.rightKeys = ImmutableList.copyOf(rightKeys);
    }

    public List<SlotReference> getLeftKeys() {
        return leftKeys;
    }

    public List<SlotReference> getRightKeys() {
        return rightKeys;
    }

    public List<OrderKey> getLeftOrderKeys() {
        return leftKeys.stream().map(OrderKey::asc).collect(Collectors.toList());
    }

    public List<OrderKey> getRightOrderKeys() {
        return rightKeys.stream().map(OrderKey::asc).collect(Collectors.toList());
    }

    @Override
    protected PhysicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, List<Plan> children) {
        Preconditions.checkArgument(children.size() == 2, "PhysicalMergeJoin should have 2 children");
        return new PhysicalMergeJoin(joinType, hashJoinConjuncts, leftKeys, rightKeys, engineType, groupExpression,
                statistics, physicalProperties, cost, children.get(0), children.get(1));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        PhysicalMergeJoin that = (PhysicalMergeJoin) o;
        return leftKeys.equals(that.leftKeys) && rightKeys.equals(that.rightKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), leftKeys, rightKeys);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("PhysicalMergeJoin", "type", joinType, "leftKeys", Utils.join(leftKeys),
                "rightKeys", Utils.join(rightKeys), "engine", engineType);
    }
}
