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
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.Expression;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.JoinType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract class for all physical join node.
 */
public abstract class AbstractPhysicalJoin extends AbstractPhysicalPlan {
    protected final JoinType joinType;
    protected final List<Expression> hashJoinConjuncts;

    protected AbstractPhysicalJoin(PlanType type, JoinType joinType, List<Expression> hashJoinConjuncts,
            EngineType engineType, Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, Plan left, Plan right) {
        super(type, engineType, groupExpression, statistics, physicalProperties, cost, ImmutableList.of(left, right));
        this.joinType = Objects.requireNonNull(joinType, "joinType can not be null");
        this.hashJoinConjuncts = ImmutableList.copyOf(hashJoinConjuncts);
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public List<Expression> getHashJoinConjuncts() {
        return hashJoinConjuncts;
    }

    public Plan left() {
        return child(0);
    }

    public Plan right() {
        return child(1);
    }

    @Override
    public List<SlotReference> getOutput() {
        return ImmutableList.<SlotReference>builder()
                .addAll(left().getOutput())
                .addAll(right().getOutput())
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        AbstractPhysicalJoin that = (AbstractPhysicalJoin) o;
        return joinType == that.joinType && hashJoinConjuncts.equals(that.hashJoinConjuncts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), joinType, hashJoinConjuncts);
    }
}
