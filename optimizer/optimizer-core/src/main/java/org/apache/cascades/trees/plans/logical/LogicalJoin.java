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

package org.apache.cascades.trees.plans.logical;

import org.apache.cascades.memo.GroupExpression;
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

/**
 * Logical join plan. {@code hashJoinConjuncts} are equalities between a left slot and a right slot.
 */
public class LogicalJoin extends AbstractLogicalPlan {
    private final JoinType joinType;
    private final List<Expression> hashJoinConjuncts;

    public LogicalJoin(JoinType joinType, List<Expression> hashJoinConjuncts, EngineType engineType,
            Plan left, Plan right) {
        this(joinType, hashJoinConjuncts, engineType, Optional.empty(), Optional.empty(), left, right);
    }

    /**
     * Constructor for LogicalJoin.
     */
    public LogicalJoin(JoinType joinType, List<Expression> hashJoinConjuncts, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics, Plan left, Plan right) {
        super(PlanType.LOGICAL_JOIN, engineType, groupExpression, statistics, ImmutableList.of(left, right));
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
    protected LogicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            List<Plan> children) {
        Preconditions.checkArgument(children.size() == 2, "LogicalJoin should have 2 children");
        return new LogicalJoin(joinType, hashJoinConjuncts, engineType, groupExpression, statistics,
                children.get(0), children.get(1));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        LogicalJoin that = (LogicalJoin) o;
        return joinType == that.joinType && hashJoinConjuncts.equals(that.hashJoinConjuncts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), joinType, hashJoinConjuncts);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("LogicalJoin", "type", joinType,
                "hashJoinConjuncts", Utils.join(hashJoinConjuncts), "engine", engineType);
    }
}
