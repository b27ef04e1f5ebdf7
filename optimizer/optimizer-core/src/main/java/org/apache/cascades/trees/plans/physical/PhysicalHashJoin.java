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
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.JoinType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;
import org.apache.cascades.util.Utils;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.Optional;

/**
 * Physical hash join plan. The right child is the build side.
 */
public class PhysicalHashJoin extends AbstractPhysicalJoin {

    public PhysicalHashJoin(JoinType joinType, List<Expression> hashJoinConjuncts, EngineType engineType,
            Plan left, Plan right) {
        this(joinType, hashJoinConjuncts, engineType, Optional.empty(), Optional.empty(), PhysicalProperties.ANY,
                Optional.empty(), left, right);
    }

    /**
     * Constructor for PhysicalHashJoin.
     */
    public PhysicalHashJoin(JoinType joinType, List<Expression> hashJoinConjuncts, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, Plan left, Plan right) {
        super(PlanType.PHYSICAL_HASH_JOIN, joinType, hashJoinConjuncts, engineType, groupExpression, statistics,
                physicalProperties, cost, left, right);
    }

    @Override
    protected PhysicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, List<Plan> children) {
        Preconditions.checkArgument(children.size() == 2, "PhysicalHashJoin should have 2 children");
        return new PhysicalHashJoin(joinType, hashJoinConjuncts, engineType, groupExpression, statistics,
                physicalProperties, cost, children.get(0), children.get(1));
    }

    @Override
    public String toString() {
        return Utils.toSqlString("PhysicalHashJoin", "type", joinType,
                "hashJoinConjuncts", Utils.join(hashJoinConjuncts), "engine", engineType);
    }
}
