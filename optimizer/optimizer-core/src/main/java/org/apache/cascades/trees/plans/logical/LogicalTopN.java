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
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.PlanType;
import org.apache.cascades.util.Utils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Logical top-N plan: order by ... limit {@code limit} offset {@code offset}.
 */
public class LogicalTopN extends AbstractLogicalPlan {
    private final List<OrderKey> orderKeys;
    private final long limit;
    private final long offset;

    public LogicalTopN(List<OrderKey> orderKeys, long limit, long offset, EngineType engineType, Plan child) {
        this(orderKeys, limit, offset, engineType, Optional.empty(), Optional.empty(), child);
    }

    /**
     * Constructor for LogicalTopN.
     */
    public LogicalTopN(List<OrderKey> orderKeys, long limit, long offset, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics, Plan child) {
        super(PlanType.LOGICAL_TOP_N, engineType, groupExpression, statistics, ImmutableList.of(child));
        Preconditions.checkArgument(!orderKeys.isEmpty(), "top-n must have at least one order key");
        Preconditions.checkArgument(limit >= 0 && offset >= 0, "limit and offset must be non-negative");
        this.orderKeys = ImmutableList.copyOf(orderKeys);
        this.limit = limit;
        this.offset = offset;
    }

    public List<OrderKey> getOrderKeys() {
        return orderKeys;
    }

    public long getLimit() {
        return limit;
    }

    public long getOffset() {
        return offset;
    }

    @Override
    public List<SlotReference> getOutput() {
        return child(0).getOutput();
    }

    @Override
    protected LogicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1, "LogicalTopN should have 1 child");
        return new LogicalTopN(orderKeys, limit, offset, engineType, groupExpression, statistics, children.get(0));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        LogicalTopN that = (LogicalTopN) o;
        return limit == that.limit && offset == that.offset && orderKeys.equals(that.orderKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), orderKeys, limit, offset);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("LogicalTopN", "orderKeys", Utils.join(orderKeys),
                "limit", limit, "offset", offset, "engine", engineType);
    }
}
