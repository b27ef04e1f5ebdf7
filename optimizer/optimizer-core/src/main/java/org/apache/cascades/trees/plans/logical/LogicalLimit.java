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
 * Logical limit plan
 * eg: select * from table limit 10 offset 5
 * limit: 10
 * offset: 5
 */
public class LogicalLimit extends AbstractLogicalPlan {
    private final long limit;
    private final long offset;

    public LogicalLimit(long limit, long offset, EngineType engineType, Plan child) {
        this(limit, offset, engineType, Optional.empty(), Optional.empty(), child);
    }

    /**
     * Constructor for LogicalLimit.
     */
    public LogicalLimit(long limit, long offset, EngineType engineType, Optional<GroupExpression> groupExpression,
            Optional<Statistics> statistics, Plan child) {
        super(PlanType.LOGICAL_LIMIT, engineType, groupExpression, statistics, ImmutableList.of(child));
        Preconditions.checkArgument(limit >= 0 && offset >= 0, "limit and offset must be non-negative");
        this.limit = limit;
        this.offset = offset;
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
        Preconditions.checkArgument(children.size() == 1, "LogicalLimit should have 1 child");
        return new LogicalLimit(limit, offset, engineType, groupExpression, statistics, children.get(0));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        LogicalLimit that = (LogicalLimit) o;
        return limit == that.limit && offset == that.offset;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), limit, offset);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("LogicalLimit", "limit", limit, "offset", offset, "engine", engineType);
    }
}
