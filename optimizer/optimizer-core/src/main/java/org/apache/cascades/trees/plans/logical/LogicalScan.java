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

import org.apache.cascades.catalog.Table;
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
 * Logical scan of a catalog table. Output slots are aligned with the table's columns.
 */
public class LogicalScan extends AbstractLogicalPlan {
    private final Table table;
    private final List<SlotReference> output;

    public LogicalScan(Table table, List<SlotReference> output, EngineType engineType) {
        this(table, output, engineType, Optional.empty(), Optional.empty());
    }

    /**
     * Constructor for LogicalScan.
     */
    public LogicalScan(Table table, List<SlotReference> output, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics) {
        super(PlanType.LOGICAL_SCAN, engineType, groupExpression, statistics, ImmutableList.of());
        Preconditions.checkArgument(output.size() == table.getColumns().size(),
                "scan of %s must output every column", table.getName());
        this.table = Objects.requireNonNull(table, "table can not be null");
        this.output = ImmutableList.copyOf(output);
    }

    public Table getTable() {
        return table;
    }

    @Override
    public List<SlotReference> getOutput() {
        return output;
    }

    @Override
    protected LogicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            List<Plan> children) {
        Preconditions.checkArgument(children.isEmpty(), "LogicalScan is a leaf");
        return new LogicalScan(table, output, engineType, groupExpression, statistics);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && table.equals(((LogicalScan) o).table) && output.equals(((LogicalScan) o).output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), table, output);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("LogicalScan", "table", table.getName(), "engine", engineType);
    }
}
