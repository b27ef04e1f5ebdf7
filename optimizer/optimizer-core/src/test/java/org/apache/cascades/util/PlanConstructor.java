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

import org.apache.cascades.catalog.Column;
import org.apache.cascades.catalog.Index;
import org.apache.cascades.catalog.Table;
import org.apache.cascades.common.IdGenerator;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.ExprId;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.EngineType;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.logical.LogicalPlan;
import org.apache.cascades.trees.plans.logical.LogicalScan;
import org.apache.cascades.types.DataType;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Builds catalog tables and logical plans carrying statistics for tests. Each instance hands out
 * its own expression ids.
 */
public class PlanConstructor {
    private final IdGenerator<ExprId> exprIdGenerator = ExprId.createGenerator();
    private long nextTableId = 0;

    /**
     * A table of INT columns.
     */
    public Table newTable(String name, List<String> primaryKeys, List<Index> indexes, String... columnNames) {
        ImmutableList.Builder<Column> columns = ImmutableList.builder();
        for (String columnName : columnNames) {
            columns.add(new Column(columnName, DataType.INT));
        }
        return new Table(nextTableId++, name, columns.build(), primaryKeys, indexes);
    }

    /**
     * The table {@code name(pk, a, b)} with primary key {@code pk}.
     */
    public Table newPkTable(String name, Index... indexes) {
        return newTable(name, ImmutableList.of("pk"), ImmutableList.copyOf(indexes), "pk", "a", "b");
    }

    public LogicalScan newLogicalScan(Table table, EngineType engineType, double rowCount) {
        ImmutableList.Builder<SlotReference> output = ImmutableList.builder();
        for (Column column : table.getColumns()) {
            output.add(new SlotReference(exprIdGenerator.getNextId(), column.getName(), column.getType(),
                    table.getName()));
        }
        return withRows(new LogicalScan(table, output.build(), engineType), rowCount);
    }

    public SlotReference newSlot(String name, DataType dataType) {
        return new SlotReference(exprIdGenerator.getNextId(), name, dataType, "");
    }

    public static <T extends LogicalPlan> T withRows(T plan, double rowCount) {
        @SuppressWarnings("unchecked")
        T withStats = (T) plan.withStats(Statistics.of(rowCount));
        return withStats;
    }

    /**
     * The output slot of {@code plan} named {@code name}.
     */
    public static SlotReference slot(Plan plan, String name) {
        for (SlotReference slot : plan.getOutput()) {
            if (slot.getName().equals(name)) {
                return slot;
            }
        }
        throw new IllegalArgumentException("no slot " + name + " in " + plan.getOutput());
    }
}
