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

import org.apache.cascades.catalog.Table;
import org.apache.cascades.cost.Cost;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.OrderKey;
import org.apache.cascades.properties.OrderSpec;
import org.apache.cascades.properties.PhysicalProperties;
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
 * Full scan of a table. Rows come out in primary key order.
 */
public class PhysicalTableScan extends AbstractPhysicalPlan {
    private final Table table;
    private final List<SlotReference> output;

    public PhysicalTableScan(Table table, List<SlotReference> output, EngineType engineType) {
        this(table, output, engineType, Optional.empty(), Optional.empty(), PhysicalProperties.ANY,
                Optional.empty());
    }

    /**
     * Constructor for PhysicalTableScan.
     */
    public PhysicalTableScan(Table table, List<SlotReference> output, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost) {
        super(PlanType.PHYSICAL_TABLE_SCAN, engineType, groupExpression, statistics, physicalProperties, cost,
                ImmutableList.of());
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

    /**
     * Order the rows are produced in: the primary key columns, ascending.
     */
    public OrderSpec getNaturalOrder() {
        return naturalOrder(table, table.getPrimaryKeys(), output);
    }

    static OrderSpec naturalOrder(Table table, List<String> keyColumns, List<SlotReference> output) {
        ImmutableList.Builder<OrderKey> orderKeys = ImmutableList.builder();
        for (String keyColumn : keyColumns) {
            int index = table.getColumns().indexOf(table.getColumn(keyColumn).get());
            orderKeys.add(OrderKey.asc(output.get(index)));
        }
        return OrderSpec.of(orderKeys.build());
    }

    @Override
    protected PhysicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, List<Plan> children) {
        Preconditions.checkArgument(children.isEmpty(), "PhysicalTableScan is a leaf");
        return new PhysicalTableScan(table, output, engineType, groupExpression, statistics, physicalProperties,
                cost);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && table.equals(((PhysicalTableScan) o).table)
                && output.equals(((PhysicalTableScan) o).output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), table, output);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("PhysicalTableScan", "table", table.getName(), "engine", engineType);
    }
}
