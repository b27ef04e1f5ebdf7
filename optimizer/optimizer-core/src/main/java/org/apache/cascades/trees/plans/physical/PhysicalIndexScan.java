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

import org.apache.cascades.catalog.Index;
import org.apache.cascades.catalog.Table;
import org.apache.cascades.cost.Cost;
import org.apache.cascades.memo.GroupExpression;
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
 * Scan of a table through one of its secondary indexes. Rows come out in index key order.
 */
public class PhysicalIndexScan extends AbstractPhysicalPlan {
    private final Table table;
    private final Index index;
    private final List<SlotReference> output;

    public PhysicalIndexScan(Table table, Index index, List<SlotReference> output, EngineType engineType) {
        this(table, index, output, engineType, Optional.empty(), Optional.empty(), PhysicalProperties.ANY,
                Optional.empty());
    }

    /**
     * Constructor for PhysicalIndexScan.
     */
    public PhysicalIndexScan(Table table, Index index, List<SlotReference> output, EngineType engineType,
            Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost) {
        super(PlanType.PHYSICAL_INDEX_SCAN, engineType, groupExpression, statistics, physicalProperties, cost,
                ImmutableList.of());
        Preconditions.checkArgument(table.getIndexes().contains(index),
                "index %s does not belong to table %s", index.getName(), table.getName());
        this.table = table;
        this.index = index;
        this.output = ImmutableList.copyOf(output);
    }

    public Table getTable() {
        return table;
    }

    public Index getIndex() {
        return index;
    }

    @Override
    public List<SlotReference> getOutput() {
        return output;
    }

    public OrderSpec getNaturalOrder() {
        return PhysicalTableScan.naturalOrder(table, index.getKeyColumns(), output);
    }

    @Override
    protected PhysicalPlan copy(Optional<GroupExpression> groupExpression, Optional<Statistics> statistics,
            PhysicalProperties physicalProperties, Optional<Cost> cost, List<Plan> children) {
        Preconditions.checkArgument(children.isEmpty(), "PhysicalIndexScan is a leaf");
        return new PhysicalIndexScan(table, index, output, engineType, groupExpression, statistics,
                physicalProperties, cost);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        PhysicalIndexScan that = (PhysicalIndexScan) o;
        return table.equals(that.table) && index.equals(that.index) && output.equals(that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), table, index, output);
    }

    @Override
    public String toString() {
        return Utils.toSqlString("PhysicalIndexScan", "table", table.getName(), "index", index.getName(),
                "engine", engineType);
    }
}
