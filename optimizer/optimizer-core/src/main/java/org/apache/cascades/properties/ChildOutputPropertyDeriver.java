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

package org.apache.cascades.properties;

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.trees.expressions.SlotReference;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.physical.AbstractPhysicalSort;
import org.apache.cascades.trees.plans.physical.PhysicalIndexScan;
import org.apache.cascades.trees.plans.physical.PhysicalMergeJoin;
import org.apache.cascades.trees.plans.physical.PhysicalProject;
import org.apache.cascades.trees.plans.physical.PhysicalStreamAggregate;
import org.apache.cascades.trees.plans.physical.PhysicalTableScan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Set;

/**
 * Used for property drive: the order a physical expression delivers, given the properties its
 * children actually deliver.
 */
public class ChildOutputPropertyDeriver {

    private ChildOutputPropertyDeriver() {
    }

    /**
     * Derive the output properties of {@code groupExpression}.
     */
    public static PhysicalProperties getOutputProperties(GroupExpression groupExpression,
            List<PhysicalProperties> childrenOutputProperties) {
        Plan plan = groupExpression.getPlan();
        Preconditions.checkArgument(childrenOutputProperties.size() == plan.arity(),
                "%s has %s children but %s child properties", plan, plan.arity(), childrenOutputProperties.size());
        switch (plan.getType()) {
            case PHYSICAL_TABLE_SCAN:
                return PhysicalProperties.of(((PhysicalTableScan) plan).getNaturalOrder());
            case PHYSICAL_INDEX_SCAN:
                return PhysicalProperties.of(((PhysicalIndexScan) plan).getNaturalOrder());
            case PHYSICAL_FILTER:
            case PHYSICAL_LIMIT:
            case PHYSICAL_GATHER:
                return PhysicalProperties.of(childrenOutputProperties.get(0).getOrderSpec());
            case PHYSICAL_PROJECT:
                return PhysicalProperties.of(projectOrder(((PhysicalProject) plan).getProjects(),
                        childrenOutputProperties.get(0).getOrderSpec()));
            case PHYSICAL_MERGE_JOIN:
                return PhysicalProperties.ordered(((PhysicalMergeJoin) plan).getLeftOrderKeys());
            case PHYSICAL_STREAM_AGGREGATE:
                return PhysicalProperties.ordered(
                        RequestPropertyDeriver.ascending(((PhysicalStreamAggregate) plan).getGroupByKeys()));
            case PHYSICAL_QUICK_SORT:
            case PHYSICAL_TOP_N:
                return PhysicalProperties.ordered(((AbstractPhysicalSort) plan).getOrderKeys());
            case PHYSICAL_HASH_JOIN:
            case PHYSICAL_HASH_AGGREGATE:
                return PhysicalProperties.ANY;
            default:
                throw new IllegalArgumentException("can not derive output properties of " + plan);
        }
    }

    // the longest prefix of the child order whose columns survive the projection
    private static OrderSpec projectOrder(List<SlotReference> projects, OrderSpec childOrder) {
        Set<SlotReference> outputs = ImmutableSet.copyOf(projects);
        ImmutableList.Builder<OrderKey> orderKeys = ImmutableList.builder();
        for (OrderKey orderKey : childOrder.getOrderKeys()) {
            if (!outputs.contains(orderKey.getExpr())) {
                break;
            }
            orderKeys.add(orderKey);
        }
        return OrderSpec.of(orderKeys.build());
    }
}
