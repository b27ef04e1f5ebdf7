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
import org.apache.cascades.trees.plans.physical.PhysicalLimit;
import org.apache.cascades.trees.plans.physical.PhysicalMergeJoin;
import org.apache.cascades.trees.plans.physical.PhysicalStreamAggregate;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Used for parent property drive.
 * <p>
 * For a physical expression and the properties required of it, list the alternatives of what to
 * request from its children. Each alternative holds one request per child.
 */
public class RequestPropertyDeriver {

    private RequestPropertyDeriver() {
    }

    /**
     * Get the request children property list.
     */
    public static List<List<PhysicalProperties>> getRequestChildrenPropertyList(GroupExpression groupExpression,
            PhysicalProperties requiredProperties) {
        Plan plan = groupExpression.getPlan();
        switch (plan.getType()) {
            case PHYSICAL_TABLE_SCAN:
            case PHYSICAL_INDEX_SCAN:
                return ImmutableList.of(ImmutableList.of());
            case PHYSICAL_FILTER:
                // a filter keeps the order, but not the number of rows
                return ImmutableList.of(ImmutableList.of(requiredProperties.withoutExpectedRowCount()));
            case PHYSICAL_PROJECT:
                return ImmutableList.of(ImmutableList.of(requiredProperties));
            case PHYSICAL_HASH_JOIN:
                return ImmutableList.of(ImmutableList.of(PhysicalProperties.ANY, PhysicalProperties.ANY));
            case PHYSICAL_MERGE_JOIN: {
                PhysicalMergeJoin mergeJoin = (PhysicalMergeJoin) plan;
                return ImmutableList.of(ImmutableList.of(
                        PhysicalProperties.ordered(mergeJoin.getLeftOrderKeys()),
                        PhysicalProperties.ordered(mergeJoin.getRightOrderKeys())));
            }
            case PHYSICAL_STREAM_AGGREGATE:
                return ImmutableList.of(ImmutableList.of(
                        PhysicalProperties.ordered(ascending(((PhysicalStreamAggregate) plan).getGroupByKeys()))));
            case PHYSICAL_LIMIT: {
                PhysicalLimit limit = (PhysicalLimit) plan;
                // the child is stopped once offset rows plus what the parent consumes are produced
                double expectedRowCount = Math.min(limit.getLimit(), requiredProperties.getExpectedRowCount())
                        + limit.getOffset();
                if (limit.getOrderKeys().isEmpty()) {
                    return ImmutableList.of(ImmutableList.of(
                            requiredProperties.withExpectedRowCount(expectedRowCount)));
                }
                return ImmutableList.of(ImmutableList.of(
                        PhysicalProperties.of(OrderSpec.of(limit.getOrderKeys()), expectedRowCount)));
            }
            case PHYSICAL_GATHER:
                // the gather keeps the order of its single input stream
                if (requiredProperties.isAny()) {
                    return ImmutableList.of(ImmutableList.of(PhysicalProperties.ANY));
                }
                return ImmutableList.of(ImmutableList.of(requiredProperties),
                        ImmutableList.of(PhysicalProperties.ANY));
            case PHYSICAL_HASH_AGGREGATE:
            case PHYSICAL_QUICK_SORT:
            case PHYSICAL_TOP_N:
                return ImmutableList.of(ImmutableList.of(PhysicalProperties.ANY));
            default:
                throw new IllegalArgumentException("can not request properties for " + plan);
        }
    }

    static List<OrderKey> ascending(List<SlotReference> slots) {
        ImmutableList.Builder<OrderKey> orderKeys = ImmutableList.builder();
        for (SlotReference slot : slots) {
            orderKeys.add(OrderKey.asc(slot));
        }
        return orderKeys.build();
    }
}
