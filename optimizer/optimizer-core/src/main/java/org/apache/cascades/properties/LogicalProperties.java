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

import org.apache.cascades.trees.expressions.ExprId;
import org.apache.cascades.trees.expressions.SlotReference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Logical properties shared by every expression of a group: its output slots.
 * Two logical properties are equal when they output the same set of expr ids, whatever the
 * column order, so a commuted join lives in the same group as the original one.
 */
public class LogicalProperties {
    private final List<SlotReference> output;
    private final Set<ExprId> outputExprIdSet;

    public LogicalProperties(List<SlotReference> output) {
        this.output = ImmutableList.copyOf(output);
        ImmutableSet.Builder<ExprId> exprIds = ImmutableSet.builder();
        output.forEach(slot -> exprIds.add(slot.getExprId()));
        this.outputExprIdSet = exprIds.build();
    }

    public List<SlotReference> getOutput() {
        return output;
    }

    /**
     * Schema width used by the cost model: the number of output columns.
     */
    public int getWidth() {
        return Math.max(1, output.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return outputExprIdSet.equals(((LogicalProperties) o).outputExprIdSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outputExprIdSet);
    }

    @Override
    public String toString() {
        return "LogicalProperties" + output;
    }
}
