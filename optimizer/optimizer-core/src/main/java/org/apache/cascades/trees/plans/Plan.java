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

package org.apache.cascades.trees.plans;

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.properties.LogicalProperties;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.expressions.SlotReference;

import java.util.List;
import java.util.Optional;

/**
 * Abstract class for all plan node.
 *
 * <p>Equality of plans only covers the operator kind, its parameters and its engine; children,
 * statistics and memo bookkeeping are ignored, so two expressions are structurally equal iff
 * their plans are equal and their child groups are identical.
 */
public interface Plan {

    PlanType getType();

    EngineType getEngineType();

    List<Plan> children();

    default Plan child(int index) {
        return children().get(index);
    }

    default int arity() {
        return children().size();
    }

    Optional<GroupExpression> getGroupExpression();

    /**
     * Statistics attached by the statistics subsystem, or derived by the rule that created this plan.
     */
    Optional<Statistics> getStats();

    List<SlotReference> getOutput();

    default LogicalProperties getLogicalProperties() {
        return new LogicalProperties(getOutput());
    }

    Plan withChildren(List<Plan> children);

    Plan withGroupExpression(Optional<GroupExpression> groupExpression);

    String treeString();
}
