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

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.statistics.Statistics;
import org.apache.cascades.trees.plans.Plan;

import java.util.Optional;

/**
 * Util for plan
 */
public class PlanUtils {

    private PlanUtils() {
    }

    /**
     * Statistics of the group a bound plan belongs to, falling back to the plan's own statistics.
     */
    public static Statistics groupStatistics(Plan plan) {
        Optional<GroupExpression> groupExpression = plan.getGroupExpression();
        if (groupExpression.isPresent() && groupExpression.get().getOwnerGroup() != null) {
            return groupExpression.get().getOwnerGroup().getStatistics();
        }
        return plan.getStats().orElseThrow(() -> new IllegalStateException("no statistics on " + plan));
    }
}
