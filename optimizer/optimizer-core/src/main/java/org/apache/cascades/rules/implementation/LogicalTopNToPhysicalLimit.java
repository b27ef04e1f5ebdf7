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

package org.apache.cascades.rules.implementation;

import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.plans.physical.PhysicalLimit;

/**
 * Implementation rule that convert logical top-n to a physical limit over a child ordered on the
 * top-n keys. The child is told that only {@code limit + offset} rows are consumed.
 */
public class LogicalTopNToPhysicalLimit extends OneImplementationRuleFactory {
    @Override
    public Rule build() {
        return logicalTopN().then(topN -> new PhysicalLimit(topN.getLimit(), topN.getOffset(),
                topN.getOrderKeys(), topN.getEngineType(), topN.child(0)))
                .toRule(RuleType.LOGICAL_TOP_N_TO_PHYSICAL_LIMIT_RULE);
    }
}
