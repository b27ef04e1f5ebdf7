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

package org.apache.cascades.rules.exploration;

import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.plans.logical.LogicalJoin;

/**
 * Join commute: swap the children of an inner or cross join.
 * The output slot set does not change, so the commuted join joins the same group.
 */
public class JoinCommute extends OneExplorationRuleFactory {

    @Override
    public Rule build() {
        return logicalJoin()
                .when(join -> join.getJoinType().isCommutable())
                .then(join -> new LogicalJoin(join.getJoinType(), join.getHashJoinConjuncts(),
                        join.getEngineType(), join.right(), join.left()))
                .toRule(RuleType.JOIN_COMMUTE);
    }
}
