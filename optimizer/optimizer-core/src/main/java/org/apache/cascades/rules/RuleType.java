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

package org.apache.cascades.rules;

/**
 * Type of rules, each rule has its unique type. The ordinal indexes the applied-rule mask of a
 * group expression.
 */
public enum RuleType {
    // exploration rules
    JOIN_COMMUTE(RuleTypeClass.EXPLORATION),
    PUSH_DOWN_FILTER_THROUGH_PROJECT(RuleTypeClass.EXPLORATION),
    PUSH_DOWN_FILTER_THROUGH_GATHER(RuleTypeClass.EXPLORATION),
    PUSH_DOWN_TOP_N_THROUGH_GATHER(RuleTypeClass.EXPLORATION),

    // implementation rules
    LOGICAL_SCAN_TO_PHYSICAL_TABLE_SCAN_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_SCAN_TO_PHYSICAL_INDEX_SCAN_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_FILTER_TO_PHYSICAL_FILTER_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_PROJECT_TO_PHYSICAL_PROJECT_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_JOIN_TO_HASH_JOIN_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_JOIN_TO_MERGE_JOIN_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_AGG_TO_PHYSICAL_HASH_AGG_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_AGG_TO_PHYSICAL_STREAM_AGG_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_SORT_TO_PHYSICAL_QUICK_SORT_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_TOP_N_TO_PHYSICAL_TOP_N_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_TOP_N_TO_PHYSICAL_LIMIT_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_LIMIT_TO_PHYSICAL_LIMIT_RULE(RuleTypeClass.IMPLEMENTATION),
    LOGICAL_GATHER_TO_PHYSICAL_GATHER_RULE(RuleTypeClass.IMPLEMENTATION);

    private final RuleTypeClass ruleTypeClass;

    RuleType(RuleTypeClass ruleTypeClass) {
        this.ruleTypeClass = ruleTypeClass;
    }

    public RuleTypeClass getRuleTypeClass() {
        return ruleTypeClass;
    }

    public RulePromise getRulePromise() {
        return ruleTypeClass == RuleTypeClass.IMPLEMENTATION ? RulePromise.IMPLEMENT : RulePromise.EXPLORE;
    }

    /**
     * Class of the rule.
     */
    public enum RuleTypeClass {
        EXPLORATION,
        IMPLEMENTATION,
    }
}
