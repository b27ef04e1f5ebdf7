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

/**
 * Types for all Plan in the optimizer.
 */
public enum PlanType {
    // special
    GROUP_PLAN,

    // logical plans
    LOGICAL_SCAN,
    LOGICAL_FILTER,
    LOGICAL_PROJECT,
    LOGICAL_JOIN,
    LOGICAL_AGGREGATE,
    LOGICAL_SORT,
    LOGICAL_TOP_N,
    LOGICAL_LIMIT,
    LOGICAL_GATHER,

    // physical plans
    PHYSICAL_TABLE_SCAN,
    PHYSICAL_INDEX_SCAN,
    PHYSICAL_FILTER,
    PHYSICAL_PROJECT,
    PHYSICAL_HASH_JOIN,
    PHYSICAL_MERGE_JOIN,
    PHYSICAL_HASH_AGGREGATE,
    PHYSICAL_STREAM_AGGREGATE,
    PHYSICAL_QUICK_SORT,
    PHYSICAL_TOP_N,
    PHYSICAL_LIMIT,
    PHYSICAL_GATHER;

    public boolean isLogical() {
        return name().startsWith("LOGICAL_");
    }

    public boolean isPhysical() {
        return name().startsWith("PHYSICAL_");
    }
}
