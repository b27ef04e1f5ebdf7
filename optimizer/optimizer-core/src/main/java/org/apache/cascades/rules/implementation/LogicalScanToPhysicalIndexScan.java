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

import org.apache.cascades.catalog.Index;
import org.apache.cascades.rules.Rule;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.plans.physical.PhysicalIndexScan;

import com.google.common.collect.ImmutableList;

/**
 * Implementation rule that convert logical scan to one physical index scan per index of the table.
 */
public class LogicalScanToPhysicalIndexScan extends OneImplementationRuleFactory {
    @Override
    public Rule build() {
        return logicalScan()
                .when(scan -> !scan.getTable().getIndexes().isEmpty())
                .thenMulti(scan -> {
                    ImmutableList.Builder<PhysicalIndexScan> indexScans = ImmutableList.builder();
                    for (Index index : scan.getTable().getIndexes()) {
                        indexScans.add(new PhysicalIndexScan(scan.getTable(), index, scan.getOutput(),
                                scan.getEngineType()));
                    }
                    return indexScans.build();
                })
                .toRule(RuleType.LOGICAL_SCAN_TO_PHYSICAL_INDEX_SCAN_RULE);
    }
}
