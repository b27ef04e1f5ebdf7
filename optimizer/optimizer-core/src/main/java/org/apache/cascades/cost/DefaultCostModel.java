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

package org.apache.cascades.cost;

import org.apache.cascades.properties.OrderSpec;
import org.apache.cascades.qe.SessionVariable;
import org.apache.cascades.trees.plans.physical.PhysicalIndexScan;
import org.apache.cascades.trees.plans.physical.PhysicalLimit;
import org.apache.cascades.trees.plans.physical.PhysicalTableScan;
import org.apache.cascades.trees.plans.physical.PhysicalTopN;

import com.google.common.math.LongMath;

/**
 * Cost model built from the cost factors of a {@link SessionVariable}.
 * <p>
 * A scan whose natural order satisfies the required order stops after the expected row count.
 */
public class DefaultCostModel implements CostModel {
    private final double cpuFactor;
    private final double memoryFactor;
    private final double scanFactor;
    private final double indexScanFactor;
    private final double networkFactor;

    public DefaultCostModel(SessionVariable sessionVariable) {
        this.cpuFactor = sessionVariable.getCpuCostFactor();
        this.memoryFactor = sessionVariable.getMemoryCostFactor();
        this.scanFactor = sessionVariable.getScanCostFactor();
        this.indexScanFactor = sessionVariable.getIndexScanCostFactor();
        this.networkFactor = sessionVariable.getNetworkCostFactor();
    }

    @Override
    public Cost estimate(CostContext context) {
        double rows = context.getRowCount();
        int width = context.getWidth();
        switch (context.getPlan().getType()) {
            case PHYSICAL_TABLE_SCAN: {
                PhysicalTableScan scan = (PhysicalTableScan) context.getPlan();
                return Cost.of(scannedRows(context, scan.getNaturalOrder()) * width * scanFactor);
            }
            case PHYSICAL_INDEX_SCAN: {
                PhysicalIndexScan scan = (PhysicalIndexScan) context.getPlan();
                return Cost.of(scannedRows(context, scan.getNaturalOrder()) * width * scanFactor * indexScanFactor);
            }
            case PHYSICAL_FILTER:
            case PHYSICAL_PROJECT:
            case PHYSICAL_STREAM_AGGREGATE:
                return Cost.of(context.getChildRowCount(0) * cpuFactor);
            case PHYSICAL_HASH_JOIN: {
                double left = context.getChildRowCount(0);
                double right = context.getChildRowCount(1);
                return Cost.of((left + right) * cpuFactor + right * memoryFactor + rows * cpuFactor);
            }
            case PHYSICAL_MERGE_JOIN: {
                double left = context.getChildRowCount(0);
                double right = context.getChildRowCount(1);
                return Cost.of((left + right) * cpuFactor + rows * cpuFactor);
            }
            case PHYSICAL_HASH_AGGREGATE:
                return Cost.of(context.getChildRowCount(0) * cpuFactor + rows * width * memoryFactor);
            case PHYSICAL_QUICK_SORT:
                return Cost.of(sortCost(rows, width));
            case PHYSICAL_TOP_N: {
                PhysicalTopN topN = (PhysicalTopN) context.getPlan();
                double input = context.getChildRowCount(0);
                double kept = Math.min(input, LongMath.saturatedAdd(topN.getLimit(), topN.getOffset()));
                return Cost.of(input * log2(Math.max(2, kept)) * cpuFactor + kept * width * memoryFactor);
            }
            case PHYSICAL_LIMIT: {
                PhysicalLimit limit = (PhysicalLimit) context.getPlan();
                long consumed = LongMath.saturatedAdd(limit.getLimit(), limit.getOffset());
                return Cost.of(Math.min(context.getChildRowCount(0), consumed) * cpuFactor);
            }
            case PHYSICAL_GATHER:
                return Cost.of(rows * width * networkFactor);
            default:
                throw new IllegalArgumentException("can not estimate cost of " + context.getPlan());
        }
    }

    /**
     * Cost of sorting {@code rows} rows of {@code width} columns.
     */
    public double sortCost(double rows, int width) {
        if (rows <= 1) {
            return 0;
        }
        return rows * log2(rows) * width * cpuFactor + rows * width * memoryFactor;
    }

    private static double scannedRows(CostContext context, OrderSpec naturalOrder) {
        if (naturalOrder.satisfy(context.getRequiredProperties().getOrderSpec())) {
            return Math.min(context.getRowCount(), context.getRequiredProperties().getExpectedRowCount());
        }
        return context.getRowCount();
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }
}
