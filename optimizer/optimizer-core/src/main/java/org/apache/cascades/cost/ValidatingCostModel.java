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

import org.apache.cascades.exceptions.CostModelContractException;

import java.util.Objects;

/**
 * Checks every estimate of a delegate cost model: it must be a non-negative number and must not go
 * down when all row counts are doubled.
 */
public class ValidatingCostModel implements CostModel {
    private final CostModel delegate;

    public ValidatingCostModel(CostModel delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate can not be null");
    }

    public CostModel getDelegate() {
        return delegate;
    }

    @Override
    public Cost estimate(CostContext context) {
        Cost cost = checkValue(delegate.estimate(context), context);
        CostContext doubled = context.withScaledRowCounts(2);
        Cost doubledCost = checkValue(delegate.estimate(doubled), doubled);
        if (doubledCost.compareTo(cost) < 0) {
            throw new CostModelContractException("cost decreases from " + cost + " to " + doubledCost
                    + " when row counts double: " + context);
        }
        return cost;
    }

    private static Cost checkValue(Cost cost, CostContext context) {
        if (cost == null || Double.isNaN(cost.getValue()) || cost.getValue() < 0) {
            throw new CostModelContractException("invalid cost " + cost + " for " + context);
        }
        return cost;
    }
}
