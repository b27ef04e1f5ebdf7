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

package org.apache.cascades.statistics;

import com.google.common.base.Preconditions;

import java.text.DecimalFormat;

/**
 * Statistics snapshot attached to a plan node by the statistics subsystem. Immutable for the whole
 * compilation, so it can be shared by concurrent compilations.
 */
public class Statistics {
    private static final DecimalFormat FORMAT = new DecimalFormat("#,##0.##");

    private final double rowCount;

    public Statistics(double rowCount) {
        Preconditions.checkArgument(rowCount >= 0 && !Double.isNaN(rowCount),
                "row count must be non-negative, but is %s", rowCount);
        this.rowCount = rowCount;
    }

    public static Statistics of(double rowCount) {
        return new Statistics(rowCount);
    }

    public double getRowCount() {
        return rowCount;
    }

    public Statistics withRowCount(double rowCount) {
        return new Statistics(rowCount);
    }

    public String detail(String prefix) {
        return prefix + "rows=" + FORMAT.format(rowCount) + "\n";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Double.compare(rowCount, ((Statistics) o).rowCount) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(rowCount);
    }

    @Override
    public String toString() {
        return "rows=" + FORMAT.format(rowCount);
    }
}
