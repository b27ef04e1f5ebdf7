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

import com.google.common.base.Preconditions;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Utils for the optimizer.
 */
public class Utils {

    private Utils() {
    }

    /**
     * Used for packing Plan/Expression to string, e.g. {@code LogicalFilter[conjuncts=(a > 1)]}.
     *
     * @param planName name of the plan node
     * @param variables alternating name and value
     */
    public static String toSqlString(String planName, Object... variables) {
        Preconditions.checkState(variables.length % 2 == 0, "variables must be name/value pairs");
        if (variables.length == 0) {
            return planName + "[]";
        }
        StringBuilder stringBuilder = new StringBuilder();
        stringBuilder.append(planName).append("[");
        for (int i = 0; i < variables.length; i += 2) {
            if (i != 0) {
                stringBuilder.append(", ");
            }
            stringBuilder.append(variables[i]).append("=").append(variables[i + 1]);
        }
        return stringBuilder.append("]").toString();
    }

    public static String join(Collection<?> items) {
        return items.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
