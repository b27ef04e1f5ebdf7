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

package org.apache.cascades.exceptions;

import org.apache.cascades.properties.PhysicalProperties;

/**
 * No physical plan of the root group delivers the required properties.
 */
public class NoFeasiblePlanException extends CascadesException {
    private final PhysicalProperties requiredProperties;

    public NoFeasiblePlanException(PhysicalProperties requiredProperties) {
        super("lowestCostPlans with physicalProperties(" + requiredProperties + ") doesn't exist in root group");
        this.requiredProperties = requiredProperties;
    }

    public PhysicalProperties getRequiredProperties() {
        return requiredProperties;
    }
}
