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

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution engine a plan subtree is assigned to by engine selection. The compute engine runs on
 * the coordinator and can execute every operator; the storage engine is pushed down next to the
 * data and can only run scans and row-local operators.
 */
public enum EngineType {
    COMPUTE,
    STORAGE;

    public static final Set<EngineType> ALL = EnumSet.allOf(EngineType.class);
    public static final Set<EngineType> COMPUTE_ONLY = EnumSet.of(COMPUTE);
}
