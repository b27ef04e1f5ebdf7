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
import org.apache.cascades.trees.plans.logical.LogicalFilter;
import org.apache.cascades.trees.plans.logical.LogicalProject;
import org.apache.cascades.util.PlanUtils;

/**
 * Push down filter through project.
 * input:
 * filter(a > 2, b > 0)
 * |
 * project(a, b)
 * output:
 * project(a, b)
 * |
 * filter(a > 2, b > 0)
 */
public class PushDownFilterThroughProject extends OneExplorationRuleFactory {

    @Override
    public Rule build() {
        return logicalFilter(logicalProject())
                .when(filter -> filter.getEngineType() == filter.child(0).getEngineType())
                .then(filter -> {
                    LogicalProject project = (LogicalProject) filter.child(0);
                    LogicalFilter pushedFilter = new LogicalFilter(filter.getConjuncts(), project.getEngineType(),
                            project.child(0));
                    return new LogicalProject(project.getProjects(), project.getEngineType(),
                            pushedFilter.withStats(PlanUtils.groupStatistics(filter)));
                })
                .toRule(RuleType.PUSH_DOWN_FILTER_THROUGH_PROJECT);
    }
}
