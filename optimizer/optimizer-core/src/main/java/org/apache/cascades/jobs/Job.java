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

package org.apache.cascades.jobs;

import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.rules.RuleSet;
import org.apache.cascades.rules.RuleType;

import java.util.Set;

/**
 * Abstract class for all job using for analyze and optimize query plan.
 */
public abstract class Job {
    protected JobType type;
    protected JobContext context;

    public Job(JobType type, JobContext context) {
        this.type = type;
        this.context = context;
    }

    public void pushJob(Job job) {
        context.getCascadesContext().pushJob(job);
    }

    public RuleSet getRuleSet() {
        return context.getCascadesContext().getRuleSet();
    }

    public Set<RuleType> getDisabledRules() {
        return context.getCascadesContext().getDisabledRules();
    }

    public JobType getType() {
        return type;
    }

    public JobContext getContext() {
        return context;
    }

    protected void countJobExecutionTimesOfGroupExpressions(GroupExpression groupExpression) {
        groupExpression.incrementJobExecutionCount();
    }

    public abstract void execute();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{required=" + context.getRequiredProperties()
                + ", upperBound=" + context.getCostUpperBound() + "}";
    }
}
