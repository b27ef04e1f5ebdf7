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

package org.apache.cascades;

import org.apache.cascades.common.CancellationHandle;
import org.apache.cascades.cost.CostModel;
import org.apache.cascades.cost.ValidatingCostModel;
import org.apache.cascades.exceptions.ConfigurationException;
import org.apache.cascades.exceptions.OptimizationCancelledException;
import org.apache.cascades.jobs.Job;
import org.apache.cascades.jobs.JobContext;
import org.apache.cascades.jobs.scheduler.JobPool;
import org.apache.cascades.jobs.scheduler.JobScheduler;
import org.apache.cascades.jobs.scheduler.JobStack;
import org.apache.cascades.jobs.scheduler.ScheduleContext;
import org.apache.cascades.jobs.scheduler.SimpleJobScheduler;
import org.apache.cascades.memo.Memo;
import org.apache.cascades.properties.PhysicalProperties;
import org.apache.cascades.qe.SessionVariable;
import org.apache.cascades.rules.RuleSet;
import org.apache.cascades.rules.RuleType;
import org.apache.cascades.trees.plans.Plan;

import com.google.common.base.Stopwatch;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Context used in CBO stage. Holds the state of one compilation: the memo, the job pool and the
 * shared, immutable rule set and cost model.
 */
public class CascadesContext implements ScheduleContext {
    private final Memo memo;
    private final RuleSet ruleSet;
    private final CostModel costModel;
    private final SessionVariable sessionVariable;
    private final CancellationHandle cancellationHandle;
    private final Set<RuleType> disabledRules;
    private final JobPool jobPool = new JobStack();
    private final JobScheduler jobScheduler = new SimpleJobScheduler();
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    // set once a search of this context failed, its memo may hold winners of an unfinished search
    private String abortReason;

    private CascadesContext(Plan plan, RuleSet ruleSet, CostModel costModel, SessionVariable sessionVariable,
            CancellationHandle cancellationHandle) {
        this.ruleSet = ruleSet;
        this.costModel = sessionVariable.isEnableCostModelValidation() && !(costModel instanceof ValidatingCostModel)
                ? new ValidatingCostModel(costModel) : costModel;
        this.sessionVariable = sessionVariable;
        this.cancellationHandle = cancellationHandle;
        this.disabledRules = sessionVariable.getDisabledRules();
        this.memo = new Memo(plan);
    }

    /**
     * Create a context for optimizing {@code plan}.
     *
     * @throws ConfigurationException if a collaborator is missing
     */
    public static CascadesContext newContext(Plan plan, RuleSet ruleSet, CostModel costModel,
            SessionVariable sessionVariable, CancellationHandle cancellationHandle) {
        if (plan == null) {
            throw new ConfigurationException("plan to optimize is missing");
        }
        if (ruleSet == null) {
            throw new ConfigurationException("rule set is missing");
        }
        if (costModel == null) {
            throw new ConfigurationException("cost model is missing");
        }
        if (sessionVariable == null) {
            throw new ConfigurationException("session variable is missing");
        }
        if (cancellationHandle == null) {
            throw new ConfigurationException("cancellation handle is missing");
        }
        return new CascadesContext(plan, ruleSet, costModel, sessionVariable, cancellationHandle);
    }

    /**
     * A context for the root group of the memo without any cost limit.
     */
    public JobContext newRootJobContext(PhysicalProperties requiredProperties) {
        return new JobContext(this, requiredProperties, Double.POSITIVE_INFINITY);
    }

    /**
     * Abort the compilation if it was cancelled or ran out of its time budget.
     *
     * @throws OptimizationCancelledException on cancellation or timeout
     */
    public void checkCancelled() {
        String reason = cancellationHandle.checkReason();
        if (reason != null) {
            throw new OptimizationCancelledException("optimization cancelled: " + reason);
        }
        long timeoutMs = sessionVariable.getOptimizerTimeoutMs();
        if (timeoutMs > 0 && stopwatch.elapsed(TimeUnit.MILLISECONDS) > timeoutMs) {
            throw new OptimizationCancelledException("optimization timeout, it has exceeded "
                    + SessionVariable.OPTIMIZER_TIMEOUT_MS + " " + timeoutMs + "ms");
        }
    }

    /**
     * Drop the pending jobs and refuse any further search or plan extraction on this context.
     */
    public void abort(String reason) {
        jobPool.clear();
        if (abortReason == null) {
            abortReason = reason == null ? "unknown error" : reason;
        }
    }

    public boolean isAborted() {
        return abortReason != null;
    }

    /**
     * @throws OptimizationCancelledException if an earlier search of this context was aborted
     */
    public void checkNotAborted() {
        if (abortReason != null) {
            throw new OptimizationCancelledException("optimization was aborted: " + abortReason);
        }
    }

    @Override
    public JobPool getJobPool() {
        return jobPool;
    }

    @Override
    public void pushJob(Job job) {
        jobPool.push(job);
    }

    public JobScheduler getJobScheduler() {
        return jobScheduler;
    }

    public Memo getMemo() {
        return memo;
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public SessionVariable getSessionVariable() {
        return sessionVariable;
    }

    public CancellationHandle getCancellationHandle() {
        return cancellationHandle;
    }

    public Set<RuleType> getDisabledRules() {
        return disabledRules;
    }

    public Stopwatch getStopwatch() {
        return stopwatch;
    }
}
