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

package org.apache.cascades.jobs.executor;

import org.apache.cascades.CascadesContext;
import org.apache.cascades.exceptions.OptimizationCancelledException;
import org.apache.cascades.jobs.cascades.OptimizeGroupJob;
import org.apache.cascades.properties.PhysicalProperties;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Cascades style optimize:
 * Perform equivalent logical plan exploration and physical implementation enumeration,
 * try to find best plan under the guidance of statistic information and cost model.
 */
public class Optimizer {
    private static final Logger LOG = LogManager.getLogger(Optimizer.class);

    private final CascadesContext cascadesContext;

    public Optimizer(CascadesContext cascadesContext) {
        this.cascadesContext = Objects.requireNonNull(cascadesContext, "cascadesContext cannot be null");
    }

    /**
     * Search the memo until the root group has a winner for {@code requiredProperties} or the search
     * space is exhausted. Winners found by an earlier call are reused. A search that fails leaves the
     * context aborted.
     *
     * @throws OptimizationCancelledException if the context was aborted before
     */
    public void execute(PhysicalProperties requiredProperties) {
        cascadesContext.checkNotAborted();
        Stopwatch stopwatch = cascadesContext.getStopwatch();
        if (!stopwatch.isRunning()) {
            stopwatch.start();
        }
        cascadesContext.pushJob(new OptimizeGroupJob(cascadesContext.getMemo().getRoot(),
                cascadesContext.newRootJobContext(requiredProperties)));
        try {
            cascadesContext.getJobScheduler().executeJobPool(cascadesContext);
        } catch (RuntimeException e) {
            cascadesContext.abort(e.getMessage());
            throw e;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("optimized root group for {}, memo holds {} group expressions", requiredProperties,
                    cascadesContext.getMemo().getGroupExpressionsSize());
        }
    }
}
