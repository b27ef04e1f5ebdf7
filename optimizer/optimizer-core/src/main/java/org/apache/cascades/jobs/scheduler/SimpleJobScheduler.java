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

package org.apache.cascades.jobs.scheduler;

import org.apache.cascades.CascadesContext;
import org.apache.cascades.jobs.Job;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Single thread, serial scheduler. Cancellation and the time budget are checked before each job.
 */
public class SimpleJobScheduler implements JobScheduler {
    private static final Logger LOG = LogManager.getLogger(SimpleJobScheduler.class);

    @Override
    public void executeJobPool(ScheduleContext scheduleContext) {
        JobPool pool = scheduleContext.getJobPool();
        CascadesContext context = (CascadesContext) scheduleContext;
        long executedJobs = 0;
        while (!pool.isEmpty()) {
            context.checkCancelled();
            Job job = pool.pop();
            job.execute();
            executedJobs++;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("executed {} jobs in {}", executedJobs, context.getStopwatch());
        }
    }
}
