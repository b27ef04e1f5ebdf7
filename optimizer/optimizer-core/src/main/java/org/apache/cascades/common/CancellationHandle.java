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

package org.apache.cascades.common;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation and deadline signal handed to one query compilation by its driver.
 * The driver may cancel from another thread; the optimizer only polls it.
 */
public class CancellationHandle {
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long deadlineNanos;
    private volatile boolean cancelled = false;
    private volatile String reason;

    private CancellationHandle(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static CancellationHandle create() {
        return new CancellationHandle(NO_DEADLINE);
    }

    public static CancellationHandle withTimeout(Duration timeout) {
        return new CancellationHandle(System.nanoTime() + timeout.toNanos());
    }

    public void cancel(String reason) {
        this.reason = reason;
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDeadlineExceeded() {
        return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos > 0;
    }

    /**
     * Returns the reason of the trip, or null when the handle is still live.
     */
    public String checkReason() {
        if (cancelled) {
            return reason == null ? "cancelled" : reason;
        }
        if (isDeadlineExceeded()) {
            return "deadline exceeded";
        }
        return null;
    }

    public long remainingMillis() {
        if (deadlineNanos == NO_DEADLINE) {
            return Long.MAX_VALUE;
        }
        return TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
    }
}
