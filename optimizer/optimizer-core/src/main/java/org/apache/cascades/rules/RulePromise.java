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

package org.apache.cascades.rules;

/**
 * Promise of rule, The value with a large promise has a higher priority.
 * An implementation rule has a higher promise than an exploration rule, so a group gets a
 * physical plan, and with it a cost bound, before its alternatives are explored further.
 */
public enum RulePromise {
    EXPLORE(1),
    IMPLEMENT(2);

    private final int promise;

    RulePromise(int promise) {
        this.promise = promise;
    }

    public int promise() {
        return promise;
    }
}
