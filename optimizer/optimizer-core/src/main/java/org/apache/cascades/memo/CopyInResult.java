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

package org.apache.cascades.memo;

/**
 * Result of {@link Memo#copyIn}.
 */
public class CopyInResult {
    /** whether a new group expression was created. */
    public final boolean generateNewExpression;
    /** the new group expression, or the existing one the plan was deduplicated to. */
    public final GroupExpression correspondingExpression;

    public CopyInResult(boolean generateNewExpression, GroupExpression correspondingExpression) {
        this.generateNewExpression = generateNewExpression;
        this.correspondingExpression = correspondingExpression;
    }

    public static CopyInResult of(boolean generateNewExpression, GroupExpression correspondingExpression) {
        return new CopyInResult(generateNewExpression, correspondingExpression);
    }
}
