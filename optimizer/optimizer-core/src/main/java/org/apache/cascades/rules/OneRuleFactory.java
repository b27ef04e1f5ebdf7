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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * abstract class for all rule factories build one rule.
 */
public abstract class OneRuleFactory implements RuleFactory {

    @Override
    public final List<Rule> buildRules() {
        Rule rule = build();
        checkRuleTypeClass(rule);
        return ImmutableList.of(rule);
    }

    public abstract Rule build();

    protected void checkRuleTypeClass(Rule rule) {
    }
}
