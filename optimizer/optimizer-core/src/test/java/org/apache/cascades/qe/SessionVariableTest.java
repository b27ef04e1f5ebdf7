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

package org.apache.cascades.qe;

import org.apache.cascades.exceptions.ConfigurationException;
import org.apache.cascades.rules.RuleType;

import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Properties;

public class SessionVariableTest {

    @Test
    public void testLoadDefault() {
        SessionVariable sessionVariable = SessionVariable.loadDefault();

        Assertions.assertEquals(30000L, sessionVariable.getOptimizerTimeoutMs());
        Assertions.assertEquals(10000, sessionVariable.getMemoMaxGroupExpressionSize());
        Assertions.assertTrue(sessionVariable.getDisabledRules().isEmpty());
        Assertions.assertFalse(sessionVariable.isEnableFallbackToAnyProperty());
        Assertions.assertEquals(0.5, sessionVariable.getMemoryCostFactor());
    }

    @Test
    public void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(SessionVariable.OPTIMIZER_TIMEOUT_MS, " 100 ");
        properties.setProperty("ENABLE_FALLBACK_TO_ANY_PROPERTY", "TRUE");
        properties.setProperty(SessionVariable.DISABLE_OPTIMIZER_RULES,
                "join_commute, LOGICAL_JOIN_TO_MERGE_JOIN_RULE,");
        properties.setProperty(SessionVariable.NETWORK_COST_FACTOR, "3");

        SessionVariable sessionVariable = SessionVariable.fromProperties(properties);

        Assertions.assertEquals(100L, sessionVariable.getOptimizerTimeoutMs());
        Assertions.assertTrue(sessionVariable.isEnableFallbackToAnyProperty());
        Assertions.assertEquals(ImmutableSet.of(RuleType.JOIN_COMMUTE, RuleType.LOGICAL_JOIN_TO_MERGE_JOIN_RULE),
                sessionVariable.getDisabledRules());
        Assertions.assertEquals(3.0, sessionVariable.getNetworkCostFactor());
    }

    @Test
    public void testInvalidVariables() {
        SessionVariable sessionVariable = new SessionVariable();

        Assertions.assertThrows(ConfigurationException.class, () -> sessionVariable.setVar("no_such_var", "1"));
        Assertions.assertThrows(ConfigurationException.class,
                () -> sessionVariable.setVar(SessionVariable.OPTIMIZER_TIMEOUT_MS, "soon"));
        Assertions.assertThrows(ConfigurationException.class,
                () -> sessionVariable.setVar(SessionVariable.ENABLE_COST_MODEL_VALIDATION, "yes"));
        Assertions.assertThrows(ConfigurationException.class,
                () -> sessionVariable.setVar(SessionVariable.CPU_COST_FACTOR, "0"));
        Assertions.assertEquals(1.0, sessionVariable.getCpuCostFactor());
        Assertions.assertThrows(ConfigurationException.class,
                () -> new SessionVariable().setVar(SessionVariable.DISABLE_OPTIMIZER_RULES, "NO_SUCH_RULE"));
        Assertions.assertThrows(ConfigurationException.class,
                () -> SessionVariable.load("no_such_config.conf"));
    }
}
