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
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Variables that tune one compilation: search limits, the rules to leave out and the factors of the
 * default cost model. Every field annotated with {@link VarAttr} can be set by its name, from code or
 * from a properties file.
 */
public class SessionVariable {
    private static final Logger LOG = LogManager.getLogger(SessionVariable.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "cascades.conf";

    public static final String OPTIMIZER_TIMEOUT_MS = "optimizer_timeout_ms";
    public static final String MEMO_MAX_GROUP_EXPRESSION_SIZE = "memo_max_group_expression_size";
    public static final String DISABLE_OPTIMIZER_RULES = "disable_optimizer_rules";
    public static final String ENABLE_COST_MODEL_VALIDATION = "enable_cost_model_validation";
    public static final String ENABLE_FALLBACK_TO_ANY_PROPERTY = "enable_fallback_to_any_property";
    public static final String CPU_COST_FACTOR = "cpu_cost_factor";
    public static final String MEMORY_COST_FACTOR = "memory_cost_factor";
    public static final String SCAN_COST_FACTOR = "scan_cost_factor";
    public static final String INDEX_SCAN_COST_FACTOR = "index_scan_cost_factor";
    public static final String NETWORK_COST_FACTOR = "network_cost_factor";

    private static final Map<String, Field> VARIABLES;

    static {
        Map<String, Field> variables = Maps.newLinkedHashMap();
        for (Field field : SessionVariable.class.getDeclaredFields()) {
            VarAttr attr = field.getAnnotation(VarAttr.class);
            if (attr != null) {
                variables.put(attr.name(), field);
            }
        }
        VARIABLES = Collections.unmodifiableMap(variables);
    }

    @VarAttr(name = OPTIMIZER_TIMEOUT_MS, description = "budget of one compilation in milliseconds, 0 for none")
    public long optimizerTimeoutMs = 30_000L;

    @VarAttr(name = MEMO_MAX_GROUP_EXPRESSION_SIZE,
            description = "exploration stops adding expressions once the memo holds that many")
    public int memoMaxGroupExpressionSize = 10_000;

    @VarAttr(name = DISABLE_OPTIMIZER_RULES, description = "comma separated rule types to skip")
    public String disableOptimizerRules = "";

    @VarAttr(name = ENABLE_COST_MODEL_VALIDATION,
            description = "check every estimated cost is non-negative and grows with the row count")
    public boolean enableCostModelValidation = false;

    @VarAttr(name = ENABLE_FALLBACK_TO_ANY_PROPERTY,
            description = "plan for ANY when no plan delivers the required properties")
    public boolean enableFallbackToAnyProperty = false;

    @VarAttr(name = CPU_COST_FACTOR)
    public double cpuCostFactor = 1.0;

    @VarAttr(name = MEMORY_COST_FACTOR)
    public double memoryCostFactor = 0.5;

    @VarAttr(name = SCAN_COST_FACTOR)
    public double scanCostFactor = 1.0;

    @VarAttr(name = INDEX_SCAN_COST_FACTOR, description = "extra factor of reading rows through an index")
    public double indexScanCostFactor = 1.5;

    @VarAttr(name = NETWORK_COST_FACTOR)
    public double networkCostFactor = 1.5;

    /**
     * Load the variables of the {@value #DEFAULT_CONFIG_RESOURCE} classpath resource, or the defaults
     * when there is no such resource.
     */
    public static SessionVariable loadDefault() {
        ClassLoader classLoader = SessionVariable.class.getClassLoader();
        if (classLoader.getResource(DEFAULT_CONFIG_RESOURCE) == null) {
            LOG.info("no {} on the classpath, use default session variables", DEFAULT_CONFIG_RESOURCE);
            return new SessionVariable();
        }
        return load(DEFAULT_CONFIG_RESOURCE);
    }

    /**
     * Load the variables of a classpath resource in {@link Properties} format.
     */
    public static SessionVariable load(String resource) {
        InputStream stream = SessionVariable.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new ConfigurationException("config resource not found: " + resource);
        }
        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("failed to read config resource " + resource, e);
        }
        return fromProperties(properties);
    }

    public static SessionVariable fromProperties(Properties properties) {
        SessionVariable sessionVariable = new SessionVariable();
        for (String name : properties.stringPropertyNames()) {
            sessionVariable.setVar(name, properties.getProperty(name));
        }
        return sessionVariable;
    }

    /**
     * Set a variable by its name.
     *
     * @throws ConfigurationException if there is no such variable or the value does not parse
     */
    public void setVar(String name, String value) {
        Field field = VARIABLES.get(StringUtils.trimToEmpty(name).toLowerCase(Locale.ROOT));
        if (field == null) {
            throw new ConfigurationException("Unknown session variable: " + name);
        }
        String trimmed = StringUtils.trimToEmpty(value);
        Object previous;
        try {
            previous = field.get(this);
            Class<?> type = field.getType();
            if (type == long.class) {
                field.setLong(this, Long.parseLong(trimmed));
            } else if (type == int.class) {
                field.setInt(this, Integer.parseInt(trimmed));
            } else if (type == double.class) {
                field.setDouble(this, Double.parseDouble(trimmed));
            } else if (type == boolean.class) {
                field.setBoolean(this, parseBoolean(name, trimmed));
            } else {
                field.set(this, trimmed);
            }
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value '" + value + "' of session variable " + name, e);
        } catch (IllegalAccessException e) {
            throw new ConfigurationException("Can not set session variable " + name, e);
        }
        try {
            checkValues();
        } catch (ConfigurationException e) {
            // keep the variables valid
            try {
                field.set(this, previous);
            } catch (IllegalAccessException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
    }

    private static boolean parseBoolean(String name, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigurationException("Invalid value '" + value + "' of boolean session variable " + name);
    }

    private void checkValues() {
        if (optimizerTimeoutMs < 0) {
            throw new ConfigurationException(OPTIMIZER_TIMEOUT_MS + " must be non-negative");
        }
        if (memoMaxGroupExpressionSize <= 0) {
            throw new ConfigurationException(MEMO_MAX_GROUP_EXPRESSION_SIZE + " must be positive");
        }
        checkFactor(CPU_COST_FACTOR, cpuCostFactor);
        checkFactor(MEMORY_COST_FACTOR, memoryCostFactor);
        checkFactor(SCAN_COST_FACTOR, scanCostFactor);
        checkFactor(INDEX_SCAN_COST_FACTOR, indexScanCostFactor);
        checkFactor(NETWORK_COST_FACTOR, networkCostFactor);
        getDisabledRules();
    }

    private static void checkFactor(String name, double value) {
        // the enforce cost must stay positive for more than one row
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(name + " must be a positive number, but is " + value);
        }
    }

    /**
     * Rule types listed in {@value #DISABLE_OPTIMIZER_RULES}.
     */
    public Set<RuleType> getDisabledRules() {
        ImmutableSet.Builder<RuleType> disabledRules = ImmutableSet.builder();
        for (String ruleName : StringUtils.split(disableOptimizerRules, ',')) {
            String trimmed = StringUtils.trimToEmpty(ruleName);
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                disabledRules.add(RuleType.valueOf(trimmed.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown rule in " + DISABLE_OPTIMIZER_RULES + ": " + trimmed, e);
            }
        }
        return disabledRules.build();
    }

    public long getOptimizerTimeoutMs() {
        return optimizerTimeoutMs;
    }

    public int getMemoMaxGroupExpressionSize() {
        return memoMaxGroupExpressionSize;
    }

    public boolean isEnableCostModelValidation() {
        return enableCostModelValidation;
    }

    public boolean isEnableFallbackToAnyProperty() {
        return enableFallbackToAnyProperty;
    }

    public double getCpuCostFactor() {
        return cpuCostFactor;
    }

    public double getMemoryCostFactor() {
        return memoryCostFactor;
    }

    public double getScanCostFactor() {
        return scanCostFactor;
    }

    public double getIndexScanCostFactor() {
        return indexScanCostFactor;
    }

    public double getNetworkCostFactor() {
        return networkCostFactor;
    }
}
