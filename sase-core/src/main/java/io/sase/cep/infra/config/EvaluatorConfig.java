/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.infra.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for predicate guard evaluation.
 *
 * <p><b>Precedence</b> (highest first): environment variables, properties file,
 * builder defaults.
 *
 * <p>Environment variables:
 * <pre>
 * SASE_EVAL_TRACING_ENABLED=true
 * SASE_EVAL_METRICS_ENABLED=false
 * SASE_EVAL_DIAGNOSTICS_ENABLED=true
 * </pre>
 *
 * <p><b>Example sase-evaluator.properties:</b>
 * <pre>
 * sase.eval.tracing.enabled=false
 * sase.eval.metrics.enabled=true
 * sase.eval.diagnostics.enabled=true
 * </pre>
 */
public final class EvaluatorConfig {

    private static final Logger logger = LoggerFactory.getLogger(EvaluatorConfig.class);

    public static final String DEFAULT_PROPERTIES = "sase-evaluator.properties";

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_TRACING_ENABLED = "SASE_EVAL_TRACING_ENABLED";
    static final String ENV_METRICS_ENABLED = "SASE_EVAL_METRICS_ENABLED";
    static final String ENV_DIAGNOSTICS_ENABLED = "SASE_EVAL_DIAGNOSTICS_ENABLED";

    static final String PROP_TRACING_ENABLED = "sase.eval.tracing.enabled";
    static final String PROP_METRICS_ENABLED = "sase.eval.metrics.enabled";
    static final String PROP_DIAGNOSTICS_ENABLED = "sase.eval.diagnostics.enabled";

    private final boolean tracingEnabled;
    private final boolean metricsEnabled;
    private final boolean diagnosticsEnabled;

    private EvaluatorConfig(Builder builder) {
        this.tracingEnabled = builder.tracingEnabled;
        this.metricsEnabled = builder.metricsEnabled;
        this.diagnosticsEnabled = builder.diagnosticsEnabled;
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Metrics and diagnostics on, tracing off.
     */
    public static EvaluatorConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by the process environment.
     */
    public static EvaluatorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static EvaluatorConfig fromEnvironment(Map<String, String> env) {
        return builder().applyEnvironment(env).build();
    }

    /**
     * Loads {@link #DEFAULT_PROPERTIES} from the class path (if present), then
     * applies environment overrides.
     */
    public static EvaluatorConfig loadDefault() {
        return load(DEFAULT_PROPERTIES, System.getenv());
    }

    public static EvaluatorConfig load(String resource, Map<String, String> env) {
        Properties props = new Properties();
        try (InputStream is = EvaluatorConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} evaluator properties from classpath: {}", props.size(), resource);
            } else {
                logger.debug("No evaluator properties at {}, using defaults", resource);
            }
        } catch (IOException e) {
            logger.warn("Could not read evaluator properties {}. Using defaults.", resource, e);
        }
        return builder().applyProperties(props).applyEnvironment(env).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean tracingEnabled() {
        return tracingEnabled;
    }

    public boolean metricsEnabled() {
        return metricsEnabled;
    }

    public boolean diagnosticsEnabled() {
        return diagnosticsEnabled;
    }

    @Override
    public String toString() {
        return "EvaluatorConfig{tracing=" + tracingEnabled
                + ", metrics=" + metricsEnabled
                + ", diagnostics=" + diagnosticsEnabled + "}";
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private boolean tracingEnabled = false;
        private boolean metricsEnabled = true;
        private boolean diagnosticsEnabled = true;

        private Builder() {
        }

        public Builder tracingEnabled(boolean enabled) {
            this.tracingEnabled = enabled;
            return this;
        }

        public Builder metricsEnabled(boolean enabled) {
            this.metricsEnabled = enabled;
            return this;
        }

        public Builder diagnosticsEnabled(boolean enabled) {
            this.diagnosticsEnabled = enabled;
            return this;
        }

        Builder applyProperties(Properties props) {
            tracingEnabled = parseFlag(PROP_TRACING_ENABLED, props.getProperty(PROP_TRACING_ENABLED), tracingEnabled);
            metricsEnabled = parseFlag(PROP_METRICS_ENABLED, props.getProperty(PROP_METRICS_ENABLED), metricsEnabled);
            diagnosticsEnabled = parseFlag(PROP_DIAGNOSTICS_ENABLED,
                    props.getProperty(PROP_DIAGNOSTICS_ENABLED), diagnosticsEnabled);
            return this;
        }

        Builder applyEnvironment(Map<String, String> env) {
            tracingEnabled = parseFlag(ENV_TRACING_ENABLED, env.get(ENV_TRACING_ENABLED), tracingEnabled);
            metricsEnabled = parseFlag(ENV_METRICS_ENABLED, env.get(ENV_METRICS_ENABLED), metricsEnabled);
            diagnosticsEnabled = parseFlag(ENV_DIAGNOSTICS_ENABLED, env.get(ENV_DIAGNOSTICS_ENABLED), diagnosticsEnabled);
            return this;
        }

        public EvaluatorConfig build() {
            return new EvaluatorConfig(this);
        }

        private static boolean parseFlag(String key, String raw, boolean fallback) {
            if (raw == null || raw.isBlank()) {
                return fallback;
            }
            String value = raw.trim();
            if (value.equalsIgnoreCase("true")) {
                return true;
            }
            if (value.equalsIgnoreCase("false")) {
                return false;
            }
            logger.warn("Invalid boolean for {}: '{}', keeping {}", key, raw, fallback);
            return fallback;
        }
    }
}
