/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.infra.metrics;

import io.sase.cep.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; components
 * also accept a registry through their constructors so tests can inject one.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * Counter uncertain = metrics.counter("sase_predicate_evaluations_total", "result", "uncertain");
 * uncertain.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a timer histogram.
     *
     * @param name metric name
     * @param tags optional key-value pairs
     * @return thread-safe timer instance
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry selected by {@link java.util.ServiceLoader}.
     * Falls back to a no-op registry when no provider is on the class path.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    /**
     * @return a registry that records nothing
     */
    static MetricsRegistry noop() {
        return MetricsRegistryHolder.NOOP;
    }
}
