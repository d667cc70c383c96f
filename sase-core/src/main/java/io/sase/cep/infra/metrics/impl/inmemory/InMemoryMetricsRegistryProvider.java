/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.infra.metrics.impl.inmemory;

import io.sase.cep.infra.metrics.MetricsRegistry;
import io.sase.cep.infra.metrics.api.MetricsRegistryProvider;

/**
 * Supplies an {@link InMemoryMetricsRegistry} so tests can read back predicate
 * outcome and diagnostics counters.
 *
 * <p>Registered for the test class path only, in
 * {@code src/test/resources/META-INF/services/io.sase.cep.infra.metrics.api.MetricsRegistryProvider}.
 * Its priority outranks any production provider that is also present.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    static final int PRIORITY = 1000;

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
