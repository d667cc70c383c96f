/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.infra.metrics.internal;

import io.sase.cep.infra.metrics.Counter;
import io.sase.cep.infra.metrics.MetricsRegistry;
import io.sase.cep.infra.metrics.Timer;

import java.time.Duration;

/**
 * Registry whose instruments discard every update. Every series reads as zero.
 */
enum NoOpMetricsRegistry implements MetricsRegistry, Counter, Timer {
    INSTANCE;

    @Override
    public Counter counter(String name, String... tags) {
        return this;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return this;
    }

    @Override
    public void increment() {
    }

    @Override
    public void increment(long amount) {
    }

    @Override
    public void record(Duration duration) {
    }

    @Override
    public Duration percentile(double p) {
        return Duration.ZERO;
    }

    @Override
    public long count() {
        return 0L;
    }
}
