/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.infra.metrics;

import java.time.Duration;

/**
 * Latency histogram.
 * Thread-safe.
 */
public interface Timer {

    void record(Duration duration);

    default void recordNanos(long nanos) {
        record(Duration.ofNanos(nanos));
    }

    /**
     * @param percentile value in [0, 1]
     * @return the recorded duration at that percentile, {@link Duration#ZERO} when empty
     */
    Duration percentile(double percentile);

    long count();
}
