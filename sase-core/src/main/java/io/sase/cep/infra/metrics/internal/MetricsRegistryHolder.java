/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.infra.metrics.internal;

import io.sase.cep.infra.metrics.MetricsRegistry;
import io.sase.cep.infra.metrics.api.MetricsRegistryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

/**
 * Resolves the process-wide MetricsRegistry once, on first use.
 *
 * <p>The provider with the highest priority wins. Setting the system property
 * {@value #PROVIDER_PROPERTY} to a provider name pins that provider instead.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = LoggerFactory.getLogger(MetricsRegistryHolder.class);

    public static final String PROVIDER_PROPERTY = "sase.metrics.provider";

    public static final MetricsRegistry NOOP = NoOpMetricsRegistry.INSTANCE;
    public static final MetricsRegistry INSTANCE =
            select(ServiceLoader.load(MetricsRegistryProvider.class), System.getProperty(PROVIDER_PROPERTY));

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    static MetricsRegistry select(Iterable<MetricsRegistryProvider> providers, String pinnedName) {
        MetricsRegistryProvider chosen = null;
        for (MetricsRegistryProvider candidate : providers) {
            if (pinnedName != null) {
                if (pinnedName.equals(candidate.name())) {
                    chosen = candidate;
                    break;
                }
            } else if (chosen == null || candidate.priority() > chosen.priority()) {
                chosen = candidate;
            }
        }
        if (chosen == null) {
            if (pinnedName != null) {
                logger.warn("[Metrics] Provider '{}' not found, metrics disabled", pinnedName);
            } else {
                logger.debug("[Metrics] No provider found, metrics disabled");
            }
            return NoOpMetricsRegistry.INSTANCE;
        }
        logger.info("[Metrics] Using provider: {} (priority: {})", chosen.name(), chosen.priority());
        return chosen.create();
    }
}
