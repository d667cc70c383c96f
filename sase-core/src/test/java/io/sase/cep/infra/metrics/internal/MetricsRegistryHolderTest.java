package io.sase.cep.infra.metrics.internal;

import io.sase.cep.infra.metrics.MetricsRegistry;
import io.sase.cep.infra.metrics.api.MetricsRegistryProvider;
import io.sase.cep.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.sase.cep.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryHolderTest {

    private static final MetricsRegistry LOW_REGISTRY = new InMemoryMetricsRegistry();

    private static final MetricsRegistryProvider LOW = new MetricsRegistryProvider() {
        @Override
        public MetricsRegistry create() {
            return LOW_REGISTRY;
        }

        @Override
        public String name() {
            return "low";
        }
    };

    @Test
    @DisplayName("Should prefer the provider with the highest priority")
    void highestPriorityWins() {
        MetricsRegistry selected = MetricsRegistryHolder.select(List.of(LOW, new InMemoryMetricsRegistryProvider()), null);

        assertThat(selected).isInstanceOf(InMemoryMetricsRegistry.class).isNotSameAs(LOW_REGISTRY);
    }

    @Test
    @DisplayName("Should honour a pinned provider name")
    void pinnedProvider() {
        MetricsRegistry selected = MetricsRegistryHolder.select(List.of(new InMemoryMetricsRegistryProvider(), LOW), "low");

        assertThat(selected).isSameAs(LOW_REGISTRY);
        assertThat(MetricsRegistryHolder.select(List.of(LOW, new InMemoryMetricsRegistryProvider()), "in-memory"))
                .isInstanceOf(InMemoryMetricsRegistry.class);
    }

    @Test
    @DisplayName("Should fall back to a registry that records nothing")
    void fallsBackToNoop() {
        assertThat(MetricsRegistryHolder.select(List.of(), null)).isSameAs(MetricsRegistryHolder.NOOP);
        assertThat(MetricsRegistryHolder.select(List.of(LOW), "missing")).isSameAs(MetricsRegistryHolder.NOOP);

        MetricsRegistry noop = MetricsRegistryHolder.NOOP;
        noop.counter("sase_test_total").increment(5);
        assertThat(noop.counter("sase_test_total").count()).isZero();
    }
}
