package io.sase.cep.infra.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluatorConfigTest {

    @Test
    @DisplayName("Defaults should enable metrics and diagnostics but not tracing")
    void defaults() {
        EvaluatorConfig config = EvaluatorConfig.defaults();

        assertThat(config.tracingEnabled()).isFalse();
        assertThat(config.metricsEnabled()).isTrue();
        assertThat(config.diagnosticsEnabled()).isTrue();
    }

    @Test
    @DisplayName("Environment variables should override defaults")
    void environmentOverrides() {
        EvaluatorConfig config = EvaluatorConfig.fromEnvironment(Map.of(
                "SASE_EVAL_TRACING_ENABLED", "TRUE",
                "SASE_EVAL_METRICS_ENABLED", " false "));

        assertThat(config.tracingEnabled()).isTrue();
        assertThat(config.metricsEnabled()).isFalse();
        assertThat(config.diagnosticsEnabled()).isTrue();
    }

    @Test
    @DisplayName("Invalid values should keep the previous setting")
    void invalidValuesAreIgnored() {
        EvaluatorConfig config = EvaluatorConfig.fromEnvironment(Map.of(
                "SASE_EVAL_DIAGNOSTICS_ENABLED", "yes please"));

        assertThat(config.diagnosticsEnabled()).isTrue();
    }

    @Test
    @DisplayName("Properties file should apply and environment should win over it")
    void propertiesThenEnvironment() {
        EvaluatorConfig fromFile = EvaluatorConfig.load("sase-evaluator-test.properties", Map.of());
        assertThat(fromFile.tracingEnabled()).isTrue();
        assertThat(fromFile.metricsEnabled()).isFalse();
        assertThat(fromFile.diagnosticsEnabled()).isTrue();

        EvaluatorConfig overridden = EvaluatorConfig.load("sase-evaluator-test.properties",
                Map.of("SASE_EVAL_TRACING_ENABLED", "false"));
        assertThat(overridden.tracingEnabled()).isFalse();
    }

    @Test
    @DisplayName("Default load should read the bundled properties under the process environment")
    void loadDefault() {
        EvaluatorConfig bundled = EvaluatorConfig.load(EvaluatorConfig.DEFAULT_PROPERTIES, Map.of());
        assertThat(bundled.toString()).isEqualTo(EvaluatorConfig.defaults().toString());

        // the bundled file restates the defaults, so only the environment can change the outcome
        assertThat(EvaluatorConfig.loadDefault().toString())
                .isEqualTo(EvaluatorConfig.fromEnvironment().toString());
    }

    @Test
    @DisplayName("Missing properties resource should fall back to defaults")
    void missingPropertiesResource() {
        EvaluatorConfig config = EvaluatorConfig.load("does-not-exist.properties", Map.of());

        assertThat(config.toString()).isEqualTo(EvaluatorConfig.defaults().toString());
    }
}
