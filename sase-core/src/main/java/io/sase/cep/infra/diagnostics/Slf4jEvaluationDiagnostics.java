/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.infra.diagnostics;

import io.sase.cep.api.EvaluationDiagnostics;
import io.sase.cep.api.Predicate;
import io.sase.cep.api.exceptions.EvaluationException;
import io.sase.cep.api.model.Scalar;
import io.sase.cep.infra.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link EvaluationDiagnostics} that writes a WARN line per problem and
 * counts problems by kind in {@code sase_predicate_diagnostics_total}.
 *
 * <p>Each report terminates one candidate match, so the volume tracks the number
 * of candidates killed by broken queries rather than the event rate.
 */
public final class Slf4jEvaluationDiagnostics implements EvaluationDiagnostics {

    public static final String METRIC_NAME = "sase_predicate_diagnostics_total";

    private final Logger logger;
    private final MetricsRegistry metrics;

    public Slf4jEvaluationDiagnostics() {
        this(LoggerFactory.getLogger(Slf4jEvaluationDiagnostics.class), MetricsRegistry.getInstance());
    }

    public Slf4jEvaluationDiagnostics(Logger logger, MetricsRegistry metrics) {
        this.logger = logger;
        this.metrics = metrics;
    }

    @Override
    public void evaluationFailed(Predicate predicate, EvaluationException cause) {
        metrics.counter(METRIC_NAME, "kind", "evaluation_failed").increment();
        logger.warn("[sase:{}] Could not evaluate {} left/right: {}",
                source(predicate), safeText(predicate), cause.getMessage());
    }

    @Override
    public void typeMismatch(Predicate predicate, String operatorSymbol, Scalar left, Scalar right) {
        metrics.counter(METRIC_NAME, "kind", "type_mismatch").increment();
        logger.warn("[sase:{}] Could not compare {} for non-numeric operands {} and {}: {}",
                source(predicate), operatorSymbol, left, right, safeText(predicate));
    }

    @Override
    public void malformed(Predicate predicate, String reason) {
        metrics.counter(METRIC_NAME, "kind", "malformed").increment();
        logger.warn("[sase:{}] {}: {}", source(predicate), reason, safeText(predicate));
    }

    private static String source(Predicate predicate) {
        if (predicate == null) {
            return "predicate";
        }
        String name = predicate.getClass().getSimpleName();
        return name.isEmpty() ? "predicate" : Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    private static String safeText(Predicate predicate) {
        if (predicate == null) {
            return "<null>";
        }
        try {
            return predicate.queryText();
        } catch (RuntimeException e) {
            // diagnostics never throw
            return "<unrenderable " + predicate.getClass().getSimpleName() + ": " + e + ">";
        }
    }
}
