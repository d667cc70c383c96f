/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.evaluation;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.Predicate;
import io.sase.cep.api.PredicateResult;
import io.sase.cep.infra.config.EvaluatorConfig;
import io.sase.cep.infra.metrics.Counter;
import io.sase.cep.infra.metrics.MetricsRegistry;
import io.sase.cep.infra.metrics.Timer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point the automaton calls to evaluate the guard predicates of a transition.
 *
 * <p>A transition is guarded by zero or more predicates combined as a conjunction:
 * <ul>
 *   <li>any {@link PredicateResult#NEGATIVE} guard discards the candidate (evaluation stops there)</li>
 *   <li>otherwise any {@link PredicateResult#UNCERTAIN} guard keeps the transition pending</li>
 *   <li>otherwise the transition is taken</li>
 * </ul>
 *
 * <p>Deciding what an UNCERTAIN verdict means once a candidate's sequence is known to be
 * complete is left to the automaton.
 *
 * <h2>Observability</h2>
 * <p>Outcomes are counted in {@value #EVALUATIONS_METRIC} tagged by {@code result}, and
 * guard-list latency in {@value #LATENCY_METRIC}. With tracing enabled every call runs in
 * an OpenTelemetry span.
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless apart from thread-safe metrics; one instance serves all candidates.
 */
public final class GuardEvaluator {

    public static final String EVALUATIONS_METRIC = "sase_predicate_evaluations_total";
    public static final String LATENCY_METRIC = "sase_guard_evaluation_latency";

    static final String INSTRUMENTATION_NAME = "io.sase.cep.evaluator";

    private final boolean tracingEnabled;
    private final Tracer tracer;
    private final Map<PredicateResult, Counter> outcomes;
    private final Timer latency;

    public GuardEvaluator(EvaluatorConfig config) {
        this(config, MetricsRegistry.getInstance(), GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    public GuardEvaluator(EvaluatorConfig config, MetricsRegistry metrics, Tracer tracer) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(tracer, "tracer cannot be null");
        MetricsRegistry registry = config.metricsEnabled() && metrics != null ? metrics : MetricsRegistry.noop();

        this.tracingEnabled = config.tracingEnabled();
        this.tracer = tracer;
        this.outcomes = new EnumMap<>(PredicateResult.class);
        for (PredicateResult result : PredicateResult.values()) {
            outcomes.put(result, registry.counter(EVALUATIONS_METRIC, "result", result.name().toLowerCase(Locale.ROOT)));
        }
        this.latency = registry.timer(LATENCY_METRIC);
    }

    /**
     * Evaluates a single predicate.
     */
    public PredicateResult evaluate(Predicate predicate, CapturedEvents events) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        if (!tracingEnabled) {
            return record(predicate.evaluate(events));
        }
        Span span = tracer.spanBuilder("predicate.evaluate").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("sase.predicate", predicate.queryText());
            span.setAttribute("sase.bound_aliases", (long) events.size());
            PredicateResult result = record(predicate.evaluate(events));
            span.setAttribute("sase.result", result.name());
            return result;
        } finally {
            span.end();
        }
    }

    /**
     * Evaluates a transition's guards as a conjunction, stopping at the first NEGATIVE.
     *
     * @param guards the guards in declaration order; an empty list always passes
     */
    public PredicateResult evaluateAll(List<Predicate> guards, CapturedEvents events) {
        Objects.requireNonNull(guards, "guards cannot be null");
        long start = System.nanoTime();
        Span span = tracingEnabled ? tracer.spanBuilder("guard.evaluate").startSpan() : Span.getInvalid();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("sase.guard_count", (long) guards.size());
            PredicateResult verdict = PredicateResult.POSITIVE;
            for (Predicate guard : guards) {
                verdict = verdict.and(evaluate(guard, events));
                if (verdict == PredicateResult.NEGATIVE) {
                    break;
                }
            }
            span.setAttribute("sase.result", verdict.name());
            return verdict;
        } finally {
            span.end();
            latency.recordNanos(System.nanoTime() - start);
        }
    }

    /**
     * Lists the aliases a predicate reads that the binding does not cover yet, without
     * duplicates, in first-use order. Empty means the predicate can be decided now.
     */
    public List<String> missingAliases(Predicate predicate, CapturedEvents events) {
        Set<String> missing = new LinkedHashSet<>();
        for (String alias : predicate.usedAliases()) {
            if (!events.isBound(alias)) {
                missing.add(alias);
            }
        }
        return new ArrayList<>(missing);
    }

    private PredicateResult record(PredicateResult result) {
        outcomes.get(result).increment();
        return result;
    }
}
