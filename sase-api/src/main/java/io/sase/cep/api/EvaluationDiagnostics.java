/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api;

import io.sase.cep.api.exceptions.EvaluationException;
import io.sase.cep.api.model.Scalar;

/**
 * Fire-and-forget sink for non-fatal evaluation problems.
 *
 * <p>Injected into predicates at construction so evaluation stays testable
 * without capturing global log output. Implementations must not block.
 */
public interface EvaluationDiagnostics {

    /**
     * Discards every report.
     */
    EvaluationDiagnostics NOOP = new EvaluationDiagnostics() {
        @Override
        public void evaluationFailed(Predicate predicate, EvaluationException cause) {
        }

        @Override
        public void typeMismatch(Predicate predicate, String operatorSymbol, Scalar left, Scalar right) {
        }

        @Override
        public void malformed(Predicate predicate, String reason) {
        }
    };

    /**
     * An operand could not be resolved for a reason other than an unbound alias.
     */
    void evaluationFailed(Predicate predicate, EvaluationException cause);

    /**
     * An ordering operator was applied to non-numeric operands.
     */
    void typeMismatch(Predicate predicate, String operatorSymbol, Scalar left, Scalar right);

    /**
     * The predicate itself is structurally broken (missing operand, unhandled operator).
     */
    void malformed(Predicate predicate, String reason);
}
