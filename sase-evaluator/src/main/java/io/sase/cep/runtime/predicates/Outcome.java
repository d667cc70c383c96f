/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.predicates;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.Predicate;
import io.sase.cep.api.PredicateResult;

/**
 * Evaluation outcome as seen inside a predicate tree.
 *
 * <p>{@link #FAULT} marks a NEGATIVE caused by a broken query (missing field, type
 * mismatch, malformed predicate) rather than by data. It surfaces as
 * {@link PredicateResult#NEGATIVE} and, unlike a plain NEGATIVE, is never inverted
 * by {@link NotPredicate}: a fault terminates the candidate wherever it occurs.
 */
enum Outcome {
    POSITIVE(PredicateResult.POSITIVE),
    NEGATIVE(PredicateResult.NEGATIVE),
    UNCERTAIN(PredicateResult.UNCERTAIN),
    FAULT(PredicateResult.NEGATIVE);

    private final PredicateResult result;

    Outcome(PredicateResult result) {
        this.result = result;
    }

    PredicateResult result() {
        return result;
    }

    static Outcome of(PredicateResult result) {
        switch (result) {
            case POSITIVE:
                return POSITIVE;
            case NEGATIVE:
                return NEGATIVE;
            default:
                return UNCERTAIN;
        }
    }

    /**
     * Evaluates an operand, keeping fault information when the operand reports it.
     */
    static Outcome evaluate(Predicate predicate, CapturedEvents events) {
        if (predicate instanceof OutcomePredicate) {
            return ((OutcomePredicate) predicate).outcome(events);
        }
        return of(predicate.evaluate(events));
    }
}
