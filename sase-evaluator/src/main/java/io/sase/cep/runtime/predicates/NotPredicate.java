/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.predicates;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.Predicate;
import io.sase.cep.api.PredicateResult;

import java.util.List;
import java.util.Objects;

/**
 * Negation. An undecided operand stays undecided, and a faulted operand stays a
 * NEGATIVE that terminates the candidate.
 */
public final class NotPredicate implements OutcomePredicate {

    private final Predicate operand;

    public NotPredicate(Predicate operand) {
        this.operand = Objects.requireNonNull(operand, "NOT operand cannot be null");
    }

    public Predicate operand() {
        return operand;
    }

    @Override
    public PredicateResult evaluate(CapturedEvents events) {
        return outcome(events).result();
    }

    @Override
    public Outcome outcome(CapturedEvents events) {
        Outcome inner = Outcome.evaluate(operand, events);
        if (inner == Outcome.FAULT) {
            return inner;
        }
        return Outcome.of(inner.result().negate());
    }

    @Override
    public String queryText() {
        return "NOT (" + operand.queryText() + ")";
    }

    @Override
    public List<String> usedAliases() {
        return operand.usedAliases();
    }

    @Override
    public String toString() {
        return "NotPredicate[" + queryText() + "]";
    }
}
