/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.predicates;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.Predicate;

import java.util.List;

/**
 * Disjunction under Kleene logic: POSITIVE as soon as one operand is POSITIVE,
 * otherwise UNCERTAIN while any operand is UNCERTAIN.
 */
public final class OrPredicate extends CompositePredicate {

    public OrPredicate(List<Predicate> operands) {
        super(operands);
    }

    public static OrPredicate of(Predicate... operands) {
        return new OrPredicate(List.of(operands));
    }

    @Override
    String keyword() {
        return "OR";
    }

    @Override
    public Outcome outcome(CapturedEvents events) {
        Outcome result = Outcome.NEGATIVE;
        for (Predicate operand : operands) {
            Outcome next = Outcome.evaluate(operand, events);
            if (next == Outcome.FAULT || next == Outcome.POSITIVE) {
                return next;
            }
            if (next == Outcome.UNCERTAIN) {
                result = Outcome.UNCERTAIN;
            }
        }
        return result;
    }
}
