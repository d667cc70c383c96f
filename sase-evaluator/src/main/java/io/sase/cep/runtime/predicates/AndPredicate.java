/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.predicates;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.Predicate;

import java.util.List;

/**
 * Conjunction under Kleene logic: NEGATIVE as soon as one operand is NEGATIVE,
 * otherwise UNCERTAIN while any operand is UNCERTAIN.
 */
public final class AndPredicate extends CompositePredicate {

    public AndPredicate(List<Predicate> operands) {
        super(operands);
    }

    public static AndPredicate of(Predicate... operands) {
        return new AndPredicate(List.of(operands));
    }

    @Override
    String keyword() {
        return "AND";
    }

    @Override
    public Outcome outcome(CapturedEvents events) {
        Outcome result = Outcome.POSITIVE;
        for (Predicate operand : operands) {
            Outcome next = Outcome.evaluate(operand, events);
            if (next == Outcome.FAULT || next == Outcome.NEGATIVE) {
                return next;
            }
            if (next == Outcome.UNCERTAIN) {
                result = Outcome.UNCERTAIN;
            }
        }
        return result;
    }
}
