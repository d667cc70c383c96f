/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api;

/**
 * Three-valued outcome of evaluating a {@link Predicate} against a partial binding.
 *
 * <ul>
 *   <li>{@link #POSITIVE}: the condition holds</li>
 *   <li>{@link #NEGATIVE}: the condition does not hold (or never can); the candidate is terminated</li>
 *   <li>{@link #UNCERTAIN}: a referenced alias is not bound yet; the candidate stays pending</li>
 * </ul>
 *
 * <p>The combinators follow Kleene's strong three-valued logic.
 */
public enum PredicateResult {
    POSITIVE,
    NEGATIVE,
    UNCERTAIN;

    public static PredicateResult of(boolean holds) {
        return holds ? POSITIVE : NEGATIVE;
    }

    public boolean isDecided() {
        return this != UNCERTAIN;
    }

    public PredicateResult and(PredicateResult other) {
        if (this == NEGATIVE || other == NEGATIVE) {
            return NEGATIVE;
        }
        if (this == UNCERTAIN || other == UNCERTAIN) {
            return UNCERTAIN;
        }
        return POSITIVE;
    }

    public PredicateResult or(PredicateResult other) {
        if (this == POSITIVE || other == POSITIVE) {
            return POSITIVE;
        }
        if (this == UNCERTAIN || other == UNCERTAIN) {
            return UNCERTAIN;
        }
        return NEGATIVE;
    }

    public PredicateResult negate() {
        return switch (this) {
            case POSITIVE -> NEGATIVE;
            case NEGATIVE -> POSITIVE;
            case UNCERTAIN -> UNCERTAIN;
        };
    }
}
