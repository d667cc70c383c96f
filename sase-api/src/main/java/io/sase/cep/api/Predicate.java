/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api;

import java.util.List;

/**
 * Boolean condition over a candidate's captured events with three-valued semantics.
 *
 * <p>Evaluation is a pure function of the predicate's structure and the binding
 * passed in, so the automaton may (and must) re-evaluate a predicate as more
 * events are captured.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are immutable and can be evaluated concurrently without locking.
 */
public interface Predicate {

    /**
     * Evaluates the predicate. Never throws: resolution failures are folded into the result.
     *
     * @param events current binding snapshot
     * @return {@link PredicateResult#UNCERTAIN} if a referenced alias is unbound,
     *         otherwise a definite verdict
     */
    PredicateResult evaluate(CapturedEvents events);

    /**
     * @return human readable query text; never throws, even for partially built predicates
     */
    String queryText();

    /**
     * @return aliases consulted during evaluation, operands' lists concatenated in order
     */
    List<String> usedAliases();
}
