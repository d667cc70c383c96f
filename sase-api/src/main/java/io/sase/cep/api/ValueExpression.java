/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api;

import io.sase.cep.api.exceptions.EvaluationException;
import io.sase.cep.api.exceptions.EventNotFoundException;
import io.sase.cep.api.model.Scalar;

import java.util.List;

/**
 * An expression that reads a scalar out of a partially bound event sequence.
 *
 * <p>Instances are built once at query compile time, are immutable and may be
 * resolved concurrently against independent bindings.
 */
public interface ValueExpression {

    /**
     * Resolves this expression against the captured events.
     *
     * @param events current binding snapshot
     * @return the resolved value, never {@code null}
     * @throws EventNotFoundException if a needed alias is not bound yet
     * @throws EvaluationException    for any other resolution failure (missing field, unsupported type)
     */
    Scalar value(CapturedEvents events) throws EvaluationException;

    /**
     * @return canonical query text, used for diagnostics
     */
    String queryText();

    /**
     * @return aliases this expression reads; may be empty, may contain duplicates
     */
    List<String> usedAliases();
}
