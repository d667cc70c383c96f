/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api.exceptions;

/**
 * The referenced alias has no captured event yet.
 *
 * <p>This is the routine outcome of evaluating a predicate over a partial
 * sequence and is never reported as a failure.
 */
public class EventNotFoundException extends EvaluationException {

    private final String alias;

    public EventNotFoundException(String alias) {
        super("No event captured for alias '" + alias + "'");
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }
}
