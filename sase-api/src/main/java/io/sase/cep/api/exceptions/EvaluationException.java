/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api.exceptions;

/**
 * Raised when a value expression cannot be resolved against a set of captured events.
 *
 * <p>Checked so that every resolution site decides explicitly whether the failure
 * leaves a candidate pending ({@link EventNotFoundException}) or terminates it.
 */
public class EvaluationException extends Exception {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
