/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api.exceptions;

/**
 * A value has a runtime type the requested operation cannot handle.
 */
public class TypeMismatchException extends EvaluationException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
