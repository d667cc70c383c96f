/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.compiler;

/**
 * Thrown when a predicate definition cannot be turned into a predicate tree.
 *
 * <p>Messages start with the JSON path of the offending node, e.g.
 * {@code $.and[1].right: missing operand}.
 */
public class CompilationException extends Exception {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
