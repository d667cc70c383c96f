/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api.exceptions;

/**
 * The event bound to an alias does not carry the requested attribute.
 */
public class FieldNotFoundException extends EvaluationException {

    private final String alias;
    private final String field;

    public FieldNotFoundException(String alias, String field) {
        super("Event bound to '" + alias + "' has no field '" + field + "'");
        this.alias = alias;
        this.field = field;
    }

    public String alias() {
        return alias;
    }

    public String field() {
        return field;
    }
}
