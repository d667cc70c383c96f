/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.values;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.ValueExpression;
import io.sase.cep.api.exceptions.TypeMismatchException;
import io.sase.cep.api.model.Scalar;

import java.util.List;
import java.util.Objects;

/**
 * Constant operand. Resolves without consulting the binding.
 */
public final class LiteralExpression implements ValueExpression {

    private final Scalar value;

    public LiteralExpression(Scalar value) {
        this.value = Objects.requireNonNull(value, "Literal value cannot be null, use Scalar.NULL");
    }

    public static LiteralExpression number(double value) {
        return new LiteralExpression(Scalar.number(value));
    }

    public static LiteralExpression string(String value) {
        return new LiteralExpression(Scalar.string(value));
    }

    public static LiteralExpression bool(boolean value) {
        return new LiteralExpression(Scalar.bool(value));
    }

    /**
     * @throws IllegalArgumentException if the value has no scalar kind
     */
    public static LiteralExpression of(Object value) {
        try {
            return new LiteralExpression(Scalar.of(value));
        } catch (TypeMismatchException e) {
            throw new IllegalArgumentException("Cannot build literal: " + e.getMessage(), e);
        }
    }

    @Override
    public Scalar value(CapturedEvents events) {
        return value;
    }

    @Override
    public String queryText() {
        return value.queryText();
    }

    @Override
    public List<String> usedAliases() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralExpression that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return queryText();
    }
}
