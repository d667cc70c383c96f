/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.values;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.ValueExpression;
import io.sase.cep.api.exceptions.EventNotFoundException;
import io.sase.cep.api.exceptions.FieldNotFoundException;
import io.sase.cep.api.exceptions.TypeMismatchException;
import io.sase.cep.api.model.Event;
import io.sase.cep.api.model.Scalar;

import java.util.List;
import java.util.Objects;

/**
 * Reads one attribute of the event bound to an alias, e.g. {@code a.price}.
 */
public final class FieldExpression implements ValueExpression {

    private final String alias;
    private final String field;
    private final List<String> usedAliases;

    public FieldExpression(String alias, String field) {
        this.alias = requireName(alias, "alias");
        this.field = requireName(field, "field");
        this.usedAliases = List.of(alias);
    }

    private static String requireName(String name, String what) {
        Objects.requireNonNull(name, what + " cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be blank");
        }
        return name;
    }

    public String alias() {
        return alias;
    }

    public String field() {
        return field;
    }

    @Override
    public Scalar value(CapturedEvents events)
            throws EventNotFoundException, FieldNotFoundException, TypeMismatchException {
        Event event = events.lookup(alias).orElseThrow(() -> new EventNotFoundException(alias));
        if (!event.hasAttribute(field)) {
            throw new FieldNotFoundException(alias, field);
        }
        try {
            return Scalar.of(event.attributes().get(field));
        } catch (TypeMismatchException e) {
            throw new TypeMismatchException(queryText() + " of event " + event.eventId() + ": " + e.getMessage());
        }
    }

    @Override
    public String queryText() {
        return alias + "." + field;
    }

    @Override
    public List<String> usedAliases() {
        return usedAliases;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldExpression that)) return false;
        return alias.equals(that.alias) && field.equals(that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, field);
    }

    @Override
    public String toString() {
        return queryText();
    }
}
