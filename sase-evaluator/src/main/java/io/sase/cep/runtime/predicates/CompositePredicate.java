/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.predicates;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.Predicate;
import io.sase.cep.api.PredicateResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base for predicates combining two or more operands with one keyword.
 */
abstract class CompositePredicate implements OutcomePredicate {

    protected final List<Predicate> operands;
    private final List<String> usedAliases;

    CompositePredicate(List<Predicate> operands) {
        Objects.requireNonNull(operands, "Operands cannot be null");
        if (operands.isEmpty()) {
            throw new IllegalArgumentException(keyword() + " requires at least one operand");
        }
        for (Predicate operand : operands) {
            Objects.requireNonNull(operand, keyword() + " operand cannot be null");
        }
        this.operands = List.copyOf(operands);

        List<String> aliases = new ArrayList<>();
        for (Predicate operand : this.operands) {
            aliases.addAll(operand.usedAliases());
        }
        this.usedAliases = Collections.unmodifiableList(aliases);
    }

    abstract String keyword();

    @Override
    public PredicateResult evaluate(CapturedEvents events) {
        return outcome(events).result();
    }

    public List<Predicate> operands() {
        return operands;
    }

    @Override
    public String queryText() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                sb.append(' ').append(keyword()).append(' ');
            }
            sb.append('(').append(operands.get(i).queryText()).append(')');
        }
        return sb.toString();
    }

    @Override
    public List<String> usedAliases() {
        return usedAliases;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + queryText() + "]";
    }
}
