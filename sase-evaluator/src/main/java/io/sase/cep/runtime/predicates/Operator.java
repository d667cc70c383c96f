/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.predicates;

/**
 * Comparison operators supported by {@link OperatorPredicate}.
 *
 * <p>Equality operators work on any scalar kind; ordering operators only on numbers.
 */
public enum Operator {
    EQ("=="),
    NE("!="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this == GT || this == LT || this == GE || this == LE;
    }

    /**
     * Resolves an operator from its symbol ({@code ">="}) or name ({@code "ge"}, case-insensitive).
     *
     * @return the operator, or null if the text names none
     */
    public static Operator fromSymbol(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        for (Operator op : values()) {
            if (op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        return null;
    }
}
