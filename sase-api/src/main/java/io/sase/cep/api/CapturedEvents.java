/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api;

import io.sase.cep.api.model.Event;

import java.util.List;
import java.util.Optional;

/**
 * Ordered, append-only binding from alias to the event captured for that role
 * in the current candidate match.
 *
 * <p>Owned by the automaton. Predicates only read it for the duration of one
 * evaluation call and never keep a reference to it. Implementations must not be
 * mutated while an evaluation reading them is in flight; extending a binding
 * should produce a new snapshot instead.
 */
public interface CapturedEvents {

    /**
     * Looks up the event bound to an alias.
     *
     * @param alias pattern variable name, e.g. {@code "a"}
     * @return the bound event, or empty if the alias has no binding yet
     */
    Optional<Event> lookup(String alias);

    /**
     * @return bound aliases in capture order
     */
    List<String> aliases();

    default int size() {
        return aliases().size();
    }

    default boolean isBound(String alias) {
        return lookup(alias).isPresent();
    }
}
