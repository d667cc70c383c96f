/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.predicates;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.Predicate;

/**
 * Predicate that can tell a faulted evaluation apart from a plain NEGATIVE.
 */
interface OutcomePredicate extends Predicate {

    Outcome outcome(CapturedEvents events);
}
