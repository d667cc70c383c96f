/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable stream event captured by the automaton.
 *
 * <p>
 * An event consists of:
 * <ul>
 * <li><b>eventId</b>: unique identifier for traceability.</li>
 * <li><b>eventType</b>: logical type (e.g. "STOCK_TICK"), may be null.</li>
 * <li><b>attributes</b>: payload fields. Values may be null.</li>
 * </ul>
 *
 * @param eventId    unique identifier of the event (must not be null)
 * @param eventType  logical type of the event
 * @param attributes event payload, copied on construction
 */
public record Event(
        String eventId,
        String eventType,
        Map<String, Object> attributes) {

    public Event {
        Objects.requireNonNull(eventId, "eventId cannot be null");
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * @return the attribute value; empty when absent or explicitly null
     */
    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }
}
