/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.context;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.model.Event;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Copy-on-extend {@link CapturedEvents} snapshot.
 *
 * <p>{@link #with(String, Event)} returns a new snapshot backed by fresh arrays, so
 * a predicate evaluating against one snapshot never observes the automaton
 * extending the candidate. Candidates rarely bind more than a handful of aliases,
 * so lookup is a linear scan.
 *
 * <pre>{@code
 * CapturedEvents b0 = ImmutableCapturedEvents.empty();
 * CapturedEvents b1 = b0.with("a", tick);      // b0 is unchanged
 * predicate.evaluate(b1);
 * }</pre>
 */
public final class ImmutableCapturedEvents implements CapturedEvents {

    private static final ImmutableCapturedEvents EMPTY =
            new ImmutableCapturedEvents(new String[0], new Event[0]);

    private final String[] aliases;
    private final Event[] events;

    private ImmutableCapturedEvents(String[] aliases, Event[] events) {
        this.aliases = aliases;
        this.events = events;
    }

    public static ImmutableCapturedEvents empty() {
        return EMPTY;
    }

    public static ImmutableCapturedEvents of(String alias, Event event) {
        return EMPTY.with(alias, event);
    }

    /**
     * Binds an event to an alias that is not bound yet.
     *
     * @return a new snapshot; this one is left untouched
     * @throws IllegalArgumentException if the alias is already bound
     */
    public ImmutableCapturedEvents with(String alias, Event event) {
        Objects.requireNonNull(alias, "alias cannot be null");
        Objects.requireNonNull(event, "event cannot be null");
        if (indexOf(alias) >= 0) {
            throw new IllegalArgumentException("Alias '" + alias + "' is already bound");
        }
        String[] nextAliases = Arrays.copyOf(aliases, aliases.length + 1);
        Event[] nextEvents = Arrays.copyOf(events, events.length + 1);
        nextAliases[aliases.length] = alias;
        nextEvents[events.length] = event;
        return new ImmutableCapturedEvents(nextAliases, nextEvents);
    }

    @Override
    public Optional<Event> lookup(String alias) {
        int index = indexOf(alias);
        return index >= 0 ? Optional.of(events[index]) : Optional.empty();
    }

    @Override
    public List<String> aliases() {
        return Collections.unmodifiableList(Arrays.asList(aliases));
    }

    @Override
    public int size() {
        return aliases.length;
    }

    private int indexOf(String alias) {
        for (int i = 0; i < aliases.length; i++) {
            if (aliases[i].equals(alias)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CapturedEvents{");
        for (int i = 0; i < aliases.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(aliases[i]).append('=').append(events[i].eventId());
        }
        return sb.append('}').toString();
    }
}
