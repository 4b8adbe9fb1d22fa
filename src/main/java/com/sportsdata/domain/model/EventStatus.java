package com.sportsdata.domain.model;

import java.util.Objects;

/**
 * Live/finished state of an event.
 *
 * <p>{@code period} and {@code clock} are only kept for {@link EventState#LIVE}
 * and {@link EventState#FINAL}; for any other state they are cleared.
 *
 * @param state  normalized state, never null
 * @param detail provider display text (e.g. "Final/OT", "Q3 4:12"), may be null
 * @param period current or last period number, may be null
 * @param clock  display clock, may be null
 */
public record EventStatus(EventState state, String detail, Integer period, String clock) {

    public EventStatus {
        Objects.requireNonNull(state, "state");
        if (!state.hasProgress()) {
            period = null;
            clock = null;
        }
    }

    public static EventStatus of(EventState state) {
        return new EventStatus(state, null, null, null);
    }
}
