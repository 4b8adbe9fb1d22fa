package com.sportsdata.domain.model;

/**
 * Closed set of states an event can be in, regardless of provider.
 */
public enum EventState {
    SCHEDULED("scheduled"),
    LIVE("live"),
    FINAL("final"),
    POSTPONED("postponed"),
    CANCELLED("cancelled");

    private final String key;

    EventState(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Whether period/clock information is meaningful for this state.
     */
    public boolean hasProgress() {
        return this == LIVE || this == FINAL;
    }

    @Override
    public String toString() {
        return key;
    }
}
