package com.sportsdata.domain.model;

/**
 * Location where an event is played. Only the name is required.
 */
public record Venue(String name, String city, String state, String country) {

    public Venue {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Venue name is required");
        }
    }
}
