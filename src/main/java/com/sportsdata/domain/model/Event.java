package com.sportsdata.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A single scheduled or played contest.
 *
 * <p>Home and away teams are snapshots taken at fetch time. {@code broadcasts}
 * is never null.
 */
public record Event(
    String id,
    String provider,
    String name,
    String shortName,
    Instant startTime,
    Team homeTeam,
    Team awayTeam,
    EventStatus status,
    String league,
    String sport,
    Integer homeScore,
    Integer awayScore,
    Venue venue,
    List<String> broadcasts,
    Integer seasonYear,
    String seasonType
) {

    public Event {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Event id is required");
        }
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("Event provider is required");
        }
        if (league == null || league.isBlank()) {
            throw new IllegalArgumentException("Event league is required");
        }
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(homeTeam, "homeTeam");
        Objects.requireNonNull(awayTeam, "awayTeam");
        Objects.requireNonNull(status, "status");
        broadcasts = broadcasts == null ? List.of() : List.copyOf(broadcasts);
    }

    public boolean isLive() {
        return status.state() == EventState.LIVE;
    }
}
