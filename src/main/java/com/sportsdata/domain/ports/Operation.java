package com.sportsdata.domain.ports;

/**
 * Read operations of {@link SportsDataProvider}. The key prefixes cache keys
 * and names the operation in configuration.
 */
public enum Operation {
    TEAM("team"),
    TEAM_SCHEDULE("team_schedule"),
    EVENTS("events"),
    EVENT("event"),
    TEAM_STATS("team_stats"),
    LEAGUE_TEAMS("league_teams"),
    TEAMS_BY_CONFERENCE("teams_by_conference"),
    SEARCH_TEAMS("search_teams");

    private final String key;

    Operation(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Accepts the key ({@code league_teams}) or its kebab-case form
     * ({@code league-teams}).
     */
    public static Operation fromKey(String key) {
        String normalized = key.trim().toLowerCase().replace('-', '_');
        for (Operation operation : values()) {
            if (operation.key.equals(normalized)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
