package com.sportsdata.infrastructure.provider.tsdb;

import java.time.LocalDate;
import java.util.Map;

/**
 * TheSportsDB identifiers for a normalized league key.
 *
 * @param key          normalized league key
 * @param leagueId     TheSportsDB {@code idLeague}
 * @param sport        sport key stamped on records
 * @param splitSeason  whether seasons span two calendar years ("2023-2024")
 * @param standings    whether TheSportsDB publishes a table for the league
 */
public record TheSportsDbLeague(String key, String leagueId, String sport, boolean splitSeason, boolean standings) {

    public static final Map<String, TheSportsDbLeague> DEFAULTS = Map.ofEntries(
        entry("nfl", "4391", "football", false, false),
        entry("nba", "4387", "basketball", true, false),
        entry("nhl", "4380", "hockey", true, false),
        entry("mlb", "4424", "baseball", false, false),
        entry("ahl", "4738", "hockey", true, false),
        entry("cfl", "4405", "football", false, false),
        entry("mls", "4346", "soccer", false, true),
        entry("epl", "4328", "soccer", true, true),
        entry("laliga", "4335", "soccer", true, true),
        entry("bundesliga", "4331", "soccer", true, true),
        entry("seriea", "4332", "soccer", true, true),
        entry("ligue1", "4334", "soccer", true, true)
    );

    private static Map.Entry<String, TheSportsDbLeague> entry(String key, String leagueId, String sport,
                                                              boolean splitSeason, boolean standings) {
        return Map.entry(key, new TheSportsDbLeague(key, leagueId, sport, splitSeason, standings));
    }

    /**
     * Season label for the season in progress on {@code today}. Split seasons
     * roll over in August.
     */
    public String seasonFor(LocalDate today) {
        if (!splitSeason) {
            return String.valueOf(today.getYear());
        }
        int startYear = today.getMonthValue() >= 8 ? today.getYear() : today.getYear() - 1;
        return startYear + "-" + (startYear + 1);
    }
}
