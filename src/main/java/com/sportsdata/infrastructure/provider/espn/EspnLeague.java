package com.sportsdata.infrastructure.provider.espn;

import java.util.Map;

/**
 * ESPN path segments for a normalized league key.
 *
 * @param key         normalized league key, e.g. "ncaaf"
 * @param sport       ESPN sport segment, e.g. "football"
 * @param espnLeague  ESPN league segment, e.g. "college-football"
 * @param conferences whether the league is organized in conferences
 */
public record EspnLeague(String key, String sport, String espnLeague, boolean conferences) {

    public static final Map<String, EspnLeague> DEFAULTS = Map.ofEntries(
        entry("nfl", "football", "nfl", true),
        entry("ncaaf", "football", "college-football", true),
        entry("nba", "basketball", "nba", true),
        entry("wnba", "basketball", "wnba", true),
        entry("ncaam", "basketball", "mens-college-basketball", true),
        entry("ncaaw", "basketball", "womens-college-basketball", true),
        entry("nhl", "hockey", "nhl", true),
        entry("mlb", "baseball", "mlb", true),
        entry("mls", "soccer", "usa.1", true),
        entry("epl", "soccer", "eng.1", false),
        entry("laliga", "soccer", "esp.1", false),
        entry("bundesliga", "soccer", "ger.1", false),
        entry("seriea", "soccer", "ita.1", false),
        entry("ligue1", "soccer", "fra.1", false)
    );

    private static Map.Entry<String, EspnLeague> entry(String key, String sport, String espnLeague, boolean conferences) {
        return Map.entry(key, new EspnLeague(key, sport, espnLeague, conferences));
    }

    /**
     * "football/nfl" style path used by every ESPN endpoint.
     */
    public String path() {
        return sport + "/" + espnLeague;
    }
}
