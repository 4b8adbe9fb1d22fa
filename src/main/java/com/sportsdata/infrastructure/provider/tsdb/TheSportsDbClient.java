package com.sportsdata.infrastructure.provider.tsdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsdata.domain.ports.ProviderException;
import com.sportsdata.infrastructure.provider.JsonFetcher;

import java.time.LocalDate;
import java.util.Map;

/**
 * Raw TheSportsDB v1 endpoints.
 */
public class TheSportsDbClient {

    public static final String DEFAULT_BASE_URL = "https://www.thesportsdb.com/api/v1/json";
    public static final String DEFAULT_API_KEY = "3";

    private final JsonFetcher fetcher;
    private final String baseUrl;

    /**
     * @param baseUrl API root without the key, e.g. {@link #DEFAULT_BASE_URL}
     * @param apiKey  API key, {@link #DEFAULT_API_KEY} is the public test key
     */
    public TheSportsDbClient(JsonFetcher fetcher, String baseUrl, String apiKey) {
        this.fetcher = fetcher;
        this.baseUrl = baseUrl + "/" + apiKey;
    }

    public JsonNode lookupTeam(String teamId) throws ProviderException {
        return fetcher.getJson(baseUrl + "/lookupteam.php", Map.of("id", teamId));
    }

    public JsonNode nextEvents(String teamId) throws ProviderException {
        return fetcher.getJson(baseUrl + "/eventsnext.php", Map.of("id", teamId));
    }

    /**
     * Events of one league on one UTC date.
     */
    public JsonNode eventsOnDay(String leagueId, LocalDate utcDate) throws ProviderException {
        return fetcher.getJson(baseUrl + "/eventsday.php", Map.of("d", utcDate.toString(), "l", leagueId));
    }

    public JsonNode lookupEvent(String eventId) throws ProviderException {
        return fetcher.getJson(baseUrl + "/lookupevent.php", Map.of("id", eventId));
    }

    public JsonNode leagueTeams(String leagueId) throws ProviderException {
        return fetcher.getJson(baseUrl + "/lookup_all_teams.php", Map.of("id", leagueId));
    }

    public JsonNode searchTeams(String query) throws ProviderException {
        return fetcher.getJson(baseUrl + "/searchteams.php", Map.of("t", query));
    }

    public JsonNode table(String leagueId, String season) throws ProviderException {
        return fetcher.getJson(baseUrl + "/lookuptable.php", Map.of("l", leagueId, "s", season));
    }
}
