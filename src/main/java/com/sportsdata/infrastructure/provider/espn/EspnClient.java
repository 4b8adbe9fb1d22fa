package com.sportsdata.infrastructure.provider.espn;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsdata.domain.ports.ProviderException;
import com.sportsdata.infrastructure.provider.JsonFetcher;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Raw ESPN endpoints. Returns payloads untouched; all interpretation happens in
 * {@link EspnNormalizer}.
 */
public class EspnClient {

    public static final String DEFAULT_SITE_URL = "https://site.api.espn.com/apis/site/v2/sports";
    public static final String DEFAULT_STANDINGS_URL = "https://site.api.espn.com/apis/v2/sports";

    private static final DateTimeFormatter DATE_PARAM = DateTimeFormatter.BASIC_ISO_DATE;

    private final JsonFetcher fetcher;
    private final String siteUrl;
    private final String standingsUrl;

    public EspnClient(JsonFetcher fetcher, String siteUrl, String standingsUrl) {
        this.fetcher = fetcher;
        this.siteUrl = siteUrl;
        this.standingsUrl = standingsUrl;
    }

    public JsonNode team(EspnLeague league, String teamId) throws ProviderException {
        return fetcher.getJson(siteUrl + "/" + league.path() + "/teams/" + teamId, Map.of());
    }

    public JsonNode teamSchedule(EspnLeague league, String teamId) throws ProviderException {
        return fetcher.getJson(siteUrl + "/" + league.path() + "/teams/" + teamId + "/schedule", Map.of());
    }

    /**
     * Scoreboard for an inclusive range of ESPN (US Eastern) dates.
     */
    public JsonNode scoreboard(EspnLeague league, LocalDate from, LocalDate to) throws ProviderException {
        String dates = from.equals(to)
            ? from.format(DATE_PARAM)
            : from.format(DATE_PARAM) + "-" + to.format(DATE_PARAM);
        return fetcher.getJson(siteUrl + "/" + league.path() + "/scoreboard",
            Map.of("dates", dates, "limit", "500"));
    }

    public JsonNode summary(EspnLeague league, String eventId) throws ProviderException {
        return fetcher.getJson(siteUrl + "/" + league.path() + "/summary", Map.of("event", eventId));
    }

    public JsonNode teams(EspnLeague league) throws ProviderException {
        return fetcher.getJson(siteUrl + "/" + league.path() + "/teams", Map.of("limit", "1000"));
    }

    public JsonNode standings(EspnLeague league) throws ProviderException {
        return fetcher.getJson(standingsUrl + "/" + league.path() + "/standings", Map.of());
    }
}
