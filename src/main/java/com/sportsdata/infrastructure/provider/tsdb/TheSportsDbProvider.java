package com.sportsdata.infrastructure.provider.tsdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sportsdata.domain.model.Event;
import com.sportsdata.domain.model.Team;
import com.sportsdata.domain.model.TeamStats;
import com.sportsdata.domain.ports.ProviderException;
import com.sportsdata.domain.ports.SportsDataProvider;
import com.sportsdata.infrastructure.normalization.NormalizationException;
import com.sportsdata.infrastructure.normalization.NormalizationUtils;
import com.sportsdata.infrastructure.normalization.TeamSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Secondary provider backed by TheSportsDB.
 *
 * <p>Event payloads only embed team ids, names and badges. Events are enriched
 * from the league roster so they always carry full team records; if the roster
 * cannot be loaded the embedded fields are used instead.
 */
public class TheSportsDbProvider implements SportsDataProvider {

    private static final Logger logger = LoggerFactory.getLogger(TheSportsDbProvider.class);

    private final TheSportsDbClient client;
    private final TheSportsDbNormalizer normalizer;
    private final Map<String, TheSportsDbLeague> leagues;
    private final Map<String, TheSportsDbLeague> leaguesById;
    private final ZoneId zone;
    private final Clock clock;

    public TheSportsDbProvider(TheSportsDbClient client, TheSportsDbNormalizer normalizer,
                               Map<String, TheSportsDbLeague> leagues, ZoneId zone, Clock clock) {
        this.client = client;
        this.normalizer = normalizer;
        this.leagues = Map.copyOf(leagues);
        this.leaguesById = new HashMap<>();
        leagues.values().forEach(l -> leaguesById.put(l.leagueId(), l));
        this.zone = zone;
        this.clock = clock;
    }

    @Override
    public String name() {
        return TheSportsDbNormalizer.PROVIDER_NAME;
    }

    @Override
    public boolean supportsLeague(String league) {
        return league != null && leagues.containsKey(league);
    }

    @Override
    public Optional<Team> getTeam(String teamId, String league) throws ProviderException {
        TheSportsDbLeague tsdbLeague = leagues.get(league);
        if (tsdbLeague == null) {
            return Optional.empty();
        }
        for (JsonNode team : client.lookupTeam(teamId).path("teams")) {
            if (!tsdbLeague.equals(leaguesById.get(NormalizationUtils.text(team, "idLeague")))) {
                logger.debug("TheSportsDB team {} is not in {}", teamId, league);
                continue;
            }
            try {
                return Optional.of(normalizer.normalizeTeam(team, tsdbLeague));
            } catch (NormalizationException | IllegalArgumentException e) {
                logger.warn("Dropping TheSportsDB team {} in {}: {}", teamId, league, e.getMessage());
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Event> getTeamSchedule(String teamId, String league, int daysAhead) throws ProviderException {
        TheSportsDbLeague tsdbLeague = leagues.get(league);
        if (tsdbLeague == null) {
            return List.of();
        }
        JsonNode payload = onlyLeague(client.nextEvents(teamId), tsdbLeague);
        Instant until = clock.instant().plus(Duration.ofDays(daysAhead));

        return normalizer.normalizeEvents(payload, tsdbLeague, roster(tsdbLeague)).stream()
            .filter(e -> e.startTime().isBefore(until))
            .sorted(Comparator.comparing(Event::startTime))
            .toList();
    }

    /**
     * TheSportsDB days are UTC. Every UTC day overlapping {@code date} in the
     * configured zone is fetched and the result cut back to that local date.
     */
    @Override
    public List<Event> getEvents(String league, LocalDate date) throws ProviderException {
        TheSportsDbLeague tsdbLeague = leagues.get(league);
        if (tsdbLeague == null) {
            return List.of();
        }
        LocalDate firstUtcDay = date.atStartOfDay(zone).withZoneSameInstant(ZoneOffset.UTC).toLocalDate();
        LocalDate lastUtcDay = date.plusDays(1).atStartOfDay(zone).minusNanos(1)
            .withZoneSameInstant(ZoneOffset.UTC).toLocalDate();

        Map<String, Team> roster = roster(tsdbLeague);
        Map<String, Event> events = new LinkedHashMap<>();
        for (LocalDate day = firstUtcDay; !day.isAfter(lastUtcDay); day = day.plusDays(1)) {
            JsonNode payload = client.eventsOnDay(tsdbLeague.leagueId(), day);
            for (Event event : normalizer.normalizeEvents(payload, tsdbLeague, roster)) {
                if (NormalizationUtils.localDate(event.startTime(), zone).equals(date)) {
                    events.putIfAbsent(event.id(), event);
                }
            }
        }
        return events.values().stream()
            .sorted(Comparator.comparing(Event::startTime))
            .toList();
    }

    @Override
    public Optional<Event> getEvent(String eventId, String league) throws ProviderException {
        TheSportsDbLeague tsdbLeague = leagues.get(league);
        if (tsdbLeague == null) {
            return Optional.empty();
        }
        JsonNode payload = onlyLeague(client.lookupEvent(eventId), tsdbLeague);
        if (payload.path("events").isEmpty()) {
            return Optional.empty();
        }
        return normalizer.normalizeEvents(payload, tsdbLeague, roster(tsdbLeague)).stream().findFirst();
    }

    @Override
    public Optional<TeamStats> getTeamStats(String teamId, String league) throws ProviderException {
        TheSportsDbLeague tsdbLeague = leagues.get(league);
        if (tsdbLeague == null || !tsdbLeague.standings()) {
            return Optional.empty();
        }
        String season = tsdbLeague.seasonFor(LocalDate.ofInstant(clock.instant(), zone));
        for (JsonNode row : client.table(tsdbLeague.leagueId(), season).path("table")) {
            if (teamId.equals(NormalizationUtils.text(row, "idTeam"))) {
                return Optional.ofNullable(normalizer.normalizeTeamStats(row, tsdbLeague));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Team> getLeagueTeams(String league) throws ProviderException {
        TheSportsDbLeague tsdbLeague = leagues.get(league);
        if (tsdbLeague == null) {
            return List.of();
        }
        return normalizer.normalizeTeams(client.leagueTeams(tsdbLeague.leagueId()), tsdbLeague).stream()
            .sorted(Comparator.comparing(Team::name))
            .toList();
    }

    /**
     * TheSportsDB has no conference structure.
     */
    @Override
    public Map<String, List<Team>> getTeamsByConference(String league) {
        return Map.of();
    }

    @Override
    public List<Team> searchTeams(String query, String league) throws ProviderException {
        if (league != null && !supportsLeague(league)) {
            return List.of();
        }
        List<Team> candidates = new ArrayList<>();
        for (JsonNode team : client.searchTeams(query).path("teams")) {
            TheSportsDbLeague teamLeague = leaguesById.get(NormalizationUtils.text(team, "idLeague"));
            if (teamLeague == null || (league != null && !teamLeague.key().equals(league))) {
                continue;
            }
            try {
                candidates.add(normalizer.normalizeTeam(team, teamLeague));
            } catch (NormalizationException | IllegalArgumentException e) {
                logger.warn("Dropping TheSportsDB search result: {}", e.getMessage());
            }
        }
        return TeamSearch.rank(candidates, query);
    }

    private Map<String, Team> roster(TheSportsDbLeague league) {
        Map<String, Team> roster = new HashMap<>();
        try {
            for (Team team : normalizer.normalizeTeams(client.leagueTeams(league.leagueId()), league)) {
                roster.put(team.id(), team);
            }
        } catch (ProviderException e) {
            logger.warn("Could not load TheSportsDB roster for {}, using embedded team fields: {}",
                league.key(), e.getMessage());
        }
        return roster;
    }

    /**
     * Team and event lookups are not league-scoped upstream, so events from
     * other competitions (cups, friendlies) are removed here.
     */
    private JsonNode onlyLeague(JsonNode payload, TheSportsDbLeague league) {
        if (!payload.path("events").isArray()) {
            return payload;
        }
        ArrayNode kept = JsonNodeFactory.instance.arrayNode();
        for (JsonNode event : payload.path("events")) {
            if (league.leagueId().equals(NormalizationUtils.text(event, "idLeague"))) {
                kept.add(event);
            }
        }
        ObjectNode filtered = JsonNodeFactory.instance.objectNode();
        filtered.set("events", kept);
        return filtered;
    }
}
