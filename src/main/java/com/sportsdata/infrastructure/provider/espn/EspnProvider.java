package com.sportsdata.infrastructure.provider.espn;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary provider backed by ESPN's public site API.
 *
 * Flow for every call:
 * 1) Resolve the league key to ESPN path segments (unsupported leagues never reach the network)
 * 2) Fetch the raw payload through {@link EspnClient}
 * 3) Normalize with {@link EspnNormalizer}, stamping the requested league
 */
public class EspnProvider implements SportsDataProvider {

    private static final Logger logger = LoggerFactory.getLogger(EspnProvider.class);

    private final EspnClient client;
    private final EspnNormalizer normalizer;
    private final Map<String, EspnLeague> leagues;
    private final ZoneId zone;
    private final Clock clock;

    public EspnProvider(EspnClient client, EspnNormalizer normalizer, Map<String, EspnLeague> leagues,
                        ZoneId zone, Clock clock) {
        this.client = client;
        this.normalizer = normalizer;
        this.leagues = Map.copyOf(leagues);
        this.zone = zone;
        this.clock = clock;
    }

    @Override
    public String name() {
        return EspnNormalizer.PROVIDER_NAME;
    }

    @Override
    public boolean supportsLeague(String league) {
        return league != null && leagues.containsKey(league);
    }

    @Override
    public Optional<Team> getTeam(String teamId, String league) throws ProviderException {
        EspnLeague espnLeague = leagues.get(league);
        if (espnLeague == null) {
            return Optional.empty();
        }
        JsonNode team = client.team(espnLeague, teamId).path("team");
        if (team.isMissingNode() || team.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(normalizer.normalizeTeam(team, espnLeague, EspnEndpoint.TEAMS));
        } catch (NormalizationException | IllegalArgumentException e) {
            logger.warn("Dropping ESPN team {} in {}: {}", teamId, league, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<Event> getTeamSchedule(String teamId, String league, int daysAhead) throws ProviderException {
        EspnLeague espnLeague = leagues.get(league);
        if (espnLeague == null) {
            return List.of();
        }
        Instant now = clock.instant();
        Instant from = LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
        Instant until = now.plus(Duration.ofDays(daysAhead));

        List<Event> events = normalizer.normalizeEvents(client.teamSchedule(espnLeague, teamId), espnLeague,
            EspnEndpoint.SCHEDULE);
        List<Event> upcoming = events.stream()
            .filter(e -> !e.startTime().isBefore(from) && e.startTime().isBefore(until))
            .sorted(Comparator.comparing(Event::startTime))
            .toList();
        logger.debug("ESPN schedule for team {} in {}: {} of {} events within {} days",
            teamId, league, upcoming.size(), events.size(), daysAhead);
        return upcoming;
    }

    /**
     * ESPN buckets its scoreboard by US Eastern dates, so the day before and
     * after are fetched as well and the result is cut back to {@code date} in the
     * configured zone.
     */
    @Override
    public List<Event> getEvents(String league, LocalDate date) throws ProviderException {
        EspnLeague espnLeague = leagues.get(league);
        if (espnLeague == null) {
            return List.of();
        }
        JsonNode scoreboard = client.scoreboard(espnLeague, date.minusDays(1), date.plusDays(1));
        List<Event> events = normalizer.normalizeEvents(scoreboard, espnLeague, EspnEndpoint.SCOREBOARD);
        return events.stream()
            .filter(e -> NormalizationUtils.localDate(e.startTime(), zone).equals(date))
            .sorted(Comparator.comparing(Event::startTime))
            .toList();
    }

    @Override
    public Optional<Event> getEvent(String eventId, String league) throws ProviderException {
        EspnLeague espnLeague = leagues.get(league);
        if (espnLeague == null) {
            return Optional.empty();
        }
        JsonNode summary = client.summary(espnLeague, eventId);
        if (summary.path("header").isMissingNode()) {
            return Optional.empty();
        }
        try {
            return Optional.of(normalizer.normalizeSummary(summary, espnLeague));
        } catch (NormalizationException | IllegalArgumentException e) {
            logger.warn("Dropping ESPN event {} in {}: {}", eventId, league, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<TeamStats> getTeamStats(String teamId, String league) throws ProviderException {
        EspnLeague espnLeague = leagues.get(league);
        if (espnLeague == null) {
            return Optional.empty();
        }
        JsonNode team = client.team(espnLeague, teamId).path("team");
        if (team.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.ofNullable(normalizer.normalizeTeamStats(team));
    }

    @Override
    public List<Team> getLeagueTeams(String league) throws ProviderException {
        EspnLeague espnLeague = leagues.get(league);
        if (espnLeague == null) {
            return List.of();
        }
        List<Team> teams = normalizer.normalizeTeams(client.teams(espnLeague), espnLeague);
        return teams.stream().sorted(Comparator.comparing(Team::name)).toList();
    }

    @Override
    public Map<String, List<Team>> getTeamsByConference(String league) throws ProviderException {
        EspnLeague espnLeague = leagues.get(league);
        if (espnLeague == null || !espnLeague.conferences()) {
            return Map.of();
        }
        return normalizer.normalizeConferences(client.standings(espnLeague), espnLeague);
    }

    @Override
    public List<Team> searchTeams(String query, String league) throws ProviderException {
        List<Team> candidates = new ArrayList<>();
        if (league != null) {
            if (!supportsLeague(league)) {
                return List.of();
            }
            candidates.addAll(getLeagueTeams(league));
        } else {
            for (String key : leagues.keySet().stream().sorted().toList()) {
                candidates.addAll(getLeagueTeams(key));
            }
        }
        return TeamSearch.rank(candidates, query);
    }
}
