package com.sportsdata.application.service;

import com.sportsdata.application.federation.FederatedRequest;
import com.sportsdata.application.federation.FederationTimeoutException;
import com.sportsdata.application.federation.ProviderFederator;
import com.sportsdata.application.federation.RequestOptions;
import com.sportsdata.application.federation.TeamMerger;
import com.sportsdata.domain.model.Event;
import com.sportsdata.domain.model.Team;
import com.sportsdata.domain.model.TeamStats;
import com.sportsdata.domain.ports.Operation;
import com.sportsdata.infrastructure.cache.ProviderResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for consumers of sports data.
 *
 * <p>Mirrors {@link com.sportsdata.domain.ports.SportsDataProvider} but never
 * throws for provider trouble: when no provider can answer, the empty value is
 * returned.
 */
@Service
public class SportsDataService {

    private static final Logger logger = LoggerFactory.getLogger(SportsDataService.class);

    private final ProviderFederator federator;

    public SportsDataService(ProviderFederator federator) {
        this.federator = federator;
    }

    public boolean supportsLeague(String league) {
        return federator.supportsLeague(league);
    }

    public Optional<Team> getTeam(String teamId, String league) {
        return getTeam(teamId, league, RequestOptions.DEFAULT);
    }

    public Optional<Team> getTeam(String teamId, String league, RequestOptions options) {
        FederatedRequest<Optional<Team>> request = FederatedRequest
            .of(Operation.TEAM, p -> p.getTeam(teamId, league), Optional.<Team>empty(), Optional::isEmpty)
            .league(league)
            .arguments(league, teamId)
            .build();
        return federator.execute(request, options).value();
    }

    public List<Event> getTeamSchedule(String teamId, String league, int daysAhead) {
        return getTeamSchedule(teamId, league, daysAhead, RequestOptions.DEFAULT);
    }

    public List<Event> getTeamSchedule(String teamId, String league, int daysAhead, RequestOptions options) {
        if (daysAhead < 0) {
            throw new IllegalArgumentException("daysAhead must not be negative: " + daysAhead);
        }
        FederatedRequest<List<Event>> request = FederatedRequest
            .of(Operation.TEAM_SCHEDULE, p -> p.getTeamSchedule(teamId, league, daysAhead), List.<Event>of(),
                List::isEmpty)
            .league(league)
            .arguments(league, teamId, daysAhead)
            .sanitizer(events -> inLeagueByStartTime(events, league))
            .build();
        return federator.execute(request, options).value();
    }

    public List<Event> getEvents(String league, LocalDate date) {
        return getEvents(league, date, RequestOptions.DEFAULT);
    }

    public List<Event> getEvents(String league, LocalDate date, RequestOptions options) {
        FederatedRequest<List<Event>> request = FederatedRequest
            .of(Operation.EVENTS, p -> p.getEvents(league, date), List.<Event>of(), List::isEmpty)
            .league(league)
            .arguments(league, date)
            .date(date)
            .sanitizer(events -> inLeagueByStartTime(events, league))
            .build();
        return federator.execute(request, options).value();
    }

    /**
     * Events from {@code from} to {@code to}, both inclusive. Each day is
     * federated and cached on its own; the timeout bounds the whole range, so
     * days reached after it ran out are only served from the cache.
     */
    public List<Event> getEvents(String league, LocalDate from, LocalDate to) {
        return getEvents(league, from, to, RequestOptions.DEFAULT);
    }

    public List<Event> getEvents(String league, LocalDate from, LocalDate to, RequestOptions options) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " is before start " + from);
        }
        Duration budget = options.timeout() != null ? options.timeout() : federator.defaultTimeout();
        long deadline = System.nanoTime() + budget.toNanos();

        List<Event> events = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            try {
                events.addAll(getEvents(league, day, new RequestOptions(options.forceRefresh(), remaining)));
            } catch (FederationTimeoutException e) {
                logger.warn("Skipping {} events on {}: range budget of {} exhausted", league, day, budget);
            }
        }
        events.sort(Comparator.comparing(Event::startTime));
        return List.copyOf(events);
    }

    public Optional<Event> getEvent(String eventId, String league) {
        return getEvent(eventId, league, RequestOptions.DEFAULT);
    }

    public Optional<Event> getEvent(String eventId, String league, RequestOptions options) {
        FederatedRequest<Optional<Event>> request = FederatedRequest
            .of(Operation.EVENT, p -> p.getEvent(eventId, league), Optional.<Event>empty(), Optional::isEmpty)
            .league(league)
            .arguments(league, eventId)
            .sanitizer(event -> event.filter(e -> league.equals(e.league())))
            .build();
        return federator.execute(request, options).value();
    }

    public Optional<TeamStats> getTeamStats(String teamId, String league) {
        return getTeamStats(teamId, league, RequestOptions.DEFAULT);
    }

    public Optional<TeamStats> getTeamStats(String teamId, String league, RequestOptions options) {
        FederatedRequest<Optional<TeamStats>> request = FederatedRequest
            .of(Operation.TEAM_STATS, p -> p.getTeamStats(teamId, league), Optional.<TeamStats>empty(),
                Optional::isEmpty)
            .league(league)
            .arguments(league, teamId)
            .build();
        return federator.execute(request, options).value();
    }

    public List<Team> getLeagueTeams(String league) {
        return getLeagueTeams(league, RequestOptions.DEFAULT);
    }

    public List<Team> getLeagueTeams(String league, RequestOptions options) {
        FederatedRequest<List<Team>> request = FederatedRequest
            .of(Operation.LEAGUE_TEAMS, p -> p.getLeagueTeams(league), List.<Team>of(), List::isEmpty)
            .league(league)
            .arguments(league)
            .sanitizer(teams -> byName(teams))
            .merger(TeamMerger::merge)
            .build();
        return federator.execute(request, options).value();
    }

    public Map<String, List<Team>> getTeamsByConference(String league) {
        return getTeamsByConference(league, RequestOptions.DEFAULT);
    }

    public Map<String, List<Team>> getTeamsByConference(String league, RequestOptions options) {
        FederatedRequest<Map<String, List<Team>>> request = FederatedRequest
            .of(Operation.TEAMS_BY_CONFERENCE, p -> p.getTeamsByConference(league), Map.<String, List<Team>>of(),
                Map::isEmpty)
            .league(league)
            .arguments(league)
            .sanitizer(SportsDataService::immutableConferences)
            .build();
        return federator.execute(request, options).value();
    }

    /**
     * @param league null searches every league
     */
    public List<Team> searchTeams(String query, String league) {
        return searchTeams(query, league, RequestOptions.DEFAULT);
    }

    public List<Team> searchTeams(String query, String league, RequestOptions options) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String trimmed = query.trim();
        FederatedRequest<List<Team>> request = FederatedRequest
            .of(Operation.SEARCH_TEAMS, p -> p.searchTeams(trimmed, league), List.<Team>of(), List::isEmpty)
            .league(league)
            .arguments(league, trimmed.toLowerCase())
            .sanitizer(List::copyOf)
            .build();
        return federator.execute(request, options).value();
    }

    /**
     * Failure counts per provider since startup.
     */
    public Map<String, Long> failureCounts() {
        return federator.failureCounts();
    }

    public List<String> providerNames() {
        return federator.providerNames();
    }

    public ProviderResultCache.Stats cacheStats() {
        return federator.cacheStats();
    }

    /**
     * @return number of entries removed
     */
    public int clearCache() {
        return federator.clearCache();
    }

    /**
     * Drops cached results that contain data from {@code provider}.
     *
     * @return number of entries removed
     */
    public int invalidateProvider(String provider) {
        return federator.invalidateProvider(provider);
    }

    private static List<Event> inLeagueByStartTime(List<Event> events, String league) {
        List<Event> kept = new ArrayList<>(events.size());
        for (Event event : events) {
            if (league.equals(event.league())) {
                kept.add(event);
            } else {
                logger.warn("Dropping event {} from {}: league {} does not match requested {}",
                    event.id(), event.provider(), event.league(), league);
            }
        }
        kept.sort(Comparator.comparing(Event::startTime));
        return List.copyOf(kept);
    }

    private static List<Team> byName(List<Team> teams) {
        List<Team> sorted = new ArrayList<>(teams);
        sorted.sort(Comparator.comparing(Team::name));
        return List.copyOf(sorted);
    }

    private static Map<String, List<Team>> immutableConferences(Map<String, List<Team>> conferences) {
        Map<String, List<Team>> copy = new LinkedHashMap<>();
        conferences.forEach((conference, teams) -> copy.put(conference, List.copyOf(teams)));
        return Collections.unmodifiableMap(copy);
    }
}
