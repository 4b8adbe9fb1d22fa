package com.sportsdata.domain.ports;

import com.sportsdata.domain.model.Event;
import com.sportsdata.domain.model.Team;
import com.sportsdata.domain.model.TeamStats;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port implemented by every sports data source.
 *
 * <p>Implementations return only normalized records. Anything that can
 * legitimately find nothing returns an empty value; {@link ProviderException}
 * is reserved for the provider being unusable for the call.
 */
public interface SportsDataProvider {

    /**
     * Stable lowercase identifier (e.g. "espn", "tsdb"). Stamped on every record.
     */
    String name();

    /**
     * Pure capability check. Must not touch the network.
     */
    boolean supportsLeague(String league);

    Optional<Team> getTeam(String teamId, String league) throws ProviderException;

    /**
     * Upcoming events for a team, ordered by start time.
     */
    List<Event> getTeamSchedule(String teamId, String league, int daysAhead) throws ProviderException;

    /**
     * All events of a league whose start time falls on {@code date} in the
     * configured local zone.
     */
    List<Event> getEvents(String league, LocalDate date) throws ProviderException;

    Optional<Event> getEvent(String eventId, String league) throws ProviderException;

    Optional<TeamStats> getTeamStats(String teamId, String league) throws ProviderException;

    List<Team> getLeagueTeams(String league) throws ProviderException;

    /**
     * Conference name to teams. Providers without a conference concept return an
     * empty map.
     */
    Map<String, List<Team>> getTeamsByConference(String league) throws ProviderException;

    /**
     * Case-insensitive fuzzy search over team names, best match first.
     *
     * @param league league to restrict the search to, or null for every supported league
     */
    List<Team> searchTeams(String query, String league) throws ProviderException;
}
