package com.sportsdata.infrastructure.provider.tsdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsdata.domain.model.Event;
import com.sportsdata.domain.model.EventState;
import com.sportsdata.domain.model.EventStatus;
import com.sportsdata.domain.model.Team;
import com.sportsdata.domain.model.TeamStats;
import com.sportsdata.domain.model.Venue;
import com.sportsdata.infrastructure.normalization.NormalizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.sportsdata.infrastructure.normalization.NormalizationUtils.decimal;
import static com.sportsdata.infrastructure.normalization.NormalizationUtils.deriveAbbreviation;
import static com.sportsdata.infrastructure.normalization.NormalizationUtils.integer;
import static com.sportsdata.infrastructure.normalization.NormalizationUtils.normalizeColor;
import static com.sportsdata.infrastructure.normalization.NormalizationUtils.requiredText;
import static com.sportsdata.infrastructure.normalization.NormalizationUtils.text;

/**
 * Maps TheSportsDB payloads to normalized records.
 *
 * Field sources:
 * - start time: {@code strTimestamp}, always UTC ({@code dateEvent}/{@code strTime} are ignored)
 * - team logo: {@code strBadge} on team payloads, {@code strHomeTeamBadge}/{@code strAwayTeamBadge} on events
 * - color: {@code strColour1}
 * - short event name: built from team abbreviations
 * - broadcasts: not published by the v1 API, always empty
 */
public class TheSportsDbNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(TheSportsDbNormalizer.class);

    public static final String PROVIDER_NAME = "tsdb";

    private static final Pattern SEASON_START_YEAR = Pattern.compile("^(\\d{4})");
    private static final Pattern TRAILING_STREAK = Pattern.compile("([WLD])\\1*$");

    public Team normalizeTeam(JsonNode team, TheSportsDbLeague league) {
        String id = requiredText(team, "idTeam", "TheSportsDB team");
        String name = requiredText(team, "strTeam", "TheSportsDB team " + id);
        String shortName = text(team, "strTeamAlternate");
        String abbreviation = text(team, "strTeamShort");

        return new Team(
            id,
            PROVIDER_NAME,
            name,
            shortName != null ? firstAlias(shortName) : name,
            abbreviation != null ? abbreviation : deriveAbbreviation(name),
            league.key(),
            league.sport(),
            text(team, "strBadge"),
            normalizeColor(text(team, "strColour1"))
        );
    }

    // strTeamAlternate holds a comma separated alias list
    private static String firstAlias(String aliases) {
        String first = aliases.split(",")[0].trim();
        return first.isEmpty() ? aliases : first;
    }

    /**
     * {@code {"teams": [...]}} payload. TheSportsDB answers "nothing" with
     * {@code "teams": null}.
     */
    public List<Team> normalizeTeams(JsonNode root, TheSportsDbLeague league) {
        List<Team> result = new ArrayList<>();
        for (JsonNode team : root.path("teams")) {
            try {
                result.add(normalizeTeam(team, league));
            } catch (NormalizationException | IllegalArgumentException e) {
                logger.warn("Dropping TheSportsDB team in {}: {}", league.key(), e.getMessage());
            }
        }
        return result;
    }

    /**
     * {@code {"events": [...]}} payload. {@code roster} supplies full team records
     * by id; teams missing from it are built from the event's own fields.
     */
    public List<Event> normalizeEvents(JsonNode root, TheSportsDbLeague league, Map<String, Team> roster) {
        List<Event> result = new ArrayList<>();
        for (JsonNode event : root.path("events")) {
            try {
                result.add(normalizeEvent(event, league, roster));
            } catch (NormalizationException | IllegalArgumentException e) {
                logger.warn("Dropping TheSportsDB event {} in {}: {}",
                    text(event, "idEvent"), league.key(), e.getMessage());
            }
        }
        return result;
    }

    public Event normalizeEvent(JsonNode event, TheSportsDbLeague league, Map<String, Team> roster) {
        String id = requiredText(event, "idEvent", "TheSportsDB event");
        String context = "TheSportsDB event " + id;

        Team homeTeam = eventTeam(event, "Home", league, roster, context);
        Team awayTeam = eventTeam(event, "Away", league, roster, context);
        EventStatus status = normalizeStatus(event, id);

        Integer homeScore = status.state().hasProgress() ? integer(event, "intHomeScore") : null;
        Integer awayScore = status.state().hasProgress() ? integer(event, "intAwayScore") : null;

        String venueName = text(event, "strVenue");
        Venue venue = venueName != null
            ? new Venue(venueName, text(event, "strCity"), null, text(event, "strCountry"))
            : null;

        return new Event(
            id,
            PROVIDER_NAME,
            requiredText(event, "strEvent", context),
            awayTeam.abbreviation() + " @ " + homeTeam.abbreviation(),
            parseTimestamp(requiredText(event, "strTimestamp", context), id),
            homeTeam,
            awayTeam,
            status,
            league.key(),
            league.sport(),
            homeScore,
            awayScore,
            venue,
            List.of(),
            seasonYear(text(event, "strSeason")),
            null
        );
    }

    private Team eventTeam(JsonNode event, String side, TheSportsDbLeague league, Map<String, Team> roster,
                           String context) {
        String teamId = requiredText(event, "id" + side + "Team", context);
        Team known = roster.get(teamId);
        if (known != null) {
            return known;
        }
        String name = requiredText(event, "str" + side + "Team", context);
        return new Team(
            teamId,
            PROVIDER_NAME,
            name,
            name,
            deriveAbbreviation(name),
            league.key(),
            league.sport(),
            text(event, "str" + side + "TeamBadge"),
            null
        );
    }

    EventStatus normalizeStatus(JsonNode event, String eventId) {
        String raw = text(event, "strStatus");
        EventState state = TheSportsDbStatusMapper.map(raw);
        if (state == null) {
            logger.warn("Unknown TheSportsDB status '{}' on event {}, treating as scheduled", raw, eventId);
            state = EventState.SCHEDULED;
        }
        return new EventStatus(state, raw, null, text(event, "strProgress"));
    }

    /**
     * {@code strTimestamp} is UTC, sometimes with an explicit offset
     * ({@code 2024-01-15T19:00:00+00:00}) and sometimes without.
     */
    static Instant parseTimestamp(String value, String eventId) {
        try {
            if (value.length() > 19) {
                return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            }
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new NormalizationException("TheSportsDB event " + eventId + " has unparseable timestamp '"
                + value + "'", e);
        }
    }

    private static Integer seasonYear(String season) {
        if (season == null) {
            return null;
        }
        Matcher matcher = SEASON_START_YEAR.matcher(season);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    /**
     * One {@code lookuptable.php} row. Soccer records are W-L-D, everything else
     * W-L with a tie count appended only when non-zero.
     */
    public TeamStats normalizeTeamStats(JsonNode row, TheSportsDbLeague league) {
        Integer wins = integer(row, "intWin");
        Integer losses = integer(row, "intLoss");
        if (wins == null || losses == null) {
            return null;
        }
        int draws = integer(row, "intDraw") != null ? integer(row, "intDraw") : 0;
        String record = "soccer".equals(league.sport()) || draws > 0
            ? wins + "-" + losses + "-" + draws
            : wins + "-" + losses;

        return TeamStats.builder(record)
            .wins(wins)
            .losses(losses)
            .ties(draws)
            .rank(integer(row, "intRank"))
            .streak(streak(text(row, "strForm")))
            .pointsFor(decimal(row, "intGoalsFor"))
            .pointsAgainst(decimal(row, "intGoalsAgainst"))
            .build();
    }

    // strForm lists results oldest first, e.g. "WDLWW" is a two game winning streak
    private static String streak(String form) {
        if (form == null) {
            return null;
        }
        Matcher matcher = TRAILING_STREAK.matcher(form.toUpperCase());
        if (!matcher.find()) {
            return null;
        }
        return matcher.group(1) + matcher.group().length();
    }
}
