package com.sportsdata.infrastructure.provider.espn;

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
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
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
 * Maps ESPN payloads to normalized records.
 *
 * <p>Field locations that differ between endpoints are resolved through
 * {@link EspnEndpoint}. Records that cannot be built are dropped from list
 * results and logged; they never abort the whole payload.
 */
public class EspnNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(EspnNormalizer.class);

    public static final String PROVIDER_NAME = "espn";

    // "1st in AFC West"
    private static final Pattern STANDING_SUMMARY = Pattern.compile("^(\\d+)(?:st|nd|rd|th)\\s+in\\s+(.+)$");

    public Team normalizeTeam(JsonNode team, EspnLeague league, EspnEndpoint endpoint) {
        String id = requiredText(team, "id", "ESPN team");
        String name = requiredText(team, "displayName", "ESPN team " + id);
        String shortName = text(team, "shortDisplayName");
        String abbreviation = text(team, "abbreviation");

        return new Team(
            id,
            PROVIDER_NAME,
            name,
            shortName != null ? shortName : name,
            abbreviation != null ? abbreviation : deriveAbbreviation(name),
            league.key(),
            league.sport(),
            logo(team, endpoint),
            normalizeColor(text(team, "color"))
        );
    }

    /**
     * {@code /teams} payload: {@code sports[0].leagues[0].teams[].team}.
     */
    public List<Team> normalizeTeams(JsonNode root, EspnLeague league) {
        JsonNode teams = root.path("sports").path(0).path("leagues").path(0).path("teams");
        List<Team> result = new ArrayList<>();
        for (JsonNode wrapper : teams) {
            try {
                result.add(normalizeTeam(wrapper.path("team"), league, EspnEndpoint.TEAMS));
            } catch (NormalizationException | IllegalArgumentException e) {
                logger.warn("Dropping ESPN team in {}: {}", league.key(), e.getMessage());
            }
        }
        return result;
    }

    private String logo(JsonNode team, EspnEndpoint endpoint) {
        return switch (endpoint.logo()) {
            case LOGO -> text(team, "logo");
            case LOGOS_ARRAY -> text(team.path("logos").path(0), "href");
        };
    }

    /**
     * Scoreboard or schedule payload: {@code events[]}.
     */
    public List<Event> normalizeEvents(JsonNode root, EspnLeague league, EspnEndpoint endpoint) {
        List<Event> result = new ArrayList<>();
        for (JsonNode event : root.path("events")) {
            try {
                result.add(normalizeEvent(event, league, endpoint));
            } catch (NormalizationException | IllegalArgumentException e) {
                logger.warn("Dropping ESPN event {} in {}: {}",
                    text(event, "id"), league.key(), e.getMessage());
            }
        }
        return result;
    }

    public Event normalizeEvent(JsonNode event, EspnLeague league, EspnEndpoint endpoint) {
        String id = requiredText(event, "id", "ESPN event");
        JsonNode competition = event.path("competitions").path(0);
        JsonNode venue = competition.path("venue");
        return buildEvent(id, text(event, "name"), text(event, "shortName"), requiredText(event, "date", "ESPN event " + id),
            event, competition, venue, league, endpoint);
    }

    /**
     * {@code /summary} payload. The event lives under {@code header}; the venue
     * under {@code gameInfo}.
     */
    public Event normalizeSummary(JsonNode root, EspnLeague league) {
        JsonNode header = root.path("header");
        String id = requiredText(header, "id", "ESPN summary");
        JsonNode competition = header.path("competitions").path(0);
        String date = requiredText(competition, "date", "ESPN summary " + id);
        return buildEvent(id, null, null, date, header, competition, root.path("gameInfo").path("venue"),
            league, EspnEndpoint.SUMMARY);
    }

    private Event buildEvent(String id, String name, String shortName, String date, JsonNode seasonHolder,
                             JsonNode competition, JsonNode venue, EspnLeague league, EspnEndpoint endpoint) {
        JsonNode home = competitor(competition, "home", id);
        JsonNode away = competitor(competition, "away", id);

        Team homeTeam = normalizeTeam(home.path("team"), league, endpoint);
        Team awayTeam = normalizeTeam(away.path("team"), league, endpoint);
        EventStatus status = normalizeStatus(competition.path("status"), id);

        Integer homeScore = status.state().hasProgress() ? score(home, endpoint) : null;
        Integer awayScore = status.state().hasProgress() ? score(away, endpoint) : null;

        return new Event(
            id,
            PROVIDER_NAME,
            name != null ? name : awayTeam.name() + " at " + homeTeam.name(),
            shortName != null ? shortName : awayTeam.abbreviation() + " @ " + homeTeam.abbreviation(),
            parseInstant(date, id),
            homeTeam,
            awayTeam,
            status,
            league.key(),
            league.sport(),
            homeScore,
            awayScore,
            normalizeVenue(venue),
            broadcasts(competition, endpoint),
            integer(seasonHolder.path("season"), "year"),
            EspnStatusMapper.mapSeasonType(seasonType(seasonHolder, endpoint))
        );
    }

    private JsonNode competitor(JsonNode competition, String side, String eventId) {
        for (JsonNode competitor : competition.path("competitors")) {
            if (side.equals(text(competitor, "homeAway"))) {
                return competitor;
            }
        }
        throw new NormalizationException("ESPN event " + eventId + " has no " + side + " competitor");
    }

    EventStatus normalizeStatus(JsonNode status, String eventId) {
        JsonNode type = status.path("type");
        String statusName = text(type, "name");
        EventState state = EspnStatusMapper.map(statusName);
        if (state == null) {
            logger.warn("Unknown ESPN status '{}' on event {}, treating as scheduled", statusName, eventId);
            state = EventState.SCHEDULED;
        }
        return new EventStatus(state, text(type, "shortDetail"), integer(status, "period"), text(status, "displayClock"));
    }

    private Integer score(JsonNode competitor, EspnEndpoint endpoint) {
        return switch (endpoint.score()) {
            case TEXT -> integer(competitor, "score");
            case VALUE_OBJECT -> integer(competitor.path("score"), "value");
            case NONE -> null;
        };
    }

    private List<String> broadcasts(JsonNode competition, EspnEndpoint endpoint) {
        List<String> names = new ArrayList<>();
        for (JsonNode broadcast : competition.path("broadcasts")) {
            switch (endpoint.broadcasts()) {
                case NAMES -> {
                    for (JsonNode name : broadcast.path("names")) {
                        addBroadcast(names, name.asText());
                    }
                }
                case MEDIA_SHORT_NAME -> addBroadcast(names, text(broadcast.path("media"), "shortName"));
                case NONE -> {
                }
            }
        }
        return names;
    }

    private static void addBroadcast(List<String> names, String name) {
        if (name != null && !name.isBlank() && !names.contains(name.trim())) {
            names.add(name.trim());
        }
    }

    private Integer seasonType(JsonNode seasonHolder, EspnEndpoint endpoint) {
        return switch (endpoint.seasonType()) {
            case SEASON_TYPE -> integer(seasonHolder.path("season"), "type");
            case SEASON_TYPE_OBJECT -> integer(seasonHolder.path("seasonType"), "type");
            case NONE -> null;
        };
    }

    private Venue normalizeVenue(JsonNode venue) {
        String name = text(venue, "fullName");
        if (name == null) {
            return null;
        }
        JsonNode address = venue.path("address");
        return new Venue(name, text(address, "city"), text(address, "state"), text(address, "country"));
    }

    /**
     * ESPN timestamps are ISO-8601 with an offset and optional seconds,
     * e.g. {@code 2024-01-14T18:00Z}.
     */
    static Instant parseInstant(String value, String eventId) {
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new NormalizationException("ESPN event " + eventId + " has unparseable date '" + value + "'", e);
        }
    }

    /**
     * Stats from the {@code /teams/{id}} payload's {@code team} node. Returns null
     * when ESPN publishes no overall record for the team.
     */
    public TeamStats normalizeTeamStats(JsonNode team) {
        JsonNode total = null;
        String homeRecord = null;
        String awayRecord = null;
        for (JsonNode item : team.path("record").path("items")) {
            String type = text(item, "type");
            if ("total".equals(type)) {
                total = item;
            } else if ("home".equals(type)) {
                homeRecord = text(item, "summary");
            } else if ("road".equals(type)) {
                awayRecord = text(item, "summary");
            }
        }
        if (total == null || text(total, "summary") == null) {
            return null;
        }

        Map<String, JsonNode> stats = new LinkedHashMap<>();
        for (JsonNode stat : total.path("stats")) {
            String name = text(stat, "name");
            if (name != null) {
                stats.put(name, stat);
            }
        }

        TeamStats.Builder builder = TeamStats.builder(text(total, "summary"))
            .wins(intStat(stats, "wins"))
            .losses(intStat(stats, "losses"))
            .ties(intStat(stats, "ties"))
            .homeRecord(homeRecord)
            .awayRecord(awayRecord)
            .streak(streak(stats.get("streak")))
            .playoffSeed(nullableInt(stats, "playoffSeed"))
            .gamesBack(decimal(stats.get("gamesBehind"), "value"))
            .pointsFor(decimal(stats.get("avgPointsFor"), "value"))
            .pointsAgainst(decimal(stats.get("avgPointsAgainst"), "value"));

        String standingSummary = text(team, "standingSummary");
        if (standingSummary != null) {
            Matcher matcher = STANDING_SUMMARY.matcher(standingSummary);
            if (matcher.matches()) {
                builder.rank(Integer.valueOf(matcher.group(1))).division(matcher.group(2));
            }
        }
        return builder.build();
    }

    private static int intStat(Map<String, JsonNode> stats, String name) {
        Integer value = nullableInt(stats, name);
        return value != null ? value : 0;
    }

    private static Integer nullableInt(Map<String, JsonNode> stats, String name) {
        Integer value = integer(stats.get(name), "value");
        return value != null && value != 0 ? value : null;
    }

    // ESPN encodes streaks as signed numbers: +3 is three wins, -2 two losses.
    private static String streak(JsonNode stat) {
        Integer value = integer(stat, "value");
        if (value == null || value == 0) {
            return null;
        }
        return (value > 0 ? "W" : "L") + Math.abs(value);
    }

    /**
     * Standings payload: {@code children[]} are conferences. Their entries are
     * either direct or nested one level deeper under divisions.
     */
    public Map<String, List<Team>> normalizeConferences(JsonNode root, EspnLeague league) {
        Map<String, List<Team>> conferences = new LinkedHashMap<>();
        for (JsonNode conference : root.path("children")) {
            String conferenceName = text(conference, "name");
            if (conferenceName == null) {
                continue;
            }
            List<Team> teams = new ArrayList<>();
            collectStandingTeams(conference, league, teams);
            for (JsonNode division : conference.path("children")) {
                collectStandingTeams(division, league, teams);
            }
            if (!teams.isEmpty()) {
                conferences.put(conferenceName, teams);
            }
        }
        return conferences;
    }

    private void collectStandingTeams(JsonNode group, EspnLeague league, List<Team> teams) {
        for (JsonNode entry : group.path("standings").path("entries")) {
            try {
                teams.add(normalizeTeam(entry.path("team"), league, EspnEndpoint.TEAMS));
            } catch (NormalizationException | IllegalArgumentException e) {
                logger.warn("Dropping ESPN standings team in {}: {}", league.key(), e.getMessage());
            }
        }
    }
}
