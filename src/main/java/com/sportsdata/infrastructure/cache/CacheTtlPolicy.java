package com.sportsdata.infrastructure.cache;

import com.sportsdata.domain.model.Event;
import com.sportsdata.domain.ports.Operation;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides how long a federated result stays cached.
 *
 * Rules, first match wins:
 * 1) Any LIVE event in the result: {@code live}
 * 2) Events for a past date: {@code events-past}; today: {@code events-today};
 *    tomorrow: {@code events-tomorrow}
 * 3) The operation's own TTL
 */
public class CacheTtlPolicy {

    public static final String LIVE = "live";
    public static final String EMPTY = "empty";
    public static final String EVENTS_TODAY = "events-today";
    public static final String EVENTS_TOMORROW = "events-tomorrow";
    public static final String EVENTS_PAST = "events-past";

    private static final Map<String, Duration> DEFAULTS = Map.ofEntries(
        Map.entry("team", Duration.ofHours(24)),
        Map.entry("team-schedule", Duration.ofHours(8)),
        Map.entry("events", Duration.ofHours(8)),
        Map.entry(EVENTS_TODAY, Duration.ofMinutes(30)),
        Map.entry(EVENTS_TOMORROW, Duration.ofHours(4)),
        Map.entry(EVENTS_PAST, Duration.ofDays(180)),
        Map.entry("event", Duration.ofMinutes(30)),
        Map.entry(LIVE, Duration.ofSeconds(30)),
        Map.entry("team-stats", Duration.ofHours(4)),
        Map.entry("league-teams", Duration.ofHours(24)),
        Map.entry("teams-by-conference", Duration.ofHours(24)),
        Map.entry("search-teams", Duration.ofHours(1)),
        Map.entry(EMPTY, Duration.ofMinutes(2))
    );

    private final Map<String, Duration> ttls;
    private final ZoneId zone;
    private final Clock clock;

    /**
     * @param overrides TTLs keyed by kebab-case name ({@code team-stats}); missing keys use the defaults
     */
    public CacheTtlPolicy(Map<String, Duration> overrides, ZoneId zone, Clock clock) {
        this.ttls = new HashMap<>(DEFAULTS);
        overrides.forEach((key, ttl) -> {
            if (!DEFAULTS.containsKey(key)) {
                throw new IllegalArgumentException("Unknown cache TTL '" + key + "'");
            }
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("Cache TTL '" + key + "' must be positive");
            }
            ttls.put(key, ttl);
        });
        this.zone = zone;
        this.clock = clock;
    }

    public static CacheTtlPolicy defaults(ZoneId zone, Clock clock) {
        return new CacheTtlPolicy(Map.of(), zone, clock);
    }

    /**
     * @param date the requested date for {@link Operation#EVENTS}, otherwise null
     */
    public Duration ttlFor(Operation operation, Object value, LocalDate date) {
        if (containsLive(value)) {
            return ttls.get(LIVE);
        }
        if (operation == Operation.EVENTS && date != null) {
            LocalDate today = LocalDate.now(clock.withZone(zone));
            if (date.isBefore(today)) {
                return ttls.get(EVENTS_PAST);
            }
            if (date.equals(today)) {
                return ttls.get(EVENTS_TODAY);
            }
            if (date.equals(today.plusDays(1))) {
                return ttls.get(EVENTS_TOMORROW);
            }
        }
        return ttls.get(operation.key().replace('_', '-'));
    }

    public Duration emptyTtl() {
        return ttls.get(EMPTY);
    }

    private static boolean containsLive(Object value) {
        if (value instanceof Event event) {
            return event.isLive();
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() && containsLive(optional.get());
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().anyMatch(CacheTtlPolicy::containsLive);
        }
        return false;
    }
}
