package com.sportsdata.infrastructure.provider.tsdb;

import com.sportsdata.domain.model.EventState;

/**
 * Maps TheSportsDB {@code strStatus} values to {@link EventState}.
 *
 * <p>TheSportsDB mixes short codes ("FT", "HT") with prose ("Match Finished")
 * depending on the sport. Upcoming events often carry no status at all.
 */
public final class TheSportsDbStatusMapper {

    private TheSportsDbStatusMapper() {
    }

    /**
     * @return the mapped state, or null when the value is not in the table
     */
    public static EventState map(String status) {
        if (status == null || status.isBlank()) {
            return EventState.SCHEDULED;
        }
        return switch (status.trim()) {
            case "NS", "Not Started", "TBD", "Time To Be Defined", "Scheduled" -> EventState.SCHEDULED;
            case "1H", "HT", "2H", "ET", "BT", "P", "LIVE", "Live", "In Progress",
                 "Q1", "Q2", "Q3", "Q4", "OT", "P1", "P2", "P3", "PT", "IN1", "IN2", "IN3", "IN4", "IN5",
                 "IN6", "IN7", "IN8", "IN9" -> EventState.LIVE;
            case "FT", "AET", "PEN", "AOT", "AP", "Match Finished", "Finished", "Final", "After Over Time",
                 "After Penalties", "FT_PEN" -> EventState.FINAL;
            case "PST", "Postponed", "SUSP", "Suspended", "INT", "Interrupted" -> EventState.POSTPONED;
            case "CANC", "Cancelled", "Canceled", "ABD", "Abandoned", "AWD", "WO" -> EventState.CANCELLED;
            default -> null;
        };
    }
}
