package com.sportsdata.infrastructure.provider.espn;

import com.sportsdata.domain.model.EventState;

/**
 * Maps ESPN {@code status.type.name} values to the closed {@link EventState} set.
 */
public final class EspnStatusMapper {

    private EspnStatusMapper() {
    }

    /**
     * @return the mapped state, or null when the value is not in the table
     */
    public static EventState map(String statusName) {
        if (statusName == null) {
            return null;
        }
        return switch (statusName) {
            case "STATUS_SCHEDULED", "STATUS_TBD" -> EventState.SCHEDULED;
            case "STATUS_IN_PROGRESS",
                 "STATUS_HALFTIME",
                 "STATUS_END_PERIOD",
                 "STATUS_FIRST_HALF",
                 "STATUS_SECOND_HALF",
                 "STATUS_OVERTIME",
                 "STATUS_SHOOTOUT",
                 "STATUS_END_OF_REGULATION",
                 "STATUS_DELAYED",
                 "STATUS_RAIN_DELAY" -> EventState.LIVE;
            case "STATUS_FINAL",
                 "STATUS_FINAL_OT",
                 "STATUS_FINAL_AET",
                 "STATUS_FINAL_PEN",
                 "STATUS_FULL_TIME",
                 "STATUS_FULL_PEN" -> EventState.FINAL;
            case "STATUS_POSTPONED", "STATUS_SUSPENDED" -> EventState.POSTPONED;
            case "STATUS_CANCELED", "STATUS_CANCELLED", "STATUS_ABANDONED", "STATUS_FORFEIT" -> EventState.CANCELLED;
            default -> null;
        };
    }

    /**
     * Season type numbers used by ESPN.
     */
    public static String mapSeasonType(Integer type) {
        if (type == null) {
            return null;
        }
        return switch (type) {
            case 1 -> "preseason";
            case 2 -> "regular";
            case 3 -> "postseason";
            default -> null;
        };
    }
}
