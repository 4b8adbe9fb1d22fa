package com.sportsdata.infrastructure.provider.espn;

/**
 * ESPN publishes the same concepts under different keys depending on the
 * endpoint. Each endpoint declares the one place every such field is read from.
 */
public enum EspnEndpoint {

    /** {@code /scoreboard}: score is text, logo is {@code team.logo}, broadcasts are {@code names[]}. */
    SCOREBOARD(ScoreSource.TEXT, LogoSource.LOGO, BroadcastSource.NAMES, SeasonTypeSource.SEASON_TYPE),

    /** {@code /teams/{id}/schedule}: score is an object, logos array, broadcasts carry media. */
    SCHEDULE(ScoreSource.VALUE_OBJECT, LogoSource.LOGOS_ARRAY, BroadcastSource.MEDIA_SHORT_NAME,
        SeasonTypeSource.SEASON_TYPE_OBJECT),

    /** {@code /summary}: header competitions, score is text, logos array. */
    SUMMARY(ScoreSource.TEXT, LogoSource.LOGOS_ARRAY, BroadcastSource.MEDIA_SHORT_NAME, SeasonTypeSource.SEASON_TYPE),

    /** {@code /teams} and {@code /teams/{id}}: team payloads only. */
    TEAMS(ScoreSource.NONE, LogoSource.LOGOS_ARRAY, BroadcastSource.NONE, SeasonTypeSource.NONE);

    public enum ScoreSource { TEXT, VALUE_OBJECT, NONE }

    public enum LogoSource { LOGO, LOGOS_ARRAY }

    public enum BroadcastSource { NAMES, MEDIA_SHORT_NAME, NONE }

    /** {@code season.type} as an int, or {@code seasonType.type} on the schedule endpoint. */
    public enum SeasonTypeSource { SEASON_TYPE, SEASON_TYPE_OBJECT, NONE }

    private final ScoreSource score;
    private final LogoSource logo;
    private final BroadcastSource broadcasts;
    private final SeasonTypeSource seasonType;

    EspnEndpoint(ScoreSource score, LogoSource logo, BroadcastSource broadcasts, SeasonTypeSource seasonType) {
        this.score = score;
        this.logo = logo;
        this.broadcasts = broadcasts;
        this.seasonType = seasonType;
    }

    public ScoreSource score() {
        return score;
    }

    public LogoSource logo() {
        return logo;
    }

    public BroadcastSource broadcasts() {
        return broadcasts;
    }

    public SeasonTypeSource seasonType() {
        return seasonType;
    }
}
