package com.sportsdata.domain.model;

/**
 * Aggregate standings data for a team.
 *
 * <p>{@code record} is kept in the provider's own W-L(-D) format.
 */
public record TeamStats(
    String record,
    int wins,
    int losses,
    int ties,
    String homeRecord,
    String awayRecord,
    String streak,
    Integer rank,
    Integer playoffSeed,
    Double gamesBack,
    String conference,
    String conferenceAbbrev,
    String division,
    Double pointsFor,
    Double pointsAgainst
) {

    public TeamStats {
        if (record == null || record.isBlank()) {
            throw new IllegalArgumentException("TeamStats record is required");
        }
    }

    public static Builder builder(String record) {
        return new Builder(record);
    }

    public static final class Builder {
        private final String record;
        private int wins;
        private int losses;
        private int ties;
        private String homeRecord;
        private String awayRecord;
        private String streak;
        private Integer rank;
        private Integer playoffSeed;
        private Double gamesBack;
        private String conference;
        private String conferenceAbbrev;
        private String division;
        private Double pointsFor;
        private Double pointsAgainst;

        private Builder(String record) {
            this.record = record;
        }

        public Builder wins(int wins) {
            this.wins = wins;
            return this;
        }

        public Builder losses(int losses) {
            this.losses = losses;
            return this;
        }

        public Builder ties(int ties) {
            this.ties = ties;
            return this;
        }

        public Builder homeRecord(String homeRecord) {
            this.homeRecord = homeRecord;
            return this;
        }

        public Builder awayRecord(String awayRecord) {
            this.awayRecord = awayRecord;
            return this;
        }

        public Builder streak(String streak) {
            this.streak = streak;
            return this;
        }

        public Builder rank(Integer rank) {
            this.rank = rank;
            return this;
        }

        public Builder playoffSeed(Integer playoffSeed) {
            this.playoffSeed = playoffSeed;
            return this;
        }

        public Builder gamesBack(Double gamesBack) {
            this.gamesBack = gamesBack;
            return this;
        }

        public Builder conference(String conference) {
            this.conference = conference;
            return this;
        }

        public Builder conferenceAbbrev(String conferenceAbbrev) {
            this.conferenceAbbrev = conferenceAbbrev;
            return this;
        }

        public Builder division(String division) {
            this.division = division;
            return this;
        }

        public Builder pointsFor(Double pointsFor) {
            this.pointsFor = pointsFor;
            return this;
        }

        public Builder pointsAgainst(Double pointsAgainst) {
            this.pointsAgainst = pointsAgainst;
            return this;
        }

        public TeamStats build() {
            return new TeamStats(record, wins, losses, ties, homeRecord, awayRecord, streak, rank,
                playoffSeed, gamesBack, conference, conferenceAbbrev, division, pointsFor, pointsAgainst);
        }
    }
}
