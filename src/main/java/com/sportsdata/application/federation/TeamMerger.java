package com.sportsdata.application.federation;

import com.sportsdata.domain.model.Team;
import com.sportsdata.infrastructure.normalization.NormalizationUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unions team lists from providers of different priority.
 *
 * Teams are matched on normalized name and league. For a match the
 * higher-priority team keeps its identity ({@code id}, {@code provider}) and
 * every other field is taken from it when present, else from the
 * lower-priority team.
 */
public final class TeamMerger {

    private TeamMerger() {
    }

    public static List<Team> merge(List<Team> higher, List<Team> lower) {
        Map<String, Team> byKey = new LinkedHashMap<>();
        for (Team team : higher) {
            byKey.putIfAbsent(NormalizationUtils.teamIdentityKey(team.name(), team.league()), team);
        }
        for (Team team : lower) {
            byKey.merge(NormalizationUtils.teamIdentityKey(team.name(), team.league()), team, TeamMerger::merge);
        }
        List<Team> merged = new ArrayList<>(byKey.values());
        merged.sort(Comparator.comparing(Team::name));
        return List.copyOf(merged);
    }

    public static Team merge(Team higher, Team lower) {
        return new Team(
            higher.id(),
            higher.provider(),
            higher.name(),
            firstPresent(higher.shortName(), lower.shortName()),
            firstPresent(higher.abbreviation(), lower.abbreviation()),
            higher.league(),
            firstPresent(higher.sport(), lower.sport()),
            firstPresent(higher.logoUrl(), lower.logoUrl()),
            firstPresent(higher.color(), lower.color())
        );
    }

    private static String firstPresent(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
