package com.sportsdata.infrastructure.normalization;

import com.sportsdata.domain.model.Team;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks teams against a free-text query.
 *
 * <p>Matching is case and accent insensitive. Tiers, best first: exact name,
 * exact short name or abbreviation, name prefix, word prefix, substring of the
 * name or short name, all query words present, and finally a fuzzy match so
 * that misspellings ("cheifs") still find the team.
 */
public final class TeamSearch {

    /** Minimum Jaro-Winkler similarity for the fuzzy tier. */
    static final double FUZZY_THRESHOLD = 0.90;

    private static final int FUZZY_MIN_QUERY_LENGTH = 4;
    private static final JaroWinklerSimilarity SIMILARITY = new JaroWinklerSimilarity();

    private TeamSearch() {
    }

    public static List<Team> rank(List<Team> candidates, String query) {
        String normalizedQuery = normalize(query);
        if (normalizedQuery.isEmpty()) {
            return List.of();
        }

        List<ScoredTeam> scored = new ArrayList<>();
        for (Team team : candidates) {
            int score = score(team, normalizedQuery);
            if (score > 0) {
                scored.add(new ScoredTeam(team, score));
            }
        }

        scored.sort(Comparator.comparingInt(ScoredTeam::score).reversed()
            .thenComparing(s -> s.team().name()));
        return scored.stream().map(ScoredTeam::team).toList();
    }

    static int score(Team team, String normalizedQuery) {
        String name = normalize(team.name());
        String shortName = normalize(team.shortName());
        String abbreviation = normalize(team.abbreviation());

        if (name.equals(normalizedQuery)) {
            return 100;
        }
        if (shortName.equals(normalizedQuery) || abbreviation.equals(normalizedQuery)) {
            return 95;
        }
        if (name.startsWith(normalizedQuery)) {
            return 90;
        }
        for (String word : name.split(" ")) {
            if (word.startsWith(normalizedQuery)) {
                return 80;
            }
        }
        if (name.contains(normalizedQuery)) {
            return 70;
        }
        if (!shortName.isEmpty() && shortName.contains(normalizedQuery)) {
            return 60;
        }
        List<String> nameWords = Arrays.asList(name.split(" "));
        boolean allWords = Arrays.stream(normalizedQuery.split(" "))
            .allMatch(queryWord -> nameWords.stream().anyMatch(w -> w.startsWith(queryWord)));
        if (allWords) {
            return 50;
        }
        return fuzzyMatch(normalizedQuery, name, shortName) ? 40 : 0;
    }

    // the whole name, the short name and each word of the name are compared
    private static boolean fuzzyMatch(String normalizedQuery, String name, String shortName) {
        if (normalizedQuery.length() < FUZZY_MIN_QUERY_LENGTH) {
            return false;
        }
        List<String> targets = new ArrayList<>(Arrays.asList(name.split(" ")));
        targets.add(name);
        if (!shortName.isEmpty()) {
            targets.add(shortName);
        }
        for (String target : targets) {
            if (SIMILARITY.apply(normalizedQuery, target) >= FUZZY_THRESHOLD) {
                return true;
            }
        }
        return false;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String normalized = Normalizer.normalize(value, Normalizer.Form.NFD)
            .replaceAll("\\p{M}", "")
            .toLowerCase()
            .replaceAll("[^a-z0-9]+", " ")
            .trim();
        return normalized.replaceAll(" +", " ");
    }

    private record ScoredTeam(Team team, int score) {}
}
