package com.sportsdata.domain.model;

/**
 * A team as seen by one provider.
 *
 * <p>{@code id} is only meaningful together with {@code provider}; ids are never
 * compared across providers.
 *
 * @param id           provider-scoped team id
 * @param provider     name of the provider that produced this record
 * @param name         full display name, e.g. "Kansas City Chiefs"
 * @param shortName    short display name, e.g. "Chiefs"
 * @param abbreviation e.g. "KC"
 * @param league       normalized league key, e.g. "nfl"
 * @param sport        sport key, e.g. "football"
 * @param logoUrl      logo URL, may be null
 * @param color        primary color as upper-case hex without '#', may be null
 */
public record Team(
    String id,
    String provider,
    String name,
    String shortName,
    String abbreviation,
    String league,
    String sport,
    String logoUrl,
    String color
) {

    public Team {
        requireText(id, "id");
        requireText(provider, "provider");
        requireText(name, "name");
        requireText(league, "league");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Team " + field + " is required");
        }
    }
}
