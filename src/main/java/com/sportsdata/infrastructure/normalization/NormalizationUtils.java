package com.sportsdata.infrastructure.normalization;

import com.fasterxml.jackson.databind.JsonNode;

import java.text.Normalizer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.regex.Pattern;

/**
 * Helpers shared by the provider normalizers.
 */
public final class NormalizationUtils {

    private static final Pattern HEX_COLOR = Pattern.compile("[0-9A-F]{6}");
    private static final Pattern SHORT_HEX_COLOR = Pattern.compile("[0-9A-F]{3}");

    private NormalizationUtils() {
    }

    /**
     * Normalizes text for use in identity keys.
     *
     * Rules:
     * 1. Remove accents (Montréal -> MONTREAL)
     * 2. Convert to uppercase
     * 3. Replace runs of non-alphanumerics with a single underscore
     * 4. Remove leading/trailing underscores
     */
    public static String normalizeText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");
        normalized = normalized.toUpperCase();
        normalized = normalized.replaceAll("[^A-Z0-9]+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");

        return normalized;
    }

    /**
     * Provider-independent identity of a team: normalized league and name.
     * Raw ids are never used since they are not comparable across providers.
     */
    public static String teamIdentityKey(String name, String league) {
        return normalizeText(league) + "|" + normalizeText(name);
    }

    /**
     * Canonical color form: upper-case six digit hex without '#'.
     * Three digit shorthand is expanded. Anything else yields null.
     */
    public static String normalizeColor(String raw) {
        if (raw == null) {
            return null;
        }
        String color = raw.trim().toUpperCase();
        if (color.startsWith("#")) {
            color = color.substring(1);
        }
        if (SHORT_HEX_COLOR.matcher(color).matches()) {
            StringBuilder expanded = new StringBuilder(6);
            for (char c : color.toCharArray()) {
                expanded.append(c).append(c);
            }
            return expanded.toString();
        }
        return HEX_COLOR.matcher(color).matches() ? color : null;
    }

    /**
     * Abbreviation for providers that do not publish one: the first three
     * letters or digits of the name, upper-cased.
     */
    public static String deriveAbbreviation(String name) {
        String compact = normalizeText(name).replace("_", "");
        return compact.length() <= 3 ? compact : compact.substring(0, 3);
    }

    /**
     * Trimmed text value of {@code field}, or null when missing, JSON null or blank.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Like {@link #text(JsonNode, String)} but raises a {@link NormalizationException}
     * when the value is absent.
     */
    public static String requiredText(JsonNode node, String field, String context) {
        String value = text(node, field);
        if (value == null) {
            throw new NormalizationException(context + " is missing required field '" + field + "'");
        }
        return value;
    }

    /**
     * Integer value of a numeric or numeric-text field, or null.
     */
    public static Integer integer(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.intValue();
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return (int) Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Double value of a numeric or numeric-text field, or null.
     */
    public static Double decimal(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static LocalDate localDate(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate();
    }
}
