package com.lungrisk.common.feature;

import java.util.Locale;
import java.util.Set;

/**
 * Tolerant parsing of raw attribute values into canonical numeric and binary form.
 *
 * <p>Parsing never fails. Unparseable numbers become {@link #DEFAULT_NUMERIC} and
 * unrecognised binary values become {@code 0}, so malformed input is indistinguishable
 * from a genuine zero/"no". Callers that need strict validation must do it upstream.
 */
public final class FeatureParser {

    public static final double DEFAULT_NUMERIC = 0.0;

    static final double BINARY_THRESHOLD = 0.5;

    private static final Set<String> TRUE_TOKENS = Set.of("yes", "y", "true", "t", "1");
    private static final Set<String> FALSE_TOKENS = Set.of("no", "n", "false", "f", "0");

    private FeatureParser() {
    }

    public static double parseNumeric(Object raw) {
        return parseNumeric(FeatureValue.of(raw), DEFAULT_NUMERIC);
    }

    public static double parseNumeric(FeatureValue value, double defaultValue) {
        return switch (value.getKind()) {
            case ABSENT -> defaultValue;
            case BOOLEAN -> value.asBoolean() ? 1.0 : 0.0;
            case NUMBER -> finiteOrDefault(value.asNumber(), defaultValue);
            case STRING -> parseNumericText(value.asText(), defaultValue);
        };
    }

    public static int parseBinary(Object raw) {
        return parseBinary(FeatureValue.of(raw), Set.of());
    }

    /**
     * Maps a value to {@code 1} or {@code 0}.
     *
     * @param positiveAliases additional lower-case tokens that mean {@code 1} for this
     *                        particular feature (e.g. {@code "male"} for gender)
     */
    public static int parseBinary(FeatureValue value, Set<String> positiveAliases) {
        return switch (value.getKind()) {
            case ABSENT -> 0;
            case BOOLEAN -> value.asBoolean() ? 1 : 0;
            case NUMBER -> threshold(value.asNumber());
            case STRING -> parseBinaryText(value.asText(), positiveAliases);
        };
    }

    /**
     * Whether {@link #parseBinary(FeatureValue, Set)} reads the value from a known token,
     * a boolean or a number rather than falling back to {@code 0}.
     */
    public static boolean isRecognizedBinary(FeatureValue value, Set<String> positiveAliases) {
        return switch (value.getKind()) {
            case ABSENT -> false;
            case BOOLEAN, NUMBER -> true;
            case STRING -> {
                String token = value.asText().trim().toLowerCase(Locale.ROOT);
                yield TRUE_TOKENS.contains(token) || FALSE_TOKENS.contains(token)
                    || positiveAliases.contains(token) || !Double.isNaN(parseNumericText(token, Double.NaN));
            }
        };
    }

    private static int parseBinaryText(String text, Set<String> positiveAliases) {
        String token = text.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token) || positiveAliases.contains(token)) {
            return 1;
        }
        if (FALSE_TOKENS.contains(token) || token.isEmpty()) {
            return 0;
        }
        double numeric = parseNumericText(token, Double.NaN);
        return Double.isNaN(numeric) ? 0 : threshold(numeric);
    }

    private static int threshold(double number) {
        return number >= BINARY_THRESHOLD ? 1 : 0;
    }

    private static double parseNumericText(String text, double defaultValue) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return defaultValue;
        }
        try {
            return finiteOrDefault(Double.parseDouble(trimmed), defaultValue);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double finiteOrDefault(double number, double defaultValue) {
        return Double.isFinite(number) ? number : defaultValue;
    }
}
