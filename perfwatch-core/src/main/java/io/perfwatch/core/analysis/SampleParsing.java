package io.perfwatch.core.analysis;

import java.util.Locale;

/**
 * Lenient field parsing shared by the sample readers. Returns {@code null} for anything
 * that is not a usable value so the caller can count the row as malformed.
 */
final class SampleParsing {

    private SampleParsing() {}

    static Long parseLong(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Boolean parseBoolean(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> null;
        };
    }
}
