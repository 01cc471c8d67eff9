package com.alpaca.flowdesk.config;

import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Lenient parsing of property values. Values are injected as text so that an inline
 * comment or a typo falls back to the default instead of failing the context.
 */
public final class RawProperty {
    private RawProperty() {}

    public static int parseInt(String raw, int def) {
        String s = strip(raw);
        if (s == null) return def;
        try { return Integer.parseInt(s); } catch (Exception e) { return def; }
    }

    public static long parseLong(String raw, long def) {
        String s = strip(raw);
        if (s == null) return def;
        try { return Long.parseLong(s); } catch (Exception e) { return def; }
    }

    public static double parseDouble(String raw, double def) {
        String s = strip(raw);
        if (s == null) return def;
        try { return Double.parseDouble(s); } catch (Exception e) { return def; }
    }

    public static boolean parseBool(String raw, boolean def) {
        String s = strip(raw);
        if (s == null) return def;
        return switch (s.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "y", "on" -> true;
            case "false", "0", "no", "n", "off" -> false;
            default -> def;
        };
    }

    public static LocalTime parseTime(String raw, LocalTime def) {
        String s = strip(raw);
        if (s == null) return def;
        try { return LocalTime.parse(s); } catch (Exception e) { return def; }
    }

    /** Comma separated, trimmed, upper-cased, blanks dropped. */
    public static List<String> parseSymbols(String raw) {
        if (raw == null) return List.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    // Removes any comment or space after the value
    private static String strip(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        int cut = firstOf(s, '#', ' ', '\t', ';');
        if (cut >= 0) s = s.substring(0, cut);
        return s.isEmpty() ? null : s;
    }

    private static int firstOf(String s, char... cs) {
        int min = -1;
        for (char c : cs) {
            int i = s.indexOf(c);
            if (i >= 0 && (min < 0 || i < min)) min = i;
        }
        return min;
    }
}
