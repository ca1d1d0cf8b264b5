package com.cropadvisory.knowledge;

import java.time.Month;
import java.util.Locale;
import java.util.Optional;

/**
 * Indian cropping seasons. The numeric code is part of the model feature contract
 * and must not be renumbered.
 */
public enum Season {
    KHARIF(1),
    RABI(2),
    ZAID(3),
    YEAR_ROUND(4);

    private final int code;

    Season(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Season> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "kharif", "monsoon" -> Optional.of(KHARIF);
            case "rabi", "winter" -> Optional.of(RABI);
            case "zaid", "summer" -> Optional.of(ZAID);
            case "year_round", "yearround", "all" -> Optional.of(YEAR_ROUND);
            default -> Optional.empty();
        };
    }

    /**
     * Storage key for a free-form season name. Aliases collapse to the enum key;
     * unrecognised names are only trimmed and lowercased.
     */
    public static String canonicalKey(String value) {
        return parse(value)
            .map(Season::key)
            .orElseGet(() -> value == null ? null : value.trim().toLowerCase(Locale.ROOT));
    }

    /** Jun-Oct kharif, Nov-Mar rabi, Apr-May zaid. */
    public static Season forMonth(Month month) {
        return switch (month) {
            case JUNE, JULY, AUGUST, SEPTEMBER, OCTOBER -> KHARIF;
            case APRIL, MAY -> ZAID;
            default -> RABI;
        };
    }
}
