package com.cropadvisory.knowledge;

import java.util.Locale;

public enum WaterRequirement {
    LOW(1),
    MODERATE(2),
    HIGH(3);

    private final int code;

    WaterRequirement(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Lenient parse; anything unrecognised is treated as moderate. */
    public static WaterRequirement parse(String value) {
        if (value == null || value.isBlank()) {
            return MODERATE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "low", "1" -> LOW;
            case "high", "3" -> HIGH;
            default -> MODERATE;
        };
    }
}
