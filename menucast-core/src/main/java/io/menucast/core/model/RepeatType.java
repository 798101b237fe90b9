package io.menucast.core.model;

import java.util.Locale;

public enum RepeatType {
    DAILY,
    WEEKLY,
    MONTHLY,
    ONCE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RepeatType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return DAILY;
        }
        try {
            return RepeatType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported repeat type: " + value, e);
        }
    }
}
