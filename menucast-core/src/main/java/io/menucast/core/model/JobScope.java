package io.menucast.core.model;

import java.util.Locale;

public enum JobScope {
    ALL,
    SINGLE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobScope fromWire(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return "single".equalsIgnoreCase(value.trim()) ? SINGLE : ALL;
    }
}
