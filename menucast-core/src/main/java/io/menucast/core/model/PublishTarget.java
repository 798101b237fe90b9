package io.menucast.core.model;

import java.util.Locale;

public enum PublishTarget {
    ALL,
    USERS;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PublishTarget fromWire(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return "users".equalsIgnoreCase(value.trim()) ? USERS : ALL;
    }
}
