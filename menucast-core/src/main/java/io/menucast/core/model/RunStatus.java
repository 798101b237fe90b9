package io.menucast.core.model;

import java.util.Locale;

public enum RunStatus {
    SUCCESS,
    ERROR;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return "success".equalsIgnoreCase(value.trim()) ? SUCCESS : ERROR;
    }
}
