package io.menucast.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".menucast", "config.json");
    }

    public static Path resolve(String rawPath, Path fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return fallback;
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path resolveDatabase(String rawPath) {
        return resolve(rawPath, Path.of(System.getProperty("user.home"), ".menucast", "menucast.db"));
    }

    public static Path resolveUploadFolder(String rawPath) {
        return resolve(rawPath, Path.of(System.getProperty("user.home"), ".menucast", "uploads"));
    }
}
