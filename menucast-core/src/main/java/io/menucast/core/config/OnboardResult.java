package io.menucast.core.config;

import java.nio.file.Path;
import java.util.List;

/**
 * What {@code onboard} did. {@code filledSections} lists the top-level config sections that
 * were written from defaults because the file did not have them.
 */
public record OnboardResult(
    ConfigAction action,
    Path configPath,
    Path databasePath,
    Path uploadFolder,
    List<String> filledSections
) {

    public OnboardResult {
        filledSections = filledSections == null ? List.of() : List.copyOf(filledSections);
    }

    public enum ConfigAction {
        CREATED,
        RESET,
        MERGED
    }
}
