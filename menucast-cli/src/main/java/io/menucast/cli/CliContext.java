package io.menucast.cli;

import io.menucast.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (port, schedulerEnabled) -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
