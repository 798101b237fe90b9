package io.menucast.cli;

import io.menucast.core.config.ConfigPaths;
import io.menucast.core.config.model.MenucastConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and storage status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MenucastConfig config = context.configService().load(context.configPath());
            Path database = ConfigPaths.resolveDatabase(config.storage().databasePath());
            Path uploads = ConfigPaths.resolveUploadFolder(config.storage().uploadFolder());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + database + (Files.exists(database) ? "" : " (missing)"));
            System.out.println("Upload folder: " + uploads + (Files.isDirectory(uploads) ? "" : " (missing)"));
            System.out.println("Scheduler: " + (config.scheduler().enabled() ? "enabled" : "disabled")
                + ", zone " + config.scheduler().zoneId()
                + ", every " + config.scheduler().intervalSeconds() + "s");
            System.out.println("LINE API: " + config.line().apiBase() + " (data " + config.line().dataApiBase() + ")");
            System.out.println("Gateway: " + config.gateway().host() + ":" + config.gateway().port());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
