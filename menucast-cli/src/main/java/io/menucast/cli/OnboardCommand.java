package io.menucast.cli;

import io.menucast.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write config.json, create the upload folder and initialize the job database")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--reset", "--overwrite"}, description = "Replace an existing config.json with the defaults")
    boolean reset;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), reset);
            switch (result.action()) {
                case CREATED -> System.out.println("Config created: " + result.configPath());
                case RESET -> System.out.println("Config reset to defaults: " + result.configPath());
                case MERGED -> System.out.println("Config kept: " + result.configPath()
                    + (result.filledSections().isEmpty()
                        ? ""
                        : " (added defaults for " + String.join(", ", result.filledSections()) + ")"));
            }
            System.out.println("Schedules database: " + result.databasePath());
            System.out.println("Menu images folder: " + result.uploadFolder());
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
