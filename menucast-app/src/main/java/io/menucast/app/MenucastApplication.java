package io.menucast.app;

import io.menucast.cli.CliContext;
import io.menucast.cli.MenucastCliCommand;
import io.menucast.cli.OnboardCommand;
import io.menucast.cli.RunJobCommand;
import io.menucast.cli.ServeCommand;
import io.menucast.cli.StatusCommand;
import io.menucast.core.api.GatewayServer;
import io.menucast.core.config.ConfigPaths;
import io.menucast.core.config.ConfigService;
import io.menucast.core.config.model.MenucastConfig;
import io.menucast.core.runtime.PublishingRuntime;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MenucastApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MenucastApplication.class);

    private MenucastApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            (port, schedulerEnabled) -> runServer(configService, configPath, port, schedulerEnabled)
        );

        CommandLine commandLine = new CommandLine(new MenucastCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("run-job", new RunJobCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(
        ConfigService configService,
        Path configPath,
        int port,
        boolean schedulerEnabled
    ) throws Exception {
        MenucastConfig config = configService.load(configPath);
        CountDownLatch shutdown = new CountDownLatch(1);
        try (
            PublishingRuntime runtime = PublishingRuntime.open(config);
            GatewayServer server = runtime.newGateway(port)
        ) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            if (schedulerEnabled && config.scheduler().enabled()) {
                runtime.scheduler().start();
            } else {
                LOG.info("Background scheduler disabled");
            }
            System.out.println("Gateway started on http://127.0.0.1:" + server.port());
            System.out.println("Endpoints: GET /healthz, GET /schedules/{id}, POST /schedules/{id}/run-now");
            shutdown.await();
        }
        return 0;
    }
}
