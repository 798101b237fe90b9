package io.menucast.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Run the publish scheduler and the HTTP gateway until stopped")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Gateway port override (0 uses the configured port)", defaultValue = "0")
    int port;

    @Option(names = {"--no-scheduler"}, description = "Serve the gateway only, without the background scheduler")
    boolean noScheduler;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serveRunner().run(port, !noScheduler);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
