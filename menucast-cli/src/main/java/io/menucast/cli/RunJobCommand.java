package io.menucast.cli;

import io.menucast.core.config.model.MenucastConfig;
import io.menucast.core.publish.PublishException;
import io.menucast.core.publish.RunOutcome;
import io.menucast.core.runtime.PublishingRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "run-job", description = "Publish one schedule immediately, ignoring its time and recurrence")
public final class RunJobCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", paramLabel = "SCHEDULE_ID", description = "Id of the schedule to run")
    long jobId;

    public RunJobCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MenucastConfig config = context.configService().load(context.configPath());
            try (PublishingRuntime runtime = PublishingRuntime.open(config)) {
                RunOutcome outcome = runtime.manualTrigger().runNow(jobId);
                System.out.println("Schedule " + jobId + ": " + outcome.message());
                for (String remoteId : outcome.remoteMenuIds()) {
                    System.out.println("Published rich menu: " + remoteId);
                }
                return 0;
            }
        } catch (PublishException e) {
            System.err.println("Schedule " + jobId + " failed (" + e.kind() + "): " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Run-job command failed: " + e.getMessage());
            return 1;
        }
    }
}
