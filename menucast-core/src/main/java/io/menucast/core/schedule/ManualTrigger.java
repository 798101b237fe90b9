package io.menucast.core.schedule;

import io.menucast.core.model.ScheduledJob;
import io.menucast.core.publish.JobExecutionPipeline;
import io.menucast.core.publish.PublishErrorKind;
import io.menucast.core.publish.PublishException;
import io.menucast.core.publish.RunOutcome;
import io.menucast.core.publish.TriggerSource;
import io.menucast.core.store.JobStore;
import java.io.IOException;
import java.util.Objects;

/**
 * Runs one job immediately on the caller's thread, ignoring its window, time and recurrence.
 */
public final class ManualTrigger {
    private final JobStore store;
    private final JobExecutionPipeline pipeline;

    public ManualTrigger(JobStore store, JobExecutionPipeline pipeline) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    public RunOutcome runNow(long jobId) throws PublishException {
        ScheduledJob job;
        try {
            job = store.findJob(jobId)
                .orElseThrow(() -> PublishException.notFound("Schedule " + jobId + " not found"));
        } catch (IOException e) {
            throw new PublishException(PublishErrorKind.UNEXPECTED, "Failed to load schedule " + jobId, e);
        }
        return pipeline.execute(job, TriggerSource.MANUAL);
    }
}
