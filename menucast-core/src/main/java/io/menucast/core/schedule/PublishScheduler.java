package io.menucast.core.schedule;

import io.menucast.core.model.ScheduledJob;
import io.menucast.core.publish.JobExecutionPipeline;
import io.menucast.core.publish.PublishException;
import io.menucast.core.publish.TriggerSource;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background loop that checks for due jobs on a single daemon thread and runs them one after
 * another. Ticks fire at a fixed rate so that a slow run does not push later ticks past their
 * minute. Anything thrown inside a tick is logged and the next tick runs as usual.
 */
public final class PublishScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PublishScheduler.class);

    private final DueJobSelector selector;
    private final JobExecutionPipeline pipeline;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration interval;
    private final Duration initialDelay;
    private final Supplier<ScheduledExecutorService> executorFactory;
    private ScheduledExecutorService executor;

    public PublishScheduler(
        DueJobSelector selector,
        JobExecutionPipeline pipeline,
        Clock clock,
        ZoneId zone,
        Duration interval,
        Duration initialDelay
    ) {
        this(selector, pipeline, clock, zone, interval, initialDelay, PublishScheduler::newSchedulerThread);
    }

    PublishScheduler(
        DueJobSelector selector,
        JobExecutionPipeline pipeline,
        Clock clock,
        ZoneId zone,
        Duration interval,
        Duration initialDelay,
        Supplier<ScheduledExecutorService> executorFactory
    ) {
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.interval = interval;
        this.initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = executorFactory.get();
        executor.scheduleAtFixedRate(
            this::checkAndRunJobs,
            initialDelay.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        LOG.info("Scheduler started (zone {}, every {}s)", zone, interval.toSeconds());
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    /**
     * One tick: selects the due jobs and runs each of them. Returns how many jobs were run.
     */
    public int checkAndRunJobs() {
        EvaluationMoment moment = EvaluationMoment.at(clock, zone);
        List<ScheduledJob> due;
        try {
            due = selector.select(moment);
        } catch (Throwable e) {
            LOG.error("Failed to select due schedules at {} {}", moment.today(), moment.timeOfDay(), e);
            return 0;
        }
        if (due.isEmpty()) {
            LOG.debug("No schedules due at {} {}", moment.today(), moment.timeOfDay());
            return 0;
        }

        LOG.info("{} schedule(s) due at {} {}", due.size(), moment.today(), moment.timeOfDay());
        int ran = 0;
        for (ScheduledJob job : due) {
            try {
                pipeline.execute(job, TriggerSource.SCHEDULED);
            } catch (PublishException e) {
                LOG.debug("Schedule {} recorded as failed: {}", job.id(), e.getMessage());
            } catch (Throwable e) {
                LOG.error("Schedule {} aborted unexpectedly", job.id(), e);
            }
            ran++;
        }
        return ran;
    }

    private static ScheduledExecutorService newSchedulerThread() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "menucast-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        LOG.info("Scheduler stopped");
    }
}
