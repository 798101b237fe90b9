package io.menucast.core.runtime;

import io.menucast.core.api.GatewayServer;
import io.menucast.core.config.ConfigPaths;
import io.menucast.core.config.model.MenucastConfig;
import io.menucast.core.config.model.SchedulerConfig;
import io.menucast.core.image.AdaptiveImageEncoder;
import io.menucast.core.line.LineRichMenuClient;
import io.menucast.core.publish.JobExecutionPipeline;
import io.menucast.core.schedule.DueJobSelector;
import io.menucast.core.schedule.ManualTrigger;
import io.menucast.core.schedule.PublishScheduler;
import io.menucast.core.store.SqliteJobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * The publishing engine assembled from one configuration: store, client, encoder, pipeline,
 * scheduler and manual trigger share the same clock and zone.
 */
public final class PublishingRuntime implements AutoCloseable {
    private final MenucastConfig config;
    private final SqliteJobStore store;
    private final ManualTrigger manualTrigger;
    private final PublishScheduler scheduler;

    private PublishingRuntime(MenucastConfig config, Clock clock) throws IOException {
        this.config = config;
        SchedulerConfig schedulerConfig = config.scheduler();
        ZoneId zone = schedulerConfig.zoneId();

        this.store = new SqliteJobStore(ConfigPaths.resolveDatabase(config.storage().databasePath()), clock);
        JobExecutionPipeline pipeline = new JobExecutionPipeline(
            store,
            new LineRichMenuClient(config.line()),
            new AdaptiveImageEncoder(config.image()),
            ConfigPaths.resolveUploadFolder(config.storage().uploadFolder()),
            clock,
            zone
        );
        this.manualTrigger = new ManualTrigger(store, pipeline);
        this.scheduler = new PublishScheduler(
            new DueJobSelector(store),
            pipeline,
            clock,
            zone,
            Duration.ofSeconds(Math.max(1, schedulerConfig.intervalSeconds())),
            Duration.ofSeconds(Math.max(0, schedulerConfig.initialDelaySeconds()))
        );
    }

    public static PublishingRuntime open(MenucastConfig config) throws IOException {
        return open(config, Clock.systemUTC());
    }

    public static PublishingRuntime open(MenucastConfig config, Clock clock) throws IOException {
        return new PublishingRuntime(config, clock);
    }

    public SqliteJobStore store() {
        return store;
    }

    public ManualTrigger manualTrigger() {
        return manualTrigger;
    }

    public PublishScheduler scheduler() {
        return scheduler;
    }

    public GatewayServer newGateway(int portOverride) {
        int port = portOverride > 0 ? portOverride : config.gateway().port();
        return new GatewayServer(port, config.gateway().host(), store, manualTrigger);
    }

    @Override
    public void close() {
        scheduler.close();
    }
}
