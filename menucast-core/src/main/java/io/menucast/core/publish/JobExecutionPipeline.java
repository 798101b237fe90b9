package io.menucast.core.publish;

import io.menucast.core.image.AdaptiveImageEncoder;
import io.menucast.core.image.EncodedImage;
import io.menucast.core.line.LineRichMenuClient;
import io.menucast.core.line.RemoteRichMenu;
import io.menucast.core.model.Account;
import io.menucast.core.model.JobScope;
import io.menucast.core.model.JobUpdate;
import io.menucast.core.model.Project;
import io.menucast.core.model.PublishTarget;
import io.menucast.core.model.RepeatType;
import io.menucast.core.model.RichMenuDefinition;
import io.menucast.core.model.RunStatus;
import io.menucast.core.model.ScheduledJob;
import io.menucast.core.store.JobStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the rich menus of one scheduled job and records the result on the job.
 *
 * <p>Steps run strictly in order and the first failure aborts the job. Binding the menu to
 * individual users is the only step whose failures are skipped. Whatever happens, the outcome
 * is written back to the store and a {@code once} job is disabled afterwards.
 */
public final class JobExecutionPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(JobExecutionPipeline.class);
    static final int MAX_MESSAGE_LENGTH = 200;

    private final JobStore store;
    private final LineRichMenuClient client;
    private final AdaptiveImageEncoder encoder;
    private final RichMenuDescriptorFactory descriptors;
    private final Path uploadFolder;
    private final Clock clock;
    private final ZoneId zone;

    public JobExecutionPipeline(
        JobStore store,
        LineRichMenuClient client,
        AdaptiveImageEncoder encoder,
        Path uploadFolder,
        Clock clock,
        ZoneId zone
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.uploadFolder = Objects.requireNonNull(uploadFolder, "uploadFolder must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.descriptors = new RichMenuDescriptorFactory();
    }

    /**
     * Runs the job once. The outcome is recorded before this returns or throws.
     *
     * @throws PublishException when the run failed; the recorded message is the exception's
     *     message truncated to 200 characters
     */
    public RunOutcome execute(ScheduledJob job, TriggerSource source) throws PublishException {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(source, "source must not be null");
        LOG.info("Running schedule {} ({}, project {}, scope {})", job.id(), source, job.projectId(), job.scope());

        List<String> published;
        try {
            published = publish(job);
        } catch (PublishException e) {
            recordFailure(job, source, e);
            throw e;
        } catch (IOException | RuntimeException e) {
            PublishException failure = new PublishException(PublishErrorKind.UNEXPECTED, describe(e), e);
            recordFailure(job, source, failure);
            throw failure;
        } catch (Error e) {
            recordFailure(job, source, new PublishException(PublishErrorKind.UNEXPECTED, describe(e), e));
            throw e;
        }

        OffsetDateTime runAt = now();
        try {
            store.updateJob(job.id(), JobUpdate.outcome(runAt, RunStatus.SUCCESS, source.successMessage()));
            disableIfOnce(job);
        } catch (IOException e) {
            throw new PublishException(
                PublishErrorKind.UNEXPECTED,
                "Published but failed to record outcome: " + e.getMessage(),
                e
            );
        }
        LOG.info("Schedule {} published {} menu(s)", job.id(), published.size());
        return new RunOutcome(job.id(), source, RunStatus.SUCCESS, source.successMessage(), published, runAt);
    }

    private List<String> publish(ScheduledJob job) throws PublishException, IOException {
        Project project = store.findProject(job.projectId())
            .orElseThrow(() -> PublishException.notFound("Project " + job.projectId() + " not found"));
        Account account = store.findAccount(project.accountId())
            .orElseThrow(() -> PublishException.notFound("Account " + project.accountId() + " not found"));
        if (project.richMenus().isEmpty()) {
            throw PublishException.precondition("Project " + project.id() + " has no rich menus");
        }

        List<RichMenuDefinition> targets = selectMenus(job, project);
        String token = account.channelAccessToken();

        List<String> remoteIds = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            RichMenuDefinition menu = targets.get(i);
            String name = RichMenuDescriptorFactory.displayName(menu, i);
            Path image = resolveImage(menu, name);

            deleteSameName(token, name);
            String remoteId = client.createMenu(token, descriptors.build(menu, name));
            LOG.debug("Created rich menu {} for '{}'", remoteId, name);

            EncodedImage encoded = encoder.encode(image);
            LOG.info("({}/{}) Uploading {} ({} bytes, quality {})",
                i + 1, targets.size(), image.getFileName(), encoded.size(), encoded.quality());
            try {
                client.uploadContent(token, remoteId, encoded.bytes(), encoded.contentType());
            } catch (PublishException e) {
                throw new PublishException(
                    e.kind(),
                    e.getMessage() + " (rich menu " + remoteId + " left without image)",
                    e.upstreamStatus(),
                    e
                );
            }

            if (!menu.alias().isBlank()) {
                syncAlias(token, menu.alias(), remoteId);
            }
            store.updateRemoteMenuId(menu.id(), remoteId);
            remoteIds.add(remoteId);
        }

        assignDefault(job, token, remoteIds);
        linkUsers(job, token, remoteIds);
        return remoteIds;
    }

    private List<RichMenuDefinition> selectMenus(ScheduledJob job, Project project) throws PublishException {
        if (job.scope() != JobScope.SINGLE) {
            return project.richMenus();
        }
        int index = job.currentTabIndex();
        if (index < 0 || index >= project.richMenus().size()) {
            throw PublishException.precondition(
                "Tab index " + index + " out of range for " + project.richMenus().size() + " menu(s)"
            );
        }
        return List.of(project.richMenus().get(index));
    }

    private Path resolveImage(RichMenuDefinition menu, String name) throws PublishException {
        String imagePath = menu.imagePath();
        if (imagePath == null || imagePath.isBlank()) {
            throw PublishException.precondition("Menu '" + name + "' has no image");
        }
        Path path = Path.of(imagePath);
        Path resolved = path.isAbsolute() ? path : uploadFolder.resolve(path);
        if (!Files.isRegularFile(resolved)) {
            throw PublishException.precondition("Image for menu '" + name + "' does not exist: " + imagePath);
        }
        return resolved;
    }

    private void deleteSameName(String token, String name) throws PublishException {
        for (RemoteRichMenu remote : client.listMenus(token)) {
            if (name.equals(remote.name())) {
                LOG.debug("Deleting previous rich menu {} named '{}'", remote.richMenuId(), name);
                client.deleteMenu(token, remote.richMenuId());
            }
        }
    }

    private void syncAlias(String token, String aliasId, String remoteId) throws PublishException {
        try {
            client.updateAlias(token, aliasId, remoteId);
        } catch (PublishException e) {
            if (e.kind() != PublishErrorKind.UPSTREAM_REJECTED
                || (e.upstreamStatus() != 400 && e.upstreamStatus() != 404)) {
                throw e;
            }
            LOG.debug("Alias {} not updatable ({}), creating it", aliasId, e.upstreamStatus());
            client.createAlias(token, aliasId, remoteId);
        }
    }

    private void assignDefault(ScheduledJob job, String token, List<String> remoteIds) throws PublishException {
        int index = job.defaultMenuIndex();
        if (index >= 0 && index < remoteIds.size()) {
            client.setDefaultMenu(token, remoteIds.get(index));
        } else if (job.publishTarget() == PublishTarget.ALL && index < 0) {
            client.setDefaultMenu(token, remoteIds.get(0));
        }
    }

    private void linkUsers(ScheduledJob job, String token, List<String> remoteIds) {
        if (job.publishTarget() != PublishTarget.USERS || job.userIds().isEmpty()) {
            return;
        }
        String remoteId = remoteIds.get(0);
        for (String userId : job.userIds()) {
            try {
                client.linkMenuToUser(token, userId, remoteId);
            } catch (PublishException e) {
                LOG.warn("Failed to link rich menu {} to user {}: {}", remoteId, userId, e.getMessage());
            }
        }
    }

    private void recordFailure(ScheduledJob job, TriggerSource source, PublishException failure) {
        LOG.error("Schedule {} failed ({}, {}): {}", job.id(), source, failure.kind(), failure.getMessage());
        try {
            store.updateJob(job.id(), JobUpdate.outcome(now(), RunStatus.ERROR, truncate(failure.getMessage())));
            disableIfOnce(job);
        } catch (IOException e) {
            failure.addSuppressed(e);
            LOG.error("Failed to record outcome for schedule {}", job.id(), e);
        }
    }

    private void disableIfOnce(ScheduledJob job) throws IOException {
        if (job.repeatType() == RepeatType.ONCE) {
            store.updateJob(job.id(), JobUpdate.disable());
            LOG.info("Disabled one-time schedule {}", job.id());
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant(), zone);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
