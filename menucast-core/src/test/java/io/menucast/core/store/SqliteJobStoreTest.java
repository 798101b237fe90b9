package io.menucast.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.menucast.core.model.JobScope;
import io.menucast.core.model.JobUpdate;
import io.menucast.core.model.MenuArea;
import io.menucast.core.model.MenuBounds;
import io.menucast.core.model.Project;
import io.menucast.core.model.PublishTarget;
import io.menucast.core.model.RepeatType;
import io.menucast.core.model.RichMenuDefinition;
import io.menucast.core.model.RunStatus;
import io.menucast.core.model.ScheduledJob;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteJobStoreTest {
    private static final LocalDate JAN_1 = LocalDate.of(2026, 1, 1);
    private static final LocalDate JAN_31 = LocalDate.of(2026, 1, 31);

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistJobWithAllFields() throws Exception {
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("db/menucast.db"));
        long projectId = seedProject(store);

        long jobId = store.createJob(ScheduledJob.builder(projectId)
            .scope(JobScope.SINGLE)
            .currentTabIndex(1)
            .publishTarget(PublishTarget.USERS)
            .userIds(List.of("u1", "u2"))
            .defaultMenuIndex(0)
            .window(JAN_1, JAN_31)
            .runTime("09:00")
            .weekly(2)
            .build());

        ScheduledJob job = store.findJob(jobId).orElseThrow();
        assertThat(job.projectId()).isEqualTo(projectId);
        assertThat(job.scope()).isEqualTo(JobScope.SINGLE);
        assertThat(job.currentTabIndex()).isEqualTo(1);
        assertThat(job.publishTarget()).isEqualTo(PublishTarget.USERS);
        assertThat(job.userIds()).containsExactly("u1", "u2");
        assertThat(job.defaultMenuIndex()).isZero();
        assertThat(job.startDate()).isEqualTo(JAN_1);
        assertThat(job.endDate()).isEqualTo(JAN_31);
        assertThat(job.runTime()).isEqualTo("09:00");
        assertThat(job.repeatType()).isEqualTo(RepeatType.WEEKLY);
        assertThat(job.repeatWeekday()).isEqualTo(2);
        assertThat(job.repeatDay()).isNull();
        assertThat(job.enabled()).isTrue();
        assertThat(job.lastRunAt()).isNull();
    }

    @Test
    void listDueShouldFilterByWindowTimeAndEnabledInIdOrder() throws Exception {
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("menucast.db"));
        long projectId = seedProject(store);
        long first = store.createJob(daily(projectId, "09:00"));
        long second = store.createJob(daily(projectId, "09:00"));
        store.createJob(daily(projectId, "09:01"));
        long disabled = store.createJob(daily(projectId, "09:00"));
        store.updateJob(disabled, JobUpdate.disable());
        store.createJob(ScheduledJob.builder(projectId)
            .window(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 28))
            .runTime("09:00")
            .build());

        List<ScheduledJob> due = store.listDue(LocalDate.of(2026, 1, 15), "09:00");

        assertThat(due).extracting(ScheduledJob::id).containsExactly(first, second);
        assertThat(store.listDue(JAN_31, "09:00")).hasSize(2);
        assertThat(store.listDue(LocalDate.of(2026, 2, 1), "09:01")).isEmpty();
    }

    @Test
    void listDueShouldSkipUnreadableRowsAndKeepTheRest() throws Exception {
        Path dbPath = tempDir.resolve("menucast.db");
        SqliteJobStore store = new SqliteJobStore(dbPath);
        long projectId = seedProject(store);
        long hourly = store.createJob(daily(projectId, "09:00"));
        long good = store.createJob(daily(projectId, "09:00"));
        long badTimestamp = store.createJob(daily(projectId, "09:00"));
        overwrite(dbPath, "UPDATE scheduled_jobs SET repeat_type = 'hourly' WHERE id = ?", hourly);
        overwrite(dbPath, "UPDATE scheduled_jobs SET last_run_at = 'garbage' WHERE id = ?", badTimestamp);

        List<ScheduledJob> due = store.listDue(LocalDate.of(2026, 1, 15), "09:00");

        assertThat(due).extracting(ScheduledJob::id).containsExactly(good);
        assertThat(store.listJobsByProject(projectId)).extracting(ScheduledJob::id).containsExactly(good);
    }

    @Test
    void listJobsByProjectShouldReturnNewestFirstForThatProjectOnly() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2026-01-10T00:00:00Z"), ZoneOffset.UTC);
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("menucast.db"), clock);
        long projectId = seedProject(store);
        long other = seedProject(store);
        long older = store.createJob(daily(projectId, "09:00"));
        long newer = store.createJob(daily(projectId, "18:00"));
        store.createJob(daily(other, "09:00"));

        assertThat(store.listJobsByProject(projectId)).extracting(ScheduledJob::id).containsExactly(newer, older);
        assertThat(store.listJobsByProject(999)).isEmpty();
    }

    @Test
    void updateJobShouldOnlyTouchProvidedFields() throws Exception {
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("menucast.db"));
        long jobId = store.createJob(daily(seedProject(store), "09:00"));
        OffsetDateTime runAt = OffsetDateTime.of(2026, 1, 15, 9, 0, 3, 0, ZoneOffset.ofHours(8));

        store.updateJob(jobId, JobUpdate.outcome(runAt, RunStatus.ERROR, "boom"));
        store.updateJob(jobId, JobUpdate.disable());

        ScheduledJob job = store.findJob(jobId).orElseThrow();
        assertThat(job.enabled()).isFalse();
        assertThat(job.lastRunAt()).isEqualTo(runAt);
        assertThat(job.lastRunStatus()).isEqualTo(RunStatus.ERROR);
        assertThat(job.lastRunMessage()).isEqualTo("boom");
    }

    @Test
    void shouldLoadProjectMenusInCreationOrderWithAreas() throws Exception {
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("menucast.db"));
        long accountId = store.createAccount("Shop", "token-1");
        long projectId = store.createProject(accountId, "Spring");
        long firstMenu = store.createRichMenu(projectId, RichMenuDefinition.draft(
            "Main",
            "main-alias",
            List.of(new MenuArea(new MenuBounds(0, 0, 1250, 843), Map.of("type", "uri", "uri", "https://example.com"))),
            "main.png"
        ));
        store.createRichMenu(projectId, RichMenuDefinition.draft("Second", "", List.of(), "second.png"));

        store.updateRemoteMenuId(firstMenu, "richmenu-abc");

        Project project = store.findProject(projectId).orElseThrow();
        assertThat(project.accountId()).isEqualTo(accountId);
        assertThat(project.richMenus()).extracting(RichMenuDefinition::name).containsExactly("Main", "Second");
        RichMenuDefinition main = project.richMenus().get(0);
        assertThat(main.remoteMenuId()).isEqualTo("richmenu-abc");
        assertThat(main.alias()).isEqualTo("main-alias");
        assertThat(main.width()).isEqualTo(2500);
        assertThat(main.height()).isEqualTo(1686);
        assertThat(main.areas()).hasSize(1);
        assertThat(main.areas().get(0).bounds()).isEqualTo(new MenuBounds(0, 0, 1250, 843));
        assertThat(main.areas().get(0).action()).containsEntry("uri", "https://example.com");
        assertThat(store.findAccount(accountId).orElseThrow().channelAccessToken()).isEqualTo("token-1");
    }

    @Test
    void deletingProjectShouldCascadeToJobs() throws Exception {
        SqliteJobStore store = new SqliteJobStore(tempDir.resolve("menucast.db"));
        long projectId = seedProject(store);
        long jobId = store.createJob(daily(projectId, "09:00"));

        store.deleteProject(projectId);

        assertThat(store.findProject(projectId)).isEmpty();
        assertThat(store.findJob(jobId)).isEmpty();
        assertThat(store.deleteJob(jobId)).isFalse();
    }

    @Test
    void shouldReadNaiveTimestampsAsUtc() {
        assertThat(SqliteJobStore.parseRunAt("2026-01-15T09:00:00"))
            .isEqualTo(LocalDateTime.of(2026, 1, 15, 9, 0).atOffset(ZoneOffset.UTC));
        assertThat(SqliteJobStore.parseRunAt(null)).isNull();
    }

    private static void overwrite(Path dbPath, String sql, long jobId) throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, jobId);
            statement.executeUpdate();
        }
    }

    private long seedProject(SqliteJobStore store) throws Exception {
        long accountId = store.createAccount("Shop", "token");
        return store.createProject(accountId, "Project");
    }

    private ScheduledJob daily(long projectId, String runTime) {
        return ScheduledJob.builder(projectId).window(JAN_1, JAN_31).runTime(runTime).daily().build();
    }
}
