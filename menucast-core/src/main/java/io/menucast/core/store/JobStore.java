package io.menucast.core.store;

import io.menucast.core.model.Account;
import io.menucast.core.model.JobUpdate;
import io.menucast.core.model.Project;
import io.menucast.core.model.ScheduledJob;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence used by the publishing engine. Every update is an independent write; callers
 * must not assume two updates are applied atomically.
 */
public interface JobStore {

    /**
     * Enabled jobs whose date window contains {@code today} and whose run time equals
     * {@code timeOfDay} ({@code HH:mm}). Recurrence rules are not applied here.
     */
    List<ScheduledJob> listDue(LocalDate today, String timeOfDay) throws IOException;

    Optional<ScheduledJob> findJob(long jobId) throws IOException;

    /**
     * All jobs of a project, newest first.
     */
    List<ScheduledJob> listJobsByProject(long projectId) throws IOException;

    void updateJob(long jobId, JobUpdate update) throws IOException;

    /**
     * The project with its menu definitions in creation order.
     */
    Optional<Project> findProject(long projectId) throws IOException;

    Optional<Account> findAccount(long accountId) throws IOException;

    void updateRemoteMenuId(long menuId, String remoteMenuId) throws IOException;
}
