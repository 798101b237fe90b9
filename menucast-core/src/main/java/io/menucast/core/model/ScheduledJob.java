package io.menucast.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * A timed publish of one project's rich menus.
 *
 * <p>{@code repeatWeekday} uses 0 for Monday through 6 for Sunday; {@code repeatDay} is a
 * day of month. Both are null unless the matching {@link RepeatType} is used.
 */
public record ScheduledJob(
    long id,
    long projectId,
    JobScope scope,
    int currentTabIndex,
    PublishTarget publishTarget,
    List<String> userIds,
    int defaultMenuIndex,
    LocalDate startDate,
    LocalDate endDate,
    String runTime,
    RepeatType repeatType,
    Integer repeatWeekday,
    Integer repeatDay,
    boolean enabled,
    OffsetDateTime lastRunAt,
    RunStatus lastRunStatus,
    String lastRunMessage,
    Instant createdAt,
    Instant updatedAt
) {
    public ScheduledJob {
        scope = scope == null ? JobScope.ALL : scope;
        publishTarget = publishTarget == null ? PublishTarget.ALL : publishTarget;
        userIds = userIds == null ? List.of() : List.copyOf(userIds);
        repeatType = repeatType == null ? RepeatType.DAILY : repeatType;
        runTime = runTime == null || runTime.isBlank() ? "00:00" : runTime.trim();
    }

    public static Builder builder(long projectId) {
        return new Builder(projectId);
    }

    public static final class Builder {
        private final long projectId;
        private JobScope scope = JobScope.ALL;
        private int currentTabIndex;
        private PublishTarget publishTarget = PublishTarget.ALL;
        private List<String> userIds = List.of();
        private int defaultMenuIndex = -1;
        private LocalDate startDate;
        private LocalDate endDate;
        private String runTime = "00:00";
        private RepeatType repeatType = RepeatType.DAILY;
        private Integer repeatWeekday;
        private Integer repeatDay;

        private Builder(long projectId) {
            this.projectId = projectId;
        }

        public Builder scope(JobScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder currentTabIndex(int currentTabIndex) {
            this.currentTabIndex = currentTabIndex;
            return this;
        }

        public Builder publishTarget(PublishTarget publishTarget) {
            this.publishTarget = publishTarget;
            return this;
        }

        public Builder userIds(List<String> userIds) {
            this.userIds = userIds;
            return this;
        }

        public Builder defaultMenuIndex(int defaultMenuIndex) {
            this.defaultMenuIndex = defaultMenuIndex;
            return this;
        }

        public Builder window(LocalDate startDate, LocalDate endDate) {
            this.startDate = startDate;
            this.endDate = endDate;
            return this;
        }

        public Builder runTime(String runTime) {
            this.runTime = runTime;
            return this;
        }

        public Builder daily() {
            this.repeatType = RepeatType.DAILY;
            return this;
        }

        public Builder weekly(int weekday) {
            this.repeatType = RepeatType.WEEKLY;
            this.repeatWeekday = weekday;
            return this;
        }

        public Builder monthly(int dayOfMonth) {
            this.repeatType = RepeatType.MONTHLY;
            this.repeatDay = dayOfMonth;
            return this;
        }

        public Builder once() {
            this.repeatType = RepeatType.ONCE;
            return this;
        }

        public ScheduledJob build() {
            return new ScheduledJob(
                0,
                projectId,
                scope,
                currentTabIndex,
                publishTarget,
                userIds,
                defaultMenuIndex,
                startDate,
                endDate,
                runTime,
                repeatType,
                repeatWeekday,
                repeatDay,
                true,
                null,
                null,
                null,
                null,
                null
            );
        }
    }
}
