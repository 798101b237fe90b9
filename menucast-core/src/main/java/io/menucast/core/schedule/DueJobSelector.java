package io.menucast.core.schedule;

import io.menucast.core.model.ScheduledJob;
import io.menucast.core.store.JobStore;
import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks the jobs that should run at a given moment. The store narrows by window, enabled flag
 * and exact time of day; recurrence and the once-per-day guard are applied here.
 */
public final class DueJobSelector {
    private final JobStore store;

    public DueJobSelector(JobStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public List<ScheduledJob> select(EvaluationMoment moment) throws IOException {
        List<ScheduledJob> due = new ArrayList<>();
        for (ScheduledJob job : store.listDue(moment.today(), moment.timeOfDay())) {
            if (matchesRecurrence(job, moment) && !ranToday(job, moment)) {
                due.add(job);
            }
        }
        return due;
    }

    static boolean matchesRecurrence(ScheduledJob job, EvaluationMoment moment) {
        return switch (job.repeatType()) {
            case DAILY -> true;
            case WEEKLY -> job.repeatWeekday() != null && job.repeatWeekday() == moment.weekday();
            case MONTHLY -> job.repeatDay() != null && job.repeatDay() == moment.dayOfMonth();
            case ONCE -> moment.today().equals(job.startDate());
        };
    }

    static boolean ranToday(ScheduledJob job, EvaluationMoment moment) {
        OffsetDateTime lastRunAt = job.lastRunAt();
        if (lastRunAt == null) {
            return false;
        }
        return lastRunAt.atZoneSameInstant(moment.zone()).toLocalDate().equals(moment.today());
    }
}
