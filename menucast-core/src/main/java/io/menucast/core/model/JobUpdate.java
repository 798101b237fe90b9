package io.menucast.core.model;

import java.time.OffsetDateTime;

/**
 * Partial update of a scheduled job's run bookkeeping. Null components are left untouched.
 */
public record JobUpdate(
    Boolean enabled,
    OffsetDateTime lastRunAt,
    RunStatus lastRunStatus,
    String lastRunMessage
) {

    public static JobUpdate outcome(OffsetDateTime runAt, RunStatus status, String message) {
        return new JobUpdate(null, runAt, status, message);
    }

    public static JobUpdate disable() {
        return new JobUpdate(false, null, null, null);
    }

    public boolean isEmpty() {
        return enabled == null && lastRunAt == null && lastRunStatus == null && lastRunMessage == null;
    }
}
