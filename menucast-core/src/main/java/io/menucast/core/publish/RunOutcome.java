package io.menucast.core.publish;

import io.menucast.core.model.RunStatus;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * What a successful pipeline run recorded on its job. {@code remoteMenuIds} lists the menus
 * created remotely in upload order. Failed runs surface as {@link PublishException} instead.
 */
public record RunOutcome(
    long jobId,
    TriggerSource source,
    RunStatus status,
    String message,
    List<String> remoteMenuIds,
    OffsetDateTime runAt
) {
    public RunOutcome {
        remoteMenuIds = remoteMenuIds == null ? List.of() : List.copyOf(remoteMenuIds);
    }

    public boolean succeeded() {
        return status == RunStatus.SUCCESS;
    }
}
