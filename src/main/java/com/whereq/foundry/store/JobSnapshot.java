package com.whereq.foundry.store;

import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.model.ProgressSnapshot;
import com.whereq.foundry.model.ProgressState;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only copy of a {@link JobRecord}, safe to use outside the store lock.
 */
@Value
@Builder
public class JobSnapshot {
    String id;
    JobStatus status;
    ProgressState progress;
    JobMetadata metadata;
    String error;

    /**
     * Worker pid while the handle is held, else null
     */
    Long pid;

    boolean processAttached;

    int outputLineCount;

    public ProgressSnapshot toProgressSnapshot() {
        return ProgressSnapshot.of(id, status, progress, error);
    }
}
