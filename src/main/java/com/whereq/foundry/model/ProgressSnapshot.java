package com.whereq.foundry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Serializable copy of a job's progress and status, as mirrored to the cache.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProgressSnapshot {
    private String jobId;
    private JobStatus status;
    private double progress;
    private String stage;
    private boolean estimated;
    private Instant lastUpdate;
    private Instant completedAt;
    private String error;

    public static ProgressSnapshot of(String jobId, JobStatus status, ProgressState state, String error) {
        return ProgressSnapshot.builder()
            .jobId(jobId)
            .status(status)
            .progress(state.getProgress())
            .stage(state.getStage())
            .estimated(state.isEstimated())
            .lastUpdate(state.getLastUpdate())
            .completedAt(state.getCompletedAt())
            .error(error)
            .build();
    }
}
