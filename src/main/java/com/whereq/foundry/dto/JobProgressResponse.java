package com.whereq.foundry.dto;

import com.whereq.foundry.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job progress query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobProgressResponse {
    private String jobId;
    private double progress;
    private String stage;

    /**
     * True when the value was inferred rather than read from the worker's output
     */
    private boolean estimated;

    private Instant lastUpdate;
    private JobStatus status;
}
