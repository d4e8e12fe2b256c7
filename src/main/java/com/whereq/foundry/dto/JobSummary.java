package com.whereq.foundry.dto;

import com.whereq.foundry.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of the job listing
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSummary {
    private String jobId;
    private JobStatus status;
    private double progress;
    private String stage;
    private String inputPath;
    private Instant createdAt;

    /**
     * Worker pid while it is attached
     */
    private Long pid;
}
