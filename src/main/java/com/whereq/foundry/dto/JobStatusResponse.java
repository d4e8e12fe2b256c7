package com.whereq.foundry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.model.OutputFile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Current status
     */
    private JobStatus status;

    /**
     * Human readable summary of the status
     */
    private String message;

    /**
     * Last known progress, 0..100
     */
    private double progress;

    /**
     * Last known stage label
     */
    private String stage;

    /**
     * Files produced by the worker (only when completed)
     */
    private List<OutputFile> outputFiles;

    /**
     * Error message (if failed)
     */
    private String error;
}
