package com.whereq.foundry.dto;

import com.whereq.foundry.model.CancelResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Outcome of the request
     */
    private CancelResult result;

    /**
     * Cancellation message
     */
    private String message;
}
