package com.whereq.foundry.dto;

import com.whereq.foundry.model.ProgressSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic view of a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDebugResponse {
    private String jobId;

    /**
     * Whether the job is held in memory by this process
     */
    private boolean active;

    private ProgressSnapshot progress;

    /**
     * Last output lines, oldest first
     */
    private List<String> recentOutput;

    private int totalOutputLines;

    private Long elapsedSeconds;

    /**
     * Which cache mirrors exist, keyed progress/metadata/files
     */
    private Map<String, Boolean> cache;
}
