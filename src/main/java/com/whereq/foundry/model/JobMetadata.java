package com.whereq.foundry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Launch facts of a job. Written once at spawn time and mirrored to the cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobMetadata {
    /**
     * Input the worker was started for (the uploaded audio file)
     */
    private String inputPath;

    /**
     * Directory the worker writes its artifacts to
     */
    private String outputDirectory;

    /**
     * Directory the worker runs in
     */
    private String workingDirectory;

    /**
     * Command line the worker was started with
     */
    private List<String> command;

    /**
     * Launch parameters as given by the caller
     */
    private Map<String, String> parameters;

    /**
     * When the job was created
     */
    private Instant createdAt;
}
