package com.whereq.foundry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to start a worker. The command line is built by the caller
 * and passed through untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LaunchRequest {
    /**
     * Full command line, executable first
     */
    private List<String> command;

    /**
     * Existing directory the worker runs in
     */
    private Path workingDirectory;

    /**
     * Input file the job was accepted for (optional)
     */
    private Path inputPath;

    /**
     * Directory the worker writes to; defaults to the working directory
     */
    private Path outputDirectory;

    /**
     * Launch parameters kept for reporting (optional)
     */
    private Map<String, String> parameters;
}
