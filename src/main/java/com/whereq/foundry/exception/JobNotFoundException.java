package com.whereq.foundry.exception;

/**
 * Exception thrown when a job id is known neither in memory nor in the cache
 */
public class JobNotFoundException extends FoundryException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
