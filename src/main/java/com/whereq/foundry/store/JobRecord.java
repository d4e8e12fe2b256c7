package com.whereq.foundry.store;

import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.model.ProgressState;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * All state of one job. Owned by {@link JobRecordStore}; instances are only read or
 * changed inside the store's critical section.
 */
@Getter
public class JobRecord {

    private final String id;
    private final JobMetadata metadata;
    @Getter(AccessLevel.NONE)
    private final List<String> outputLog = new ArrayList<>();

    /**
     * Worker handle; null once the job is terminal
     */
    private Process process;

    private JobStatus status = JobStatus.RUNNING;
    private ProgressState progress;
    private String error;

    public JobRecord(String id, Process process, JobMetadata metadata, Instant now) {
        this.id = Objects.requireNonNull(id, "id");
        this.process = Objects.requireNonNull(process, "process");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.progress = ProgressState.initial(now);
    }

    public Instant getStartedAt() {
        return metadata.getCreatedAt();
    }

    public void appendOutput(String line) {
        outputLog.add(line);
    }

    /**
     * Copy of the last {@code limit} output lines, oldest first.
     */
    public List<String> outputTail(int limit) {
        int from = Math.max(0, outputLog.size() - limit);
        return List.copyOf(outputLog.subList(from, outputLog.size()));
    }

    /**
     * Replace the progress of a running job. Ignored once the job is terminal.
     */
    public void updateProgress(ProgressState next) {
        if (status == JobStatus.RUNNING && next != null) {
            this.progress = next;
        }
    }

    /**
     * Move the job to a terminal status. Transitions only go forward, so the first
     * caller wins and every later call is a no-op.
     *
     * @return true if this call performed the transition
     */
    public boolean finish(JobStatus terminal, String error, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (status.isTerminal()) {
            return false;
        }

        ProgressState.ProgressStateBuilder next = progress.toBuilder().completedAt(now);
        if (terminal == JobStatus.COMPLETED) {
            next.progress(100.0).stage("completed").estimated(false).lastUpdate(now);
        }

        this.status = terminal;
        this.error = error;
        this.progress = next.build();
        return true;
    }

    /**
     * Hand the worker handle to the caller and forget it.
     */
    public Process releaseProcess() {
        Process released = process;
        process = null;
        return released;
    }

    Long pid() {
        if (process == null) {
            return null;
        }
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return null;
        }
    }

    public JobSnapshot snapshot() {
        return JobSnapshot.builder()
            .id(id)
            .status(status)
            .progress(progress)
            .metadata(metadata)
            .error(error)
            .pid(pid())
            .processAttached(process != null)
            .outputLineCount(outputLog.size())
            .build();
    }
}
