package com.whereq.foundry.service;

import com.whereq.foundry.cache.JobCache;
import com.whereq.foundry.config.FoundryProperties;
import com.whereq.foundry.exception.LaunchException;
import com.whereq.foundry.executor.ProcessLauncher;
import com.whereq.foundry.model.CancelResult;
import com.whereq.foundry.model.JobEvent;
import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.model.LaunchRequest;
import com.whereq.foundry.model.ProgressSnapshot;
import com.whereq.foundry.model.ProgressState;
import com.whereq.foundry.progress.ProgressEstimator;
import com.whereq.foundry.store.JobRecord;
import com.whereq.foundry.store.JobRecordStore;
import com.whereq.foundry.store.JobSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts worker processes and follows them to the end.
 *
 * <p>Every job gets one collector thread. The collector is the only reader of the
 * worker's output: it appends each line to the job's log, feeds it to the
 * {@link ProgressEstimator}, publishes it on the job's event channel and, when the
 * stream ends, settles the job's terminal status from the exit code. Request threads
 * never read worker output and never wait on it.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobSupervisor {

    public static final String MONITORING_ERROR = "Monitoring error";

    private final JobRecordStore store;
    private final ProcessLauncher processLauncher;
    private final ProgressEstimator estimator;
    private final JobCache jobCache;
    private final JobEventStreamer eventStreamer;
    private final Clock clock;
    private final Duration gracePeriod;

    private final ExecutorService collectors;
    private final Set<String> activeCollectors = ConcurrentHashMap.newKeySet();

    private final Counter startedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter cancelledCounter;

    @Autowired
    public JobSupervisor(JobRecordStore store,
                         ProcessLauncher processLauncher,
                         ProgressEstimator estimator,
                         JobCache jobCache,
                         JobEventStreamer eventStreamer,
                         FoundryProperties properties,
                         Clock clock,
                         MeterRegistry meterRegistry) {
        this.store = store;
        this.processLauncher = processLauncher;
        this.estimator = estimator;
        this.jobCache = jobCache;
        this.eventStreamer = eventStreamer;
        this.clock = clock;
        this.gracePeriod = properties.getWorker().getGracePeriod();

        String threadPrefix = properties.getWorker().getCollectorThreadPrefix();
        AtomicInteger threadCount = new AtomicInteger();
        this.collectors = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, threadPrefix + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        startedCounter = Counter.builder("foundry.jobs.started")
            .description("Number of worker processes started")
            .register(meterRegistry);

        completedCounter = Counter.builder("foundry.jobs.completed")
            .description("Number of jobs whose worker exited with code 0")
            .register(meterRegistry);

        failedCounter = Counter.builder("foundry.jobs.failed")
            .description("Number of jobs that failed or could not be monitored")
            .register(meterRegistry);

        cancelledCounter = Counter.builder("foundry.jobs.cancelled")
            .description("Number of jobs cancelled by a caller")
            .register(meterRegistry);

        Gauge.builder("foundry.jobs.running", this, JobSupervisor::runningCount)
            .description("Number of jobs with a live worker")
            .register(meterRegistry);
    }

    /**
     * Start a worker in a directory, with no further metadata.
     *
     * @see #spawn(LaunchRequest)
     */
    public String spawn(List<String> command, Path workingDirectory) {
        return spawn(LaunchRequest.builder()
            .command(command)
            .workingDirectory(workingDirectory)
            .build());
    }

    /**
     * Start a worker and begin collecting its output.
     *
     * @param request command line and launch facts
     * @return id of the new job
     * @throws LaunchException if the worker could not be started; no job is created
     */
    public String spawn(LaunchRequest request) {
        validate(request);

        List<String> command = List.copyOf(request.getCommand());
        Path workingDirectory = request.getWorkingDirectory();

        Process process;
        try {
            process = processLauncher.launch(command, workingDirectory);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to start worker {}: {}", command.get(0), e.getMessage());
            throw new LaunchException("Failed to start worker '" + command.get(0) + "': " + e.getMessage(), e);
        }

        String jobId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        JobMetadata metadata = JobMetadata.builder()
            .inputPath(request.getInputPath() != null ? request.getInputPath().toString() : null)
            .outputDirectory(Optional.ofNullable(request.getOutputDirectory()).orElse(workingDirectory).toString())
            .workingDirectory(workingDirectory.toString())
            .command(command)
            .parameters(request.getParameters() != null ? Map.copyOf(request.getParameters()) : Map.of())
            .createdAt(now)
            .build();

        JobRecord record = new JobRecord(jobId, process, metadata, now);
        ProgressState initial = record.getProgress();

        eventStreamer.open(jobId);
        store.register(record);
        activeCollectors.add(jobId);
        mirror(jobId, Mono.when(
            jobCache.mirrorMetadata(jobId, metadata),
            jobCache.mirrorProgress(ProgressSnapshot.of(jobId, JobStatus.RUNNING, initial, null))));

        try {
            collectors.execute(() -> collect(jobId, process));
        } catch (RejectedExecutionException e) {
            activeCollectors.remove(jobId);
            store.remove(jobId);
            eventStreamer.close(jobId);
            jobCache.evict(jobId).subscribe();
            process.destroyForcibly();
            throw new LaunchException("Supervisor is shutting down", e);
        }

        startedCounter.increment();

        log.info("Job {} started: {}", jobId, String.join(" ", command));
        return jobId;
    }

    /**
     * Cancel a running job: graceful signal first, forced kill after the grace period.
     *
     * @param jobId job identifier
     * @return what happened; a terminal job is left untouched
     */
    public CancelResult cancel(String jobId) {
        Instant now = clock.instant();

        Optional<CancelAttempt> attempt = store.update(jobId, record -> {
            if (!record.finish(JobStatus.CANCELLED, null, now)) {
                return CancelAttempt.finished(record.getStatus());
            }
            return CancelAttempt.accepted(record.releaseProcess(), record.snapshot());
        });

        if (attempt.isEmpty()) {
            log.info("Cancel requested for unknown job {}", jobId);
            return CancelResult.NOT_FOUND;
        }
        if (!attempt.get().isAccepted()) {
            log.info("Cancel requested for job {} which is already {}", jobId, attempt.get().getStatus());
            return CancelResult.ALREADY_FINISHED;
        }

        cancelledCounter.increment();
        mirrorProgress(attempt.get().getSnapshot());

        boolean graceful = terminate(jobId, attempt.get().getProcess());
        log.info("Job {} cancelled{}", jobId, graceful ? "" : " (worker killed)");
        return graceful ? CancelResult.CANCELLED : CancelResult.KILLED;
    }

    /**
     * Forget a job entirely, killing its worker if it is still alive. Deleting an
     * unknown job is a no-op.
     */
    public void delete(String jobId) {
        Optional<JobRecord> removed = store.remove(jobId);

        removed.map(JobRecord::releaseProcess)
            .filter(Process::isAlive)
            .ifPresent(process -> {
                log.info("Killing worker of deleted job {}", jobId);
                process.destroyForcibly();
            });

        eventStreamer.close(jobId);
        jobCache.evict(jobId).subscribe();

        if (removed.isPresent()) {
            log.info("Deleted job {}", jobId);
        } else {
            log.debug("Delete of unknown job {} ignored", jobId);
        }
    }

    /**
     * Settle running jobs whose worker has exited but whose collector is gone.
     * Called by the janitor; a live collector always settles its own job.
     *
     * @return ids of the jobs settled by this call
     */
    public List<String> settleOrphans() {
        Instant now = clock.instant();

        List<JobSnapshot> settled = store.sweep(record -> {
            Process process = record.getProcess();
            if (record.getStatus() != JobStatus.RUNNING || process == null
                    || process.isAlive() || activeCollectors.contains(record.getId())) {
                return null;
            }
            int exitCode = process.exitValue();
            if (exitCode == 0) {
                record.finish(JobStatus.COMPLETED, null, now);
            } else {
                record.finish(JobStatus.FAILED, workerFailure(exitCode), now);
            }
            record.releaseProcess();
            return record.snapshot();
        });

        for (JobSnapshot snapshot : settled) {
            log.warn("Job {} settled by sweep as {}", snapshot.getId(), snapshot.getStatus());
            count(snapshot.getStatus());
            mirrorProgress(snapshot);
            eventStreamer.complete(snapshot.getId(), terminalEvent(snapshot, now));
        }
        return settled.stream().map(JobSnapshot::getId).toList();
    }

    public int runningCount() {
        return store.sweep(record -> record.getStatus() == JobStatus.RUNNING ? record.getId() : null).size();
    }

    /**
     * Ask every live worker to stop when the application shuts down.
     */
    @PreDestroy
    public void shutdown() {
        List<Process> live = store.sweep(record -> {
            Process process = record.getProcess();
            return process != null && process.isAlive() ? process : null;
        });

        if (!live.isEmpty()) {
            log.info("Terminating {} running workers", live.size());
        }
        live.forEach(Process::destroy);

        collectors.shutdown();
        try {
            if (!collectors.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Collectors still running after {}", gracePeriod);
                collectors.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            collectors.shutdownNow();
        }
    }

    /**
     * Drain one worker's output until it closes, then settle the job.
     */
    void collect(String jobId, Process process) {
        Integer exitCode = null;
        boolean monitoringFailed = false;

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                onLine(jobId, line);
            }
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Collector of job {} interrupted", jobId);
            monitoringFailed = true;
        } catch (Exception e) {
            log.error("Error monitoring output of job {}", jobId, e);
            monitoringFailed = true;
        }

        try {
            settle(jobId, process, exitCode, monitoringFailed);
        } finally {
            activeCollectors.remove(jobId);
        }
    }

    private void onLine(String jobId, String line) {
        log.debug("Job {} output: {}", jobId, line);
        Instant now = clock.instant();

        Optional<LineOutcome> outcome = store.update(jobId, record -> {
            record.appendOutput(line);
            ProgressState prior = record.getProgress();
            if (record.getStatus() == JobStatus.RUNNING) {
                record.updateProgress(estimator.estimate(line, prior, record.getStartedAt(), now));
            }
            boolean changed = record.getProgress() != prior;
            return new LineOutcome(changed, record.snapshot());
        });

        if (outcome.isEmpty()) {
            // deleted while running
            return;
        }

        JobSnapshot snapshot = outcome.get().getSnapshot();
        if (outcome.get().isChanged()) {
            mirrorProgress(snapshot);
        }
        eventStreamer.publish(jobId, JobEvent.output(line, snapshot.getProgress().getProgress(), now));
    }

    private void settle(String jobId, Process process, Integer exitCode, boolean monitoringFailed) {
        Instant now = clock.instant();

        JobStatus target;
        String error;
        if (monitoringFailed) {
            target = JobStatus.FAILED;
            error = MONITORING_ERROR;
        } else if (exitCode == 0) {
            target = JobStatus.COMPLETED;
            error = null;
        } else {
            target = JobStatus.FAILED;
            error = workerFailure(exitCode);
        }

        Optional<LineOutcome> settled = store.update(jobId, record -> {
            boolean transitioned = record.finish(target, error, now);
            record.releaseProcess();
            return new LineOutcome(transitioned, record.snapshot());
        });

        if (monitoringFailed && process.isAlive()) {
            log.warn("Killing worker of job {} after monitoring error", jobId);
            process.destroyForcibly();
        }

        if (settled.isEmpty()) {
            log.info("Worker of deleted job {} finished", jobId);
            return;
        }

        JobSnapshot snapshot = settled.get().getSnapshot();
        if (settled.get().isChanged()) {
            count(snapshot.getStatus());
            if (snapshot.getStatus() == JobStatus.COMPLETED) {
                log.info("Job {} completed", jobId);
            } else {
                log.warn("Job {} failed at {}% ({}): {}", jobId,
                    snapshot.getProgress().getProgress(), snapshot.getProgress().getStage(), snapshot.getError());
            }
        }

        mirrorProgress(snapshot);
        eventStreamer.complete(jobId, terminalEvent(snapshot, now));
    }

    private void mirrorProgress(JobSnapshot snapshot) {
        mirror(snapshot.getId(), jobCache.mirrorProgress(snapshot.toProgressSnapshot()));
    }

    /**
     * Write a mirror, then evict the job again if it was deleted while the write was
     * in flight.
     */
    private void mirror(String jobId, Mono<?> write) {
        write.then(Mono.defer(() -> store.contains(jobId) ? Mono.empty() : jobCache.evict(jobId).then()))
            .subscribe();
    }

    private boolean terminate(String jobId, Process process) {
        if (process == null || !process.isAlive()) {
            return true;
        }

        process.destroy();
        try {
            if (process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Worker of job {} still alive after {}, killing it", jobId, gracePeriod);
            process.destroyForcibly();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return false;
        }
    }

    private void count(JobStatus status) {
        switch (status) {
            case COMPLETED -> completedCounter.increment();
            case FAILED -> failedCounter.increment();
            case CANCELLED -> cancelledCounter.increment();
            default -> {
            }
        }
    }

    private static JobEvent terminalEvent(JobSnapshot snapshot, Instant now) {
        double progress = snapshot.getProgress().getProgress();
        return switch (snapshot.getStatus()) {
            case COMPLETED -> JobEvent.terminal(JobEvent.Type.COMPLETED, "Generation completed", progress, now);
            case CANCELLED -> JobEvent.terminal(JobEvent.Type.CANCELLED, "Job cancelled", progress, now);
            case FAILED -> MONITORING_ERROR.equals(snapshot.getError())
                ? JobEvent.terminal(JobEvent.Type.ERROR, MONITORING_ERROR, progress, now)
                : JobEvent.terminal(JobEvent.Type.FAILED, snapshot.getError(), progress, now);
            case RUNNING -> throw new IllegalStateException("Job " + snapshot.getId() + " is still running");
        };
    }

    private static String workerFailure(int exitCode) {
        return "Worker exited with code " + exitCode;
    }

    private static void validate(LaunchRequest request) {
        if (request == null || request.getCommand() == null || request.getCommand().isEmpty()) {
            throw new LaunchException("Command must not be empty");
        }
        Path workingDirectory = request.getWorkingDirectory();
        if (workingDirectory == null || !Files.isDirectory(workingDirectory)) {
            throw new LaunchException("Working directory does not exist: " + workingDirectory);
        }
        if (!Files.isWritable(workingDirectory)) {
            throw new LaunchException("Working directory is not writable: " + workingDirectory);
        }
    }

    @Value
    private static class LineOutcome {
        boolean changed;
        JobSnapshot snapshot;
    }

    @Value
    private static class CancelAttempt {
        boolean accepted;
        JobStatus status;
        Process process;
        JobSnapshot snapshot;

        static CancelAttempt finished(JobStatus status) {
            return new CancelAttempt(false, status, null, null);
        }

        static CancelAttempt accepted(Process process, JobSnapshot snapshot) {
            return new CancelAttempt(true, JobStatus.CANCELLED, process, snapshot);
        }
    }
}
