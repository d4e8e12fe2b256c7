package com.whereq.foundry.service;

import com.whereq.foundry.cache.JobCache;
import com.whereq.foundry.dto.JobDebugResponse;
import com.whereq.foundry.dto.JobProgressResponse;
import com.whereq.foundry.dto.JobStatusResponse;
import com.whereq.foundry.dto.JobSummary;
import com.whereq.foundry.exception.JobNotFoundException;
import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.model.ProgressSnapshot;
import com.whereq.foundry.model.ProgressState;
import com.whereq.foundry.store.JobRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read side of job supervision: status, progress, listing and diagnostics.
 *
 * <p>The in-memory store is authoritative. Jobs it does not hold are looked up in the
 * cache. A cached job that is still marked running but has no in-memory record lost
 * its supervisor (the service restarted); it is reported completed when it left
 * output files behind and failed otherwise.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobStatusService {

    public static final String UNSUPERVISED_ERROR = "Job is no longer supervised";

    static final int DEBUG_TAIL_LINES = 20;

    private final JobRecordStore store;
    private final JobCache jobCache;
    private final OutputFileCatalog fileCatalog;
    private final Clock clock;

    @Autowired
    public JobStatusService(JobRecordStore store, JobCache jobCache, OutputFileCatalog fileCatalog, Clock clock) {
        this.store = store;
        this.jobCache = jobCache;
        this.fileCatalog = fileCatalog;
        this.clock = clock;
    }

    /**
     * Current progress and status of a job, wherever it is known.
     *
     * @param jobId job identifier
     * @return the snapshot; errors with {@link JobNotFoundException} for unknown jobs
     */
    public Mono<ProgressSnapshot> snapshot(String jobId) {
        return Mono.defer(() -> store.find(jobId)
            .map(snapshot -> Mono.just(snapshot.toProgressSnapshot()))
            .orElseGet(() -> fromCache(jobId)));
    }

    public Mono<JobStatusResponse> status(String jobId) {
        return snapshot(jobId).flatMap(snapshot -> {
            JobStatusResponse.JobStatusResponseBuilder response = JobStatusResponse.builder()
                .jobId(jobId)
                .status(snapshot.getStatus())
                .message(describe(snapshot.getStatus()))
                .progress(snapshot.getProgress())
                .stage(snapshot.getStage())
                .error(snapshot.getError());

            if (snapshot.getStatus() != JobStatus.COMPLETED) {
                return Mono.just(response.build());
            }
            return fileCatalog.list(jobId).map(files -> response.outputFiles(files).build());
        });
    }

    public Mono<JobProgressResponse> progress(String jobId) {
        return snapshot(jobId).map(snapshot -> JobProgressResponse.builder()
            .jobId(jobId)
            .progress(snapshot.getProgress())
            .stage(snapshot.getStage())
            .estimated(snapshot.isEstimated())
            .lastUpdate(snapshot.getLastUpdate())
            .status(snapshot.getStatus())
            .build());
    }

    /**
     * Jobs held in memory, oldest first.
     */
    public List<JobSummary> listJobs() {
        return store.snapshots().stream()
            .map(snapshot -> JobSummary.builder()
                .jobId(snapshot.getId())
                .status(snapshot.getStatus())
                .progress(snapshot.getProgress().getProgress())
                .stage(snapshot.getProgress().getStage())
                .inputPath(snapshot.getMetadata().getInputPath())
                .createdAt(snapshot.getMetadata().getCreatedAt())
                .pid(snapshot.getPid())
                .build())
            .toList();
    }

    /**
     * Full output of a job held in memory.
     */
    public Mono<List<String>> output(String jobId) {
        return Mono.defer(() -> Mono.justOrEmpty(store.outputTail(jobId, Integer.MAX_VALUE)))
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    public Mono<JobDebugResponse> debug(String jobId) {
        return snapshot(jobId).zipWith(jobCache.presence(jobId), (snapshot, presence) -> {
            List<String> tail = store.outputTail(jobId, DEBUG_TAIL_LINES).orElse(List.of());
            JobDebugResponse.JobDebugResponseBuilder response = JobDebugResponse.builder()
                .jobId(jobId)
                .progress(snapshot)
                .recentOutput(tail)
                .cache(presence);

            store.find(jobId).ifPresentOrElse(held -> {
                Instant end = held.getProgress().getCompletedAt() != null
                    ? held.getProgress().getCompletedAt()
                    : clock.instant();
                response.active(held.getStatus() == JobStatus.RUNNING)
                    .totalOutputLines(held.getOutputLineCount())
                    .elapsedSeconds(Duration.between(held.getMetadata().getCreatedAt(), end).toSeconds());
            }, () -> response.active(false).totalOutputLines(0));

            return response.build();
        });
    }

    private Mono<ProgressSnapshot> fromCache(String jobId) {
        return jobCache.findProgress(jobId)
            .switchIfEmpty(Mono.defer(() -> jobCache.findMetadata(jobId).map(metadata -> unsupervised(jobId, metadata))))
            .flatMap(cached -> cached.getStatus() == JobStatus.RUNNING ? resolveOrphan(cached) : Mono.just(cached))
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    private Mono<ProgressSnapshot> resolveOrphan(ProgressSnapshot cached) {
        String jobId = cached.getJobId();
        return fileCatalog.list(jobId).map(files -> {
            Instant now = clock.instant();
            if (!files.isEmpty()) {
                log.info("Job {} is not supervised but left {} output files, reporting it completed", jobId, files.size());
                return cached.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .progress(100.0)
                    .stage("completed")
                    .estimated(false)
                    .completedAt(now)
                    .build();
            }
            log.info("Job {} is not supervised and left no output, reporting it failed", jobId);
            return cached.toBuilder()
                .status(JobStatus.FAILED)
                .error(UNSUPERVISED_ERROR)
                .completedAt(now)
                .build();
        });
    }

    private static ProgressSnapshot unsupervised(String jobId, JobMetadata metadata) {
        return ProgressSnapshot.of(jobId, JobStatus.RUNNING, ProgressState.initial(metadata.getCreatedAt()), null);
    }

    private static String describe(JobStatus status) {
        return switch (status) {
            case RUNNING -> "Generation in progress";
            case COMPLETED -> "Generation completed";
            case FAILED -> "Generation failed";
            case CANCELLED -> "Job cancelled";
        };
    }
}
