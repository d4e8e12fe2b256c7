package com.whereq.foundry.controller;

import com.whereq.foundry.dto.ErrorResponse;
import com.whereq.foundry.dto.JobCancellationResponse;
import com.whereq.foundry.exception.JobNotFoundException;
import com.whereq.foundry.exception.OutputNotFoundException;
import com.whereq.foundry.model.CancelResult;
import com.whereq.foundry.model.JobEvent;
import com.whereq.foundry.service.JobEventStreamer;
import com.whereq.foundry.service.JobStatusService;
import com.whereq.foundry.service.JobSupervisor;
import com.whereq.foundry.service.OutputFileCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Controller for querying, following and managing generation jobs.
 * Jobs are started in-process through {@link JobSupervisor}; there is no submit endpoint.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Generation job status, progress and output")
public class JobController {

    @Autowired
    private JobSupervisor jobSupervisor;

    @Autowired
    private JobStatusService statusService;

    @Autowired
    private JobEventStreamer eventStreamer;

    @Autowired
    private OutputFileCatalog fileCatalog;

    @GetMapping
    @Operation(summary = "List jobs", description = "Jobs held by this service, oldest first")
    public Mono<ResponseEntity<Object>> listJobs() {
        return respond(Mono.fromCallable(statusService::listJobs), "listing jobs");
    }

    @GetMapping("/{jobId}/status")
    @Operation(summary = "Job status", description = "Status, progress and, once completed, the output files")
    public Mono<ResponseEntity<Object>> getStatus(@PathVariable String jobId) {
        return respond(statusService.status(jobId), "reading status of job " + jobId);
    }

    @GetMapping("/{jobId}/progress")
    @Operation(summary = "Job progress", description = "Progress percentage, stage and whether it is estimated")
    public Mono<ResponseEntity<Object>> getProgress(@PathVariable String jobId) {
        return respond(statusService.progress(jobId), "reading progress of job " + jobId);
    }

    /**
     * Server-sent events of a job, replayed from the first output line
     *
     * @param jobId job identifier
     * @return event stream; event name is the lower-case event type
     */
    @GetMapping(value = "/{jobId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream job events", description = "Output lines and the final status as server-sent events")
    public Mono<ResponseEntity<Flux<ServerSentEvent<JobEvent>>>> stream(@PathVariable String jobId) {
        return statusService.snapshot(jobId)
            .map(known -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(eventStreamer.stream(jobId).map(JobController::toServerSentEvent)))
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel job", description = "Terminate the worker, forcibly after the grace period")
    public Mono<ResponseEntity<Object>> cancel(@PathVariable String jobId) {
        log.info("Job cancellation request for {}", jobId);

        return Mono.fromCallable(() -> jobSupervisor.cancel(jobId))
            .subscribeOn(Schedulers.boundedElastic())
            .map(result -> {
                if (result == CancelResult.NOT_FOUND) {
                    return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .<Object>body(ErrorResponse.of("Job not found: " + jobId));
                }
                return ResponseEntity.ok().<Object>body(JobCancellationResponse.builder()
                    .jobId(jobId)
                    .result(result)
                    .message(describe(result))
                    .build());
            })
            .onErrorResume(e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .<Object>body(ErrorResponse.of("Error cancelling job: " + e.getMessage())));
            });
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete job", description = "Forget a job, killing its worker if it is still running")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String jobId) {
        log.info("Job deletion request for {}", jobId);

        return Mono.fromRunnable(() -> jobSupervisor.delete(jobId))
            .subscribeOn(Schedulers.boundedElastic())
            .then(Mono.just(ResponseEntity.noContent().<Void>build()))
            .onErrorResume(e -> {
                log.error("Error deleting job {}", jobId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @GetMapping("/{jobId}/files")
    @Operation(summary = "List output files", description = "Files the worker wrote to its output directory")
    public Mono<ResponseEntity<Object>> listFiles(@PathVariable String jobId) {
        return respond(statusService.snapshot(jobId)
            .then(fileCatalog.list(jobId))
            .map(files -> Map.of("jobId", jobId, "files", files)), "listing files of job " + jobId);
    }

    @GetMapping("/{jobId}/download")
    @Operation(summary = "Download output file", description = "The named file, else the first .osz, else the first file")
    public Mono<ResponseEntity<Resource>> download(@PathVariable String jobId,
                                                   @RequestParam(required = false) String filename) {
        return fileCatalog.resolveDownload(jobId, filename)
            .map(path -> ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                    .filename(path.getFileName().toString())
                    .build()
                    .toString())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .<Resource>body(new FileSystemResource(path)))
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(OutputNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(e -> {
                log.error("Error resolving download for job {}", jobId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @GetMapping("/{jobId}/output")
    @Operation(summary = "Job output", description = "Every output line of a job held in memory")
    public Mono<ResponseEntity<Object>> getOutput(@PathVariable String jobId) {
        return respond(statusService.output(jobId)
            .map(lines -> Map.of("jobId", jobId, "output", lines)), "reading output of job " + jobId);
    }

    @GetMapping("/{jobId}/debug")
    @Operation(summary = "Debug job", description = "Recent output, timings and cache presence of a job")
    public Mono<ResponseEntity<Object>> debug(@PathVariable String jobId) {
        return respond(statusService.debug(jobId), "reading debug info of job " + jobId);
    }

    private static <T> Mono<ResponseEntity<Object>> respond(Mono<T> body, String action) {
        return body
            .map(value -> ResponseEntity.ok().<Object>body(value))
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .<Object>body(ErrorResponse.of(e.getMessage()))))
            .onErrorResume(e -> {
                log.error("Unexpected error {}", action, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .<Object>body(ErrorResponse.of("Internal server error: " + e.getMessage())));
            });
    }

    private static ServerSentEvent<JobEvent> toServerSentEvent(JobEvent event) {
        return ServerSentEvent.builder(event)
            .event(event.getType().eventName())
            .build();
    }

    private static String describe(CancelResult result) {
        return switch (result) {
            case CANCELLED -> "Job cancelled successfully";
            case KILLED -> "Job force-killed after timeout";
            case ALREADY_FINISHED -> "Job already finished";
            case NOT_FOUND -> "Job not found";
        };
    }
}
