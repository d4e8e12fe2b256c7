package com.whereq.foundry.service;

import com.whereq.foundry.model.JobEvent;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.model.ProgressSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live event channels, one per job.
 *
 * <p>A job's collector is the only publisher on its channel. Every channel keeps all
 * events it has seen and replays them to each new subscriber, so any number of
 * observers get the complete ordered sequence independently of each other, ending
 * with exactly one terminal event. Subscribers going away never affects the worker.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobEventStreamer {

    private final ConcurrentHashMap<String, Sinks.Many<JobEvent>> channels = new ConcurrentHashMap<>();

    private final JobStatusService statusService;
    private final Clock clock;

    @Autowired
    public JobEventStreamer(JobStatusService statusService, Clock clock) {
        this.statusService = statusService;
        this.clock = clock;
    }

    /**
     * Create the channel for a new job
     */
    public void open(String jobId) {
        channels.put(jobId, Sinks.many().replay().all());
    }

    /**
     * Append a non-terminal event
     */
    public void publish(String jobId, JobEvent event) {
        Sinks.Many<JobEvent> sink = channels.get(jobId);
        if (sink == null) {
            return;
        }
        synchronized (sink) {
            Sinks.EmitResult result = sink.tryEmitNext(event);
            if (result.isFailure()) {
                log.debug("Dropped {} event for job {}: {}", event.getType(), jobId, result);
            }
        }
    }

    /**
     * Append the terminal event and end the channel. Subscribers arriving later
     * still receive the full history.
     */
    public void complete(String jobId, JobEvent terminal) {
        Sinks.Many<JobEvent> sink = channels.get(jobId);
        if (sink == null) {
            return;
        }
        synchronized (sink) {
            sink.tryEmitNext(terminal);
            sink.tryEmitComplete();
        }
    }

    /**
     * Drop a channel. Open subscriptions end without a terminal event.
     */
    public void close(String jobId) {
        Sinks.Many<JobEvent> sink = channels.remove(jobId);
        if (sink != null) {
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
    }

    public boolean hasChannel(String jobId) {
        return channels.containsKey(jobId);
    }

    /**
     * Events of a job from the first output line on.
     *
     * <p>A job that is only known to the cache yields a single event describing its
     * final state.
     *
     * @param jobId job identifier
     * @return event sequence; errors with {@link com.whereq.foundry.exception.JobNotFoundException}
     *         for unknown jobs
     */
    public Flux<JobEvent> stream(String jobId) {
        Sinks.Many<JobEvent> sink = channels.get(jobId);
        if (sink != null) {
            return sink.asFlux()
                .doOnSubscribe(s -> log.debug("Stream subscriber attached to job {}", jobId))
                .doOnCancel(() -> log.debug("Stream subscriber detached from job {}", jobId));
        }
        return statusService.snapshot(jobId)
            .map(this::describe)
            .flux();
    }

    private JobEvent describe(ProgressSnapshot snapshot) {
        JobEvent.Type type;
        String message;
        if (snapshot.getStatus() == JobStatus.COMPLETED) {
            type = JobEvent.Type.COMPLETED;
            message = "Generation completed";
        } else if (snapshot.getStatus() == JobStatus.CANCELLED) {
            type = JobEvent.Type.CANCELLED;
            message = "Job cancelled";
        } else if (snapshot.getStatus() == JobStatus.FAILED) {
            type = JobEvent.Type.FAILED;
            message = snapshot.getError();
        } else {
            // running in the cache but not supervised by this process
            type = JobEvent.Type.ERROR;
            message = "Live output is not available for this job";
        }
        return JobEvent.terminal(type, message, snapshot.getProgress(), clock.instant());
    }
}
