package com.whereq.foundry.service;

import com.whereq.foundry.cache.JobCache;
import com.whereq.foundry.config.FoundryProperties;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.store.JobRecord;
import com.whereq.foundry.store.JobRecordStore;
import com.whereq.foundry.store.JobSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic housekeeping of finished jobs
 */
@Slf4j
@Component
public class JobJanitor {

    private final JobRecordStore store;
    private final JobSupervisor supervisor;
    private final JobEventStreamer eventStreamer;
    private final JobCache jobCache;
    private final Clock clock;
    private final Duration retention;

    @Autowired
    public JobJanitor(JobRecordStore store,
                      JobSupervisor supervisor,
                      JobEventStreamer eventStreamer,
                      JobCache jobCache,
                      FoundryProperties properties,
                      Clock clock) {
        this.store = store;
        this.supervisor = supervisor;
        this.eventStreamer = eventStreamer;
        this.jobCache = jobCache;
        this.clock = clock;
        this.retention = properties.getJanitor().getRetention();
    }

    /**
     * Settle jobs whose worker exited unnoticed, then drop finished jobs older than
     * the retention period. Running jobs are never removed.
     */
    @Scheduled(fixedDelayString = "${foundry.janitor.interval:PT5M}",
        initialDelayString = "${foundry.janitor.interval:PT5M}")
    public void sweep() {
        List<String> settled = supervisor.settleOrphans();

        Instant cutoff = clock.instant().minus(retention);
        List<JobRecord> expired = store.removeIf(snapshot -> isExpired(snapshot, cutoff));

        for (JobRecord job : expired) {
            eventStreamer.close(job.getId());
            jobCache.evict(job.getId()).subscribe();
        }

        if (!settled.isEmpty() || !expired.isEmpty()) {
            log.info("Janitor sweep: settled {} jobs, removed {} expired jobs, {} remaining",
                settled.size(), expired.size(), store.size());
        } else {
            log.debug("Janitor sweep: nothing to do, {} jobs held", store.size());
        }
    }

    /**
     * Delete job mirrors that were written without an expiry.
     */
    @Scheduled(fixedDelayString = "${foundry.janitor.cache-purge-interval:PT1H}",
        initialDelayString = "${foundry.janitor.cache-purge-interval:PT1H}")
    public void purgeCache() {
        if (!jobCache.isActive()) {
            return;
        }
        jobCache.purgeWithoutExpiry()
            .subscribe(purged -> {
                if (purged > 0) {
                    log.info("Purged {} cache keys without expiry", purged);
                }
            });
    }

    private static boolean isExpired(JobSnapshot snapshot, Instant cutoff) {
        if (snapshot.getStatus() == JobStatus.RUNNING) {
            return false;
        }
        Instant completedAt = snapshot.getProgress().getCompletedAt();
        return completedAt != null && completedAt.isBefore(cutoff);
    }
}
