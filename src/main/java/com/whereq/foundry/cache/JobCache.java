package com.whereq.foundry.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.whereq.foundry.config.FoundryProperties;
import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.OutputFile;
import com.whereq.foundry.model.ProgressSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mirrors job state to the cache so it survives eviction from memory or a restart.
 * The cache is never authoritative over the in-memory store.
 */
@Slf4j
@Service
public class JobCache {

    static final String PROGRESS_KEY_PREFIX = "progress:";
    static final String METADATA_KEY_PREFIX = "metadata:";
    static final String FILES_KEY_PREFIX = "files:";

    private static final List<String> PREFIXES = List.of(PROGRESS_KEY_PREFIX, METADATA_KEY_PREFIX, FILES_KEY_PREFIX);

    private static final TypeReference<List<OutputFile>> FILE_LIST = new TypeReference<>() {
    };

    private final CacheFacade cache;
    private final FoundryProperties.CacheConfig config;

    @Autowired
    public JobCache(CacheFacade cache, FoundryProperties properties) {
        this.cache = cache;
        this.config = properties.getCache();
    }

    public boolean isActive() {
        return cache.isActive();
    }

    public CacheMode getMode() {
        return cache.getMode();
    }

    public Mono<Boolean> mirrorProgress(ProgressSnapshot snapshot) {
        return cache.put(PROGRESS_KEY_PREFIX + snapshot.getJobId(), snapshot, config.getProgressTtl());
    }

    public Mono<ProgressSnapshot> findProgress(String jobId) {
        return cache.get(PROGRESS_KEY_PREFIX + jobId, ProgressSnapshot.class);
    }

    public Mono<Boolean> mirrorMetadata(String jobId, JobMetadata metadata) {
        return cache.put(METADATA_KEY_PREFIX + jobId, metadata, config.getMetadataTtl());
    }

    public Mono<JobMetadata> findMetadata(String jobId) {
        return cache.get(METADATA_KEY_PREFIX + jobId, JobMetadata.class);
    }

    public Mono<Boolean> mirrorOutputFiles(String jobId, List<OutputFile> files) {
        return cache.put(FILES_KEY_PREFIX + jobId, files, config.getFilesTtl());
    }

    public Mono<List<OutputFile>> findOutputFiles(String jobId) {
        return cache.get(FILES_KEY_PREFIX + jobId, FILE_LIST);
    }

    /**
     * Delete every mirror of a job
     */
    public Mono<Long> evict(String jobId) {
        return cache.delete(PREFIXES.stream().map(prefix -> prefix + jobId).toArray(String[]::new))
            .doOnNext(removed -> log.debug("Evicted {} cache keys for job {}", removed, jobId));
    }

    /**
     * Which mirrors currently exist for a job, keyed "progress", "metadata", "files"
     */
    public Mono<Map<String, Boolean>> presence(String jobId) {
        return Flux.fromIterable(PREFIXES)
            .concatMap(prefix -> cache.exists(prefix + jobId).map(found -> Map.entry(label(prefix), found)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
    }

    /**
     * Number of keys per mirror kind
     */
    public Mono<Map<String, Long>> keyCounts() {
        return Flux.fromIterable(PREFIXES)
            .concatMap(prefix -> cache.countKeys(prefix + "*").map(count -> Map.entry(label(prefix), count)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
    }

    /**
     * Remove mirrors that were written without an expiry
     */
    public Mono<Long> purgeWithoutExpiry() {
        return Flux.fromIterable(PREFIXES)
            .concatMap(prefix -> cache.purgeWithoutExpiry(prefix + "*"))
            .reduce(0L, Long::sum);
    }

    private static String label(String prefix) {
        return prefix.substring(0, prefix.length() - 1);
    }
}
