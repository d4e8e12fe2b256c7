package com.whereq.foundry.support;

import com.whereq.foundry.cache.CacheFacade;
import com.whereq.foundry.cache.JobCache;
import com.whereq.foundry.config.FoundryProperties;
import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.ProgressSnapshot;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Job cache kept in a map. The next progress write past zero can be held on the
 * writing thread until the test releases it.
 */
public class InMemoryJobCache extends JobCache {

    private final Map<String, Object> entries = new ConcurrentHashMap<>();

    private final AtomicBoolean holdArmed = new AtomicBoolean();
    private final CountDownLatch writeHeld = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch heldWriteDone = new CountDownLatch(1);

    public InMemoryJobCache(CacheFacade facade, FoundryProperties properties) {
        super(facade, properties);
    }

    public void holdNextProgressWrite() {
        holdArmed.set(true);
    }

    public boolean awaitHeldWrite(long timeout, TimeUnit unit) throws InterruptedException {
        return writeHeld.await(timeout, unit);
    }

    public boolean releaseHeldWrite(long timeout, TimeUnit unit) throws InterruptedException {
        release.countDown();
        return heldWriteDone.await(timeout, unit);
    }

    public Map<String, Object> getEntries() {
        return entries;
    }

    @Override
    public Mono<Boolean> mirrorProgress(ProgressSnapshot snapshot) {
        return Mono.fromCallable(() -> {
            boolean hold = snapshot.getProgress() > 0 && holdArmed.compareAndSet(true, false);
            if (hold) {
                writeHeld.countDown();
                release.await(5, TimeUnit.SECONDS);
            }
            entries.put("progress:" + snapshot.getJobId(), snapshot);
            if (hold) {
                heldWriteDone.countDown();
            }
            return true;
        });
    }

    @Override
    public Mono<ProgressSnapshot> findProgress(String jobId) {
        return Mono.justOrEmpty((ProgressSnapshot) entries.get("progress:" + jobId));
    }

    @Override
    public Mono<Boolean> mirrorMetadata(String jobId, JobMetadata metadata) {
        return Mono.fromCallable(() -> {
            entries.put("metadata:" + jobId, metadata);
            return true;
        });
    }

    @Override
    public Mono<JobMetadata> findMetadata(String jobId) {
        return Mono.justOrEmpty((JobMetadata) entries.get("metadata:" + jobId));
    }

    @Override
    public Mono<Long> evict(String jobId) {
        return Mono.fromCallable(() -> entries.keySet().stream()
            .filter(key -> key.endsWith(":" + jobId))
            .toList()
            .stream()
            .filter(key -> entries.remove(key) != null)
            .count());
    }
}
