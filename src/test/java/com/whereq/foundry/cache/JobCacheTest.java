package com.whereq.foundry.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.whereq.foundry.config.FoundryProperties;
import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.model.OutputFile;
import com.whereq.foundry.model.ProgressSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobCacheTest {

    @Mock
    private CacheFacade cacheFacade;

    private JobCache jobCache;

    @BeforeEach
    void setUp() {
        jobCache = new JobCache(cacheFacade, new FoundryProperties());
    }

    @Test
    void mirrorsUseKeyPrefixesAndConfiguredExpiry() {
        when(cacheFacade.put(any(), any(), any())).thenReturn(Mono.just(true));
        ProgressSnapshot snapshot = ProgressSnapshot.builder().jobId("j1").status(JobStatus.RUNNING).build();
        JobMetadata metadata = JobMetadata.builder().outputDirectory("/out").build();
        List<OutputFile> files = List.of(OutputFile.builder().name("map.osz").build());

        StepVerifier.create(jobCache.mirrorProgress(snapshot)).expectNext(true).verifyComplete();
        StepVerifier.create(jobCache.mirrorMetadata("j1", metadata)).expectNext(true).verifyComplete();
        StepVerifier.create(jobCache.mirrorOutputFiles("j1", files)).expectNext(true).verifyComplete();

        verify(cacheFacade).put("progress:j1", snapshot, Duration.ofHours(2));
        verify(cacheFacade).put("metadata:j1", metadata, Duration.ofHours(2));
        verify(cacheFacade).put("files:j1", files, Duration.ofHours(1));
    }

    @Test
    void readsFromPrefixedKeys() {
        ProgressSnapshot snapshot = ProgressSnapshot.builder().jobId("j1").status(JobStatus.COMPLETED).build();
        when(cacheFacade.get("progress:j1", ProgressSnapshot.class)).thenReturn(Mono.just(snapshot));
        when(cacheFacade.get("metadata:j1", JobMetadata.class)).thenReturn(Mono.empty());

        StepVerifier.create(jobCache.findProgress("j1")).expectNext(snapshot).verifyComplete();
        StepVerifier.create(jobCache.findMetadata("j1")).verifyComplete();
    }

    @Test
    void outputFileListingUsesTypedRead() {
        List<OutputFile> files = List.of(OutputFile.builder().name("map.osz").build());
        when(cacheFacade.get(eq("files:j1"), any(TypeReference.class))).thenReturn(Mono.just(files));

        StepVerifier.create(jobCache.findOutputFiles("j1")).expectNext(files).verifyComplete();
    }

    @Test
    void evictRemovesAllMirrorsOfJob() {
        when(cacheFacade.delete("progress:j1", "metadata:j1", "files:j1")).thenReturn(Mono.just(3L));

        StepVerifier.create(jobCache.evict("j1")).expectNext(3L).verifyComplete();
    }

    @Test
    void presenceReportsEachMirror() {
        when(cacheFacade.exists("progress:j1")).thenReturn(Mono.just(true));
        when(cacheFacade.exists("metadata:j1")).thenReturn(Mono.just(true));
        when(cacheFacade.exists("files:j1")).thenReturn(Mono.just(false));

        StepVerifier.create(jobCache.presence("j1"))
            .assertNext(presence -> assertThat(presence)
                .containsExactly(
                    entry("progress", true),
                    entry("metadata", true),
                    entry("files", false)))
            .verifyComplete();
    }

    @Test
    void purgeSumsAllPrefixes() {
        when(cacheFacade.purgeWithoutExpiry("progress:*")).thenReturn(Mono.just(2L));
        when(cacheFacade.purgeWithoutExpiry("metadata:*")).thenReturn(Mono.just(1L));
        when(cacheFacade.purgeWithoutExpiry("files:*")).thenReturn(Mono.just(0L));

        StepVerifier.create(jobCache.purgeWithoutExpiry()).expectNext(3L).verifyComplete();
    }
}
