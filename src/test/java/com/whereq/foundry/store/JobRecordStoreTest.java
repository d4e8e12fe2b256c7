package com.whereq.foundry.store;

import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.JobStatus;
import com.whereq.foundry.model.ProgressState;
import com.whereq.foundry.support.ScriptedProcess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobRecordStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private JobRecordStore store;

    @BeforeEach
    void setUp() {
        store = new JobRecordStore();
    }

    @Test
    void registeredJobStartsRunningAtZero() {
        store.register(record("a"));

        JobSnapshot snapshot = store.find("a").orElseThrow();
        assertThat(snapshot.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(snapshot.getProgress().getProgress()).isZero();
        assertThat(snapshot.getProgress().getStage()).isEqualTo(ProgressState.INITIAL_STAGE);
        assertThat(snapshot.isProcessAttached()).isTrue();
        assertThat(snapshot.getPid()).isEqualTo(4242L);
    }

    @Test
    void duplicateIdIsRejected() {
        store.register(record("a"));

        assertThatThrownBy(() -> store.register(record("a")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void firstTerminalTransitionWins() {
        store.register(record("a"));

        boolean cancelled = store.update("a", r -> r.finish(JobStatus.CANCELLED, null, NOW)).orElseThrow();
        boolean completed = store.update("a", r -> r.finish(JobStatus.COMPLETED, null, NOW)).orElseThrow();

        assertThat(cancelled).isTrue();
        assertThat(completed).isFalse();
        assertThat(store.find("a").orElseThrow().getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void completionSetsFullProgressAndCompletedStage() {
        store.register(record("a"));
        store.update("a", r -> {
            r.updateProgress(r.getProgress().toBuilder().progress(63).stage("generating_map").build());
            return r.finish(JobStatus.COMPLETED, null, NOW.plusSeconds(90));
        });

        ProgressState progress = store.find("a").orElseThrow().getProgress();
        assertThat(progress.getProgress()).isEqualTo(100.0);
        assertThat(progress.getStage()).isEqualTo("completed");
        assertThat(progress.isEstimated()).isFalse();
        assertThat(progress.getCompletedAt()).isEqualTo(NOW.plusSeconds(90));
    }

    @Test
    void failureKeepsLastKnownProgress() {
        store.register(record("a"));
        store.update("a", r -> {
            r.updateProgress(r.getProgress().toBuilder().progress(37).stage("generating_timing").build());
            return r.finish(JobStatus.FAILED, "Worker exited with code 1", NOW);
        });

        JobSnapshot snapshot = store.find("a").orElseThrow();
        assertThat(snapshot.getProgress().getProgress()).isEqualTo(37.0);
        assertThat(snapshot.getProgress().getStage()).isEqualTo("generating_timing");
        assertThat(snapshot.getError()).isEqualTo("Worker exited with code 1");
    }

    @Test
    void progressIsFrozenOnceTerminal() {
        store.register(record("a"));
        store.update("a", r -> r.finish(JobStatus.CANCELLED, null, NOW));

        store.update("a", r -> {
            r.updateProgress(r.getProgress().toBuilder().progress(80).build());
            return null;
        });

        assertThat(store.find("a").orElseThrow().getProgress().getProgress()).isZero();
    }

    @Test
    void finishRejectsRunning() {
        store.register(record("a"));

        assertThatThrownBy(() -> store.update("a", r -> r.finish(JobStatus.RUNNING, null, NOW)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void releasedProcessIsNoLongerReported() {
        store.register(record("a"));
        store.update("a", JobRecord::releaseProcess);

        JobSnapshot snapshot = store.find("a").orElseThrow();
        assertThat(snapshot.isProcessAttached()).isFalse();
        assertThat(snapshot.getPid()).isNull();
    }

    @Test
    void outputTailReturnsLastLinesInOrder() {
        store.register(record("a"));
        store.update("a", r -> {
            for (int i = 1; i <= 30; i++) {
                r.appendOutput("line " + i);
            }
            return null;
        });

        assertThat(store.outputTail("a", 3)).hasValue(List.of("line 28", "line 29", "line 30"));
        assertThat(store.find("a").orElseThrow().getOutputLineCount()).isEqualTo(30);
        assertThat(store.outputTail("missing", 3)).isEmpty();
    }

    @Test
    void removedRecordOnlyHandsOutCopiesOfItsOutput() {
        store.register(record("a"));
        store.update("a", r -> {
            r.appendOutput("first");
            return null;
        });

        JobRecord removed = store.remove("a").orElseThrow();
        List<String> tail = removed.outputTail(10);
        removed.appendOutput("second");

        assertThat(tail).containsExactly("first");
        assertThatThrownBy(() -> tail.add("third")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(removed.outputTail(1)).containsExactly("second");
    }

    @Test
    void snapshotsFollowCreationOrder() {
        store.register(record("c"));
        store.register(record("a"));
        store.register(record("b"));

        assertThat(store.snapshots()).extracting(JobSnapshot::getId).containsExactly("c", "a", "b");
    }

    @Test
    void removeIfOnlyRemovesMatchingJobs() {
        store.register(record("running"));
        store.register(record("done"));
        store.update("done", r -> r.finish(JobStatus.COMPLETED, null, NOW));

        List<JobRecord> removed = store.removeIf(s -> s.getStatus().isTerminal());

        assertThat(removed).extracting(JobRecord::getId).containsExactly("done");
        assertThat(store.contains("running")).isTrue();
        assertThat(store.contains("done")).isFalse();
    }

    @Test
    void updateOfUnknownJobIsEmpty() {
        assertThat(store.update("missing", r -> "touched")).isEmpty();
        assertThat(store.remove("missing")).isEmpty();
    }

    @Test
    void concurrentAppendsAreNotLost() throws Exception {
        store.register(record("a"));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Runnable> writers = new ArrayList<>();
        for (int w = 0; w < 4; w++) {
            writers.add(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 500; i++) {
                    store.update("a", r -> {
                        r.appendOutput("x");
                        return null;
                    });
                }
            });
        }
        writers.forEach(pool::execute);
        start.countDown();
        pool.shutdown();

        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(store.find("a").orElseThrow().getOutputLineCount()).isEqualTo(2000);
    }

    private static JobRecord record(String id) {
        JobMetadata metadata = JobMetadata.builder()
            .command(List.of("worker"))
            .workingDirectory("/tmp")
            .outputDirectory("/tmp")
            .createdAt(NOW)
            .build();
        return new JobRecord(id, new ScriptedProcess(), metadata, NOW);
    }
}
