package com.whereq.foundry.progress;

import com.whereq.foundry.model.ProgressState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProgressEstimatorTest {

    private static final Instant START = Instant.parse("2026-01-01T10:00:00Z");

    private final ProgressEstimator estimator = new ProgressEstimator(StageTable.defaults(), ProgressTuning.defaults());

    @Test
    void tqdmLineGivesExactProgress() {
        ProgressState prior = state(0, "initializing", START);

        ProgressState next = estimator.estimate("  50%|██████████          | 1/2 [00:03<00:03]", prior, START, START.plusSeconds(3));

        assertThat(next.getProgress()).isEqualTo(50.0);
        assertThat(next.isEstimated()).isFalse();
        assertThat(next.getStage()).isEqualTo("initializing");
        assertThat(next.getLastUpdate()).isEqualTo(START.plusSeconds(3));
    }

    @Test
    void stageKeywordJumpsToRangeStart() {
        ProgressState prior = state(10, "model_ready", START);

        ProgressState next = estimator.estimate("Generating timing points", prior, START, START.plusSeconds(1));

        assertThat(next.getProgress()).isEqualTo(15.0);
        assertThat(next.getStage()).isEqualTo("generating_timing");
        assertThat(next.isEstimated()).isTrue();
    }

    @Test
    void stageKeywordBelowCurrentProgressOnlyRelabels() {
        ProgressState prior = state(50, "generating_map", START);

        ProgressState next = estimator.estimate("Generating timing points", prior, START, START.plusSeconds(1));

        assertThat(next.getProgress()).isEqualTo(50.0);
        assertThat(next.getStage()).isEqualTo("generating_timing");
    }

    @Test
    void structuredExtractionBeatsKeywords() {
        ProgressState prior = state(10, "model_ready", START);

        ProgressState next = estimator.estimate("Generating timing points... 32%", prior, START, START.plusSeconds(1));

        assertThat(next.getProgress()).isEqualTo(32.0);
        assertThat(next.isEstimated()).isFalse();
        assertThat(next.getStage()).isEqualTo("generating_timing");
    }

    @Test
    void structuredValueNeverMovesProgressBackward() {
        ProgressState prior = state(60, "generating_map", START);

        ProgressState next = estimator.estimate("  10%|█         | 1/10", prior, START, START.plusSeconds(1));

        assertThat(next.getProgress()).isEqualTo(60.0);
    }

    @Test
    void failureLineKeepsProgressAndReportsErrorStage() {
        ProgressState prior = state(42, "generating_map", START);

        ProgressState next = estimator.estimate("RuntimeError: CUDA out of memory", prior, START, START.plusSeconds(1));

        assertThat(next.getProgress()).isEqualTo(42.0);
        assertThat(next.getStage()).isEqualTo("error");
    }

    @Test
    void blankLinesChangeNothing() {
        ProgressState prior = state(42, "generating_map", START);

        assertThat(estimator.estimate("   ", prior, START, START.plusSeconds(60))).isSameAs(prior);
        assertThat(estimator.estimate("", prior, START, START.plusSeconds(60))).isSameAs(prior);
    }

    @Test
    void estimateIsPure() {
        ProgressState prior = state(10, "model_ready", START);
        Instant now = START.plusSeconds(30);

        ProgressState first = estimator.estimate("Generating kiai", prior, START, now);
        ProgressState second = estimator.estimate("Generating kiai", prior, START, now);

        assertThat(first).isEqualTo(second);
        assertThat(prior.getProgress()).isEqualTo(10.0);
    }

    @Test
    void nudgeAdvancesGenerationStageAfterQuiescence() {
        Instant lastUpdate = START.plusSeconds(110);
        ProgressState prior = state(20, "generating_map", lastUpdate);
        Instant now = lastUpdate.plusSeconds(10);

        ProgressState next = estimator.estimate("unrelated chatter", prior, START, now);

        assertThat(next.getProgress()).isCloseTo(22.0, within(1e-9));
        assertThat(next.isEstimated()).isTrue();
        assertThat(next.getLastUpdate()).isEqualTo(now);
        assertThat(next.getStage()).isEqualTo("generating_map");
    }

    @Test
    void nudgeWaitsForQuiescence() {
        ProgressState prior = state(20, "generating_map", START.plusSeconds(100));

        ProgressState next = estimator.estimate("unrelated chatter", prior, START, START.plusSeconds(103));

        assertThat(next).isSameAs(prior);
    }

    @Test
    void nudgeForLoadingConvergesTowardThirty() {
        ProgressState prior = state(28, "loading", START.plusSeconds(100));

        ProgressState next = estimator.nudge(prior, START, START.plusSeconds(120));

        assertThat(next.getProgress()).isCloseTo(28.4, within(1e-9));
    }

    @Test
    void nudgeAfterSeedUsesDefaultIncrement() {
        ProgressState prior = state(8, "loading_model", START.plusSeconds(100));

        ProgressState next = estimator.nudge(prior, START, START.plusSeconds(120));

        assertThat(next.getProgress()).isCloseTo(11.0, within(1e-9));
    }

    @Test
    void nudgeIsBoundedByElapsedTime() {
        // 18s of an assumed 180s run caps the estimate at 10%
        ProgressState prior = state(20, "generating_map", START.plusSeconds(5));

        ProgressState next = estimator.nudge(prior, START, START.plusSeconds(18));

        assertThat(next).isSameAs(prior);
    }

    @Test
    void nudgeNeverExceedsCeiling() {
        ProgressEstimator generous = new ProgressEstimator(StageTable.defaults(),
            ProgressTuning.builder().timeCeiling(99).quiescence(Duration.ofSeconds(1)).build());
        ProgressState prior = state(94.8, "postprocessing", START.plusSeconds(500));

        ProgressState next = generous.nudge(prior, START, START.plusSeconds(1000));

        assertThat(next.getProgress()).isEqualTo(95.0);
        assertThat(generous.nudge(next, START, START.plusSeconds(2000))).isSameAs(next);
    }

    @Test
    void inspectReportsNothingForUnrelatedLines() {
        assertThat(estimator.inspect("hello world", 10, "loading")).isEmpty();
    }

    private static ProgressState state(double progress, String stage, Instant lastUpdate) {
        return ProgressState.builder()
            .progress(progress)
            .stage(stage)
            .estimated(false)
            .lastUpdate(lastUpdate)
            .build();
    }
}
