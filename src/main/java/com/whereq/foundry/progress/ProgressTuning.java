package com.whereq.foundry.progress;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Constants of the elapsed-time fallback. These are tuning values observed on real
 * generation runs, not guarantees, and are bound from {@code foundry.progress.*}.
 */
@Value
@Builder
public class ProgressTuning {

    /**
     * Minimum silence before a nudge is allowed.
     */
    @Builder.Default
    Duration quiescence = Duration.ofSeconds(5);

    /**
     * Assumed total duration of a run, used to extrapolate from elapsed time.
     */
    @Builder.Default
    Duration assumedDuration = Duration.ofSeconds(180);

    @Builder.Default
    double timeCeiling = 90.0;

    @Builder.Default
    double ceiling = 95.0;

    public static ProgressTuning defaults() {
        return ProgressTuning.builder().build();
    }
}
