package com.whereq.foundry.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Progress of one job. Immutable; every change produces a new instance.
 */
@Value
@Builder(toBuilder = true)
public class ProgressState {

    public static final String INITIAL_STAGE = "initializing";

    /**
     * Percentage in [0, 100]
     */
    double progress;

    /**
     * Last recognized phase of the worker
     */
    String stage;

    /**
     * True when the value was inferred heuristically
     */
    boolean estimated;

    /**
     * Last time progress or stage changed
     */
    Instant lastUpdate;

    /**
     * When the job reached a terminal status
     */
    Instant completedAt;

    public static ProgressState initial(Instant now) {
        return ProgressState.builder()
            .progress(0.0)
            .stage(INITIAL_STAGE)
            .estimated(false)
            .lastUpdate(now)
            .build();
    }
}
