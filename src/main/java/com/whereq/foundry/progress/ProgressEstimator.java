package com.whereq.foundry.progress;

import com.whereq.foundry.model.ProgressState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns lines of worker output into a progress percentage and a stage label.
 *
 * <p>Three tiers are tried for every line, most specific first:
 * <ol>
 *   <li>structured extraction: progress bars and explicit percentages, exact;</li>
 *   <li>stage keywords from the {@link StageTable}, estimated;</li>
 *   <li>an elapsed-time nudge when the worker has been quiet for a while, estimated.</li>
 * </ol>
 *
 * <p>The estimator holds no mutable state. Given the same arguments it returns the
 * same result, the clock being one of the arguments. Progress never goes down.
 *
 * @author WhereQ Inc.
 */
public class ProgressEstimator {

    private final StageTable stageTable;
    private final ProgressTuning tuning;
    private final StructuredProgressParser parser = new StructuredProgressParser();

    public ProgressEstimator(StageTable stageTable, ProgressTuning tuning) {
        this.stageTable = Objects.requireNonNull(stageTable, "stageTable");
        this.tuning = Objects.requireNonNull(tuning, "tuning");
    }

    public StageTable getStageTable() {
        return stageTable;
    }

    /**
     * Read progress from a single line, without the elapsed-time fallback.
     *
     * @param line raw output line
     * @param priorProgress progress before the line
     * @param priorStage stage before the line
     * @return the update, empty when the line says nothing about progress
     */
    public Optional<ProgressUpdate> inspect(String line, double priorProgress, String priorStage) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        Optional<StageRule> rule = stageTable.match(line);

        OptionalDouble parsed = parser.parse(line);
        if (parsed.isPresent()) {
            String stage = rule.filter(r -> !r.isFailure())
                .map(StageRule::getStage)
                .orElse(priorStage);
            return Optional.of(new ProgressUpdate(Math.max(priorProgress, parsed.getAsDouble()), stage, false));
        }

        return rule.map(r -> fromStage(r, priorProgress));
    }

    /**
     * Compute the progress after a line of output.
     *
     * @param line raw output line
     * @param prior progress before the line
     * @param startedAt when the job was spawned
     * @param now current time
     * @return the new state, or {@code prior} itself when nothing changed
     */
    public ProgressState estimate(String line, ProgressState prior, Instant startedAt, Instant now) {
        if (line == null || line.isBlank()) {
            return prior;
        }

        Optional<ProgressUpdate> update = inspect(line, prior.getProgress(), prior.getStage());
        if (update.isPresent()) {
            ProgressUpdate u = update.get();
            return prior.toBuilder()
                .progress(u.getProgress())
                .stage(u.getStage())
                .estimated(u.isEstimated())
                .lastUpdate(now)
                .build();
        }

        return nudge(prior, startedAt, now);
    }

    /**
     * Elapsed-time fallback. Fires at most once per quiescence interval because it
     * moves {@code lastUpdate} whenever it changes progress.
     */
    ProgressState nudge(ProgressState prior, Instant startedAt, Instant now) {
        Duration idle = Duration.between(prior.getLastUpdate(), now);
        if (idle.compareTo(tuning.getQuiescence()) <= 0) {
            return prior;
        }

        double current = prior.getProgress();
        double increment = switch (stageTable.categoryOf(prior.getStage())) {
            case GENERATION -> Math.min(2.0, (100.0 - current) * 0.08);
            case LOADING -> Math.min(5.0, (30.0 - current) * 0.2);
            default -> Math.min(3.0, (100.0 - current) * 0.1);
        };

        double elapsed = Math.max(0, Duration.between(startedAt, now).toMillis());
        double assumed = Math.max(1, tuning.getAssumedDuration().toMillis());
        double timeBased = Math.min(tuning.getTimeCeiling(), elapsed / assumed * 100.0);

        double next = Math.min(Math.min(timeBased, current + increment), tuning.getCeiling());
        if (next <= current) {
            return prior;
        }

        return prior.toBuilder()
            .progress(next)
            .estimated(true)
            .lastUpdate(now)
            .build();
    }

    private static ProgressUpdate fromStage(StageRule rule, double priorProgress) {
        if (rule.isFailure()) {
            return new ProgressUpdate(priorProgress, rule.getStage(), true);
        }
        // stage transitions never move progress backward
        double progress = rule.getRangeStart() > priorProgress ? rule.getRangeStart() : priorProgress;
        return new ProgressUpdate(progress, rule.getStage(), true);
    }
}
