package com.whereq.foundry.progress;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.whereq.foundry.progress.StageCategory.GENERATION;
import static com.whereq.foundry.progress.StageCategory.LOADING;
import static com.whereq.foundry.progress.StageCategory.OTHER;

/**
 * Ordered, immutable keyword table used when a line carries no structured progress.
 *
 * <p>Matching rules:
 * <ul>
 *   <li>failure rules win over everything else, so a line that mentions an error is
 *       always reported as such;</li>
 *   <li>otherwise the longest matching keyword wins ("generating timing" beats
 *       "generating"); on equal length the earlier row wins.</li>
 * </ul>
 *
 * @author WhereQ Inc.
 */
public final class StageTable {

    private static final StageTable DEFAULTS = new StageTable(List.of(
        // device selection printed by the inference script
        StageRule.of("using cuda for inference", "initializing", 0, 5, LOADING),
        StageRule.of("using mps for inference", "initializing", 0, 5, LOADING),
        StageRule.of("using cpu for inference", "initializing", 0, 5, LOADING),
        StageRule.of("random seed", "loading_model", 5, 10, OTHER),
        StageRule.of("model loaded", "model_ready", 10, 15, OTHER),
        StageRule.of("generating map", "generating_map", 15, 85, GENERATION),
        StageRule.of("generating timing", "generating_timing", 15, 40, GENERATION),
        StageRule.of("generating kiai", "generating_kiai", 40, 60, GENERATION),
        StageRule.of("seq len", "refining_positions", 85, 95, OTHER),
        StageRule.of("generated beatmap saved", "saving", 85, 95, OTHER),
        StageRule.of("generated .osz saved", "finishing", 95, 100, OTHER),

        // generic vocabulary
        StageRule.of("loading", "loading", 0, 10, LOADING),
        StageRule.of("load", "loading", 0, 10, LOADING),
        StageRule.of("initializing", "initializing", 0, 5, LOADING),
        StageRule.of("preprocessing", "preprocessing", 5, 15, OTHER),
        StageRule.of("processing", "processing", 10, 50, OTHER),
        StageRule.of("inference", "inference", 30, 80, GENERATION),
        StageRule.of("generating", "generating", 40, 85, GENERATION),
        StageRule.of("postprocessing", "postprocessing", 85, 95, OTHER),
        StageRule.of("saving", "saving", 95, 100, OTHER),
        StageRule.of("export", "export", 95, 100, OTHER),
        // 100 is only ever set by a confirmed exit code 0
        StageRule.of("complete", "finishing", 95, 100, OTHER),
        StageRule.of("finished", "finishing", 95, 100, OTHER),
        StageRule.of("done", "finishing", 95, 100, OTHER),

        StageRule.of("model", "loading", 0, 10, LOADING),
        StageRule.of("tokenizer", "loading", 5, 15, LOADING),
        StageRule.of("config", "loading", 0, 10, LOADING),
        StageRule.of("checkpoint", "loading", 5, 15, LOADING),

        StageRule.of("audio", "preprocessing", 10, 25, OTHER),
        StageRule.of("spectrogram", "preprocessing", 15, 30, OTHER),
        StageRule.of("feature", "preprocessing", 20, 35, OTHER),

        StageRule.of("cuda", "initializing", 0, 5, LOADING),
        StageRule.of("device", "initializing", 0, 5, LOADING),
        StageRule.of("gpu", "initializing", 0, 5, LOADING),

        StageRule.failure("error"),
        StageRule.failure("failed"),
        StageRule.failure("exception"),
        StageRule.failure("traceback")
    ));

    private final List<StageRule> rules;

    private StageTable(List<StageRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static StageTable of(List<StageRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Stage table must contain at least one rule");
        }
        return new StageTable(rules);
    }

    /**
     * Table matching the console vocabulary of the beatmap generation worker.
     */
    public static StageTable defaults() {
        return DEFAULTS;
    }

    public List<StageRule> getRules() {
        return rules;
    }

    /**
     * Find the rule describing a line of worker output.
     *
     * @param line raw output line
     * @return the winning rule, empty when no keyword occurs in the line
     */
    public Optional<StageRule> match(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String lower = line.toLowerCase(Locale.ROOT);

        StageRule best = null;
        for (StageRule rule : rules) {
            if (!rule.matches(lower)) {
                continue;
            }
            if (rule.isFailure()) {
                return Optional.of(rule);
            }
            if (best == null || rule.getKeyword().length() > best.getKeyword().length()) {
                best = rule;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Category of a stage name, taken from the first row that produces it.
     */
    public StageCategory categoryOf(String stage) {
        if (stage == null) {
            return OTHER;
        }
        for (StageRule rule : rules) {
            if (rule.getStage().equals(stage)) {
                return rule.getCategory();
            }
        }
        return OTHER;
    }
}
