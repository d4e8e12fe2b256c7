package com.whereq.foundry.progress;

import lombok.Value;

import java.util.Locale;

/**
 * One row of the stage table: a keyword found in worker output and the stage and
 * progress range it stands for.
 */
@Value
public class StageRule {

    /**
     * Lower-case phrase matched as a substring of the lower-cased line.
     */
    String keyword;

    String stage;

    double rangeStart;

    double rangeEnd;

    StageCategory category;

    public StageRule(String keyword, String stage, double rangeStart, double rangeEnd, StageCategory category) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Stage keyword must not be blank");
        }
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank for keyword '" + keyword + "'");
        }
        if (rangeStart > rangeEnd) {
            throw new IllegalArgumentException("Stage range start exceeds end for keyword '" + keyword + "'");
        }
        this.keyword = keyword.toLowerCase(Locale.ROOT);
        this.stage = stage;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.category = category == null ? StageCategory.OTHER : category;
    }

    public static StageRule of(String keyword, String stage, double start, double end, StageCategory category) {
        return new StageRule(keyword, stage, start, end, category);
    }

    /**
     * Rule for a failure phrase. It only relabels the stage and never moves progress.
     */
    public static StageRule failure(String keyword) {
        return new StageRule(keyword, "error", 0, 0, StageCategory.ERROR);
    }

    public boolean isFailure() {
        return category == StageCategory.ERROR;
    }

    boolean matches(String lowerCaseLine) {
        return lowerCaseLine.contains(keyword);
    }
}
