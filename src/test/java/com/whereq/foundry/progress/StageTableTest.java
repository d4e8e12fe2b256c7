package com.whereq.foundry.progress;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageTableTest {

    private final StageTable table = StageTable.defaults();

    @Test
    void longestKeywordWins() {
        assertThat(table.match("Generating timing points"))
            .get()
            .extracting(StageRule::getStage)
            .isEqualTo("generating_timing");

        assertThat(table.match("Generating something else"))
            .get()
            .extracting(StageRule::getStage)
            .isEqualTo("generating");
    }

    @Test
    void seedLineIsNotALoadingStage() {
        assertThat(table.categoryOf("loading_model")).isEqualTo(StageCategory.OTHER);
        assertThat(table.categoryOf("loading")).isEqualTo(StageCategory.LOADING);
        assertThat(table.categoryOf("initializing")).isEqualTo(StageCategory.LOADING);
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertThat(table.match("MODEL LOADED in 3.2s"))
            .get()
            .extracting(StageRule::getStage)
            .isEqualTo("model_ready");
    }

    @Test
    void failureKeywordsTakePrecedence() {
        assertThat(table.match("Error while generating timing points"))
            .get()
            .satisfies(rule -> {
                assertThat(rule.isFailure()).isTrue();
                assertThat(rule.getStage()).isEqualTo("error");
            });
        assertThat(table.match("Traceback (most recent call last):")).get()
            .extracting(StageRule::isFailure)
            .isEqualTo(true);
    }

    @Test
    void equalLengthKeywordsResolveToEarlierRow() {
        StageTable custom = StageTable.of(List.of(
            StageRule.of("alpha", "first", 10, 20, StageCategory.OTHER),
            StageRule.of("omega", "second", 30, 40, StageCategory.OTHER)));

        assertThat(custom.match("omega then alpha")).get()
            .extracting(StageRule::getStage)
            .isEqualTo("first");
    }

    @Test
    void completionWordsNeverReachHundred() {
        assertThat(table.match("Generated .osz saved to /out/map.osz")).get()
            .satisfies(rule -> {
                assertThat(rule.getStage()).isEqualTo("finishing");
                assertThat(rule.getRangeStart()).isLessThan(100.0);
            });
    }

    @Test
    void unknownLinesDoNotMatch() {
        assertThat(table.match("hello world")).isEmpty();
        assertThat(table.match("   ")).isEmpty();
        assertThat(table.match(null)).isEmpty();
    }

    @Test
    void categoryComesFromFirstRowWithStage() {
        assertThat(table.categoryOf("generating_map")).isEqualTo(StageCategory.GENERATION);
        assertThat(table.categoryOf("loading")).isEqualTo(StageCategory.LOADING);
        assertThat(table.categoryOf("initializing")).isEqualTo(StageCategory.LOADING);
        assertThat(table.categoryOf("nonexistent")).isEqualTo(StageCategory.OTHER);
    }

    @Test
    void rejectsInvalidRules() {
        assertThatThrownBy(() -> StageRule.of(" ", "stage", 0, 10, StageCategory.OTHER))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StageRule.of("word", "stage", 50, 10, StageCategory.OTHER))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StageTable.of(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
