package com.whereq.foundry.config;

import com.whereq.foundry.executor.DefaultProcessLauncher;
import com.whereq.foundry.executor.ProcessLauncher;
import com.whereq.foundry.progress.ProgressEstimator;
import com.whereq.foundry.progress.ProgressTuning;
import com.whereq.foundry.progress.StageRule;
import com.whereq.foundry.progress.StageTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wiring for the progress estimator, the process launcher and the clock.
 *
 * @author WhereQ Inc.
 */
@Configuration
@Slf4j
public class FoundryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return new DefaultProcessLauncher();
    }

    @Bean
    public StageTable stageTable(FoundryProperties properties) {
        List<FoundryProperties.StageRuleConfig> configured = properties.getProgress().getStages();
        if (configured == null || configured.isEmpty()) {
            return StageTable.defaults();
        }

        List<StageRule> rules = configured.stream()
            .map(c -> StageRule.of(c.getKeyword(), c.getStage(), c.getStart(), c.getEnd(), c.getCategory()))
            .toList();

        log.info("Using configured stage table with {} rules", rules.size());
        return StageTable.of(rules);
    }

    @Bean
    public ProgressEstimator progressEstimator(StageTable stageTable, FoundryProperties properties) {
        FoundryProperties.ProgressConfig progress = properties.getProgress();

        ProgressTuning tuning = ProgressTuning.builder()
            .quiescence(progress.getQuiescence())
            .assumedDuration(progress.getAssumedDuration())
            .timeCeiling(progress.getTimeCeiling())
            .ceiling(progress.getCeiling())
            .build();

        return new ProgressEstimator(stageTable, tuning);
    }
}
