package com.whereq.foundry.config;

import com.whereq.foundry.progress.StageCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Foundry.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "foundry")
@Data
public class FoundryProperties {

    private WorkerConfig worker = new WorkerConfig();

    private ProgressConfig progress = new ProgressConfig();

    private CacheConfig cache = new CacheConfig();

    private JanitorConfig janitor = new JanitorConfig();

    private DownloadConfig download = new DownloadConfig();

    @Data
    public static class WorkerConfig {
        /**
         * Time a cancelled worker gets to exit after the graceful signal
         * before it is killed forcibly.
         */
        private Duration gracePeriod = Duration.ofSeconds(5);

        /**
         * Name prefix for output collector threads.
         */
        private String collectorThreadPrefix = "job-collector-";
    }

    @Data
    public static class ProgressConfig {
        /**
         * Silence after which the elapsed-time fallback may nudge progress.
         */
        private Duration quiescence = Duration.ofSeconds(5);

        /**
         * Empirical total duration of a generation run, used for time extrapolation.
         */
        private Duration assumedDuration = Duration.ofSeconds(180);

        /**
         * Upper bound of the time extrapolation.
         */
        private double timeCeiling = 90.0;

        /**
         * Upper bound of any elapsed-time nudge. The rest is reserved for a confirmed exit.
         */
        private double ceiling = 95.0;

        /**
         * Replacement stage table. Empty means the built-in table is used.
         */
        private List<StageRuleConfig> stages = new ArrayList<>();
    }

    @Data
    public static class StageRuleConfig {
        private String keyword;
        private String stage;
        private double start;
        private double end;
        private StageCategory category = StageCategory.OTHER;
    }

    @Data
    public static class CacheConfig {
        /**
         * Master switch. When false the cache is disabled without probing Redis.
         */
        private boolean enabled = true;

        /**
         * Upper bound for the startup connectivity probe.
         */
        private Duration probeTimeout = Duration.ofSeconds(2);

        private Duration progressTtl = Duration.ofHours(2);

        private Duration metadataTtl = Duration.ofHours(2);

        private Duration filesTtl = Duration.ofHours(1);
    }

    @Data
    public static class JanitorConfig {
        /**
         * Period of the store sweep.
         */
        private Duration interval = Duration.ofMinutes(5);

        /**
         * How long a finished job stays queryable in memory.
         */
        private Duration retention = Duration.ofHours(1);

        /**
         * Period of the sweep that removes cache keys without expiry.
         */
        private Duration cachePurgeInterval = Duration.ofHours(1);
    }

    @Data
    public static class DownloadConfig {
        /**
         * Base path used to build download links for output files.
         */
        private String basePath = "/api/v1/jobs";
    }
}
