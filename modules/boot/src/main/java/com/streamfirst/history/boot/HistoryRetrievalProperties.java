package com.streamfirst.history.boot;

import com.streamfirst.history.domain.RetrievalOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized settings under the {@code history} prefix.
 */
@Data
@ConfigurationProperties(prefix = "history")
public class HistoryRetrievalProperties {

    private Retrieval retrieval = new Retrieval();
    private Counts counts = new Counts();
    private Demo demo = new Demo();

    @Data
    public static class Retrieval {
        private int batchCap = RetrievalOptions.MAX_BATCH_CAP;
        private int safetySlack = 2;
        private Duration interBatchDelay = Duration.ofMillis(100);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private int maxConcurrentChannels = 1;
        private boolean includeMeta = false;
        private boolean includePublisher = true;
        private boolean includeRecordType = true;
        private boolean includeMessageActions = false;
    }

    @Data
    public static class Counts {
        /** How far back message counts reach when no baseline is given */
        private Duration lookback = Duration.ofDays(30);
    }

    @Data
    public static class Demo {
        private boolean enabled = true;
        private String channels = "orders,payments";
        private int targetCount = 250;
        private String zone = "America/New_York";
    }

    /**
     * Validated retrieval options; invalid values fail here at startup.
     */
    public RetrievalOptions toOptions() {
        return RetrievalOptions.builder()
            .batchCap(retrieval.batchCap)
            .safetySlack(retrieval.safetySlack)
            .interBatchDelay(retrieval.interBatchDelay)
            .requestTimeout(retrieval.requestTimeout)
            .maxConcurrentChannels(retrieval.maxConcurrentChannels)
            .includeMeta(retrieval.includeMeta)
            .includePublisher(retrieval.includePublisher)
            .includeRecordType(retrieval.includeRecordType)
            .includeMessageActions(retrieval.includeMessageActions)
            .build();
    }
}
