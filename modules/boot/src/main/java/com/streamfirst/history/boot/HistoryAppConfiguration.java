package com.streamfirst.history.boot;

import com.streamfirst.history.adapters.InMemoryHistoryAdapter;
import com.streamfirst.history.application.HistoryRetrievalOrchestrator;
import com.streamfirst.history.application.HistorySearch;
import com.streamfirst.history.application.MessageCountReporter;
import com.streamfirst.history.application.MessageDeletionCoordinator;
import com.streamfirst.history.application.TimetokenConverter;
import com.streamfirst.history.domain.ChannelResult;
import com.streamfirst.history.domain.Result;
import com.streamfirst.history.domain.RetrievalRequest;
import com.streamfirst.history.domain.Timetoken;
import com.streamfirst.history.domain.WindowBound;
import com.streamfirst.history.ports.HistoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Wires the retrieval engine against the in-memory history store and runs a demo walk.
 */
@Slf4j
@Configuration
public class HistoryAppConfiguration {

    // --- Adapter Beans ---

    @Bean
    public InMemoryHistoryAdapter historyStore() {
        log.info("Creating in-memory history store");
        return new InMemoryHistoryAdapter();
    }

    // --- Application Service Beans ---

    @Bean(destroyMethod = "close")
    public HistoryRetrievalOrchestrator historyRetrievalOrchestrator(
            HistoryPort historyPort, HistoryRetrievalProperties properties) {
        return new HistoryRetrievalOrchestrator(historyPort, properties.toOptions());
    }

    @Bean
    public MessageCountReporter messageCountReporter(
            HistoryPort historyPort, HistoryRetrievalProperties properties) {
        return new MessageCountReporter(historyPort, Clock.systemUTC(), properties.getCounts().getLookback());
    }

    @Bean
    public MessageDeletionCoordinator messageDeletionCoordinator(HistoryPort historyPort) {
        return new MessageDeletionCoordinator(historyPort);
    }

    // --- Demo runner ---

    @Bean
    @ConditionalOnProperty(prefix = "history.demo", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CommandLineRunner demo(
            InMemoryHistoryAdapter historyStore,
            HistoryRetrievalOrchestrator orchestrator,
            MessageCountReporter countReporter,
            MessageDeletionCoordinator deletionCoordinator,
            HistoryRetrievalProperties properties) {
        return args -> {
            HistoryRetrievalProperties.Demo demo = properties.getDemo();
            ZoneId zone = ZoneId.of(demo.getZone());
            List<String> channels = RetrievalRequest.parseChannels(demo.getChannels());
            log.info("--- Starting history retrieval demo for {} ---", channels);

            // 1. Seed one message per minute over the last day
            Instant dayAgo = Instant.now().truncatedTo(ChronoUnit.MINUTES).minus(1, ChronoUnit.DAYS);
            long minute = 60_000L * Timetoken.TICKS_PER_MILLI;
            for (String channel : channels) {
                historyStore.seed(channel, 24 * 60, Timetoken.fromInstant(dayAgo).value(), minute);
            }

            // 2. Walk forward from twelve hours ago
            Timetoken windowStart = Timetoken.fromInstant(dayAgo.plus(12, ChronoUnit.HOURS));
            RetrievalRequest request = new RetrievalRequest(
                channels, demo.getTargetCount(), WindowBound.after(windowStart));
            log.info("Retrieving {} per channel after {}", demo.getTargetCount(),
                TimetokenConverter.format(windowStart, zone));

            List<ChannelResult> results = orchestrator.retrieve(request, progress ->
                log.info("Progress {}/{} on {} (batch {}/{})", progress.current(), progress.total(),
                    progress.currentChannel(), progress.currentBatch(), progress.totalBatches()));
            for (ChannelResult result : results) {
                log.info("{}: {} records, {} .. {}{}", result.channel(), result.totalMessages(),
                    result.oldestTimetoken().map(t -> TimetokenConverter.format(t, zone)).orElse("-"),
                    result.newestTimetoken().map(t -> TimetokenConverter.format(t, zone)).orElse("-"),
                    result.errorDetail().map(e -> " [" + e.kind() + ": " + e.message() + "]").orElse(""));
            }

            // 3. Search and count
            int matches = HistorySearch.countRecords(HistorySearch.filter(results, "publisher-1"));
            log.info("Records published by publisher-1: {}", matches);
            Map<String, Integer> counts = countReporter.countMessages(channels);
            log.info("Messages in the last {}: {}", properties.getCounts().getLookback(), counts);

            // 4. Delete the newest retrieved message of the first channel
            results.get(0).newestTimetoken().ifPresent(newest -> {
                Result<Void> deletion = deletionCoordinator.deleteMessage(results.get(0).channel(), newest);
                if (deletion.isSuccess()) {
                    log.info("Deleted {} from {}", newest, results.get(0).channel());
                } else {
                    log.warn("Delete rejected ({}): {}", deletion.getErrorCode().orElse("?"),
                        deletion.getErrorMessage().orElse(""));
                }
            });

            log.info("--- Demo finished ---");
        };
    }
}
