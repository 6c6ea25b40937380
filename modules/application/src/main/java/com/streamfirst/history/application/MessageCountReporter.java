package com.streamfirst.history.application;

import com.streamfirst.history.domain.RetrievalRequest;
import com.streamfirst.history.domain.Timetoken;
import com.streamfirst.history.ports.HistoryPort;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Counts stored messages per channel. Without an explicit baseline the count covers a fixed
 * lookback (30 days by default) ending now.
 */
@Slf4j
@RequiredArgsConstructor
public class MessageCountReporter {

  public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(30);

  private final HistoryPort historyPort;
  private final Clock clock;
  private final Duration lookback;

  public MessageCountReporter(HistoryPort historyPort) {
    this(historyPort, Clock.systemUTC(), DEFAULT_LOOKBACK);
  }

  /** Counts messages published within the lookback window. */
  public Map<String, Integer> countMessages(List<String> channels) {
    Timetoken since = Timetoken.fromInstant(clock.instant().minus(lookback));
    return countMessagesSince(channels, since);
  }

  /**
   * Counts messages published after {@code since} on each channel.
   *
   * @return a count for every requested channel, in request order; 0 where the upstream
   *     reports nothing
   * @throws com.streamfirst.history.domain.HistoryTransportException if the call fails
   */
  public Map<String, Integer> countMessagesSince(List<String> channels, Timetoken since) {
    List<String> requested = RetrievalRequest.parseChannels(String.join(",", channels));
    log.debug("Counting messages since {} on {}", since, requested);

    Map<String, Integer> upstream = historyPort.countMessagesSince(requested, since);
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String channel : requested) {
      Integer count = upstream == null ? null : upstream.get(channel);
      counts.put(channel, count == null ? 0 : count);
    }

    log.info("Counted {} messages across {} channels", counts.values().stream().mapToInt(Integer::intValue).sum(), counts.size());
    return counts;
  }
}
