package com.streamfirst.history.application;

import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.RetrievalOptions;
import com.streamfirst.history.domain.SafetyCapExceededException;
import com.streamfirst.history.domain.WindowBound;
import com.streamfirst.history.ports.HistoryQuery;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Retrieval state for one channel: the cursor policy, the accumulated records and the iteration
 * count. Created per channel, driven to completion once, then discarded.
 *
 * <p>Each batch is awaited before the next cursor is computed since the cursor for batch n+1
 * depends on batch n.
 */
@Slf4j
public final class RetrievalSession {

  /** Receives the batch number and accumulated record count after every batch. */
  @FunctionalInterface
  public interface BatchListener {
    void batchCompleted(int batchNumber, int accumulated);
  }

  private final String channel;
  private final int targetCount;
  private final WindowBound window;
  private final RetrievalOptions options;
  private final boolean singleChannel;
  private final WindowPolicy policy;
  private final DeduplicatingAccumulator accumulator;
  private int iterationsDone;

  public RetrievalSession(
      String channel,
      int targetCount,
      WindowBound window,
      RetrievalOptions options,
      boolean singleChannel) {
    this.channel = channel;
    this.targetCount = targetCount;
    this.window = window;
    this.options = options;
    this.singleChannel = singleChannel;
    this.policy = WindowPolicy.forWindow(window);
    this.accumulator = new DeduplicatingAccumulator(targetCount);
  }

  /**
   * Runs the batch loop until the target is met or the history is exhausted.
   *
   * @return unique records sorted by timetoken ascending, at most {@code targetCount}
   * @throws com.streamfirst.history.domain.HistoryTransportException if a batch call fails
   * @throws SafetyCapExceededException if pagination stops making progress
   * @throws com.streamfirst.history.domain.RetrievalCancelledException if cancelled
   */
  public List<HistoryRecord> run(
      BatchFetcher fetcher, CancellationSignal cancellation, BatchListener listener) {
    int iterationCap = options.iterationCap(targetCount);
    log.debug(
        "Starting {} session for {}: target {}, iteration cap {}",
        policy.mode(),
        channel,
        targetCount,
        iterationCap);

    while (accumulator.remaining() > 0) {
      cancellation.throwIfCancelled(channel);
      if (iterationsDone >= iterationCap) {
        throw new SafetyCapExceededException(
            channel,
            iterationsDone,
            "Channel " + channel + " still short of " + targetCount + " records after "
                + iterationsDone + " batches");
      }

      int batchSize = Math.min(accumulator.remaining(), options.getBatchCap());
      HistoryQuery query =
          HistoryQuery.of(
              channel, batchSize, policy.startCursor(), policy.endCursor(), options, singleChannel);
      List<HistoryRecord> fetched = fetcher.fetch(query);
      iterationsDone++;

      if (fetched.isEmpty()) {
        listener.batchCompleted(iterationsDone, accumulator.size());
        log.debug("Channel {} returned no records on batch {}, history exhausted", channel, iterationsDone);
        break;
      }

      List<HistoryRecord> batch = keepNearestToCursor(insideWindow(fetched), batchSize);
      int added = batch.isEmpty() ? 0 : accumulator.merge(batch);
      listener.batchCompleted(iterationsDone, accumulator.size());

      if (added == 0) {
        if (fetched.size() >= batchSize) {
          throw new SafetyCapExceededException(
              channel,
              iterationsDone,
              "Channel " + channel + " returned a full batch of already seen records on batch "
                  + iterationsDone);
        }
        log.debug("Channel {} returned only known records, history exhausted", channel);
        break;
      }
      if (policy.advance(batch) == WindowPolicy.Step.COMPLETE) {
        break;
      }
      if (fetched.size() < batchSize) {
        log.debug(
            "Channel {} returned {} of {} requested records, end of history",
            channel,
            fetched.size(),
            batchSize);
        break;
      }
      if (accumulator.remaining() > 0) {
        cancellation.pause(options.getInterBatchDelay(), channel);
      }
    }

    log.debug("Channel {} finished with {} records in {} batches", channel, accumulator.size(), iterationsDone);
    return accumulator.sortedRecords();
  }

  /** Records accumulated so far, sorted ascending. */
  public List<HistoryRecord> partialRecords() {
    return accumulator.sortedRecords();
  }

  public int iterationsDone() {
    return iterationsDone;
  }

  public String channel() {
    return channel;
  }

  private List<HistoryRecord> insideWindow(List<HistoryRecord> batch) {
    return batch.stream().filter(r -> window.contains(r.getTimetoken())).toList();
  }

  /** Trims an oversized batch from the side away from the cursor. */
  private List<HistoryRecord> keepNearestToCursor(List<HistoryRecord> ascending, int batchSize) {
    if (ascending.size() <= batchSize) {
      return ascending;
    }
    log.warn("Channel {} returned {} records for a batch of {}", channel, ascending.size(), batchSize);
    return policy.mode().walksForward()
        ? ascending.subList(0, batchSize)
        : ascending.subList(ascending.size() - batchSize, ascending.size());
  }
}
