package com.streamfirst.history.application;

import com.streamfirst.history.domain.ChannelError;
import com.streamfirst.history.domain.ChannelResult;
import com.streamfirst.history.domain.FetchProgress;
import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.HistoryTransportException;
import com.streamfirst.history.domain.RetrievalCancelledException;
import com.streamfirst.history.domain.RetrievalOptions;
import com.streamfirst.history.domain.RetrievalRequest;
import com.streamfirst.history.domain.SafetyCapExceededException;
import com.streamfirst.history.ports.HistoryPort;
import com.streamfirst.history.ports.ProgressListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives history retrieval for a multi-channel request. Each channel runs its own {@link
 * RetrievalSession}; a failure in one channel is recorded on that channel's {@link ChannelResult}
 * and never aborts the others. Every requested channel gets exactly one result, in request order.
 *
 * <p>Channels run one at a time unless {@link RetrievalOptions#getMaxConcurrentChannels()} allows
 * a bounded pool. Cancellation is cooperative: it is checked between batches and between channels.
 */
@Slf4j
public class HistoryRetrievalOrchestrator implements AutoCloseable {

  private final RetrievalOptions options;
  private final BatchFetcher fetcher;
  private final ExecutorService callExecutor;

  public HistoryRetrievalOrchestrator(HistoryPort historyPort, RetrievalOptions options) {
    this.options = options;
    this.callExecutor = Executors.newCachedThreadPool(daemonThreads("history-call"));
    this.fetcher = new BatchFetcher(historyPort, options.getRequestTimeout(), callExecutor);
  }

  public RetrievalOptions options() {
    return options;
  }

  /** Retrieves history without progress reporting or cancellation. */
  public List<ChannelResult> retrieve(RetrievalRequest request) {
    return retrieve(request, ProgressListener.NONE, CancellationSignal.create());
  }

  public List<ChannelResult> retrieve(RetrievalRequest request, ProgressListener listener) {
    return retrieve(request, listener, CancellationSignal.create());
  }

  /**
   * Retrieves history for every channel in the request.
   *
   * @param request channels, per-channel target and window
   * @param listener receives progress after each batch
   * @param cancellation stops the retrieval between batches when fired
   * @return one result per requested channel, in request order
   */
  public List<ChannelResult> retrieve(
      RetrievalRequest request, ProgressListener listener, CancellationSignal cancellation) {
    log.info(
        "Retrieving up to {} records from each of {} channels ({} window)",
        request.targetCount(),
        request.channels().size(),
        request.window().mode());

    ProgressTracker tracker = new ProgressTracker(request, listener);
    int workers = Math.min(options.getMaxConcurrentChannels(), request.channels().size());
    List<ChannelResult> results =
        workers <= 1
            ? retrieveSequentially(request, tracker, cancellation)
            : retrieveConcurrently(request, tracker, cancellation, workers);

    long failed = results.stream().filter(r -> !r.isSuccess()).count();
    log.info(
        "Retrieved {} records from {} channels ({} failed)",
        results.stream().mapToInt(ChannelResult::totalMessages).sum(),
        results.size(),
        failed);
    return results;
  }

  private List<ChannelResult> retrieveSequentially(
      RetrievalRequest request, ProgressTracker tracker, CancellationSignal cancellation) {
    List<ChannelResult> results = new ArrayList<>(request.channels().size());
    for (String channel : request.channels()) {
      results.add(retrieveChannel(channel, request, tracker, cancellation));
    }
    return results;
  }

  private List<ChannelResult> retrieveConcurrently(
      RetrievalRequest request,
      ProgressTracker tracker,
      CancellationSignal cancellation,
      int workers) {
    ExecutorService pool = Executors.newFixedThreadPool(workers, daemonThreads("history-channel"));
    try {
      List<CompletableFuture<ChannelResult>> pending =
          request.channels().stream()
              .map(
                  channel ->
                      CompletableFuture.supplyAsync(
                          () -> retrieveChannel(channel, request, tracker, cancellation), pool))
              .toList();
      return pending.stream().map(CompletableFuture::join).toList();
    } finally {
      pool.shutdownNow();
    }
  }

  /** Runs one channel session and folds every failure into its result. */
  private ChannelResult retrieveChannel(
      String channel,
      RetrievalRequest request,
      ProgressTracker tracker,
      CancellationSignal cancellation) {
    if (cancellation.isCancelled()) {
      log.debug("Skipping channel {}: retrieval cancelled", channel);
      return ChannelResult.failure(
          channel, new ChannelError(ChannelError.Kind.CANCELLED, "Cancelled before start"));
    }

    RetrievalSession session =
        new RetrievalSession(
            channel,
            request.targetCount(),
            request.window(),
            options,
            request.channels().size() == 1);
    tracker.channelStarted(channel);

    try {
      List<HistoryRecord> records =
          session.run(
              fetcher,
              cancellation,
              (batch, accumulated) -> tracker.batchCompleted(channel, batch, accumulated));
      log.info(
          "Fetched {} records from {} in {} batches",
          records.size(),
          channel,
          session.iterationsDone());
      return ChannelResult.success(channel, records);
    } catch (HistoryTransportException e) {
      log.warn("History call failed for channel {}: {}", channel, e.getMessage());
      return ChannelResult.failure(
          channel, new ChannelError(ChannelError.Kind.TRANSPORT, e.getMessage()));
    } catch (SafetyCapExceededException e) {
      log.warn("Pagination stalled for channel {}: {}", channel, e.getMessage());
      return ChannelResult.failure(
          channel, new ChannelError(ChannelError.Kind.SAFETY_CAP_EXCEEDED, e.getMessage()));
    } catch (RetrievalCancelledException e) {
      log.warn("Retrieval of channel {} cancelled after {} batches", channel, session.iterationsDone());
      return ChannelResult.partial(
          channel,
          session.partialRecords(),
          new ChannelError(ChannelError.Kind.CANCELLED, e.getMessage()));
    } catch (RuntimeException e) {
      log.error("Unexpected failure retrieving channel {}", channel, e);
      return ChannelResult.failure(
          channel, new ChannelError(ChannelError.Kind.UNEXPECTED, String.valueOf(e.getMessage())));
    }
  }

  @Override
  public void close() {
    callExecutor.shutdownNow();
    try {
      if (!callExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
        log.warn("History call threads still running after shutdown");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger(1);
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }

  /** Aggregates per-channel counts into request-wide progress events. */
  private final class ProgressTracker {

    private final ProgressListener listener;
    private final int total;
    private final int totalBatches;
    private final AtomicInteger current = new AtomicInteger();
    private final Map<String, Integer> perChannel = new ConcurrentHashMap<>();

    ProgressTracker(RetrievalRequest request, ProgressListener listener) {
      this.listener = listener;
      this.total = request.totalTarget();
      this.totalBatches = options.expectedBatches(request.targetCount());
    }

    void channelStarted(String channel) {
      publish(new FetchProgress(current.get(), total, channel, 0, totalBatches));
    }

    void batchCompleted(String channel, int batch, int accumulated) {
      Integer previous = perChannel.put(channel, accumulated);
      int now = current.addAndGet(accumulated - (previous == null ? 0 : previous));
      publish(new FetchProgress(now, total, channel, batch, totalBatches));
    }

    private void publish(FetchProgress progress) {
      try {
        listener.onProgress(progress);
      } catch (RuntimeException e) {
        log.warn("Progress listener failed on {}", progress, e);
      }
    }
  }
}
