package com.streamfirst.history.application;

import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.HistoryTransportException;
import com.streamfirst.history.domain.RetrievalCancelledException;
import com.streamfirst.history.ports.HistoryPort;
import com.streamfirst.history.ports.HistoryQuery;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues a single bounded history call and normalizes the answer.
 *
 * <p>The upstream's ordering convention is not trusted: every batch is returned sorted by
 * timetoken ascending. Failures are not retried; they surface as {@link
 * HistoryTransportException}, including calls that exceed the request timeout.
 */
@Slf4j
public class BatchFetcher {

  private static final Comparator<HistoryRecord> BY_TIMETOKEN =
      Comparator.comparing(HistoryRecord::getTimetoken);

  private final HistoryPort historyPort;
  private final Duration requestTimeout;
  private final ExecutorService callExecutor;

  /**
   * @param historyPort upstream history API
   * @param requestTimeout per-call limit, zero for none
   * @param callExecutor runs timed calls and is interrupted when one overruns; may be null when
   *     the timeout is zero
   */
  public BatchFetcher(
      HistoryPort historyPort, Duration requestTimeout, ExecutorService callExecutor) {
    this.historyPort = historyPort;
    this.requestTimeout = requestTimeout;
    this.callExecutor =
        requestTimeout.isZero()
            ? callExecutor
            : Objects.requireNonNull(callExecutor, "A timed fetcher needs an executor");
  }

  /** A fetcher without a request timeout. */
  public BatchFetcher(HistoryPort historyPort) {
    this(historyPort, Duration.ZERO, null);
  }

  /**
   * Fetches one batch.
   *
   * @return records sorted by timetoken ascending, possibly empty
   * @throws HistoryTransportException on any upstream failure or timeout
   */
  public List<HistoryRecord> fetch(HistoryQuery query) {
    log.debug(
        "Fetching up to {} records from {} (start={}, end={})",
        query.count(),
        query.channel(),
        query.start(),
        query.end());

    List<HistoryRecord> batch = requestTimeout.isZero() ? call(query) : callWithTimeout(query);
    if (batch == null || batch.isEmpty()) {
      return List.of();
    }

    List<HistoryRecord> sorted = new ArrayList<>(batch);
    sorted.sort(BY_TIMETOKEN);
    return List.copyOf(sorted);
  }

  private List<HistoryRecord> call(HistoryQuery query) {
    try {
      return historyPort.fetchHistory(query);
    } catch (HistoryTransportException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new HistoryTransportException(
          "History call failed for channel " + query.channel() + ": " + e.getMessage(), e);
    }
  }

  private List<HistoryRecord> callWithTimeout(HistoryQuery query) {
    Future<List<HistoryRecord>> pending = callExecutor.submit(() -> call(query));
    try {
      return pending.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      pending.cancel(true);
      throw HistoryTransportException.timedOut(
          "History call for channel " + query.channel() + " timed out after " + requestTimeout, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof HistoryTransportException transport) {
        throw transport;
      }
      throw new HistoryTransportException(
          "History call failed for channel " + query.channel(), cause);
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      throw new RetrievalCancelledException(
          "Interrupted while fetching channel " + query.channel());
    }
  }
}
