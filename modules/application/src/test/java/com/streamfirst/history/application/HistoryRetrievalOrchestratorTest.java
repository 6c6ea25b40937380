package com.streamfirst.history.application;

import static com.streamfirst.history.application.ScriptedHistoryPort.records;
import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.history.adapters.InMemoryHistoryAdapter;
import com.streamfirst.history.domain.ChannelError;
import com.streamfirst.history.domain.ChannelResult;
import com.streamfirst.history.domain.FetchProgress;
import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.HistoryTransportException;
import com.streamfirst.history.domain.RetrievalOptions;
import com.streamfirst.history.domain.RetrievalRequest;
import com.streamfirst.history.domain.Timetoken;
import com.streamfirst.history.domain.WindowBound;
import com.streamfirst.history.ports.HistoryQuery;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class HistoryRetrievalOrchestratorTest {

  private static final long BASE = 17_000_000_000_000_000L;
  private static final long STEP = 10_000L;

  private static final RetrievalOptions FAST =
      RetrievalOptions.builder().interBatchDelay(Duration.ZERO).build();

  private InMemoryHistoryAdapter upstream;
  private HistoryRetrievalOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    upstream = new InMemoryHistoryAdapter();
    upstream.seed("orders", 500, BASE, STEP);
    orchestrator = new HistoryRetrievalOrchestrator(upstream, FAST);
  }

  @AfterEach
  void tearDown() {
    orchestrator.close();
  }

  private static Timetoken tt(int index) {
    return Timetoken.of(BASE + index * STEP);
  }

  private ChannelResult retrieveOrders(int target, WindowBound window) {
    return orchestrator.retrieve(new RetrievalRequest(List.of("orders"), target, window)).get(0);
  }

  @Test
  void small_unbounded_request_needs_exactly_one_call() {
    ChannelResult result = retrieveOrders(100, WindowBound.unbounded());

    assertThat(upstream.getCalls()).hasSize(1);
    assertThat(result.isSuccess()).isTrue();
    assertThat(result.records()).hasSize(100);
    assertThat(result.oldestTimetoken()).contains(tt(400));
    assertThat(result.newestTimetoken()).contains(tt(499));
  }

  @Test
  void large_request_is_split_into_capped_batches() {
    ChannelResult result = retrieveOrders(250, WindowBound.unbounded());

    assertThat(upstream.getCalls()).extracting(HistoryQuery::count).containsExactly(100, 100, 50);
    assertThat(result.records()).hasSize(250);
    assertThat(result.records().stream().map(HistoryRecord::getTimetoken).distinct()).hasSize(250);
    assertThat(result.records())
        .extracting(HistoryRecord::getTimetoken)
        .isSortedAccordingTo(Timetoken::compareTo);
    assertThat(result.oldestTimetoken()).contains(tt(250));
  }

  @Test
  void stops_on_a_short_batch() {
    ChannelResult result = retrieveOrders(1_000, WindowBound.until(tt(449)));

    assertThat(result.records()).hasSize(450);
    assertThat(upstream.getCalls()).extracting(HistoryQuery::count).containsOnly(100);
    assertThat(upstream.getCalls()).hasSize(5);
  }

  @Test
  void stops_on_an_empty_batch() {
    ChannelResult result = retrieveOrders(1_000, WindowBound.unbounded());

    assertThat(result.records()).hasSize(500);
    assertThat(upstream.getCalls()).hasSize(6);
  }

  @Test
  void start_only_walks_forward_from_the_start_bound() {
    ChannelResult result = retrieveOrders(250, WindowBound.after(tt(99)));

    assertThat(result.oldestTimetoken()).contains(tt(100));
    assertThat(result.newestTimetoken()).contains(tt(349));
    assertThat(upstream.getCalls()).extracting(HistoryQuery::start)
        .containsExactly(tt(99), tt(199).next(), tt(299).next());
  }

  @Test
  void end_only_walks_backward_to_the_beginning_of_history() {
    ChannelResult result = retrieveOrders(1_000, WindowBound.until(tt(299)));

    assertThat(result.records()).hasSize(300);
    assertThat(result.oldestTimetoken()).contains(tt(0));
    assertThat(result.newestTimetoken()).contains(tt(299));
    assertThat(upstream.getCalls()).extracting(HistoryQuery::end)
        .containsExactly(tt(299), tt(200).previous(), tt(100).previous(), tt(0).previous());
  }

  @Test
  void bounded_window_completes_when_start_reaches_end() {
    ChannelResult result = retrieveOrders(1_000, WindowBound.between(tt(49), tt(349)));

    assertThat(upstream.getCalls()).hasSize(3);
    assertThat(result.records()).hasSize(300);
    assertThat(result.records())
        .allSatisfy(r -> {
          assertThat(r.getTimetoken()).isGreaterThan(tt(49));
          assertThat(r.getTimetoken()).isLessThanOrEqualTo(tt(349));
        });
  }

  @Test
  void bounded_window_is_idempotent_against_unchanged_history() {
    WindowBound window = WindowBound.between(tt(10), tt(420));

    List<HistoryRecord> first = retrieveOrders(333, window).records();
    List<HistoryRecord> second = retrieveOrders(333, window).records();

    assertThat(new HashSet<>(second)).isEqualTo(new HashSet<>(first));
  }

  static Stream<Arguments> windows() {
    return Stream.of(
        Arguments.of(WindowBound.unbounded(), 450),
        Arguments.of(WindowBound.after(tt(20)), 450),
        Arguments.of(WindowBound.until(tt(470)), 450),
        Arguments.of(WindowBound.between(tt(20), tt(480)), 1_000));
  }

  @ParameterizedTest
  @MethodSource("windows")
  void no_batch_returns_data_a_previous_batch_already_returned(WindowBound window, int target) {
    for (InMemoryHistoryAdapter.ResponseOrder order : InMemoryHistoryAdapter.ResponseOrder.values()) {
      upstream.setResponseOrder(order);
      RecordingHistoryPort recording = new RecordingHistoryPort(upstream);
      try (HistoryRetrievalOrchestrator recorded = new HistoryRetrievalOrchestrator(recording, FAST)) {
        ChannelResult result =
            recorded.retrieve(new RetrievalRequest(List.of("orders"), target, window)).get(0);

        Set<Timetoken> returned = new HashSet<>();
        for (List<HistoryRecord> response : recording.responses) {
          for (HistoryRecord record : response) {
            assertThat(returned.add(record.getTimetoken()))
                .as("%s returned %s twice (%s order)", window.mode(), record.getTimetoken(), order)
                .isTrue();
          }
        }
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.records()).hasSize(returned.size());
        assertThat(result.records()).allSatisfy(r -> assertThat(window.contains(r.getTimetoken())).isTrue());
      }
    }
  }

  @Test
  void one_failing_channel_does_not_hide_the_others() {
    upstream.seed("alerts", 40, BASE, STEP);
    upstream.failChannel(
        "billing", () -> HistoryTransportException.status(500, "boom", null, List.of("billing")));

    List<ChannelResult> results =
        orchestrator.retrieve(new RetrievalRequest(List.of("orders", "billing", "alerts"), 120, null));

    assertThat(results).extracting(ChannelResult::channel).containsExactly("orders", "billing", "alerts");
    assertThat(results.get(0).records()).hasSize(120);
    assertThat(results.get(1).records()).isEmpty();
    assertThat(results.get(1).errorDetail()).map(ChannelError::kind).contains(ChannelError.Kind.TRANSPORT);
    assertThat(results.get(2).records()).hasSize(40);
    assertThat(results.get(2).isSuccess()).isTrue();
  }

  @Test
  void upstream_repeating_the_same_page_hits_the_safety_cap() {
    upstream.ignoreCursors("orders");

    ChannelResult result = retrieveOrders(1_000, WindowBound.unbounded());

    assertThat(result.errorDetail()).map(ChannelError::kind).contains(ChannelError.Kind.SAFETY_CAP_EXCEEDED);
    assertThat(result.records()).isEmpty();
    assertThat(upstream.getCalls()).hasSizeLessThanOrEqualTo(FAST.iterationCap(1_000));
  }

  @Test
  void trickling_progress_is_stopped_by_the_iteration_cap() {
    // every call returns 100 records of which only one is new
    AtomicInteger call = new AtomicInteger();
    ScriptedHistoryPort trickle =
        new ScriptedHistoryPort(q -> {
          int n = call.incrementAndGet();
          return records("trickle", n, n + 99);
        });

    try (HistoryRetrievalOrchestrator capped = new HistoryRetrievalOrchestrator(trickle, FAST)) {
      ChannelResult result = capped.retrieve(RetrievalRequest.of("trickle", 1_000)).get(0);

      assertThat(result.errorDetail()).map(ChannelError::kind).contains(ChannelError.Kind.SAFETY_CAP_EXCEEDED);
      assertThat(trickle.queries).hasSize(FAST.iterationCap(1_000));
    }
  }

  @Test
  void oversized_batches_are_trimmed_to_the_requested_size() {
    ScriptedHistoryPort generous = new ScriptedHistoryPort(q -> records("c", 1, 150));

    try (HistoryRetrievalOrchestrator trimmed = new HistoryRetrievalOrchestrator(generous, FAST)) {
      ChannelResult result = trimmed.retrieve(RetrievalRequest.of("c", 100)).get(0);

      assertThat(result.records()).hasSize(100);
      assertThat(result.oldestTimetoken()).contains(Timetoken.of(51));
      assertThat(result.newestTimetoken()).contains(Timetoken.of(150));
    }
  }

  @Test
  void reports_progress_after_every_batch() {
    List<FetchProgress> events = new ArrayList<>();

    orchestrator.retrieve(RetrievalRequest.of("orders", 250), events::add);

    assertThat(events).containsExactly(
        new FetchProgress(0, 250, "orders", 0, 3),
        new FetchProgress(100, 250, "orders", 1, 3),
        new FetchProgress(200, 250, "orders", 2, 3),
        new FetchProgress(250, 250, "orders", 3, 3));
  }

  @Test
  void reports_progress_for_the_batch_that_comes_back_empty() {
    List<FetchProgress> events = new ArrayList<>();

    orchestrator.retrieve(RetrievalRequest.of("orders", 1_000), events::add);

    assertThat(upstream.getCalls()).hasSize(6);
    assertThat(events).hasSize(7);
    assertThat(events).last().isEqualTo(new FetchProgress(500, 1_000, "orders", 6, 10));
  }

  @Test
  void progress_aggregates_across_channels() {
    upstream.seed("alerts", 30, BASE, STEP);
    List<FetchProgress> events = new ArrayList<>();

    orchestrator.retrieve(new RetrievalRequest(List.of("orders", "alerts"), 100, null), events::add);

    assertThat(events).last().isEqualTo(new FetchProgress(130, 200, "alerts", 1, 1));
  }

  @Test
  void failing_progress_listener_does_not_abort_the_fetch() {
    ChannelResult result =
        orchestrator.retrieve(RetrievalRequest.of("orders", 250), p -> {
          throw new IllegalStateException("render failed");
        }).get(0);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.records()).hasSize(250);
  }

  @Test
  void cancellation_keeps_partial_data_and_marks_unstarted_channels() {
    upstream.seed("alerts", 300, BASE, STEP);
    CancellationSignal cancellation = CancellationSignal.create();

    List<ChannelResult> results =
        orchestrator.retrieve(
            new RetrievalRequest(List.of("orders", "alerts"), 300, null),
            progress -> {
              if (progress.currentBatch() == 1) {
                cancellation.cancel();
              }
            },
            cancellation);

    assertThat(upstream.getCalls()).hasSize(1);
    assertThat(results.get(0).records()).hasSize(100);
    assertThat(results.get(0).errorDetail()).map(ChannelError::kind).contains(ChannelError.Kind.CANCELLED);
    assertThat(results.get(1).records()).isEmpty();
    assertThat(results.get(1).errorDetail()).map(ChannelError::kind).contains(ChannelError.Kind.CANCELLED);
  }

  @Test
  void slow_calls_fail_only_their_channel() {
    upstream.seed("slow", 10, BASE, STEP);
    upstream.delayChannel("slow", Duration.ofMillis(1_500));
    RetrievalOptions timed = FAST.toBuilder().requestTimeout(Duration.ofMillis(100)).build();

    try (HistoryRetrievalOrchestrator withTimeout = new HistoryRetrievalOrchestrator(upstream, timed)) {
      List<ChannelResult> results =
          withTimeout.retrieve(new RetrievalRequest(List.of("slow", "orders"), 50, null));

      assertThat(results.get(0).errorDetail()).map(ChannelError::kind).contains(ChannelError.Kind.TRANSPORT);
      assertThat(results.get(0).errorDetail()).map(ChannelError::message).hasValueSatisfying(
          m -> assertThat(m).contains("timed out"));
      assertThat(results.get(1).records()).hasSize(50);
    }
  }

  @Test
  void concurrent_channels_keep_request_order_and_per_channel_results() {
    List<String> channels = List.of("c0", "c1", "c2", "c3", "c4", "c5");
    for (int i = 0; i < channels.size(); i++) {
      upstream.seed(channels.get(i), 50 * (i + 1), BASE, STEP);
    }
    RetrievalOptions parallel = FAST.toBuilder().maxConcurrentChannels(4).build();

    try (HistoryRetrievalOrchestrator concurrent = new HistoryRetrievalOrchestrator(upstream, parallel)) {
      List<ChannelResult> results = concurrent.retrieve(new RetrievalRequest(channels, 220, null));

      assertThat(results).extracting(ChannelResult::channel).containsExactlyElementsOf(channels);
      assertThat(results).extracting(ChannelResult::totalMessages)
          .containsExactly(50, 100, 150, 200, 220, 220);
      assertThat(results).allMatch(ChannelResult::isSuccess);
    }
  }

  @Test
  void message_actions_flag_is_dropped_for_multi_channel_requests() {
    upstream.seed("alerts", 5, BASE, STEP);
    RetrievalOptions withActions = FAST.toBuilder().includeMessageActions(true).build();

    try (HistoryRetrievalOrchestrator actions = new HistoryRetrievalOrchestrator(upstream, withActions)) {
      actions.retrieve(RetrievalRequest.of("orders", 10));
      actions.retrieve(new RetrievalRequest(List.of("orders", "alerts"), 10, null));
    }

    assertThat(upstream.getCalls()).extracting(HistoryQuery::includeMessageActions)
        .containsExactly(true, false, false);
  }
}
