package com.streamfirst.history.adapters;

import com.streamfirst.history.adapters.InMemoryHistoryAdapter.ResponseOrder;
import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.HistoryTransportException;
import com.streamfirst.history.domain.Timetoken;
import com.streamfirst.history.ports.HistoryQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryHistoryAdapterTest {

    private InMemoryHistoryAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemoryHistoryAdapter();
        adapter.setResponseOrder(ResponseOrder.ASCENDING);
        adapter.seed("orders", 10, 100, 10);
    }

    private static List<Long> timetokens(List<HistoryRecord> records) {
        return records.stream().map(r -> r.getTimetoken().value()).toList();
    }

    @Test
    void without_start_returns_newest_records_up_to_end() {
        assertThat(timetokens(adapter.fetchHistory("orders", 3, null, null)))
            .containsExactly(170L, 180L, 190L);
        assertThat(timetokens(adapter.fetchHistory("orders", 3, null, Timetoken.of(150))))
            .containsExactly(130L, 140L, 150L);
    }

    @Test
    void with_start_returns_oldest_records_after_start() {
        assertThat(timetokens(adapter.fetchHistory("orders", 3, Timetoken.of(100), null)))
            .containsExactly(110L, 120L, 130L);
        assertThat(timetokens(adapter.fetchHistory("orders", 5, Timetoken.of(150), Timetoken.of(170))))
            .containsExactly(160L, 170L);
    }

    @Test
    void defaults_to_newest_first_responses() {
        InMemoryHistoryAdapter descending = new InMemoryHistoryAdapter();
        descending.seed("orders", 3, 1, 1);

        assertThat(timetokens(descending.fetchHistory("orders", 3, null, null)))
            .containsExactly(3L, 2L, 1L);
    }

    @Test
    void applies_fetch_flags_to_returned_records() {
        HistoryQuery bare = new HistoryQuery("orders", 1, null, null, false, false, false, false);
        HistoryQuery full = new HistoryQuery("orders", 1, null, null, true, true, true, false);

        HistoryRecord stripped = adapter.fetchHistory(bare).get(0);
        HistoryRecord complete = adapter.fetchHistory(full).get(0);

        assertThat(stripped.publisher()).isEmpty();
        assertThat(stripped.meta()).isEmpty();
        assertThat(stripped.recordType()).isEmpty();
        assertThat(complete.publisher()).contains("publisher-0");
        assertThat(complete.meta()).contains("{\"batch\":0}");
    }

    @Test
    void records_every_call() {
        adapter.fetchHistory("orders", 1, null, null);
        adapter.fetchHistory("billing", 1, null, null);

        assertThat(adapter.getCalls()).extracting(HistoryQuery::channel).containsExactly("orders", "billing");
        assertThat(adapter.getCalls("billing")).hasSize(1);
    }

    @Test
    void counts_only_channels_with_newer_messages() {
        assertThat(adapter.countMessagesSince(List.of("orders", "billing"), Timetoken.of(150)))
            .containsOnlyKeys("orders")
            .containsEntry("orders", 4);
    }

    @Test
    void deletes_start_exclusive_end_inclusive() {
        adapter.deleteRange("orders", Timetoken.of(100), Timetoken.of(120));

        assertThat(adapter.getStoredCount("orders")).isEqualTo(8);
        assertThat(timetokens(adapter.fetchHistory("orders", 2, Timetoken.of(0), null)))
            .containsExactly(100L, 130L);
    }

    @Test
    void injected_failures_surface_to_callers() {
        adapter.failChannel("orders", () -> new HistoryTransportException("boom"));
        adapter.rejectDeletes(HistoryTransportException.status(404, "not found", null, List.of()));

        assertThatThrownBy(() -> adapter.fetchHistory("orders", 1, null, null))
            .isInstanceOf(HistoryTransportException.class)
            .hasMessage("boom");
        assertThatThrownBy(() -> adapter.deleteRange("orders", Timetoken.of(1), Timetoken.of(2)))
            .isInstanceOf(HistoryTransportException.class);
    }

    @Test
    void clear_resets_data_and_faults() {
        adapter.failChannel("orders", () -> new HistoryTransportException("boom"));
        adapter.clear();

        assertThat(adapter.fetchHistory("orders", 5, null, null)).isEmpty();
        assertThat(adapter.getStoredCount("orders")).isZero();
    }
}
