package org.nowstart.folio.service.performance;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import org.junit.jupiter.api.Test;
import org.nowstart.folio.data.entity.CashBalance;
import org.nowstart.folio.data.entity.HoldingSnapshot;
import org.nowstart.folio.data.entity.HoldingSnapshot.SnapshotItem;

class SnapshotAggregatorTest {

    private final SnapshotAggregator aggregator = new SnapshotAggregator();

    private final Map<Long, Map<String, Long>> mapping = Map.of(1L, Map.of("IB-1", 10L, "IB-2", 11L));

    @Test
    void aggregate_latestSnapshotOfTheDayWinsPerAccount() {
        List<HoldingSnapshot> snapshots = List.of(
                snapshot(2L, "2025-01-31T20:00:00Z", position("IB-1", "VTI", "150")),
                snapshot(1L, "2025-01-31T10:00:00Z", position("IB-1", "VTI", "100"), position("IB-2", "BND", "40"))
        );

        Map<Long, NavigableMap<LocalDate, Double>> result = aggregator.aggregate(snapshots, mapping, Map.of());

        // IB-2 only appears in the earlier snapshot, so its value is still counted
        assertThat(result.get(1L)).containsExactly(Map.entry(LocalDate.of(2025, 1, 31), 190.0));
    }

    @Test
    void aggregate_totalItemOverridesPositionsAndCash() {
        List<HoldingSnapshot> snapshots = List.of(snapshot(1L, "2025-02-28T21:00:00Z",
                position("IB-1", "VTI", "100"),
                position("IB-1", "CASH:USD", "20"),
                new SnapshotItem("IB-1", null, new BigDecimal("500"), true)
        ));

        Map<Long, NavigableMap<LocalDate, Double>> result = aggregator.aggregate(snapshots, mapping, Map.of());

        assertThat(result.get(1L).get(LocalDate.of(2025, 2, 28))).isEqualTo(500.0);
    }

    @Test
    void aggregate_usesCashBalanceWhenSnapshotHasNoCash() {
        List<HoldingSnapshot> snapshots = List.of(snapshot(1L, "2025-03-31T21:00:00Z", position("IB-1", "VTI", "100")));
        Map<Long, List<CashBalance>> cash = Map.of(10L, List.of(
                cash(10L, LocalDate.of(2025, 3, 1), "10"),
                cash(10L, LocalDate.of(2025, 3, 28), "25"),
                cash(10L, LocalDate.of(2025, 4, 2), "99")
        ));

        Map<Long, NavigableMap<LocalDate, Double>> result = aggregator.aggregate(snapshots, mapping, cash);

        assertThat(result.get(1L).get(LocalDate.of(2025, 3, 31))).isEqualTo(125.0);
    }

    @Test
    void aggregate_ignoresUnmappedProviderAccounts() {
        List<HoldingSnapshot> snapshots = List.of(snapshot(1L, "2025-03-31T21:00:00Z",
                position("IB-1", "VTI", "100"),
                position("UNKNOWN", "VTI", "1000")
        ));

        Map<Long, NavigableMap<LocalDate, Double>> result = aggregator.aggregate(snapshots, mapping, Map.of());

        assertThat(result.get(1L).get(LocalDate.of(2025, 3, 31))).isEqualTo(100.0);
    }

    @Test
    void cashOnOrBefore_findsLatestBalanceNotAfterDay() {
        List<CashBalance> balances = List.of(
                cash(10L, LocalDate.of(2025, 1, 1), "5"),
                cash(10L, LocalDate.of(2025, 1, 10), "7"),
                cash(10L, LocalDate.of(2025, 1, 20), "9")
        );

        assertThat(SnapshotAggregator.cashOnOrBefore(balances, LocalDate.of(2025, 1, 15))).isEqualTo(7.0);
        assertThat(SnapshotAggregator.cashOnOrBefore(balances, LocalDate.of(2025, 1, 20))).isEqualTo(9.0);
        assertThat(SnapshotAggregator.cashOnOrBefore(balances, LocalDate.of(2024, 12, 31))).isNull();
        assertThat(SnapshotAggregator.cashOnOrBefore(null, LocalDate.of(2025, 1, 15))).isNull();
    }

    private static HoldingSnapshot snapshot(Long id, String asOf, SnapshotItem... items) {
        return HoldingSnapshot.builder()
                .id(id)
                .portfolioId(1L)
                .asOf(Instant.parse(asOf))
                .items(List.of(items))
                .build();
    }

    private static SnapshotItem position(String account, String symbol, String value) {
        return new SnapshotItem(account, symbol, new BigDecimal(value), false);
    }

    private static CashBalance cash(Long accountId, LocalDate date, String amount) {
        return CashBalance.builder().accountId(accountId).asOfDate(date).amount(new BigDecimal(amount)).build();
    }
}
