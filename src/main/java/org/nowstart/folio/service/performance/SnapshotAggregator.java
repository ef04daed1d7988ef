package org.nowstart.folio.service.performance;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.entity.CashBalance;
import org.nowstart.folio.data.entity.HoldingSnapshot;
import org.nowstart.folio.data.entity.HoldingSnapshot.SnapshotItem;
import org.springframework.stereotype.Component;

/**
 * Builds one value-per-day series per portfolio from holdings snapshots.
 * Per (account, day) the latest snapshot wins; an explicit total replaces the position and cash sum,
 * and the cash-balance series fills in cash when the snapshot reports none.
 */
@Slf4j
@Component
public class SnapshotAggregator {

    /**
     * @param snapshots          snapshots of the portfolios in range
     * @param accountsByProvider per portfolio, provider account id to internal account id; unmapped items are ignored
     * @param cashBalances       per internal account, balances in ascending date order
     */
    public Map<Long, NavigableMap<LocalDate, Double>> aggregate(
            List<HoldingSnapshot> snapshots,
            Map<Long, Map<String, Long>> accountsByProvider,
            Map<Long, List<CashBalance>> cashBalances
    ) {
        Map<AccountDay, AccountValuation> latest = new HashMap<>();
        Map<Long, Long> portfolioByAccount = new HashMap<>();

        List<HoldingSnapshot> ordered = snapshots.stream()
                .sorted(Comparator.comparing(HoldingSnapshot::getAsOf)
                        .thenComparing(HoldingSnapshot::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        for (HoldingSnapshot snapshot : ordered) {
            Map<String, Long> mapping = accountsByProvider.getOrDefault(snapshot.getPortfolioId(), Map.of());
            Map<Long, AccountValuation> perAccount = new HashMap<>();
            for (SnapshotItem item : snapshot.getItems()) {
                Long accountId = mapping.get(item.getProviderAccountId() == null ? "" : item.getProviderAccountId().trim());
                if (accountId == null) {
                    continue;
                }
                portfolioByAccount.put(accountId, snapshot.getPortfolioId());
                AccountValuation valuation = perAccount.computeIfAbsent(accountId, id -> new AccountValuation(snapshot.getAsOf()));
                valuation.add(item);
            }

            LocalDate day = LocalDate.ofInstant(snapshot.getAsOf(), ZoneOffset.UTC);
            perAccount.forEach((accountId, valuation) -> {
                if (!valuation.hasValue()) {
                    return;
                }
                AccountDay key = new AccountDay(accountId, day);
                AccountValuation previous = latest.get(key);
                if (previous == null || !snapshot.getAsOf().isBefore(previous.asOf)) {
                    latest.put(key, valuation);
                }
            });
        }

        Map<Long, NavigableMap<LocalDate, Double>> byPortfolio = new HashMap<>();
        latest.forEach((key, valuation) -> {
            double value = valuation.value(cashOnOrBefore(cashBalances.get(key.accountId()), key.day()));
            byPortfolio.computeIfAbsent(portfolioByAccount.get(key.accountId()), id -> new TreeMap<>())
                    .merge(key.day(), value, Double::sum);
        });
        log.debug("event=snapshots_aggregated snapshots={} portfolios={} accountDays={}", snapshots.size(), byPortfolio.size(), latest.size());
        return byPortfolio;
    }

    static Double cashOnOrBefore(List<CashBalance> balances, LocalDate day) {
        if (balances == null || balances.isEmpty()) {
            return null;
        }
        int low = 0;
        int high = balances.size() - 1;
        Double best = null;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            CashBalance balance = balances.get(mid);
            if (!balance.getAsOfDate().isAfter(day)) {
                best = balance.getAmount() == null ? 0.0 : balance.getAmount().doubleValue();
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return best;
    }

    private record AccountDay(Long accountId, LocalDate day) {
    }

    private static final class AccountValuation {

        private final Instant asOf;
        private Double total;
        private double positions;
        private double cash;
        private boolean hasPositions;
        private boolean hasCash;

        private AccountValuation(Instant asOf) {
            this.asOf = asOf;
        }

        private void add(SnapshotItem item) {
            double marketValue = item.getMarketValue() == null ? 0.0 : item.getMarketValue().doubleValue();
            if (item.isTotal() && marketValue > 0.0) {
                total = marketValue;
                return;
            }
            if (item.isCash()) {
                cash += marketValue;
                hasCash = true;
            } else if (item.getSymbol() != null && !item.getSymbol().isBlank()) {
                positions += marketValue;
                hasPositions = true;
            }
        }

        private boolean hasValue() {
            return total != null || hasPositions || hasCash;
        }

        private double value(Double cashBalance) {
            if (total != null) {
                return total;
            }
            if (Math.abs(cash) <= ReturnCalculator.EPSILON && cashBalance != null) {
                return positions + cashBalance;
            }
            return positions + cash;
        }
    }

}
