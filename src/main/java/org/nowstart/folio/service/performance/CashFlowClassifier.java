package org.nowstart.folio.service.performance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.dto.CashFlow;
import org.nowstart.folio.data.dto.ClassifiedCashFlows;
import org.nowstart.folio.data.entity.LedgerTransaction;
import org.springframework.stereotype.Component;

/**
 * Splits ledger cash movements into investor flows, cash-out drag and internal noise.
 * Flows are portfolio perspective: deposits positive, withdrawals negative.
 */
@Slf4j
@Component
public class CashFlowClassifier {

    private static final List<String> INTERNAL_MARKERS = List.of(
            "DEPOSIT SWEEP",
            "SHADO",
            "REC FR SIS",
            "REC TRSF SIS",
            "TRSF TO SIS",
            "TRSF SIS"
    );

    public ClassifiedCashFlows classify(List<LedgerTransaction> transactions, boolean includeWithholdingAsFlow) {
        Set<String> seenKeys = new HashSet<>();
        List<LedgerTransaction> transfers = new ArrayList<>();
        List<CashFlow> flows = new ArrayList<>();
        double fees = 0.0;
        double withholding = 0.0;
        double otherCashOut = 0.0;
        int internal = 0;
        int duplicates = 0;

        for (LedgerTransaction txn : transactions) {
            if (txn.getType() == null) {
                continue;
            }
            String key = providerKey(txn);
            if (key != null && !seenKeys.add(key)) {
                duplicates++;
                continue;
            }
            double amount = txn.getAmount() == null ? 0.0 : txn.getAmount().doubleValue();

            switch (txn.getType()) {
                case TRANSFER -> {
                    if (isInternalMechanic(txn)) {
                        internal++;
                    } else {
                        transfers.add(txn);
                    }
                }
                case WITHHOLDING -> {
                    if (includeWithholdingAsFlow) {
                        flows.add(new CashFlow(txn.getTradeDate(), amount));
                    } else {
                        withholding += Math.abs(amount);
                    }
                }
                case FEE -> {
                    if (amount < 0.0) {
                        fees += Math.abs(amount);
                    }
                }
                case OTHER -> {
                    if (amount < 0.0 && !isInternalMechanic(txn)) {
                        otherCashOut += Math.abs(amount);
                    }
                }
                default -> {
                    // trades and dividends stay inside the portfolio
                }
            }
        }

        List<CashFlow> unpaired = removeOffsettingPairs(transfers);
        internal += transfers.size() - unpaired.size();
        flows.addAll(unpaired);
        flows.sort(Comparator.comparing(CashFlow::date).thenComparingDouble(CashFlow::amount));

        double contributions = 0.0;
        double withdrawals = 0.0;
        for (CashFlow flow : flows) {
            if (flow.amount() >= 0.0) {
                contributions += flow.amount();
            } else {
                withdrawals -= flow.amount();
            }
        }

        if (internal > 0 || duplicates > 0) {
            log.debug("event=cash_flows_filtered internal={} duplicates={}", internal, duplicates);
        }
        return new ClassifiedCashFlows(flows, contributions, withdrawals, fees, withholding, otherCashOut, internal, duplicates);
    }

    /**
     * Sweep, FX settlement and multi-currency shuttle entries recognised from the broker text.
     */
    public boolean isInternalMechanic(LedgerTransaction txn) {
        String text = (nullToEmpty(txn.getDescription()) + " " + nullToEmpty(txn.getAdditionalDetail()))
                .trim()
                .toUpperCase(Locale.ROOT);

        for (String marker : INTERNAL_MARKERS) {
            if (text.contains(marker)) {
                return true;
            }
        }
        if (text.contains("MULTI") && text.contains("CURRENCY")) {
            return true;
        }
        if (text.contains("FX") && (text.contains("SETTLEMENT") || text.contains("TRAD"))) {
            return true;
        }
        return text.contains("INTERNAL") && text.contains("TRANSFER");
    }

    /**
     * Drops same-day +X/-X transfer pairs (matched in cents); unpaired residuals are kept.
     */
    List<CashFlow> removeOffsettingPairs(List<LedgerTransaction> transfers) {
        Map<PairKey, List<CashFlow>> positives = new LinkedHashMap<>();
        Map<PairKey, List<CashFlow>> negatives = new LinkedHashMap<>();
        for (LedgerTransaction txn : transfers) {
            BigDecimal cents = (txn.getAmount() == null ? BigDecimal.ZERO : txn.getAmount()).setScale(2, RoundingMode.HALF_UP);
            if (cents.signum() == 0) {
                continue;
            }
            PairKey key = new PairKey(txn.getTradeDate(), cents.abs());
            CashFlow flow = new CashFlow(txn.getTradeDate(), cents.doubleValue());
            (cents.signum() > 0 ? positives : negatives).computeIfAbsent(key, k -> new ArrayList<>()).add(flow);
        }

        List<CashFlow> kept = new ArrayList<>();
        Set<PairKey> keys = new HashSet<>(positives.keySet());
        keys.addAll(negatives.keySet());
        for (PairKey key : keys) {
            List<CashFlow> pos = positives.getOrDefault(key, List.of());
            List<CashFlow> neg = negatives.getOrDefault(key, List.of());
            int pairs = Math.min(pos.size(), neg.size());
            kept.addAll(pos.subList(pairs, pos.size()));
            kept.addAll(neg.subList(pairs, neg.size()));
        }
        kept.sort(Comparator.comparing(CashFlow::date).thenComparingDouble(CashFlow::amount));
        return kept;
    }

    private static String providerKey(LedgerTransaction txn) {
        String account = nullToEmpty(txn.getProviderAccountId()).trim();
        String id = nullToEmpty(txn.getProviderTxnId()).trim();
        return account.isEmpty() || id.isEmpty() ? null : account + "|" + id;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record PairKey(LocalDate date, BigDecimal absoluteCents) {
    }
}
