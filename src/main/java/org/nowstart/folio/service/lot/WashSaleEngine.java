package org.nowstart.folio.service.lot;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.entity.Account;
import org.nowstart.folio.data.entity.LedgerTransaction;
import org.nowstart.folio.data.entity.LotDisposal;
import org.nowstart.folio.data.entity.TaxLot;
import org.nowstart.folio.data.entity.WashSaleAdjustment;
import org.nowstart.folio.data.property.TaxLotProperties;
import org.nowstart.folio.data.type.TransactionType;
import org.nowstart.folio.data.type.WashSaleStatus;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

/**
 * Defers loss-sale losses into replacement lots bought within the wash window.
 * Replacement shares are allocated chronologically and each share backs at most one loss sale.
 */
@Slf4j
@Component
@RefreshScope
@RequiredArgsConstructor
public class WashSaleEngine {

    private static final BigDecimal LOSS_EPSILON = new BigDecimal("-0.01");

    private final TaxLotProperties taxLotProperties;

    public WashSaleResult apply(
            Long taxpayerId,
            LotReconstruction reconstruction,
            List<LedgerTransaction> candidateBuys,
            Map<Long, Account> scopeAccounts,
            Map<String, String> substituteGroups
    ) {
        Map<LedgerTransaction, List<LotDisposal>> disposalsBySale = new LinkedHashMap<>();
        for (LotDisposal disposal : reconstruction.disposals()) {
            disposalsBySale.computeIfAbsent(disposal.getSellTxn(), sale -> new ArrayList<>()).add(disposal);
        }

        Map<LedgerTransaction, TaxLot> lotByBuy = new IdentityHashMap<>();
        for (TaxLot lot : reconstruction.lots()) {
            if (lot.getCreatedFromTxn() != null) {
                lotByBuy.put(lot.getCreatedFromTxn(), lot);
            }
        }

        Map<LedgerTransaction, BigDecimal> consumedShares = new IdentityHashMap<>();
        List<WashSaleAdjustment> adjustments = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int window = taxLotProperties.washWindowDays();

        for (Map.Entry<LedgerTransaction, List<LotDisposal>> entry : disposalsBySale.entrySet()) {
            LedgerTransaction sale = entry.getKey();
            BigDecimal totalGain = totalKnownGain(entry.getValue());
            if (totalGain == null || totalGain.compareTo(LOSS_EPSILON) >= 0) {
                continue;
            }
            BigDecimal sharesSold = sale.getQuantity();
            if (!LotBook.isPositive(sharesSold)) {
                continue;
            }

            BigDecimal loss = totalGain.negate();
            LocalDate windowStart = sale.getTradeDate().minusDays(window);
            LocalDate windowEnd = sale.getTradeDate().plusDays(window);
            Set<String> identical = identicalTickers(sale.getTicker(), substituteGroups);
            Set<LedgerTransaction> soldFrom = Collections.newSetFromMap(new IdentityHashMap<>());
            entry.getValue().forEach(disposal -> {
                if (disposal.getTaxLot().getCreatedFromTxn() != null) {
                    soldFrom.add(disposal.getTaxLot().getCreatedFromTxn());
                }
            });

            BigDecimal remaining = sharesSold;
            for (LedgerTransaction buy : candidateBuys) {
                if (remaining.compareTo(LotBook.EPSILON) <= 0) {
                    break;
                }
                if (!isReplacement(buy, identical, windowStart, windowEnd, scopeAccounts) || soldFrom.contains(buy)) {
                    continue;
                }
                BigDecimal available = buy.getQuantity().subtract(consumedShares.getOrDefault(buy, BigDecimal.ZERO));
                if (available.compareTo(LotBook.EPSILON) <= 0) {
                    continue;
                }

                BigDecimal take = remaining.min(available);
                BigDecimal deferred = LotReconstructionEngine.portion(loss, take, sharesSold);
                Account account = scopeAccounts.get(buy.getAccountId());
                TaxLot replacementLot = lotByBuy.get(buy);

                WashSaleAdjustment.WashSaleAdjustmentBuilder adjustment = WashSaleAdjustment.builder()
                        .taxpayerId(taxpayerId)
                        .lossSaleTxn(sale)
                        .replacementBuyTxn(buy)
                        .replacementLot(replacementLot)
                        .deferredLoss(deferred)
                        .windowStart(windowStart)
                        .windowEnd(windowEnd);

                if (account.isTaxAdvantaged()) {
                    adjustment.status(WashSaleStatus.FLAGGED)
                            .basisIncrease(BigDecimal.ZERO)
                            .note("Replacement buy in tax-advantaged account; wash loss may be permanently disallowed (not modeled).");
                } else if (replacementLot == null) {
                    adjustment.status(WashSaleStatus.FLAGGED)
                            .basisIncrease(BigDecimal.ZERO)
                            .note("Replacement lot not found; basis not adjusted.");
                } else {
                    BigDecimal basis = replacementLot.getBasisOpen() == null ? BigDecimal.ZERO : replacementLot.getBasisOpen();
                    replacementLot.setBasisOpen(basis.add(deferred));
                    replacementLot.appendNote("Wash sale deferred loss " + deferred.stripTrailingZeros().toPlainString()
                            + " from SELL txn_id=" + sale.getId() + ".");
                    adjustment.status(WashSaleStatus.APPLIED)
                            .basisIncrease(deferred)
                            .note("Deferred " + take.stripTrailingZeros().toPlainString() + " replacement share(s).");
                }

                adjustments.add(adjustment.build());
                consumedShares.merge(buy, take, BigDecimal::add);
                remaining = remaining.subtract(take);
            }

            if (remaining.compareTo(LotBook.EPSILON) > 0 && remaining.compareTo(sharesSold.subtract(LotBook.EPSILON)) <= 0) {
                warnings.add("Wash sale: not enough replacement shares to defer full loss for sale txn_id=" + sale.getId() + ".");
            }
        }

        log.info("event=wash_sales_evaluated taxpayerId={} adjustments={} warnings={}", taxpayerId, adjustments.size(), warnings.size());
        return new WashSaleResult(adjustments, warnings);
    }

    private BigDecimal totalKnownGain(List<LotDisposal> disposals) {
        BigDecimal total = null;
        for (LotDisposal disposal : disposals) {
            if (disposal.getRealizedGain() != null) {
                total = total == null ? disposal.getRealizedGain() : total.add(disposal.getRealizedGain());
            }
        }
        return total;
    }

    private boolean isReplacement(
            LedgerTransaction buy,
            Set<String> identical,
            LocalDate windowStart,
            LocalDate windowEnd,
            Map<Long, Account> scopeAccounts
    ) {
        return buy.getType() == TransactionType.BUY
                && scopeAccounts.containsKey(buy.getAccountId())
                && identical.contains(LotBook.normalizeTicker(buy.getTicker()))
                && !buy.getTradeDate().isBefore(windowStart)
                && !buy.getTradeDate().isAfter(windowEnd)
                && LotBook.isPositive(buy.getQuantity());
    }

    static Set<String> identicalTickers(String ticker, Map<String, String> substituteGroups) {
        String normalized = LotBook.normalizeTicker(ticker);
        Set<String> identical = new HashSet<>();
        identical.add(normalized);
        String group = substituteGroups.get(normalized);
        if (group == null) {
            return identical;
        }
        substituteGroups.forEach((member, memberGroup) -> {
            if (Objects.equals(group, memberGroup)) {
                identical.add(LotBook.normalizeTicker(member));
            }
        });
        return identical;
    }
}
