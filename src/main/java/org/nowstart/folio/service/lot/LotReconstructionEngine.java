package org.nowstart.folio.service.lot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.entity.CorporateActionEvent;
import org.nowstart.folio.data.entity.LedgerTransaction;
import org.nowstart.folio.data.entity.LotDisposal;
import org.nowstart.folio.data.entity.TaxLot;
import org.nowstart.folio.data.property.TaxLotProperties;
import org.nowstart.folio.data.type.CorporateActionType;
import org.nowstart.folio.data.type.HoldingTerm;
import org.nowstart.folio.data.type.LotSource;
import org.nowstart.folio.data.type.TransactionType;
import org.nowstart.folio.service.lot.LotBook.LotKey;
import org.nowstart.folio.service.lot.LotReconstruction.CorporateActionOutcome;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

/**
 * Replays a taxpayer's ledger into FIFO tax lots and disposals. Works purely on the given
 * entities; nothing is read from or written to the database here.
 */
@Slf4j
@Component
@RefreshScope
@RequiredArgsConstructor
public class LotReconstructionEngine {

    static final int SCALE = 12;

    private final TaxLotProperties taxLotProperties;

    public LotReconstruction reconstruct(
            Long taxpayerId,
            List<LedgerTransaction> transactions,
            List<CorporateActionEvent> corporateActions,
            LocalDate asOfDate
    ) {
        List<LedgerTransaction> ordered = transactions.stream()
                .filter(txn -> isTradeType(txn.getType()))
                .filter(txn -> txn.getTicker() != null && !txn.getTicker().isBlank())
                .sorted(Comparator.comparing(LedgerTransaction::getTradeDate)
                        .thenComparing(LedgerTransaction::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        List<CorporateActionEvent> events = corporateActions.stream()
                .filter(event -> event.getActionDate() != null && !event.getActionDate().isAfter(asOfDate))
                .sorted(Comparator.comparing(CorporateActionEvent::getActionDate)
                        .thenComparing(CorporateActionEvent::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

        LotBook book = new LotBook(taxpayerId);
        List<LotDisposal> disposals = new ArrayList<>();
        List<CorporateActionOutcome> outcomes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        int eventIndex = 0;
        for (LedgerTransaction txn : ordered) {
            while (eventIndex < events.size() && !events.get(eventIndex).getActionDate().isAfter(txn.getTradeDate())) {
                outcomes.add(applyCorporateAction(book, events.get(eventIndex++), warnings));
            }

            switch (txn.getType()) {
                case BUY -> openFromBuy(taxpayerId, book, txn, warnings);
                case TRANSFER -> openFromTransfer(taxpayerId, book, txn);
                case SELL -> disposals.addAll(consumeForSell(taxpayerId, book, txn, warnings));
                default -> {
                    // other types never touch lots
                }
            }
        }
        while (eventIndex < events.size()) {
            outcomes.add(applyCorporateAction(book, events.get(eventIndex++), warnings));
        }

        log.info(
                "event=lots_reconstructed taxpayerId={} txns={} lots={} disposals={} corporateActions={} warnings={}",
                taxpayerId,
                ordered.size(),
                book.lots().size(),
                disposals.size(),
                outcomes.size(),
                warnings.size()
        );
        return new LotReconstruction(List.copyOf(book.lots()), disposals, outcomes, ordered.size(), warnings);
    }

    private void openFromBuy(Long taxpayerId, LotBook book, LedgerTransaction txn, List<String> warnings) {
        BigDecimal quantity = txn.getQuantity();
        if (!LotBook.isPositive(quantity)) {
            warnings.add("BUY txn missing qty: txn_id=" + txn.getId());
            log.warn("event=lot_buy_skipped txnId={} reason=missing_quantity", txn.getId());
            return;
        }
        BigDecimal basis = abs(txn.getAmount());
        book.open(newLot(taxpayerId, txn, quantity, basis, null));
    }

    private void openFromTransfer(Long taxpayerId, LotBook book, LedgerTransaction txn) {
        BigDecimal quantity = txn.getQuantity();
        if (!LotBook.isPositive(quantity)) {
            return;
        }
        BigDecimal basis = txn.getTransferBasis();
        if (basis == null && abs(txn.getAmount()).compareTo(LotBook.EPSILON) > 0) {
            basis = abs(txn.getAmount());
        }
        book.open(newLot(taxpayerId, txn, quantity, basis, "Transfer-in lot reconstructed; verify basis."));
    }

    private List<LotDisposal> consumeForSell(Long taxpayerId, LotBook book, LedgerTransaction txn, List<String> warnings) {
        BigDecimal quantity = txn.getQuantity();
        if (!LotBook.isPositive(quantity)) {
            warnings.add("SELL txn missing qty: txn_id=" + txn.getId());
            log.warn("event=lot_sell_skipped txnId={} reason=missing_quantity", txn.getId());
            return List.of();
        }

        LotKey key = LotKey.of(txn.getAccountId(), txn.getTicker());
        BigDecimal proceeds = abs(txn.getAmount());
        BigDecimal remaining = quantity;
        List<LotDisposal> disposals = new ArrayList<>();

        while (remaining.compareTo(LotBook.EPSILON) > 0) {
            Optional<TaxLot> next = book.nextOpen(key);
            if (next.isEmpty()) {
                warnings.add("Insufficient lots for SELL txn_id=" + txn.getId() + " ticker=" + key.ticker()
                        + "; basis unknown for " + remaining.stripTrailingZeros().toPlainString() + ".");
                log.warn(
                        "event=lot_shortfall txnId={} ticker={} shortfall={}",
                        txn.getId(),
                        key.ticker(),
                        remaining.toPlainString()
                );
                TaxLot sentinel = book.sentinel(key, txn.getTradeDate());
                sentinel.setOriginalQuantity(sentinel.getOriginalQuantity().add(remaining));
                disposals.add(LotDisposal.builder()
                        .taxpayerId(taxpayerId)
                        .sellTxn(txn)
                        .taxLot(sentinel)
                        .quantitySold(remaining)
                        .proceedsAllocated(portion(proceeds, remaining, quantity))
                        .basisAllocated(null)
                        .realizedGain(null)
                        .term(HoldingTerm.UNKNOWN)
                        .asOfDate(txn.getTradeDate())
                        .basisUnknown(true)
                        .build());
                break;
            }

            TaxLot lot = next.get();
            BigDecimal open = lot.getQuantityOpen();
            BigDecimal take = remaining.min(open);
            BigDecimal proceedsPortion = portion(proceeds, take, quantity);
            BigDecimal basisAllocated = null;
            BigDecimal gain = null;
            HoldingTerm term = HoldingTerm.UNKNOWN;

            if (lot.getBasisOpen() != null) {
                basisAllocated = take.compareTo(open) == 0
                        ? lot.getBasisOpen()
                        : portion(lot.getBasisOpen(), take, open);
                gain = proceedsPortion.subtract(basisAllocated);
                term = termOf(lot.getAcquiredDate(), txn.getTradeDate());
                lot.setBasisOpen(lot.getBasisOpen().subtract(basisAllocated));
            } else {
                warnings.add("Basis unknown lot used for SELL txn_id=" + txn.getId() + " ticker=" + key.ticker() + ".");
            }
            lot.setQuantityOpen(open.subtract(take));

            disposals.add(LotDisposal.builder()
                    .taxpayerId(taxpayerId)
                    .sellTxn(txn)
                    .taxLot(lot)
                    .quantitySold(take)
                    .proceedsAllocated(proceedsPortion)
                    .basisAllocated(basisAllocated)
                    .realizedGain(gain)
                    .term(term)
                    .asOfDate(txn.getTradeDate())
                    .basisUnknown(basisAllocated == null)
                    .build());
            remaining = remaining.subtract(take);
        }
        return disposals;
    }

    private CorporateActionOutcome applyCorporateAction(LotBook book, CorporateActionEvent event, List<String> warnings) {
        boolean newlyApplied = !event.isApplied();
        event.setApplied(true);

        CorporateActionType type = event.getActionType();
        if (type == null || !type.isSplit()) {
            event.setApplyNotes("Unsupported action_type " + type + "; not applied.");
            return new CorporateActionOutcome(event, 0, newlyApplied);
        }
        if (event.getRatio() == null) {
            event.setApplyNotes("Missing ratio; not applied.");
            warnings.add("Corporate action missing ratio; marked applied but no change made.");
            return new CorporateActionOutcome(event, 0, newlyApplied);
        }

        BigDecimal ratio = event.getRatio();
        if (ratio.signum() <= 0) {
            warnings.add(type == CorporateActionType.REVERSE_SPLIT
                    ? "Reverse split ratio=0; skipped."
                    : "Corporate action split ratio <= 0; skipped.");
            event.setApplyNotes("Invalid ratio");
            return new CorporateActionOutcome(event, 0, newlyApplied);
        }

        List<TaxLot> lots = book.openLotsMatching(event.getAccountId(), event.getTicker());
        for (TaxLot lot : lots) {
            lot.setQuantityOpen(scale(lot.getQuantityOpen(), ratio, type));
            lot.setOriginalQuantity(scale(lot.getOriginalQuantity(), ratio, type));
            lot.appendNote(type + " " + ratio.stripTrailingZeros().toPlainString() + " on " + event.getActionDate() + ".");
        }
        event.setApplyNotes("Applied " + type + " ratio=" + ratio.stripTrailingZeros().toPlainString()
                + " to " + lots.size() + " open lot(s).");
        log.info(
                "event=corporate_action_applied eventId={} type={} ratio={} touchedLots={}",
                event.getId(),
                type,
                ratio.toPlainString(),
                lots.size()
        );
        return new CorporateActionOutcome(event, lots.size(), newlyApplied);
    }

    private TaxLot newLot(Long taxpayerId, LedgerTransaction txn, BigDecimal quantity, BigDecimal basis, String notes) {
        return TaxLot.builder()
                .taxpayerId(taxpayerId)
                .accountId(txn.getAccountId())
                .ticker(LotBook.normalizeTicker(txn.getTicker()))
                .acquiredDate(txn.getTradeDate())
                .originalQuantity(quantity)
                .quantityOpen(quantity)
                .originalBasis(basis)
                .basisOpen(basis)
                .basisUnknown(basis == null)
                .source(LotSource.RECONSTRUCTED)
                .createdFromTxn(txn)
                .notes(notes)
                .build();
    }

    private HoldingTerm termOf(LocalDate acquired, LocalDate sold) {
        return ChronoUnit.DAYS.between(acquired, sold) >= taxLotProperties.longTermDays()
                ? HoldingTerm.LT
                : HoldingTerm.ST;
    }

    private static BigDecimal scale(BigDecimal quantity, BigDecimal ratio, CorporateActionType type) {
        if (quantity == null) {
            return null;
        }
        return type == CorporateActionType.REVERSE_SPLIT
                ? quantity.divide(ratio, SCALE, RoundingMode.HALF_UP)
                : quantity.multiply(ratio);
    }

    static BigDecimal portion(BigDecimal total, BigDecimal part, BigDecimal whole) {
        return total.multiply(part).divide(whole, SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal abs(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount.abs();
    }

    static boolean isTradeType(TransactionType type) {
        return type == TransactionType.BUY
                || type == TransactionType.SELL
                || type == TransactionType.TRANSFER
                || type == TransactionType.OTHER;
    }
}
