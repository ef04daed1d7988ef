package org.nowstart.folio.service.performance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.folio.data.dto.CashFlow;
import org.nowstart.folio.data.dto.ClassifiedCashFlows;
import org.nowstart.folio.data.entity.LedgerTransaction;
import org.nowstart.folio.data.type.TransactionType;

class CashFlowClassifierTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 3);

    private final CashFlowClassifier classifier = new CashFlowClassifier();

    @Test
    void classify_dropsSameDayOffsettingTransfersAndKeepsResidual() {
        ClassifiedCashFlows flows = classifier.classify(List.of(
                txn(TransactionType.TRANSFER, DAY, "100", "ACH DEPOSIT"),
                txn(TransactionType.TRANSFER, DAY, "-100", "ACH WITHDRAWAL"),
                txn(TransactionType.TRANSFER, DAY, "-25", "ACH WITHDRAWAL")
        ), false);

        assertThat(flows.externalFlows()).containsExactly(new CashFlow(DAY, -25.0));
        assertThat(flows.contributions()).isZero();
        assertThat(flows.withdrawals()).isCloseTo(25.0, within(1e-9));
        assertThat(flows.netFlow()).isCloseTo(-25.0, within(1e-9));
        assertThat(flows.internalExcluded()).isEqualTo(2);
    }

    @Test
    void classify_keepsOffsettingAmountsOnDifferentDays() {
        ClassifiedCashFlows flows = classifier.classify(List.of(
                txn(TransactionType.TRANSFER, DAY, "100", "WIRE IN"),
                txn(TransactionType.TRANSFER, DAY.plusDays(1), "-100", "WIRE OUT")
        ), false);

        assertThat(flows.externalFlows()).hasSize(2);
        assertThat(flows.netFlow()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void classify_excludesSweepAndFxMechanics() {
        ClassifiedCashFlows flows = classifier.classify(List.of(
                txn(TransactionType.TRANSFER, DAY, "5000", "DEPOSIT SWEEP"),
                txn(TransactionType.TRANSFER, DAY, "-300", "Internal transfer between accounts"),
                txn(TransactionType.OTHER, DAY, "-40", "FX Trade settlement"),
                txn(TransactionType.OTHER, DAY, "-12", "ADR custody charge")
        ), false);

        assertThat(flows.externalFlows()).isEmpty();
        assertThat(flows.internalExcluded()).isEqualTo(2);
        assertThat(flows.otherCashOut()).isCloseTo(12.0, within(1e-9));
    }

    @Test
    void classify_dedupesByProviderKeyAcrossCategories() {
        LedgerTransaction deposit = txn(TransactionType.TRANSFER, DAY, "1000", "ACH DEPOSIT");
        deposit.setProviderAccountId("U123");
        deposit.setProviderTxnId("T-1");
        LedgerTransaction duplicate = txn(TransactionType.TRANSFER, DAY, "1000", "ACH DEPOSIT");
        duplicate.setProviderAccountId("U123");
        duplicate.setProviderTxnId("T-1");

        ClassifiedCashFlows flows = classifier.classify(List.of(deposit, duplicate), false);

        assertThat(flows.externalFlows()).containsExactly(new CashFlow(DAY, 1000.0));
        assertThat(flows.duplicatesExcluded()).isEqualTo(1);
    }

    @Test
    void classify_totalsDragCategories() {
        List<LedgerTransaction> txns = List.of(
                txn(TransactionType.FEE, DAY, "-7.5", "ADVISORY FEE"),
                txn(TransactionType.FEE, DAY, "2", "FEE REBATE"),
                txn(TransactionType.WITHHOLDING, DAY, "-3", "US TAX"),
                txn(TransactionType.DIVIDEND, DAY, "30", "VTI DIVIDEND")
        );

        ClassifiedCashFlows drag = classifier.classify(txns, false);

        assertThat(drag.fees()).isCloseTo(7.5, within(1e-9));
        assertThat(drag.withholding()).isCloseTo(3.0, within(1e-9));
        assertThat(drag.totalCashOut()).isCloseTo(10.5, within(1e-9));
        assertThat(drag.externalFlows()).isEmpty();

        ClassifiedCashFlows asFlow = classifier.classify(txns, true);

        assertThat(asFlow.withholding()).isZero();
        assertThat(asFlow.externalFlows()).containsExactly(new CashFlow(DAY, -3.0));
        assertThat(asFlow.withdrawals()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void isInternalMechanic_readsAdditionalDetail() {
        LedgerTransaction txn = txn(TransactionType.TRANSFER, DAY, "-50", "TRANSFER");
        txn.setAdditionalDetail("Multi-Currency cash shuttle");

        assertThat(classifier.isInternalMechanic(txn)).isTrue();
        assertThat(classifier.isInternalMechanic(txn(TransactionType.TRANSFER, DAY, "-50", "ACH OUT"))).isFalse();
    }

    private static LedgerTransaction txn(TransactionType type, LocalDate date, String amount, String description) {
        return LedgerTransaction.builder()
                .accountId(1L)
                .type(type)
                .tradeDate(date)
                .amount(new BigDecimal(amount))
                .description(description)
                .build();
    }
}
