package org.nowstart.folio.data.dto;

import java.util.List;

public record ClassifiedCashFlows(
        List<CashFlow> externalFlows,
        double contributions,
        double withdrawals,
        double fees,
        double withholding,
        double otherCashOut,
        int internalExcluded,
        int duplicatesExcluded
) {
    public double netFlow() {
        return contributions - withdrawals;
    }

    public double totalCashOut() {
        return withdrawals + fees + withholding + otherCashOut;
    }

    public static ClassifiedCashFlows empty() {
        return new ClassifiedCashFlows(List.of(), 0.0, 0.0, 0.0, 0.0, 0.0, 0, 0);
    }
}
