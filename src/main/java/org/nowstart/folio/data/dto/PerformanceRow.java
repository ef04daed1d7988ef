package org.nowstart.folio.data.dto;

import java.time.LocalDate;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record PerformanceRow(
        Long portfolioId,
        String label,
        LocalDate startDate,
        LocalDate endDate,
        LocalDate beginDate,
        LocalDate endValueDate,
        Double beginValue,
        Double endValue,
        LocalDate coverageStart,
        LocalDate coverageEnd,
        int valuationPoints,
        int transactionCount,
        LocalDate firstTransactionDate,
        LocalDate lastTransactionDate,
        double contributions,
        double withdrawals,
        double fees,
        double withholding,
        double otherCashOut,
        double netFlow,
        double totalCashOut,
        Double gain,
        Double xirr,
        Double twr,
        Double volatility,
        Double sharpe,
        Double sortino,
        Double maxDrawdown,
        Double benchmarkTwr,
        Double benchmarkSharpe,
        Double excessReturn,
        Double excessSharpe,
        List<String> warnings
) {
}
