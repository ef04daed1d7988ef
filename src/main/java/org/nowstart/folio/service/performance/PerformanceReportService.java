package org.nowstart.folio.service.performance;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.dto.BenchmarkPriceResult;
import org.nowstart.folio.data.dto.CashFlow;
import org.nowstart.folio.data.dto.ClassifiedCashFlows;
import org.nowstart.folio.data.dto.PerformanceReport;
import org.nowstart.folio.data.dto.PerformanceReportRequest;
import org.nowstart.folio.data.dto.PerformanceRow;
import org.nowstart.folio.data.dto.RiskStats;
import org.nowstart.folio.data.dto.TimeWeightedReturn;
import org.nowstart.folio.data.dto.ValuationPoint;
import org.nowstart.folio.data.entity.Account;
import org.nowstart.folio.data.entity.CashBalance;
import org.nowstart.folio.data.entity.HoldingSnapshot;
import org.nowstart.folio.data.entity.LedgerTransaction;
import org.nowstart.folio.data.entity.Portfolio;
import org.nowstart.folio.data.entity.PortfolioAccountLink;
import org.nowstart.folio.data.entity.Taxpayer;
import org.nowstart.folio.data.exception.FolioApiException;
import org.nowstart.folio.data.property.PerformanceProperties;
import org.nowstart.folio.data.type.ReportFrequency;
import org.nowstart.folio.data.type.TransactionType;
import org.nowstart.folio.repository.AccountRepository;
import org.nowstart.folio.repository.CashBalanceRepository;
import org.nowstart.folio.repository.HoldingSnapshotRepository;
import org.nowstart.folio.repository.LedgerTransactionRepository;
import org.nowstart.folio.repository.PortfolioAccountLinkRepository;
import org.nowstart.folio.repository.PortfolioRepository;
import org.nowstart.folio.repository.TaxpayerRepository;
import org.nowstart.folio.service.benchmark.BenchmarkPriceService;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class PerformanceReportService {

    static final String COMBINED_LABEL = "Combined";

    // calendar days of prices fetched ahead of the period so the start anchor can use the prior close
    private static final int BENCHMARK_LOOKBACK_DAYS = 10;
    private static final List<TransactionType> ALL_TYPES = Arrays.asList(TransactionType.values());

    private final PortfolioRepository portfolioRepository;
    private final PortfolioAccountLinkRepository portfolioAccountLinkRepository;
    private final AccountRepository accountRepository;
    private final TaxpayerRepository taxpayerRepository;
    private final HoldingSnapshotRepository holdingSnapshotRepository;
    private final CashBalanceRepository cashBalanceRepository;
    private final LedgerTransactionRepository ledgerTransactionRepository;
    private final SnapshotAggregator snapshotAggregator;
    private final ValuationAnchorSelector valuationAnchorSelector;
    private final CashFlowClassifier cashFlowClassifier;
    private final ReturnCalculator returnCalculator;
    private final RiskStatistics riskStatistics;
    private final BenchmarkAligner benchmarkAligner;
    private final BenchmarkPriceService benchmarkPriceService;
    private final PerformanceProperties performanceProperties;

    public PerformanceReport buildReport(PerformanceReportRequest request) {
        if (request.endDate().isBefore(request.startDate())) {
            throw new FolioApiException(HttpStatus.BAD_REQUEST, "invalid_date_range", "endDate must not be before startDate");
        }
        long startedAt = System.currentTimeMillis();
        ReportWindow window = new ReportWindow(
                request.startDate(),
                request.endDate(),
                request.graceDays() == null ? performanceProperties.graceDays() : request.graceDays(),
                request.frequency() == null ? performanceProperties.defaultFrequency() : request.frequency(),
                performanceProperties.riskFreeRateAnnual(),
                performanceProperties.includeWithholdingAsFlow()
        );
        String symbol = request.benchmarkSymbol() == null || request.benchmarkSymbol().isBlank()
                ? performanceProperties.defaultBenchmark()
                : request.benchmarkSymbol();

        List<String> warnings = new ArrayList<>();
        BenchmarkStats benchmark = benchmarkStats(symbol, window, warnings);

        Map<Long, Account> accountsInScope = accountsInScope(request);
        List<Portfolio> portfolios = request.portfolioIds() == null || request.portfolioIds().isEmpty()
                ? portfolioRepository.findByActiveTrueOrderByIdAsc()
                : portfolioRepository.findByIdInAndActiveTrueOrderByIdAsc(request.portfolioIds());

        Map<Long, Map<String, Long>> accountsByProvider = new HashMap<>();
        if (!portfolios.isEmpty()) {
            List<Long> portfolioIds = portfolios.stream().map(Portfolio::getId).toList();
            for (PortfolioAccountLink link : portfolioAccountLinkRepository.findByPortfolioIdIn(portfolioIds)) {
                if (link.getAccountId() == null || !accountsInScope.containsKey(link.getAccountId())) {
                    continue;
                }
                String providerAccountId = link.getProviderAccountId() == null ? "" : link.getProviderAccountId().trim();
                accountsByProvider.computeIfAbsent(link.getPortfolioId(), id -> new HashMap<>())
                        .put(providerAccountId, link.getAccountId());
            }
        }
        List<Portfolio> reported = portfolios.stream()
                .filter(portfolio -> accountsByProvider.containsKey(portfolio.getId()))
                .toList();
        if (reported.isEmpty()) {
            warnings.add("No portfolios with accounts in scope " + request.scope() + ".");
            return new PerformanceReport(request.scope(), window.start(), window.end(), window.frequency(),
                    benchmark.label(), List.of(), null, warnings);
        }

        Set<Long> accountIds = accountsByProvider.values().stream()
                .flatMap(mapping -> mapping.values().stream())
                .collect(Collectors.toSet());
        Map<Long, NavigableMap<LocalDate, Double>> valuesByPortfolio = valuations(reported, accountsByProvider, accountIds, window);
        if (valuesByPortfolio.isEmpty()) {
            warnings.add("No holdings snapshots found in the selected period; TWR/Sharpe will be blank.");
        }
        List<LedgerTransaction> transactions = ledgerTransactionRepository.findByAccountIdInAndTypeInAndTradeDateBetweenOrderByTradeDateAscIdAsc(
                accountIds,
                ALL_TYPES,
                window.baselineWindowStart(),
                window.endWindowEnd()
        );

        Map<Long, PortfolioMeasurement> measurements = new LinkedHashMap<>();
        for (Portfolio portfolio : reported) {
            Collection<Long> portfolioAccounts = accountsByProvider.get(portfolio.getId()).values();
            List<LedgerTransaction> portfolioTransactions = transactions.stream()
                    .filter(txn -> portfolioAccounts.contains(txn.getAccountId()))
                    .toList();
            NavigableMap<LocalDate, Double> values = valuesByPortfolio.getOrDefault(portfolio.getId(), new TreeMap<>());
            measurements.put(portfolio.getId(), new PortfolioMeasurement(
                    values,
                    portfolioTransactions,
                    portfolioRow(portfolio, values, portfolioTransactions, window, benchmark)
            ));
        }

        List<PerformanceRow> rows = measurements.values().stream().map(PortfolioMeasurement::row).toList();
        PerformanceRow combined = request.includeCombined() ? combinedRow(measurements.values(), window, benchmark, warnings) : null;

        log.info(
                "event=performance_report_built scope={} start={} end={} frequency={} portfolios={} benchmark={} elapsedMs={}",
                request.scope(),
                window.start(),
                window.end(),
                window.frequency(),
                rows.size(),
                benchmark.label(),
                System.currentTimeMillis() - startedAt
        );
        return new PerformanceReport(request.scope(), window.start(), window.end(), window.frequency(),
                benchmark.label(), rows, combined, warnings);
    }

    private Map<Long, Account> accountsInScope(PerformanceReportRequest request) {
        Map<Long, Taxpayer> taxpayers = taxpayerRepository.findAll().stream()
                .collect(Collectors.toMap(Taxpayer::getId, Function.identity()));
        return accountRepository.findAll().stream()
                .filter(account -> {
                    Taxpayer taxpayer = taxpayers.get(account.getTaxpayerId());
                    return request.scope().includes(taxpayer == null ? null : taxpayer.getType(), account.getAccountType());
                })
                .collect(Collectors.toMap(Account::getId, Function.identity()));
    }

    private Map<Long, NavigableMap<LocalDate, Double>> valuations(
            List<Portfolio> portfolios,
            Map<Long, Map<String, Long>> accountsByProvider,
            Set<Long> accountIds,
            ReportWindow window
    ) {
        List<HoldingSnapshot> snapshots = holdingSnapshotRepository.findByPortfolioIdInAndAsOfBetweenOrderByAsOfAsc(
                portfolios.stream().map(Portfolio::getId).toList(),
                window.baselineWindowStart().atStartOfDay(ZoneOffset.UTC).toInstant(),
                window.endWindowEnd().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1)
        );
        Map<Long, List<CashBalance>> cashBalances = cashBalanceRepository
                .findByAccountIdInAndAsOfDateLessThanEqualOrderByAsOfDateAsc(accountIds, window.endWindowEnd())
                .stream()
                .collect(Collectors.groupingBy(CashBalance::getAccountId));
        return snapshotAggregator.aggregate(snapshots, accountsByProvider, cashBalances);
    }

    private BenchmarkStats benchmarkStats(String symbol, ReportWindow window, List<String> warnings) {
        String label = BenchmarkPriceService.cleanSymbol(symbol);
        BenchmarkPriceResult result = benchmarkPriceService.getPrices(symbol, window.start().minusDays(BENCHMARK_LOOKBACK_DAYS), window.end());
        if (result instanceof BenchmarkPriceResult.Failure failure) {
            warnings.add(label + " benchmark unavailable: " + failure.reason());
            return new BenchmarkStats(label, null, null);
        }

        BenchmarkPriceResult.Success success = (BenchmarkPriceResult.Success) result;
        List<ValuationPoint> aligned = benchmarkAligner.align(success.prices(), window.start(), window.end(), window.frequency());
        if (aligned.size() < 2) {
            warnings.add(label + " benchmark has fewer than 2 prices in the selected period.");
            return new BenchmarkStats(label, null, null);
        }

        TimeWeightedReturn twr = returnCalculator.timeWeightedReturn(aligned, List.of());
        Double sharpe = twr.periodReturns().isEmpty()
                ? null
                : returnCalculator.sharpe(twr.periodReturns(), window.riskFreeAnnual(), window.frequency().periodsPerYear());
        LocalDate coverageStart = aligned.get(0).date();
        LocalDate coverageEnd = aligned.get(aligned.size() - 1).date();
        if (coverageStart.isAfter(window.start())) {
            warnings.add(label + " benchmark coverage starts at " + coverageStart + " (missing earlier prices for selected period).");
        }
        if (coverageEnd.isBefore(window.end())) {
            warnings.add(label + " benchmark coverage ends at " + coverageEnd + " (missing later prices for selected period).");
        }
        return new BenchmarkStats(label, twr.twr(), sharpe);
    }

    private PerformanceRow portfolioRow(
            Portfolio portfolio,
            NavigableMap<LocalDate, Double> values,
            List<LedgerTransaction> transactions,
            ReportWindow window,
            BenchmarkStats benchmark
    ) {
        List<String> warnings = new ArrayList<>();
        ValuationPoint begin = valuationAnchorSelector.beginAnchor(values, window.start(), window.graceDays()).orElse(null);
        ValuationPoint end = valuationAnchorSelector.endAnchor(values, window.end(), window.graceDays()).orElse(null);
        List<ValuationPoint> sampled = valuationAnchorSelector.downsample(values, window.frequency());
        LocalDate coverageStart = sampled.isEmpty() ? null : sampled.get(0).date();
        LocalDate coverageEnd = sampled.isEmpty() ? null : sampled.get(sampled.size() - 1).date();

        // flows follow the anchors actually used so cash moved in an anchor gap is not counted as performance
        LocalDate flowStart = begin == null ? window.start() : begin.date();
        LocalDate flowEnd = end == null ? window.end() : end.date();
        List<LedgerTransaction> inWindow = between(transactions, flowStart, flowEnd);
        ClassifiedCashFlows flows = cashFlowClassifier.classify(inWindow, window.includeWithholdingAsFlow());

        LocalDate firstTransaction = inWindow.isEmpty() ? null : inWindow.get(0).getTradeDate();
        LocalDate lastTransaction = inWindow.isEmpty() ? null : inWindow.get(inWindow.size() - 1).getTradeDate();
        if (inWindow.isEmpty()) {
            warnings.add("No transactions found in valuation window (" + flowStart + " → " + flowEnd + ").");
        } else {
            if (firstTransaction.isAfter(flowStart)) {
                warnings.add("Transactions start at " + firstTransaction + " (missing earlier activity in valuation window).");
            }
            if (lastTransaction.isBefore(flowEnd)) {
                warnings.add("Transactions end at " + lastTransaction + " (missing later activity in valuation window).");
            }
        }

        if (coverageStart == null) {
            warnings.add("No valuation points (holdings snapshots) found in this period.");
        } else if (begin == null) {
            warnings.add("Coverage starts at " + coverageStart + "; upload a holdings snapshot near " + window.start()
                    + " (±~" + window.graceDays() + " days) for true period-to-date performance.");
        }
        if (begin != null && !begin.date().equals(window.start())) {
            warnings.add("Using begin snapshot at " + begin.date() + " (target " + window.start() + ").");
        }
        if (end != null && !end.date().equals(window.end())) {
            warnings.add("Using end snapshot at " + end.date() + " (target " + window.end() + ").");
        }
        if (coverageEnd != null && coverageEnd.isBefore(window.endWindowStart())) {
            warnings.add("Coverage ends at " + coverageEnd + "; upload a holdings snapshot near " + window.end()
                    + " (±~" + window.graceDays() + " days) for true period-end performance.");
        }
        if (begin != null && end != null && looksTruncated(begin.value(), end.value())) {
            warnings.add("Begin value looks unusually small vs end value; verify holdings snapshot totals (statement parsing).");
        }

        PerformanceRow measured = measure(begin, end, sampled, flows, window, benchmark, warnings);
        return measured.toBuilder()
                .portfolioId(portfolio.getId())
                .label(portfolio.getName() == null || portfolio.getName().isBlank() ? "Portfolio " + portfolio.getId() : portfolio.getName())
                .coverageStart(coverageStart)
                .coverageEnd(coverageEnd)
                .valuationPoints(sampled.size())
                .transactionCount(inWindow.size())
                .firstTransactionDate(firstTransaction)
                .lastTransactionDate(lastTransaction)
                .warnings(List.copyOf(warnings))
                .build();
    }

    private PerformanceRow combinedRow(
            Collection<PortfolioMeasurement> measurements,
            ReportWindow window,
            BenchmarkStats benchmark,
            List<String> reportWarnings
    ) {
        List<String> warnings = new ArrayList<>();
        List<PortfolioMeasurement> included = measurements.stream()
                .filter(measurement -> measurement.row().beginValue() != null)
                .toList();
        List<String> excluded = measurements.stream()
                .filter(measurement -> measurement.row().beginValue() == null)
                .map(measurement -> measurement.row().label())
                .toList();
        String exclusion = "Combined metrics exclude portfolios without a baseline snapshot near period start: " + String.join(", ", excluded);
        if (included.isEmpty()) {
            if (!excluded.isEmpty()) {
                reportWarnings.add(exclusion);
            }
            return null;
        }
        if (!excluded.isEmpty()) {
            warnings.add(exclusion);
        }

        TreeMap<LocalDate, Double> values = new TreeMap<>();
        included.forEach(measurement -> measurement.values().keySet().forEach(date -> values.put(date, 0.0)));
        for (Map.Entry<LocalDate, Double> entry : values.entrySet()) {
            double total = 0.0;
            int missing = 0;
            for (PortfolioMeasurement measurement : included) {
                Map.Entry<LocalDate, Double> carried = measurement.values().floorEntry(entry.getKey());
                if (carried == null) {
                    missing++;
                } else {
                    total += carried.getValue();
                }
            }
            if (missing > 0) {
                warnings.add("Combined value on " + entry.getKey() + " missing " + missing + " portfolio(s); using carry-forward where available.");
            }
            entry.setValue(total);
        }

        ValuationPoint begin = valuationAnchorSelector.beginAnchor(values, window.start(), window.graceDays()).orElse(null);
        ValuationPoint end = valuationAnchorSelector.endAnchor(values, window.end(), window.graceDays()).orElse(null);
        List<ValuationPoint> sampled = valuationAnchorSelector.downsample(values, window.frequency());

        List<LedgerTransaction> transactions = included.stream()
                .flatMap(measurement -> between(measurement.transactions(), window.start(), window.end()).stream())
                .sorted(Comparator.comparing(LedgerTransaction::getTradeDate)
                        .thenComparing(LedgerTransaction::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        ClassifiedCashFlows flows = cashFlowClassifier.classify(transactions, window.includeWithholdingAsFlow());

        PerformanceRow measured = measure(begin, end, sampled, flows, window, benchmark, warnings);
        double fees = included.stream().mapToDouble(measurement -> measurement.row().fees()).sum();
        double withholding = included.stream().mapToDouble(measurement -> measurement.row().withholding()).sum();
        double otherCashOut = included.stream().mapToDouble(measurement -> measurement.row().otherCashOut()).sum();
        return measured.toBuilder()
                .portfolioId(0L)
                .label(COMBINED_LABEL)
                .coverageStart(sampled.isEmpty() ? null : sampled.get(0).date())
                .coverageEnd(sampled.isEmpty() ? null : sampled.get(sampled.size() - 1).date())
                .valuationPoints(sampled.size())
                .transactionCount(transactions.size())
                .firstTransactionDate(transactions.isEmpty() ? null : transactions.get(0).getTradeDate())
                .lastTransactionDate(transactions.isEmpty() ? null : transactions.get(transactions.size() - 1).getTradeDate())
                .fees(fees)
                .withholding(withholding)
                .otherCashOut(otherCashOut)
                .totalCashOut(measured.withdrawals() + fees + withholding + otherCashOut)
                .warnings(List.copyOf(warnings))
                .build();
    }

    /**
     * Value, flow and return metrics for one valuation series between its anchors. Warnings are appended to {@code warnings}.
     */
    private PerformanceRow measure(
            ValuationPoint begin,
            ValuationPoint end,
            List<ValuationPoint> sampled,
            ClassifiedCashFlows flows,
            ReportWindow window,
            BenchmarkStats benchmark,
            List<String> warnings
    ) {
        Double gain = begin != null && end != null ? end.value() - begin.value() - flows.netFlow() : null;

        Double xirr = null;
        if (begin != null && end != null && !begin.date().equals(end.date()) && begin.value() > 0.0 && end.value() >= 0.0) {
            List<CashFlow> investorFlows = new ArrayList<>();
            investorFlows.add(new CashFlow(begin.date(), -begin.value()));
            flows.externalFlows().forEach(flow -> investorFlows.add(new CashFlow(flow.date(), -flow.amount())));
            investorFlows.add(new CashFlow(end.date(), end.value()));
            xirr = returnCalculator.xirr(investorFlows);
        } else if (begin != null) {
            warnings.add("IRR/XIRR needs at least 2 valuation points in the period.");
        }

        List<ValuationPoint> series = begin != null && end != null
                ? valuationAnchorSelector.windowSeries(sampled, begin, end)
                : List.of();
        Double twr = null;
        List<Double> returns = List.of();
        if (series.size() >= 2) {
            TimeWeightedReturn result = returnCalculator.timeWeightedReturn(series, flows.externalFlows());
            warnings.addAll(result.warnings());
            twr = result.twr();
            returns = result.periodReturns();
        }

        RiskStats risk = riskStatistics.compute(returns, null, window.riskFreeAnnual(), window.frequency().periodsPerYear());
        if (risk.sharpe() == null && series.size() >= 2) {
            warnings.add(returns.size() < 2
                    ? "Sharpe requires at least 2 period returns (≥3 valuation points)."
                    : "Sharpe is undefined for this period (insufficient return variability).");
        }
        if (benchmark.twr() != null && series.size() < 2) {
            warnings.add(benchmark.label() + " benchmark shown for selected period; portfolio has <2 valuation points.");
        }

        return PerformanceRow.builder()
                .startDate(window.start())
                .endDate(window.end())
                .beginDate(begin == null ? null : begin.date())
                .endValueDate(end == null ? null : end.date())
                .beginValue(begin == null ? null : begin.value())
                .endValue(end == null ? null : end.value())
                .contributions(flows.contributions())
                .withdrawals(flows.withdrawals())
                .fees(flows.fees())
                .withholding(flows.withholding())
                .otherCashOut(flows.otherCashOut())
                .netFlow(flows.netFlow())
                .totalCashOut(flows.totalCashOut())
                .gain(gain)
                .xirr(xirr)
                .twr(twr)
                .volatility(risk.volatility())
                .sharpe(risk.sharpe())
                .sortino(risk.sortino())
                .maxDrawdown(risk.maxDrawdown())
                .benchmarkTwr(benchmark.twr())
                .benchmarkSharpe(benchmark.sharpe())
                .excessReturn(returnCalculator.excessReturn(twr, benchmark.twr()))
                .excessSharpe(risk.sharpe() != null && benchmark.sharpe() != null ? risk.sharpe() - benchmark.sharpe() : null)
                .warnings(warnings)
                .build();
    }

    static boolean looksTruncated(double beginValue, double endValue) {
        return beginValue >= 0.0
                && endValue > 10000.0
                && beginValue < 1000.0
                && beginValue / Math.max(1.0, endValue) < 0.001;
    }

    private static List<LedgerTransaction> between(List<LedgerTransaction> transactions, LocalDate from, LocalDate to) {
        return transactions.stream()
                .filter(txn -> txn.getTradeDate() != null && !txn.getTradeDate().isBefore(from) && !txn.getTradeDate().isAfter(to))
                .toList();
    }

    record ReportWindow(
            LocalDate start,
            LocalDate end,
            int graceDays,
            ReportFrequency frequency,
            double riskFreeAnnual,
            boolean includeWithholdingAsFlow
    ) {
        LocalDate baselineWindowStart() {
            return start.minusDays(graceDays);
        }

        LocalDate endWindowStart() {
            return end.minusDays(graceDays);
        }

        LocalDate endWindowEnd() {
            return end.plusDays(graceDays);
        }
    }

    private record BenchmarkStats(String label, Double twr, Double sharpe) {
    }

    private record PortfolioMeasurement(
            NavigableMap<LocalDate, Double> values,
            List<LedgerTransaction> transactions,
            PerformanceRow row
    ) {
    }
}
