package org.nowstart.folio.service.performance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.folio.data.dto.BenchmarkPriceResult;
import org.nowstart.folio.data.dto.PerformanceReport;
import org.nowstart.folio.data.dto.PerformanceReportRequest;
import org.nowstart.folio.data.dto.PerformanceRow;
import org.nowstart.folio.data.dto.PricePoint;
import org.nowstart.folio.data.entity.Account;
import org.nowstart.folio.data.entity.HoldingSnapshot;
import org.nowstart.folio.data.entity.HoldingSnapshot.SnapshotItem;
import org.nowstart.folio.data.entity.LedgerTransaction;
import org.nowstart.folio.data.entity.Portfolio;
import org.nowstart.folio.data.entity.PortfolioAccountLink;
import org.nowstart.folio.data.entity.Taxpayer;
import org.nowstart.folio.data.exception.FolioApiException;
import org.nowstart.folio.data.property.PerformanceProperties;
import org.nowstart.folio.data.type.AccountType;
import org.nowstart.folio.data.type.BenchmarkProviderType;
import org.nowstart.folio.data.type.ReportFrequency;
import org.nowstart.folio.data.type.ReportScope;
import org.nowstart.folio.data.type.TaxpayerType;
import org.nowstart.folio.data.type.TransactionType;
import org.nowstart.folio.repository.AccountRepository;
import org.nowstart.folio.repository.CashBalanceRepository;
import org.nowstart.folio.repository.HoldingSnapshotRepository;
import org.nowstart.folio.repository.LedgerTransactionRepository;
import org.nowstart.folio.repository.PortfolioAccountLinkRepository;
import org.nowstart.folio.repository.PortfolioRepository;
import org.nowstart.folio.repository.TaxpayerRepository;
import org.nowstart.folio.service.benchmark.BenchmarkPriceService;

@ExtendWith(MockitoExtension.class)
class PerformanceReportServiceTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 1);
    private static final LocalDate END = LocalDate.of(2025, 3, 31);

    @Mock
    private PortfolioRepository portfolioRepository;
    @Mock
    private PortfolioAccountLinkRepository portfolioAccountLinkRepository;
    @Mock
    private AccountRepository accountRepository;
    @Mock
    private TaxpayerRepository taxpayerRepository;
    @Mock
    private HoldingSnapshotRepository holdingSnapshotRepository;
    @Mock
    private CashBalanceRepository cashBalanceRepository;
    @Mock
    private LedgerTransactionRepository ledgerTransactionRepository;
    @Mock
    private BenchmarkPriceService benchmarkPriceService;

    private PerformanceReportService service;

    @BeforeEach
    void setUp() {
        ReturnCalculator returnCalculator = new ReturnCalculator();
        service = new PerformanceReportService(
                portfolioRepository,
                portfolioAccountLinkRepository,
                accountRepository,
                taxpayerRepository,
                holdingSnapshotRepository,
                cashBalanceRepository,
                ledgerTransactionRepository,
                new SnapshotAggregator(),
                new ValuationAnchorSelector(),
                new CashFlowClassifier(),
                returnCalculator,
                new RiskStatistics(returnCalculator),
                new BenchmarkAligner(),
                benchmarkPriceService,
                new PerformanceProperties(14, 0.0, false, "VOO", ReportFrequency.MONTH_END)
        );
    }

    @Test
    void buildReport_rejectsEndBeforeStart() {
        PerformanceReportRequest request = request(ReportScope.ALL, END, START);

        assertThatThrownBy(() -> service.buildReport(request))
                .isInstanceOf(FolioApiException.class)
                .hasMessageContaining("endDate must not be before startDate");
        verifyNoInteractions(benchmarkPriceService, portfolioRepository);
    }

    @Test
    void buildReport_warnsWhenNoPortfolioHasAccountsInScope() {
        given(benchmarkPriceService.getPrices("VOO", START.minusDays(10), END))
                .willReturn(new BenchmarkPriceResult.Failure(BenchmarkProviderType.YAHOO, "VOO", "Yahoo request failed with status 429"));
        givenAccounts();
        given(portfolioRepository.findByActiveTrueOrderByIdAsc()).willReturn(List.of(portfolio(1L, "Brokerage")));
        given(portfolioAccountLinkRepository.findByPortfolioIdIn(List.of(1L))).willReturn(List.of(link(1L, "IB-1", 10L)));

        PerformanceReport report = service.buildReport(request(ReportScope.TRUST, START, END));

        assertThat(report.rows()).isEmpty();
        assertThat(report.combined()).isNull();
        assertThat(report.benchmarkLabel()).isEqualTo("VOO");
        assertThat(report.warnings()).containsExactly(
                "VOO benchmark unavailable: Yahoo request failed with status 429",
                "No portfolios with accounts in scope TRUST."
        );
        verifyNoInteractions(holdingSnapshotRepository, ledgerTransactionRepository);
    }

    @Test
    void buildReport_measuresPortfoliosAndCombinedRow() {
        given(benchmarkPriceService.getPrices("VOO", START.minusDays(10), END))
                .willReturn(new BenchmarkPriceResult.Success(BenchmarkProviderType.STORED, "VOO", List.of(
                        new PricePoint(LocalDate.of(2024, 12, 31), 100.0),
                        new PricePoint(LocalDate.of(2025, 1, 31), 102.0),
                        new PricePoint(LocalDate.of(2025, 2, 28), 104.0),
                        new PricePoint(LocalDate.of(2025, 3, 31), 110.0)
                )));
        givenAccounts();
        given(portfolioRepository.findByActiveTrueOrderByIdAsc()).willReturn(List.of(portfolio(1L, "Brokerage"), portfolio(2L, "")));
        given(portfolioAccountLinkRepository.findByPortfolioIdIn(List.of(1L, 2L)))
                .willReturn(List.of(link(1L, "IB-1", 10L), link(2L, "IB-2", 11L)));
        given(holdingSnapshotRepository.findByPortfolioIdInAndAsOfBetweenOrderByAsOfAsc(anyCollection(), any(), any())).willReturn(List.of(
                snapshot(1L, "2024-12-31T21:00:00Z", "IB-1", "1000"),
                snapshot(1L, "2025-01-31T21:00:00Z", "IB-1", "1050"),
                snapshot(1L, "2025-02-28T21:00:00Z", "IB-1", "1200"),
                snapshot(1L, "2025-03-31T21:00:00Z", "IB-1", "1260"),
                snapshot(2L, "2025-03-31T21:00:00Z", "IB-2", "500")
        ));
        given(cashBalanceRepository.findByAccountIdInAndAsOfDateLessThanEqualOrderByAsOfDateAsc(anyCollection(), any())).willReturn(List.of());
        given(ledgerTransactionRepository.findByAccountIdInAndTypeInAndTradeDateBetweenOrderByTradeDateAscIdAsc(
                anyCollection(), anyCollection(), any(), any())).willReturn(List.of(
                txn(1L, 10L, TransactionType.TRANSFER, "2025-02-15", "100", "ACH DEPOSIT"),
                txn(2L, 10L, TransactionType.FEE, "2025-03-31", "-5", "ADVISORY FEE"),
                txn(3L, 11L, TransactionType.TRANSFER, "2025-03-03", "500", "ACH DEPOSIT")
        ));

        PerformanceReport report = service.buildReport(request(ReportScope.ALL, START, END));

        assertThat(report.warnings()).isEmpty();
        assertThat(report.rows()).hasSize(2);

        PerformanceRow brokerage = report.rows().get(0);
        assertThat(brokerage.label()).isEqualTo("Brokerage");
        assertThat(brokerage.beginDate()).isEqualTo(LocalDate.of(2024, 12, 31));
        assertThat(brokerage.beginValue()).isEqualTo(1000.0);
        assertThat(brokerage.endValue()).isEqualTo(1260.0);
        assertThat(brokerage.contributions()).isCloseTo(100.0, within(1e-9));
        assertThat(brokerage.fees()).isCloseTo(5.0, within(1e-9));
        assertThat(brokerage.gain()).isCloseTo(160.0, within(1e-9));
        assertThat(brokerage.twr()).isPositive();
        assertThat(brokerage.xirr()).isPositive();
        assertThat(brokerage.valuationPoints()).isEqualTo(4);
        assertThat(brokerage.benchmarkTwr()).isCloseTo(0.10, within(1e-9));
        assertThat(brokerage.excessReturn()).isCloseTo(brokerage.twr() - 0.10, within(1e-9));
        assertThat(brokerage.warnings()).contains(
                "Using begin snapshot at 2024-12-31 (target 2025-01-01).",
                "Transactions start at 2025-02-15 (missing earlier activity in valuation window)."
        );

        PerformanceRow unanchored = report.rows().get(1);
        assertThat(unanchored.label()).isEqualTo("Portfolio 2");
        assertThat(unanchored.beginValue()).isNull();
        assertThat(unanchored.gain()).isNull();
        assertThat(unanchored.twr()).isNull();
        assertThat(unanchored.warnings()).contains(
                "Coverage starts at 2025-03-31; upload a holdings snapshot near 2025-01-01 (±~14 days) for true period-to-date performance.",
                "VOO benchmark shown for selected period; portfolio has <2 valuation points."
        );

        PerformanceRow combined = report.combined();
        assertThat(combined.portfolioId()).isZero();
        assertThat(combined.label()).isEqualTo("Combined");
        assertThat(combined.beginValue()).isEqualTo(1000.0);
        assertThat(combined.endValue()).isEqualTo(1260.0);
        assertThat(combined.gain()).isCloseTo(160.0, within(1e-9));
        assertThat(combined.fees()).isCloseTo(5.0, within(1e-9));
        assertThat(combined.transactionCount()).isEqualTo(2);
        assertThat(combined.warnings()).contains(
                "Combined metrics exclude portfolios without a baseline snapshot near period start: Portfolio 2");
    }

    @Test
    void buildReport_omitsCombinedRowWhenNoPortfolioHasBaseline() {
        given(benchmarkPriceService.getPrices("VOO", START.minusDays(10), END))
                .willReturn(new BenchmarkPriceResult.Success(BenchmarkProviderType.STORED, "VOO", List.of(
                        new PricePoint(LocalDate.of(2024, 12, 31), 100.0),
                        new PricePoint(LocalDate.of(2025, 3, 31), 110.0)
                )));
        givenAccounts();
        given(portfolioRepository.findByActiveTrueOrderByIdAsc()).willReturn(List.of(portfolio(1L, "Brokerage")));
        given(portfolioAccountLinkRepository.findByPortfolioIdIn(List.of(1L))).willReturn(List.of(link(1L, "IB-1", 10L)));
        given(holdingSnapshotRepository.findByPortfolioIdInAndAsOfBetweenOrderByAsOfAsc(anyCollection(), any(), any()))
                .willReturn(List.of(snapshot(1L, "2025-03-31T21:00:00Z", "IB-1", "1260")));
        given(cashBalanceRepository.findByAccountIdInAndAsOfDateLessThanEqualOrderByAsOfDateAsc(anyCollection(), any())).willReturn(List.of());
        given(ledgerTransactionRepository.findByAccountIdInAndTypeInAndTradeDateBetweenOrderByTradeDateAscIdAsc(
                anyCollection(), anyCollection(), any(), any())).willReturn(List.of());

        PerformanceReport report = service.buildReport(request(ReportScope.ALL, START, END));

        assertThat(report.rows()).singleElement()
                .satisfies(row -> assertThat(row.beginValue()).isNull());
        assertThat(report.combined()).isNull();
        assertThat(report.warnings()).containsExactly(
                "Combined metrics exclude portfolios without a baseline snapshot near period start: Brokerage");
    }

    @Test
    void looksTruncated_flagsTinyBeginAgainstLargeEnd() {
        assertThat(PerformanceReportService.looksTruncated(5.0, 250000.0)).isTrue();
        assertThat(PerformanceReportService.looksTruncated(5000.0, 250000.0)).isFalse();
        assertThat(PerformanceReportService.looksTruncated(5.0, 9000.0)).isFalse();
    }

    private void givenAccounts() {
        given(taxpayerRepository.findAll()).willReturn(List.of(
                Taxpayer.builder().id(1L).name("Self").type(TaxpayerType.PERSONAL).build()
        ));
        given(accountRepository.findAll()).willReturn(List.of(
                Account.builder().id(10L).taxpayerId(1L).accountType(AccountType.TAXABLE).build(),
                Account.builder().id(11L).taxpayerId(1L).accountType(AccountType.TAXABLE).build()
        ));
    }

    private static PerformanceReportRequest request(ReportScope scope, LocalDate start, LocalDate end) {
        return new PerformanceReportRequest(scope, start, end, null, null, null, null, true);
    }

    private static Portfolio portfolio(Long id, String name) {
        return Portfolio.builder().id(id).name(name).active(true).build();
    }

    private static PortfolioAccountLink link(Long portfolioId, String providerAccountId, Long accountId) {
        return PortfolioAccountLink.builder().portfolioId(portfolioId).providerAccountId(providerAccountId).accountId(accountId).build();
    }

    private static HoldingSnapshot snapshot(Long portfolioId, String asOf, String providerAccountId, String value) {
        return HoldingSnapshot.builder()
                .portfolioId(portfolioId)
                .asOf(Instant.parse(asOf))
                .items(List.of(new SnapshotItem(providerAccountId, null, new BigDecimal(value), true)))
                .build();
    }

    private static LedgerTransaction txn(Long id, Long accountId, TransactionType type, String date, String amount, String description) {
        return LedgerTransaction.builder()
                .id(id)
                .accountId(accountId)
                .type(type)
                .tradeDate(LocalDate.parse(date))
                .amount(new BigDecimal(amount))
                .description(description)
                .build();
    }
}
