package org.nowstart.folio.service.performance;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.folio.data.dto.RiskStats;
import org.nowstart.folio.data.dto.ValuationPoint;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RiskStatistics {

    private final ReturnCalculator returnCalculator;

    public RiskStats compute(
            List<Double> portfolioReturns,
            List<Double> benchmarkReturns,
            double riskFreeAnnual,
            double periodsPerYear
    ) {
        if (portfolioReturns == null || portfolioReturns.isEmpty()) {
            return RiskStats.empty();
        }

        double riskFreePerPeriod = riskFreeAnnual / periodsPerYear;
        double mean = ReturnCalculator.mean(portfolioReturns);
        Double std = sampleStd(portfolioReturns);
        Double volatility = std == null ? null : std * Math.sqrt(periodsPerYear);
        Double sharpe = returnCalculator.sharpe(portfolioReturns, riskFreeAnnual, periodsPerYear);

        List<Double> downside = portfolioReturns.stream()
                .map(r -> Math.min(0.0, r - riskFreePerPeriod))
                .toList();
        Double downsideStd = sampleStd(downside);
        Double sortino = downsideStd != null && downsideStd > 0.0
                ? ((mean - riskFreePerPeriod) / downsideStd) * Math.sqrt(periodsPerYear)
                : null;

        Double beta = null;
        Double alpha = null;
        Double correlation = null;
        if (benchmarkReturns != null
                && benchmarkReturns.size() == portfolioReturns.size()
                && portfolioReturns.size() >= 2) {
            double benchmarkMean = ReturnCalculator.mean(benchmarkReturns);
            double covariance = 0.0;
            for (int i = 0; i < portfolioReturns.size(); i++) {
                covariance += (benchmarkReturns.get(i) - benchmarkMean) * (portfolioReturns.get(i) - mean);
            }
            covariance /= portfolioReturns.size() - 1;
            double benchmarkVariance = ReturnCalculator.sampleVariance(benchmarkReturns, benchmarkMean);
            double portfolioVariance = ReturnCalculator.sampleVariance(portfolioReturns, mean);
            if (benchmarkVariance > 0.0) {
                beta = covariance / benchmarkVariance;
                alpha = mean - beta * benchmarkMean;
            }
            if (benchmarkVariance > 0.0 && portfolioVariance > 0.0) {
                correlation = covariance / Math.sqrt(benchmarkVariance * portfolioVariance);
            }
        }

        return new RiskStats(volatility, sharpe, sortino, maxDrawdown(portfolioReturns), beta, alpha, correlation);
    }

    public Double maxDrawdown(List<Double> returns) {
        if (returns == null || returns.isEmpty()) {
            return null;
        }
        double equity = 1.0;
        double peak = 1.0;
        double maxDrawdown = 0.0;
        for (Double r : returns) {
            equity *= 1.0 + r;
            if (equity > peak) {
                peak = equity;
            }
            double drawdown = (equity / peak) - 1.0;
            if (drawdown < maxDrawdown) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }

    /**
     * Growth of 1.0 along the series; empty unless there is one return per consecutive pair of points.
     */
    public List<ValuationPoint> growthCurve(List<ValuationPoint> series, List<Double> returns) {
        if (series.isEmpty() || returns.isEmpty() || returns.size() != series.size() - 1) {
            return List.of();
        }
        List<ValuationPoint> curve = new ArrayList<>();
        double growth = 1.0;
        curve.add(new ValuationPoint(series.get(0).date(), growth));
        for (int i = 0; i < returns.size(); i++) {
            growth *= 1.0 + returns.get(i);
            curve.add(new ValuationPoint(series.get(i + 1).date(), growth));
        }
        return curve;
    }

    private static Double sampleStd(List<Double> values) {
        if (values.size() < 2) {
            return null;
        }
        double variance = ReturnCalculator.sampleVariance(values, ReturnCalculator.mean(values));
        return variance < 0.0 ? null : Math.sqrt(variance);
    }
}
