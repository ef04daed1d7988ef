package org.nowstart.folio.service.performance;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.nowstart.folio.data.dto.CashFlow;
import org.nowstart.folio.data.dto.TimeWeightedReturn;
import org.nowstart.folio.data.dto.ValuationPoint;
import org.springframework.stereotype.Component;

/**
 * Return math over valuation series and dated cash flows. Sub-period returns use Modified Dietz
 * with each flow weighted by the fraction of the period remaining after it.
 */
@Component
public class ReturnCalculator {

    static final double EPSILON = 1e-9;

    private static final double[] XIRR_SEEDS = {0.1, 0.05, 0.2, 0.0, -0.2};
    private static final int NEWTON_ITERATIONS = 50;
    private static final int BISECTION_ITERATIONS = 200;
    private static final double NPV_TOLERANCE = 1e-6;
    private static final double STEP_TOLERANCE = 1e-9;
    private static final double DERIVATIVE_STEP = 1e-6;
    private static final double MIN_RATE = -0.999999;
    private static final double BISECTION_LOW = -0.95;
    private static final double BISECTION_HIGH = 10.0;

    public Double modifiedDietz(ValuationPoint begin, ValuationPoint end, List<CashFlow> flows) {
        return subPeriod(begin, end, netFlowsByDate(flows)).value();
    }

    public TimeWeightedReturn timeWeightedReturn(List<ValuationPoint> values, List<CashFlow> flows) {
        if (values.size() < 2) {
            return new TimeWeightedReturn(null, List.of(), List.of("Need at least 2 valuation points."));
        }
        List<ValuationPoint> ordered = values.stream()
                .sorted(Comparator.comparing(ValuationPoint::date))
                .toList();
        TreeMap<LocalDate, Double> flowsByDate = netFlowsByDate(flows);

        List<Double> returns = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (int i = 1; i < ordered.size(); i++) {
            SubPeriod period = subPeriod(ordered.get(i - 1), ordered.get(i), flowsByDate);
            if (period.value() == null) {
                warnings.add(period.skipReason());
                continue;
            }
            returns.add(period.value());
        }

        if (returns.isEmpty()) {
            if (warnings.isEmpty()) {
                warnings.add("No valid subperiod returns.");
            }
            return new TimeWeightedReturn(null, List.of(), warnings);
        }
        return new TimeWeightedReturn(chainLink(returns), returns, warnings);
    }

    public Double chainLink(List<Double> returns) {
        if (returns == null || returns.isEmpty()) {
            return null;
        }
        double product = 1.0;
        for (Double r : returns) {
            product *= 1.0 + r;
        }
        return product - 1.0;
    }

    /**
     * Investor-perspective XIRR: deposits negative, withdrawals and ending value positive.
     * Returns null when the flows do not change sign or no root is found.
     */
    public Double xirr(List<CashFlow> cashflows) {
        List<CashFlow> flows = cashflows.stream()
                .filter(flow -> flow.date() != null && Double.isFinite(flow.amount()))
                .sorted(Comparator.comparing(CashFlow::date))
                .toList();
        if (flows.size() < 2) {
            return null;
        }
        boolean hasPositive = flows.stream().anyMatch(flow -> flow.amount() > 0.0);
        boolean hasNegative = flows.stream().anyMatch(flow -> flow.amount() < 0.0);
        if (!hasPositive || !hasNegative) {
            return null;
        }

        for (double seed : XIRR_SEEDS) {
            Double root = newton(flows, seed);
            if (root != null) {
                return root;
            }
        }
        return bisection(flows);
    }

    public Double sharpe(List<Double> periodReturns, double riskFreeAnnual, double periodsPerYear) {
        if (periodReturns == null || periodReturns.size() < 2) {
            return null;
        }
        double riskFreePerPeriod = riskFreeAnnual / periodsPerYear;
        List<Double> excess = periodReturns.stream().map(r -> r - riskFreePerPeriod).toList();
        double mean = mean(excess);
        double variance = sampleVariance(excess, mean);
        if (variance <= 0.0) {
            return null;
        }
        return (mean / Math.sqrt(variance)) * Math.sqrt(periodsPerYear);
    }

    public Double excessReturn(Double portfolioTwr, Double benchmarkTwr) {
        if (portfolioTwr == null || benchmarkTwr == null) {
            return null;
        }
        return portfolioTwr - benchmarkTwr;
    }

    double npv(double rate, List<CashFlow> flows) {
        if (rate <= MIN_RATE) {
            return Double.POSITIVE_INFINITY;
        }
        LocalDate first = flows.get(0).date();
        double total = 0.0;
        for (CashFlow flow : flows) {
            double years = ChronoUnit.DAYS.between(first, flow.date()) / 365.0;
            total += flow.amount() / Math.pow(1.0 + rate, years);
        }
        return total;
    }

    private Double newton(List<CashFlow> flows, double seed) {
        double rate = seed;
        for (int i = 0; i < NEWTON_ITERATIONS; i++) {
            double value = npv(rate, flows);
            if (Math.abs(value) < NPV_TOLERANCE) {
                return rate;
            }
            double derivative = (npv(rate + DERIVATIVE_STEP, flows) - value) / DERIVATIVE_STEP;
            if (derivative == 0.0 || !Double.isFinite(derivative)) {
                return null;
            }
            double next = rate - value / derivative;
            if (next <= MIN_RATE || !Double.isFinite(next)) {
                return null;
            }
            if (Math.abs(next - rate) < STEP_TOLERANCE) {
                return next;
            }
            rate = next;
        }
        return null;
    }

    private Double bisection(List<CashFlow> flows) {
        double low = BISECTION_LOW;
        double high = BISECTION_HIGH;
        double fLow = npv(low, flows);
        double fHigh = npv(high, flows);
        if (!Double.isFinite(fLow) || !Double.isFinite(fHigh)) {
            return null;
        }
        if (fLow == 0.0) {
            return low;
        }
        if (fHigh == 0.0) {
            return high;
        }
        if (fLow * fHigh > 0.0) {
            return null;
        }
        for (int i = 0; i < BISECTION_ITERATIONS; i++) {
            double mid = (low + high) / 2.0;
            double fMid = npv(mid, flows);
            if (!Double.isFinite(fMid)) {
                high = mid;
                continue;
            }
            if (Math.abs(fMid) < NPV_TOLERANCE) {
                return mid;
            }
            if (fLow * fMid <= 0.0) {
                high = mid;
            } else {
                low = mid;
                fLow = fMid;
            }
            if (Math.abs(high - low) < STEP_TOLERANCE) {
                return (low + high) / 2.0;
            }
        }
        return null;
    }

    private SubPeriod subPeriod(ValuationPoint begin, ValuationPoint end, TreeMap<LocalDate, Double> flowsByDate) {
        LocalDate d0 = begin.date();
        LocalDate d1 = end.date();
        if (begin.value() <= EPSILON) {
            return SubPeriod.skipped("Skipped period starting " + d0 + ": begin value is zero.");
        }
        if (!d1.isAfter(d0)) {
            return SubPeriod.skipped("Skipped period starting " + d0 + ": invalid date ordering.");
        }

        double totalDays = ChronoUnit.DAYS.between(d0, d1);
        double netFlow = 0.0;
        double weightedFlow = 0.0;
        // flows on the begin date are already in v0
        for (Map.Entry<LocalDate, Double> flow : flowsByDate.subMap(d0, false, d1, true).entrySet()) {
            double weight = ChronoUnit.DAYS.between(flow.getKey(), d1) / totalDays;
            weight = Math.max(0.0, Math.min(1.0, weight));
            netFlow += flow.getValue();
            weightedFlow += flow.getValue() * weight;
        }

        double denominator = begin.value() + weightedFlow;
        if (Math.abs(denominator) <= EPSILON) {
            return SubPeriod.skipped("Skipped period starting " + d0 + ": denominator is zero (begin value + weighted flows).");
        }
        return new SubPeriod((end.value() - begin.value() - netFlow) / denominator, null);
    }

    private static TreeMap<LocalDate, Double> netFlowsByDate(List<CashFlow> flows) {
        TreeMap<LocalDate, Double> byDate = new TreeMap<>();
        if (flows != null) {
            for (CashFlow flow : flows) {
                byDate.merge(flow.date(), flow.amount(), Double::sum);
            }
        }
        return byDate;
    }

    static double mean(List<Double> values) {
        double sum = 0.0;
        for (Double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    static double sampleVariance(List<Double> values, double mean) {
        double sum = 0.0;
        for (Double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / (values.size() - 1);
    }

    private record SubPeriod(Double value, String skipReason) {

        static SubPeriod skipped(String reason) {
            return new SubPeriod(null, reason);
        }
    }
}
