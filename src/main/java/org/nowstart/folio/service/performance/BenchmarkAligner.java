package org.nowstart.folio.service.performance;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.nowstart.folio.data.dto.PricePoint;
import org.nowstart.folio.data.dto.ValuationPoint;
import org.nowstart.folio.data.type.ReportFrequency;
import org.springframework.stereotype.Component;

/**
 * Resamples a benchmark price series onto a report period. The start anchor prefers the last close
 * on or before the start so a calendar-year return anchors off the prior year's final close.
 */
@Component
public class BenchmarkAligner {

    public List<ValuationPoint> align(List<PricePoint> prices, LocalDate start, LocalDate end, ReportFrequency frequency) {
        if (prices == null || prices.isEmpty() || end.isBefore(start)) {
            return List.of();
        }
        TreeMap<LocalDate, Double> series = new TreeMap<>();
        for (PricePoint price : prices) {
            if (price.date() != null && Double.isFinite(price.price())) {
                series.put(price.date(), price.price());
            }
        }

        Map.Entry<LocalDate, Double> startAnchor = series.floorEntry(start);
        if (startAnchor == null) {
            startAnchor = series.ceilingEntry(start);
        }
        Map.Entry<LocalDate, Double> endAnchor = series.floorEntry(end);
        if (startAnchor == null || endAnchor == null) {
            return List.of();
        }

        TreeMap<LocalDate, Double> aligned = new TreeMap<>();
        if (frequency == ReportFrequency.MONTH_END) {
            Map<YearMonth, LocalDate> latestByMonth = new TreeMap<>();
            for (LocalDate date : series.subMap(start, true, end, true).keySet()) {
                latestByMonth.merge(YearMonth.from(date), date, (left, right) -> left.isAfter(right) ? left : right);
            }
            latestByMonth.values().forEach(date -> aligned.put(date, series.get(date)));
        } else {
            aligned.putAll(series.subMap(start, true, end, true));
        }
        aligned.put(startAnchor.getKey(), startAnchor.getValue());
        aligned.put(endAnchor.getKey(), endAnchor.getValue());

        return aligned.entrySet().stream()
                .map(entry -> new ValuationPoint(entry.getKey(), entry.getValue()))
                .toList();
    }
}
