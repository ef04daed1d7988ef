package org.nowstart.folio.service.performance;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import org.nowstart.folio.data.dto.ValuationPoint;
import org.nowstart.folio.data.type.ReportFrequency;
import org.springframework.stereotype.Component;

/**
 * Picks the begin/end valuation anchors inside a grace window and bounds a series to them.
 */
@Component
public class ValuationAnchorSelector {

    public Optional<ValuationPoint> beginAnchor(NavigableMap<LocalDate, Double> series, LocalDate start, int graceDays) {
        NavigableMap<LocalDate, Double> window = series.subMap(start.minusDays(graceDays), true, start.plusDays(graceDays), true);
        Map.Entry<LocalDate, Double> anchor = window.floorEntry(start);
        if (anchor == null) {
            anchor = window.higherEntry(start);
        }
        return Optional.ofNullable(anchor).map(ValuationAnchorSelector::toPoint);
    }

    public Optional<ValuationPoint> endAnchor(NavigableMap<LocalDate, Double> series, LocalDate end, int graceDays) {
        NavigableMap<LocalDate, Double> window = series.subMap(end.minusDays(graceDays), true, end.plusDays(graceDays), true);
        Map.Entry<LocalDate, Double> anchor = window.ceilingEntry(end);
        if (anchor == null) {
            anchor = window.lowerEntry(end);
        }
        return Optional.ofNullable(anchor).map(ValuationAnchorSelector::toPoint);
    }

    /**
     * Month-end sampling keeps the latest point of each month plus the first and last points of the series.
     */
    public List<ValuationPoint> downsample(NavigableMap<LocalDate, Double> series, ReportFrequency frequency) {
        if (series.isEmpty()) {
            return List.of();
        }
        if (frequency != ReportFrequency.MONTH_END) {
            return series.entrySet().stream().map(ValuationAnchorSelector::toPoint).toList();
        }

        TreeMap<LocalDate, Double> sampled = new TreeMap<>();
        Map<YearMonth, LocalDate> latestByMonth = new TreeMap<>();
        for (LocalDate date : series.keySet()) {
            latestByMonth.merge(YearMonth.from(date), date, (left, right) -> left.isAfter(right) ? left : right);
        }
        latestByMonth.values().forEach(date -> sampled.put(date, series.get(date)));
        sampled.put(series.firstKey(), series.firstEntry().getValue());
        sampled.put(series.lastKey(), series.lastEntry().getValue());
        return sampled.entrySet().stream().map(ValuationAnchorSelector::toPoint).toList();
    }

    /**
     * Points of the sampled series inside [begin, end], with both anchors always present.
     */
    public List<ValuationPoint> windowSeries(List<ValuationPoint> sampled, ValuationPoint begin, ValuationPoint end) {
        if (begin.date().isAfter(end.date())) {
            return List.of();
        }
        TreeMap<LocalDate, Double> window = new TreeMap<>();
        for (ValuationPoint point : sampled) {
            if (!point.date().isBefore(begin.date()) && !point.date().isAfter(end.date())) {
                window.put(point.date(), point.value());
            }
        }
        window.put(begin.date(), begin.value());
        window.put(end.date(), end.value());
        List<ValuationPoint> points = new ArrayList<>();
        window.forEach((date, value) -> points.add(new ValuationPoint(date, value)));
        return points;
    }

    private static ValuationPoint toPoint(Map.Entry<LocalDate, Double> entry) {
        return new ValuationPoint(entry.getKey(), entry.getValue());
    }
}
