package org.nowstart.folio.service.performance;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.nowstart.folio.data.dto.ValuationPoint;
import org.nowstart.folio.data.type.ReportFrequency;

class ValuationAnchorSelectorTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 1);
    private static final LocalDate END = LocalDate.of(2025, 6, 30);

    private final ValuationAnchorSelector selector = new ValuationAnchorSelector();

    @Test
    void beginAnchor_prefersLastPointOnOrBeforeStart() {
        TreeMap<LocalDate, Double> series = series(
                LocalDate.of(2024, 12, 28), 100.0,
                LocalDate.of(2025, 1, 3), 105.0
        );

        assertThat(selector.beginAnchor(series, START, 14))
                .contains(new ValuationPoint(LocalDate.of(2024, 12, 28), 100.0));
    }

    @Test
    void beginAnchor_fallsBackToFirstPointAfterStartWithinGrace() {
        TreeMap<LocalDate, Double> series = series(
                LocalDate.of(2024, 12, 10), 90.0,
                LocalDate.of(2025, 1, 3), 105.0
        );

        assertThat(selector.beginAnchor(series, START, 14))
                .contains(new ValuationPoint(LocalDate.of(2025, 1, 3), 105.0));
        assertThat(selector.beginAnchor(series(LocalDate.of(2024, 12, 10), 90.0), START, 14)).isEmpty();
    }

    @Test
    void endAnchor_prefersFirstPointOnOrAfterEnd() {
        TreeMap<LocalDate, Double> series = series(
                LocalDate.of(2025, 6, 27), 120.0,
                LocalDate.of(2025, 7, 2), 121.0
        );

        assertThat(selector.endAnchor(series, END, 14))
                .contains(new ValuationPoint(LocalDate.of(2025, 7, 2), 121.0));
        assertThat(selector.endAnchor(series(LocalDate.of(2025, 6, 27), 120.0), END, 14))
                .contains(new ValuationPoint(LocalDate.of(2025, 6, 27), 120.0));
    }

    @Test
    void downsample_monthEndKeepsLastPointPerMonthAndSeriesEdges() {
        TreeMap<LocalDate, Double> series = new TreeMap<>();
        series.put(LocalDate.of(2025, 1, 1), 1.0);
        series.put(LocalDate.of(2025, 1, 15), 2.0);
        series.put(LocalDate.of(2025, 1, 31), 3.0);
        series.put(LocalDate.of(2025, 2, 10), 4.0);
        series.put(LocalDate.of(2025, 2, 27), 5.0);

        List<ValuationPoint> sampled = selector.downsample(series, ReportFrequency.MONTH_END);

        assertThat(sampled).extracting(ValuationPoint::date).containsExactly(
                LocalDate.of(2025, 1, 1),
                LocalDate.of(2025, 1, 31),
                LocalDate.of(2025, 2, 27)
        );
        assertThat(selector.downsample(series, ReportFrequency.DAILY)).hasSize(5);
    }

    @Test
    void windowSeries_alwaysIncludesBothAnchors() {
        List<ValuationPoint> sampled = List.of(
                new ValuationPoint(LocalDate.of(2025, 1, 31), 101.0),
                new ValuationPoint(LocalDate.of(2025, 7, 31), 130.0)
        );
        ValuationPoint begin = new ValuationPoint(LocalDate.of(2024, 12, 31), 100.0);
        ValuationPoint end = new ValuationPoint(LocalDate.of(2025, 6, 30), 125.0);

        List<ValuationPoint> window = selector.windowSeries(sampled, begin, end);

        assertThat(window).containsExactly(begin, sampled.get(0), end);
        assertThat(selector.windowSeries(List.of(), begin, end)).containsExactly(begin, end);
    }

    private static TreeMap<LocalDate, Double> series(Object... pairs) {
        TreeMap<LocalDate, Double> series = new TreeMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            series.put((LocalDate) pairs[i], (Double) pairs[i + 1]);
        }
        return series;
    }
}
