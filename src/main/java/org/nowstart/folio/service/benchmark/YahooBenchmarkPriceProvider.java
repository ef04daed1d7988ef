package org.nowstart.folio.service.benchmark;

import feign.FeignException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.dto.BenchmarkPriceResult;
import org.nowstart.folio.data.dto.PricePoint;
import org.nowstart.folio.data.dto.YahooChartResponse;
import org.nowstart.folio.data.type.BenchmarkProviderType;
import org.nowstart.folio.repository.YahooChartFeignClient;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class YahooBenchmarkPriceProvider implements BenchmarkPriceProvider {

    private final YahooChartFeignClient yahooChartFeignClient;

    @Override
    public BenchmarkProviderType type() {
        return BenchmarkProviderType.YAHOO;
    }

    @Override
    public BenchmarkPriceResult fetch(String symbol, LocalDate start, LocalDate end) {
        long period1 = start.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        long period2 = end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();

        YahooChartResponse response;
        try {
            response = yahooChartFeignClient.getDailyChart(symbol, period1, period2, "1d", "history");
        } catch (FeignException e) {
            log.warn("event=benchmark_fetch_failed provider=YAHOO symbol={} status={}", symbol, e.status());
            return new BenchmarkPriceResult.Failure(type(), symbol, "Yahoo request failed with status " + e.status());
        }

        if (response == null || response.chart() == null) {
            return new BenchmarkPriceResult.Failure(type(), symbol, "Empty Yahoo response");
        }
        if (response.chart().error() != null) {
            return new BenchmarkPriceResult.Failure(type(), symbol, "Yahoo error: " + response.chart().error().description());
        }
        List<YahooChartResponse.Result> results = response.chart().result();
        if (results == null || results.isEmpty() || results.get(0).timestamp() == null) {
            return new BenchmarkPriceResult.Failure(type(), symbol, "No Yahoo chart data for " + symbol);
        }

        List<PricePoint> prices = toPrices(results.get(0));
        if (prices.isEmpty()) {
            return new BenchmarkPriceResult.Failure(type(), symbol, "No usable Yahoo closes for " + symbol);
        }
        return new BenchmarkPriceResult.Success(type(), symbol, prices);
    }

    private List<PricePoint> toPrices(YahooChartResponse.Result result) {
        List<Long> timestamps = result.timestamp();
        List<Double> closes = closes(result.indicators());
        TreeMap<LocalDate, Double> byDate = new TreeMap<>();
        for (int i = 0; i < timestamps.size() && i < closes.size(); i++) {
            Long timestamp = timestamps.get(i);
            Double close = closes.get(i);
            if (timestamp == null || close == null || !Double.isFinite(close) || close <= 0.0) {
                continue;
            }
            byDate.put(LocalDate.ofInstant(Instant.ofEpochSecond(timestamp), ZoneOffset.UTC), close);
        }
        return byDate.entrySet().stream()
                .map(entry -> new PricePoint(entry.getKey(), entry.getValue()))
                .toList();
    }

    private List<Double> closes(YahooChartResponse.Indicators indicators) {
        if (indicators == null) {
            return List.of();
        }
        if (indicators.adjclose() != null
                && !indicators.adjclose().isEmpty()
                && indicators.adjclose().get(0).adjclose() != null) {
            return indicators.adjclose().get(0).adjclose();
        }
        if (indicators.quote() != null
                && !indicators.quote().isEmpty()
                && indicators.quote().get(0).close() != null) {
            return indicators.quote().get(0).close();
        }
        return List.of();
    }
}
