package org.nowstart.folio.service.benchmark;

import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.folio.data.dto.BenchmarkPriceResult;
import org.nowstart.folio.data.dto.PricePoint;
import org.nowstart.folio.data.entity.BenchmarkPrice;
import org.nowstart.folio.data.type.BenchmarkProviderType;
import org.nowstart.folio.repository.BenchmarkPriceRepository;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StoredBenchmarkPriceProvider implements BenchmarkPriceProvider {

    // calendar days of slack allowed at either end of the stored range
    private static final int STALE_DAYS = 5;

    private final BenchmarkPriceRepository benchmarkPriceRepository;

    @Override
    public BenchmarkProviderType type() {
        return BenchmarkProviderType.STORED;
    }

    @Override
    public BenchmarkPriceResult fetch(String symbol, LocalDate start, LocalDate end) {
        List<PricePoint> prices = benchmarkPriceRepository.findBySymbolAndPriceDateBetweenOrderByPriceDateAsc(symbol, start, end)
                .stream()
                .filter(price -> price.getPrice() != null && price.getPrice().signum() > 0)
                .map(StoredBenchmarkPriceProvider::toPoint)
                .toList();
        if (prices.isEmpty()) {
            return new BenchmarkPriceResult.Failure(type(), symbol, "No stored prices for " + symbol);
        }

        LocalDate first = prices.get(0).date();
        LocalDate last = prices.get(prices.size() - 1).date();
        LocalDate expectedEnd = end.isAfter(LocalDate.now()) ? LocalDate.now() : end;
        if (first.isAfter(start.plusDays(STALE_DAYS)) || last.isBefore(expectedEnd.minusDays(STALE_DAYS))) {
            return new BenchmarkPriceResult.Failure(
                    type(),
                    symbol,
                    "Stored prices for " + symbol + " cover " + first + " to " + last + " only"
            );
        }
        return new BenchmarkPriceResult.Success(type(), symbol, prices);
    }

    private static PricePoint toPoint(BenchmarkPrice price) {
        return new PricePoint(price.getPriceDate(), price.getPrice().doubleValue());
    }
}
