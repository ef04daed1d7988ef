package org.nowstart.folio.service.benchmark;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.dto.BenchmarkPriceResult;
import org.nowstart.folio.data.dto.PricePoint;
import org.nowstart.folio.data.entity.BenchmarkPrice;
import org.nowstart.folio.data.property.MarketDataProperties;
import org.nowstart.folio.data.type.BenchmarkProviderType;
import org.nowstart.folio.repository.BenchmarkPriceRepository;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
public class BenchmarkPriceService {

    private static final int MAX_SYMBOL_LENGTH = 24;

    private final Map<BenchmarkProviderType, BenchmarkPriceProvider> providers;
    private final BenchmarkPriceRepository benchmarkPriceRepository;
    private final MarketDataProperties marketDataProperties;

    public BenchmarkPriceService(
            List<BenchmarkPriceProvider> providers,
            BenchmarkPriceRepository benchmarkPriceRepository,
            MarketDataProperties marketDataProperties
    ) {
        this.providers = providers.stream()
                .collect(Collectors.toMap(BenchmarkPriceProvider::type, Function.identity()));
        this.benchmarkPriceRepository = benchmarkPriceRepository;
        this.marketDataProperties = marketDataProperties;
    }

    public BenchmarkPriceResult getPrices(String rawSymbol, LocalDate start, LocalDate end) {
        String symbol = cleanSymbol(rawSymbol);
        if (symbol.isEmpty()) {
            return new BenchmarkPriceResult.Failure(BenchmarkProviderType.STORED, String.valueOf(rawSymbol), "Invalid benchmark symbol");
        }

        List<String> reasons = new ArrayList<>();
        BenchmarkProviderType lastTried = BenchmarkProviderType.STORED;
        for (BenchmarkProviderType type : marketDataProperties.providerOrder()) {
            BenchmarkPriceProvider provider = providers.get(type);
            if (provider == null) {
                continue;
            }
            lastTried = type;
            BenchmarkPriceResult result = provider.fetch(symbol, start, end);
            if (result instanceof BenchmarkPriceResult.Success success) {
                if (type != BenchmarkProviderType.STORED) {
                    cache(symbol, success.prices());
                }
                log.info("event=benchmark_prices_loaded provider={} symbol={} points={}", type, symbol, success.prices().size());
                return success;
            }
            BenchmarkPriceResult.Failure failure = (BenchmarkPriceResult.Failure) result;
            reasons.add(type + ": " + failure.reason());
        }

        log.warn("event=benchmark_prices_unavailable symbol={} reasons={}", symbol, reasons);
        return new BenchmarkPriceResult.Failure(lastTried, symbol, reasons.isEmpty() ? "No benchmark providers configured" : String.join("; ", reasons));
    }

    public static String cleanSymbol(String rawSymbol) {
        if (rawSymbol == null) {
            return "";
        }
        String cleaned = rawSymbol.trim()
                .toUpperCase(Locale.ROOT)
                .replace('/', '-')
                .replaceAll("[^A-Z0-9._-]", "");
        return cleaned.length() > MAX_SYMBOL_LENGTH ? cleaned.substring(0, MAX_SYMBOL_LENGTH) : cleaned;
    }

    // best effort, a failed write never fails the lookup
    private void cache(String symbol, List<PricePoint> prices) {
        try {
            upsert(symbol, prices);
        } catch (DataAccessException e) {
            log.warn("event=benchmark_cache_failed symbol={} message={}", symbol, e.getMessage());
        }
    }

    private void upsert(String symbol, List<PricePoint> prices) {
        Map<LocalDate, BenchmarkPrice> existing = benchmarkPriceRepository
                .findBySymbolAndPriceDateIn(symbol, prices.stream().map(PricePoint::date).toList())
                .stream()
                .collect(Collectors.toMap(BenchmarkPrice::getPriceDate, Function.identity(), (left, right) -> right));

        List<BenchmarkPrice> toSave = new ArrayList<>();
        for (PricePoint point : prices) {
            BigDecimal price = BigDecimal.valueOf(point.price());
            BenchmarkPrice stored = existing.get(point.date());
            if (stored == null) {
                toSave.add(BenchmarkPrice.builder()
                        .symbol(symbol)
                        .priceDate(point.date())
                        .price(price)
                        .build());
            } else if (stored.getPrice() == null || stored.getPrice().compareTo(price) != 0) {
                stored.setPrice(price);
                toSave.add(stored);
            }
        }
        benchmarkPriceRepository.saveAll(toSave);
        log.debug("event=benchmark_prices_cached symbol={} saved={}", symbol, toSave.size());
    }
}
