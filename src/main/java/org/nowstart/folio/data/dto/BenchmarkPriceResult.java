package org.nowstart.folio.data.dto;

import java.util.List;
import org.nowstart.folio.data.type.BenchmarkProviderType;

public sealed interface BenchmarkPriceResult {

    BenchmarkProviderType provider();

    String symbol();

    record Success(BenchmarkProviderType provider, String symbol, List<PricePoint> prices) implements BenchmarkPriceResult {
    }

    record Failure(BenchmarkProviderType provider, String symbol, String reason) implements BenchmarkPriceResult {
    }
}
