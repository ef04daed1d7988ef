package org.nowstart.folio.service.benchmark;

import java.time.LocalDate;
import org.nowstart.folio.data.dto.BenchmarkPriceResult;
import org.nowstart.folio.data.type.BenchmarkProviderType;

/**
 * Source of daily benchmark closes. Implementations report problems as a failure result, never by throwing.
 */
public interface BenchmarkPriceProvider {

    BenchmarkProviderType type();

    BenchmarkPriceResult fetch(String symbol, LocalDate start, LocalDate end);
}
