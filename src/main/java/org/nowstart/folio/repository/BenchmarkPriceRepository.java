package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.BenchmarkPrice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface BenchmarkPriceRepository extends JpaRepository<BenchmarkPrice, Long> {

    List<BenchmarkPrice> findBySymbolAndPriceDateBetweenOrderByPriceDateAsc(String symbol, LocalDate from, LocalDate to);

    List<BenchmarkPrice> findBySymbolAndPriceDateIn(String symbol, Collection<LocalDate> dates);
}
