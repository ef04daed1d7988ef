package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.TaxLot;
import org.nowstart.folio.data.type.LotSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;

public interface TaxLotRepository extends JpaRepository<TaxLot, Long> {

    List<TaxLot> findByTaxpayerIdOrderByAccountIdAscTickerAscAcquiredDateAscIdAsc(Long taxpayerId);

    List<TaxLot> findByTaxpayerIdAndQuantityOpenGreaterThanOrderByAccountIdAscTickerAscAcquiredDateAscIdAsc(
            Long taxpayerId,
            BigDecimal quantity
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TaxLot l where l.taxpayerId = :taxpayerId and l.source = :source")
    int deleteByTaxpayerIdAndSource(@Param("taxpayerId") Long taxpayerId, @Param("source") LotSource source);
}
