package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.WashSaleAdjustment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface WashSaleAdjustmentRepository extends JpaRepository<WashSaleAdjustment, Long> {

    @Query("select w from WashSaleAdjustment w join w.lossSaleTxn t "
            + "where w.taxpayerId = :taxpayerId and t.tradeDate between :from and :to order by t.tradeDate, w.id")
    List<WashSaleAdjustment> findForLossSalesBetween(
            @Param("taxpayerId") Long taxpayerId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from WashSaleAdjustment w where w.taxpayerId = :taxpayerId")
    int deleteByTaxpayerId(@Param("taxpayerId") Long taxpayerId);
}
