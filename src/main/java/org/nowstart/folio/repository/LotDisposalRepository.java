package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.LotDisposal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface LotDisposalRepository extends JpaRepository<LotDisposal, Long> {

    List<LotDisposal> findByTaxpayerIdAndAsOfDateBetweenOrderByAsOfDateAscIdAsc(Long taxpayerId, LocalDate from, LocalDate to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from LotDisposal d where d.taxpayerId = :taxpayerId")
    int deleteByTaxpayerId(@Param("taxpayerId") Long taxpayerId);
}
