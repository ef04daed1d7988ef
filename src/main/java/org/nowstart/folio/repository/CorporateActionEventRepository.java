package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.CorporateActionEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface CorporateActionEventRepository extends JpaRepository<CorporateActionEvent, Long> {

    List<CorporateActionEvent> findByTaxpayerIdAndActionDateLessThanEqualOrderByActionDateAscIdAsc(
            Long taxpayerId,
            LocalDate asOfDate
    );
}
