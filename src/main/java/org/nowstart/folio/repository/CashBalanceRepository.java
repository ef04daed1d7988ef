package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.CashBalance;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface CashBalanceRepository extends JpaRepository<CashBalance, Long> {

    List<CashBalance> findByAccountIdInAndAsOfDateLessThanEqualOrderByAsOfDateAsc(
            Collection<Long> accountIds,
            LocalDate asOfDate
    );
}
