package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.LedgerTransaction;
import org.nowstart.folio.data.type.TransactionType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {

    List<LedgerTransaction> findByAccountIdInAndTypeInAndTickerIsNotNullOrderByTradeDateAscIdAsc(
            Collection<Long> accountIds,
            Collection<TransactionType> types
    );

    List<LedgerTransaction> findByAccountIdInAndTypeInAndTradeDateBetweenOrderByTradeDateAscIdAsc(
            Collection<Long> accountIds,
            Collection<TransactionType> types,
            LocalDate from,
            LocalDate to
    );
}
