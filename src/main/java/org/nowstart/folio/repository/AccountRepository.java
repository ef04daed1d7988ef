package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.Account;
import org.nowstart.folio.data.type.AccountType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AccountRepository extends JpaRepository<Account, Long> {

    List<Account> findByTaxpayerIdOrderByIdAsc(Long taxpayerId);

    List<Account> findByTaxpayerIdAndAccountTypeOrderByIdAsc(Long taxpayerId, AccountType accountType);
}
