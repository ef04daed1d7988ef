package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.Taxpayer;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TaxpayerRepository extends JpaRepository<Taxpayer, Long> {
}
