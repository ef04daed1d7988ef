package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.Portfolio;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface PortfolioRepository extends JpaRepository<Portfolio, Long> {

    List<Portfolio> findByActiveTrueOrderByIdAsc();

    List<Portfolio> findByIdInAndActiveTrueOrderByIdAsc(Collection<Long> ids);
}
