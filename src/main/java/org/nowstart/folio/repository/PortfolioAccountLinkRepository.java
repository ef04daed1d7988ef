package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.PortfolioAccountLink;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface PortfolioAccountLinkRepository extends JpaRepository<PortfolioAccountLink, Long> {

    List<PortfolioAccountLink> findByPortfolioIdIn(Collection<Long> portfolioIds);
}
