package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.HoldingSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface HoldingSnapshotRepository extends JpaRepository<HoldingSnapshot, Long> {

    List<HoldingSnapshot> findByPortfolioIdInAndAsOfBetweenOrderByAsOfAsc(
            Collection<Long> portfolioIds,
            Instant from,
            Instant to
    );
}
