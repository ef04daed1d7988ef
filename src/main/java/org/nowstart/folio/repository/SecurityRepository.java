package org.nowstart.folio.repository;

import org.nowstart.folio.data.entity.Security;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SecurityRepository extends JpaRepository<Security, String> {

    List<Security> findBySubstituteGroupIsNotNull();
}
