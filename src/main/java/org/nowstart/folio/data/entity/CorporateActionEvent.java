package org.nowstart.folio.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.folio.data.type.CorporateActionType;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CorporateActionEvent extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long taxpayerId;

    // null matches every account of the taxpayer
    private Long accountId;

    // null matches every security
    private String ticker;

    private LocalDate actionDate;

    @Enumerated(EnumType.STRING)
    private CorporateActionType actionType;

    @Column(precision = 38, scale = 12)
    private BigDecimal ratio;

    private boolean applied;

    private String applyNotes;
}
