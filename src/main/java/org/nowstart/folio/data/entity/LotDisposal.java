package org.nowstart.folio.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.folio.data.type.HoldingTerm;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(indexes = @Index(name = "ix_lot_disposal_taxpayer", columnList = "taxpayerId, asOfDate"))
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LotDisposal extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long taxpayerId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    private LedgerTransaction sellTxn;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    private TaxLot taxLot;

    @Column(precision = 38, scale = 12)
    private BigDecimal quantitySold;

    @Column(precision = 38, scale = 12)
    private BigDecimal proceedsAllocated;

    @Column(precision = 38, scale = 12)
    private BigDecimal basisAllocated;

    @Column(precision = 38, scale = 12)
    private BigDecimal realizedGain;

    @Enumerated(EnumType.STRING)
    private HoldingTerm term;

    private LocalDate asOfDate;

    private boolean basisUnknown;
}
