package org.nowstart.folio.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.folio.data.type.WashSaleStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WashSaleAdjustment extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long taxpayerId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    private LedgerTransaction lossSaleTxn;

    @ManyToOne(fetch = FetchType.LAZY)
    private LedgerTransaction replacementBuyTxn;

    @ManyToOne(fetch = FetchType.LAZY)
    private TaxLot replacementLot;

    @Column(precision = 38, scale = 12)
    private BigDecimal deferredLoss;

    @Column(precision = 38, scale = 12)
    private BigDecimal basisIncrease;

    private LocalDate windowStart;

    private LocalDate windowEnd;

    @Enumerated(EnumType.STRING)
    private WashSaleStatus status;

    private String note;
}
