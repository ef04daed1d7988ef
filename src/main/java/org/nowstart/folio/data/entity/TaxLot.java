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
import org.nowstart.folio.data.type.LotSource;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(indexes = @Index(name = "ix_tax_lot_scope", columnList = "taxpayerId, accountId, ticker"))
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TaxLot extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long taxpayerId;

    private Long accountId;

    private String ticker;

    private LocalDate acquiredDate;

    @Column(precision = 38, scale = 12)
    private BigDecimal originalQuantity;

    @Column(precision = 38, scale = 12)
    private BigDecimal quantityOpen;

    @Column(precision = 38, scale = 12)
    private BigDecimal originalBasis;

    // null when the acquisition cost could not be determined
    @Column(precision = 38, scale = 12)
    private BigDecimal basisOpen;

    private boolean basisUnknown;

    @Enumerated(EnumType.STRING)
    private LotSource source;

    @ManyToOne(fetch = FetchType.LAZY)
    private LedgerTransaction createdFromTxn;

    private String notes;

    public boolean isOpen() {
        return quantityOpen != null && quantityOpen.signum() > 0;
    }

    public void appendNote(String note) {
        notes = notes == null || notes.isBlank() ? note : notes + " " + note;
    }
}
