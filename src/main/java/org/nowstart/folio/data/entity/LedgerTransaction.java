package org.nowstart.folio.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.folio.data.type.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Normalized ledger entry produced by the import collaborators. {@code amount} is signed from the
 * account's perspective: positive means cash into the account.
 */
@Entity
@Table(indexes = @Index(name = "ix_ledger_txn_account_date", columnList = "accountId, tradeDate"))
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerTransaction extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long accountId;

    private LocalDate tradeDate;

    @Enumerated(EnumType.STRING)
    private TransactionType type;

    private String ticker;

    @Column(precision = 38, scale = 12)
    private BigDecimal quantity;

    @Column(precision = 38, scale = 12)
    private BigDecimal amount;

    private String description;

    private String additionalDetail;

    private String rawType;

    private String providerAccountId;

    private String providerTxnId;

    // Cost basis carried over by a transfer-in, when the delivering broker reported one.
    @Column(precision = 38, scale = 12)
    private BigDecimal transferBasis;
}
