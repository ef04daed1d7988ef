package org.nowstart.folio.data.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class HoldingSnapshot extends AuditableEntity {

    public static final String CASH_PREFIX = "CASH:";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long portfolioId;

    private Instant asOf;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "holding_snapshot_item", joinColumns = @JoinColumn(name = "snapshot_id"))
    private List<SnapshotItem> items = new ArrayList<>();

    @Embeddable
    @Getter
    @Setter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class SnapshotItem {

        private String providerAccountId;

        private String symbol;

        @Column(precision = 38, scale = 12)
        private BigDecimal marketValue;

        // pre-aggregated account total (e.g. parsed from a statement summary)
        private boolean total;

        public boolean isCash() {
            return symbol != null && symbol.trim().toUpperCase(Locale.ROOT).startsWith(CASH_PREFIX);
        }
    }
}
