package org.nowstart.folio.service.lot;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.nowstart.folio.data.entity.TaxLot;
import org.nowstart.folio.data.type.LotSource;

/**
 * In-memory lot store for one rebuild. Lots live in an append-only arena; each (account, ticker)
 * key keeps the arena indexes of its lots in FIFO order, (acquiredDate, arena index).
 * The basis-unknown sentinel for a key is created on first use and kept out of the FIFO list.
 */
public class LotBook {

    static final BigDecimal EPSILON = new BigDecimal("0.000000001");

    private final Long taxpayerId;
    private final List<TaxLot> arena = new ArrayList<>();
    private final Map<LotKey, List<Integer>> fifoByKey = new HashMap<>();
    private final Map<LotKey, Integer> sentinelByKey = new HashMap<>();

    public LotBook(Long taxpayerId) {
        this.taxpayerId = taxpayerId;
    }

    public TaxLot open(TaxLot lot) {
        int index = arena.size();
        arena.add(lot);
        List<Integer> fifo = fifoByKey.computeIfAbsent(LotKey.of(lot.getAccountId(), lot.getTicker()), key -> new ArrayList<>());
        fifo.add(index);
        fifo.sort(fifoOrder());
        return lot;
    }

    public Optional<TaxLot> nextOpen(LotKey key) {
        List<Integer> fifo = fifoByKey.getOrDefault(key, List.of());
        for (Integer index : fifo) {
            TaxLot lot = arena.get(index);
            if (isPositive(lot.getQuantityOpen())) {
                return Optional.of(lot);
            }
        }
        return Optional.empty();
    }

    public TaxLot sentinel(LotKey key, LocalDate firstSeen) {
        Integer existing = sentinelByKey.get(key);
        if (existing != null) {
            return arena.get(existing);
        }

        TaxLot lot = TaxLot.builder()
                .taxpayerId(taxpayerId)
                .accountId(key.accountId())
                .ticker(key.ticker())
                .acquiredDate(firstSeen)
                .originalQuantity(BigDecimal.ZERO)
                .quantityOpen(BigDecimal.ZERO)
                .originalBasis(null)
                .basisOpen(null)
                .basisUnknown(true)
                .source(LotSource.RECONSTRUCTED)
                .notes("Synthetic lot for shares sold without acquisition history.")
                .build();
        sentinelByKey.put(key, arena.size());
        arena.add(lot);
        return lot;
    }

    /**
     * Open lots touched by a corporate action. A null account or ticker matches every value.
     */
    public List<TaxLot> openLotsMatching(Long accountId, String ticker) {
        String normalized = ticker == null ? null : normalizeTicker(ticker);
        List<Integer> indexes = new ArrayList<>();
        for (Map.Entry<LotKey, List<Integer>> entry : fifoByKey.entrySet()) {
            LotKey key = entry.getKey();
            if (accountId != null && !Objects.equals(accountId, key.accountId())) {
                continue;
            }
            if (normalized != null && !normalized.equals(key.ticker())) {
                continue;
            }
            for (Integer index : entry.getValue()) {
                if (isPositive(arena.get(index).getQuantityOpen())) {
                    indexes.add(index);
                }
            }
        }
        Collections.sort(indexes);
        return indexes.stream().map(arena::get).toList();
    }

    public List<TaxLot> lots() {
        return Collections.unmodifiableList(arena);
    }

    static boolean isPositive(BigDecimal value) {
        return value != null && value.compareTo(EPSILON) > 0;
    }

    private Comparator<Integer> fifoOrder() {
        return Comparator.<Integer, LocalDate>comparing(index -> arena.get(index).getAcquiredDate())
                .thenComparing(Comparator.naturalOrder());
    }

    public record LotKey(Long accountId, String ticker) {

        public static LotKey of(Long accountId, String ticker) {
            return new LotKey(accountId, normalizeTicker(ticker));
        }
    }

    static String normalizeTicker(String ticker) {
        return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
    }
}
