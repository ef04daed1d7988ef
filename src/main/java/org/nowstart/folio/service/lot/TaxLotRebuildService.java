package org.nowstart.folio.service.lot;

import java.time.LocalDate;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.dto.LotRebuildResult;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaxLotRebuildService {

    static final int LOCK_STRIPES = 64;

    private final TaxLotRebuildExecutor taxLotRebuildExecutor;
    // taxpayers sharing a stripe also serialize with each other
    private final ReentrantLock[] locks = newStripes();

    public LotRebuildResult rebuild(Long taxpayerId, boolean includeTaxAdvantaged) {
        return rebuild(taxpayerId, includeTaxAdvantaged, LocalDate.now());
    }

    public LotRebuildResult rebuild(Long taxpayerId, boolean includeTaxAdvantaged, LocalDate asOfDate) {
        ReentrantLock lock = lockFor(taxpayerId);
        lock.lock();
        try {
            long startedAt = System.currentTimeMillis();
            LotRebuildResult result = taxLotRebuildExecutor.replaceAll(taxpayerId, includeTaxAdvantaged, asOfDate);
            log.info(
                    "event=lots_rebuilt taxpayerId={} accounts={} txns={} lots={} disposals={} washAdjustments={} warnings={} elapsedMs={}",
                    taxpayerId,
                    result.accountsIncluded(),
                    result.txnsScanned(),
                    result.lotsCreated(),
                    result.disposalsCreated(),
                    result.washAdjustmentsCreated(),
                    result.warnings().size(),
                    System.currentTimeMillis() - startedAt
            );
            return result;
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(Long taxpayerId) {
        return locks[Math.floorMod(taxpayerId.hashCode(), LOCK_STRIPES)];
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
