package org.nowstart.folio.data.dto;

import java.util.List;

public record LotRebuildResult(
        Long taxpayerId,
        List<Long> accountsIncluded,
        int txnsScanned,
        int lotsCreated,
        int disposalsCreated,
        int washAdjustmentsCreated,
        List<String> warnings
) {
}
