package org.nowstart.folio.data.dto;

import java.math.BigDecimal;
import java.util.Map;
import org.nowstart.folio.data.type.HoldingTerm;

public record RealizedGainSummary(
        Long taxpayerId,
        int year,
        Map<HoldingTerm, TermTotals> byTerm,
        BigDecimal washDeferredLoss,
        int disposalCount
) {
    public record TermTotals(
            BigDecimal proceeds,
            BigDecimal basis,
            BigDecimal gain,
            int disposals
    ) {
    }
}
