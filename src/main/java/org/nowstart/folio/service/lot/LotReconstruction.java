package org.nowstart.folio.service.lot;

import java.util.List;
import org.nowstart.folio.data.entity.CorporateActionEvent;
import org.nowstart.folio.data.entity.LotDisposal;
import org.nowstart.folio.data.entity.TaxLot;

public record LotReconstruction(
        List<TaxLot> lots,
        List<LotDisposal> disposals,
        List<CorporateActionOutcome> corporateActions,
        int txnsScanned,
        List<String> warnings
) {
    public record CorporateActionOutcome(
            CorporateActionEvent event,
            int touchedLots,
            boolean newlyApplied
    ) {
    }
}
