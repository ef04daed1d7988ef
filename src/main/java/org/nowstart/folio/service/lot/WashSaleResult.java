package org.nowstart.folio.service.lot;

import java.util.List;
import org.nowstart.folio.data.entity.WashSaleAdjustment;

public record WashSaleResult(
        List<WashSaleAdjustment> adjustments,
        List<String> warnings
) {
}
