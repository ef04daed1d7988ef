package org.nowstart.folio.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.nowstart.folio.data.type.LotSource;

public record TaxLotView(
        Long id,
        Long accountId,
        String ticker,
        LocalDate acquiredDate,
        BigDecimal originalQuantity,
        BigDecimal quantityOpen,
        BigDecimal basisOpen,
        boolean basisUnknown,
        LotSource source,
        String notes
) {
}
