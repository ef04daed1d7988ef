package org.nowstart.folio.data.dto;

import java.time.LocalDate;

public record PricePoint(
        LocalDate date,
        double price
) {
}
