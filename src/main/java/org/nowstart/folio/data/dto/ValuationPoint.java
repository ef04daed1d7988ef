package org.nowstart.folio.data.dto;

import java.time.LocalDate;

public record ValuationPoint(
        LocalDate date,
        double value
) {
}
