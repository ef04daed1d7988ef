package org.nowstart.folio.data.dto;

import java.util.List;

public record TimeWeightedReturn(
        Double twr,
        List<Double> periodReturns,
        List<String> warnings
) {
}
