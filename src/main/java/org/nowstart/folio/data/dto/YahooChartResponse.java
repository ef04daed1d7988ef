package org.nowstart.folio.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record YahooChartResponse(
        Chart chart
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chart(
            List<Result> result,
            Error error
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(
            List<Long> timestamp,
            Indicators indicators
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Indicators(
            List<Quote> quote,
            List<AdjClose> adjclose
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Quote(
            List<Double> close
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AdjClose(
            List<Double> adjclose
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Error(
            String code,
            String description
    ) {
    }
}
