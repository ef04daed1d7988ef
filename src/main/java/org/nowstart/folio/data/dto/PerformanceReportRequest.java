package org.nowstart.folio.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import java.util.List;
import org.nowstart.folio.data.type.ReportFrequency;
import org.nowstart.folio.data.type.ReportScope;

public record PerformanceReportRequest(
        @NotNull ReportScope scope,
        @NotNull LocalDate startDate,
        @NotNull LocalDate endDate,
        ReportFrequency frequency,
        String benchmarkSymbol,
        @PositiveOrZero Integer graceDays,
        List<Long> portfolioIds,
        boolean includeCombined
) {
}
