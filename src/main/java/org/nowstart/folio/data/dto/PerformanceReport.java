package org.nowstart.folio.data.dto;

import java.time.LocalDate;
import java.util.List;
import org.nowstart.folio.data.type.ReportFrequency;
import org.nowstart.folio.data.type.ReportScope;

public record PerformanceReport(
        ReportScope scope,
        LocalDate startDate,
        LocalDate endDate,
        ReportFrequency frequency,
        String benchmarkLabel,
        List<PerformanceRow> rows,
        PerformanceRow combined,
        List<String> warnings
) {
}
