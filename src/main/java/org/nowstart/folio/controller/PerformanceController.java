package org.nowstart.folio.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import java.util.List;
import org.nowstart.folio.data.dto.PerformanceReport;
import org.nowstart.folio.data.dto.PerformanceReportRequest;
import org.nowstart.folio.data.type.ReportFrequency;
import org.nowstart.folio.data.type.ReportScope;
import org.nowstart.folio.service.performance.PerformanceReportService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/performance")
@Tag(name = "Performance", description = "포트폴리오 성과(TWR/XIRR/Sharpe) 및 벤치마크 비교 리포트 API")
public class PerformanceController {

    private final PerformanceReportService performanceReportService;

    public PerformanceController(PerformanceReportService performanceReportService) {
        this.performanceReportService = performanceReportService;
    }

    @GetMapping("/report")
    @Operation(summary = "성과 리포트 조회", description = "기간/범위별 포트폴리오 성과와 합산 성과, 벤치마크 대비 초과수익을 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "400", description = "요청 파라미터 오류")
    })
    public PerformanceReport getReport(
            @RequestParam(value = "scope", defaultValue = "ALL") ReportScope scope,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(value = "frequency", required = false) ReportFrequency frequency,
            @RequestParam(value = "benchmark", required = false) String benchmark,
            @RequestParam(value = "graceDays", required = false) @PositiveOrZero Integer graceDays,
            @RequestParam(value = "portfolioIds", required = false) List<Long> portfolioIds,
            @RequestParam(value = "combined", defaultValue = "true") boolean combined
    ) {
        return performanceReportService.buildReport(new PerformanceReportRequest(
                scope,
                start,
                end,
                frequency,
                benchmark,
                graceDays,
                portfolioIds,
                combined
        ));
    }
}
