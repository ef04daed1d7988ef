package org.nowstart.folio.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.nowstart.folio.data.type.ReportFrequency;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "folio.performance")
public record PerformanceProperties(
        // 시작/종료 앵커를 찾을 때 허용하는 최대 일수
        @PositiveOrZero @DefaultValue("14") int graceDays,
        // 연 무위험수익률(예: 0.04 = 4%)
        @DefaultValue("0") double riskFreeRateAnnual,
        // 원천징수를 외부 현금흐름으로 볼지 여부
        @DefaultValue("false") boolean includeWithholdingAsFlow,
        // 기본 벤치마크 심볼
        @NotBlank @DefaultValue("VOO") String defaultBenchmark,
        // 기본 평가 주기
        @NotNull @DefaultValue("MONTH_END") ReportFrequency defaultFrequency
) {
}
