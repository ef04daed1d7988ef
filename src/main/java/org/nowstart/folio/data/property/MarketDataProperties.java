package org.nowstart.folio.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.nowstart.folio.data.type.BenchmarkProviderType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "folio.market-data")
public record MarketDataProperties(
        // Yahoo chart API 기본 URL
        @NotBlank @DefaultValue("https://query1.finance.yahoo.com") String yahooBaseUrl,
        // 벤치마크 가격 조회 순서
        @NotEmpty @DefaultValue({"STORED", "YAHOO"}) List<BenchmarkProviderType> providerOrder,
        // 외부 시세 요청에 사용할 User-Agent
        @NotBlank @DefaultValue("folio/1.0") String userAgent
) {
}
