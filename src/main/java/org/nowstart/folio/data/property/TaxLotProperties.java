package org.nowstart.folio.data.property;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "folio.tax-lots")
public record TaxLotProperties(
        // 워시세일 판정 기간(매도일 기준 전후 일수)
        @Positive @DefaultValue("30") int washWindowDays,
        // 절세계좌 매수를 대체매수로 인정할지 여부(인정 시 FLAGGED 로만 기록)
        @DefaultValue("false") boolean washIncludeTaxAdvantaged,
        // 장기보유 판정 최소 보유일수
        @Positive @DefaultValue("365") int longTermDays
) {
}
