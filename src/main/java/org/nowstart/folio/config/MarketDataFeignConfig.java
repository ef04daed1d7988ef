package org.nowstart.folio.config;

import feign.RequestInterceptor;
import org.nowstart.folio.data.property.MarketDataProperties;
import org.nowstart.folio.service.benchmark.MarketDataRequestInterceptor;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MarketDataFeignConfig {

    @Bean
    @RefreshScope
    public RequestInterceptor marketDataRequestInterceptor(MarketDataProperties marketDataProperties) {
        return new MarketDataRequestInterceptor(marketDataProperties.userAgent());
    }
}
