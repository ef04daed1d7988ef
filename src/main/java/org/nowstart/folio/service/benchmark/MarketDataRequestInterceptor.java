package org.nowstart.folio.service.benchmark;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MarketDataRequestInterceptor implements RequestInterceptor {

    private final String userAgent;

    @Override
    public void apply(RequestTemplate template) {
        template.header("Accept", "application/json");
        template.header("User-Agent", userAgent);
    }
}
