package org.nowstart.folio.repository;

import org.nowstart.folio.config.MarketDataFeignConfig;
import org.nowstart.folio.data.dto.YahooChartResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "yahooChartClient",
        url = "${folio.market-data.yahoo-base-url}",
        configuration = MarketDataFeignConfig.class
)
public interface YahooChartFeignClient {

    @GetMapping("/v8/finance/chart/{symbol}")
    YahooChartResponse getDailyChart(
            @PathVariable("symbol") String symbol,
            @RequestParam("period1") long period1,
            @RequestParam("period2") long period2,
            @RequestParam("interval") String interval,
            @RequestParam("events") String events
    );
}
