package org.nowstart.folio.service.benchmark;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

import feign.FeignException;
import feign.Request;
import feign.Response;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.folio.data.dto.BenchmarkPriceResult;
import org.nowstart.folio.data.dto.PricePoint;
import org.nowstart.folio.data.dto.YahooChartResponse;
import org.nowstart.folio.repository.YahooChartFeignClient;

@ExtendWith(MockitoExtension.class)
class YahooBenchmarkPriceProviderTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 2);
    private static final LocalDate END = LocalDate.of(2025, 1, 6);

    @Mock
    private YahooChartFeignClient yahooChartFeignClient;

    @InjectMocks
    private YahooBenchmarkPriceProvider provider;

    @Test
    void fetch_prefersAdjustedCloseAndSkipsGaps() {
        List<Long> timestamps = List.of(marketOpen(START), marketOpen(START.plusDays(1)), marketOpen(END));
        YahooChartResponse.Indicators indicators = new YahooChartResponse.Indicators(
                List.of(new YahooChartResponse.Quote(List.of(510.0, 512.0, 515.0))),
                List.of(new YahooChartResponse.AdjClose(Arrays.asList(500.0, null, 505.0)))
        );
        long period1 = START.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        long period2 = END.plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        given(yahooChartFeignClient.getDailyChart("VOO", period1, period2, "1d", "history"))
                .willReturn(chart(new YahooChartResponse.Result(timestamps, indicators)));

        BenchmarkPriceResult result = provider.fetch("VOO", START, END);

        assertThat(result).isInstanceOf(BenchmarkPriceResult.Success.class);
        assertThat(((BenchmarkPriceResult.Success) result).prices()).containsExactly(
                new PricePoint(START, 500.0),
                new PricePoint(END, 505.0)
        );
    }

    @Test
    void fetch_fallsBackToQuoteClose() {
        YahooChartResponse.Indicators indicators = new YahooChartResponse.Indicators(
                List.of(new YahooChartResponse.Quote(List.of(510.0))),
                null
        );
        given(yahooChartFeignClient.getDailyChart(eq("VOO"), anyLong(), anyLong(), eq("1d"), eq("history")))
                .willReturn(chart(new YahooChartResponse.Result(List.of(marketOpen(START)), indicators)));

        BenchmarkPriceResult result = provider.fetch("VOO", START, END);

        assertThat(((BenchmarkPriceResult.Success) result).prices()).containsExactly(new PricePoint(START, 510.0));
    }

    @Test
    void fetch_reportsChartError() {
        YahooChartResponse response = new YahooChartResponse(new YahooChartResponse.Chart(
                null, new YahooChartResponse.Error("Not Found", "No data found, symbol may be delisted")));
        given(yahooChartFeignClient.getDailyChart(eq("ZZZZ"), anyLong(), anyLong(), eq("1d"), eq("history"))).willReturn(response);

        BenchmarkPriceResult result = provider.fetch("ZZZZ", START, END);

        assertThat(((BenchmarkPriceResult.Failure) result).reason()).isEqualTo("Yahoo error: No data found, symbol may be delisted");
    }

    @Test
    void fetch_turnsHttpErrorIntoFailure() {
        Request request = Request.create(Request.HttpMethod.GET, "/v8/finance/chart/VOO", Map.of(), null, StandardCharsets.UTF_8, null);
        Response response = Response.builder()
                .status(429)
                .reason("Too Many Requests")
                .request(request)
                .headers(Map.of())
                .build();
        given(yahooChartFeignClient.getDailyChart(eq("VOO"), anyLong(), anyLong(), eq("1d"), eq("history")))
                .willThrow(FeignException.errorStatus("YahooChartFeignClient#getDailyChart", response));

        BenchmarkPriceResult result = provider.fetch("VOO", START, END);

        assertThat(result).isEqualTo(new BenchmarkPriceResult.Failure(provider.type(), "VOO", "Yahoo request failed with status 429"));
    }

    @Test
    void fetch_failsWhenNoCloses() {
        given(yahooChartFeignClient.getDailyChart(eq("VOO"), anyLong(), anyLong(), eq("1d"), eq("history")))
                .willReturn(chart(new YahooChartResponse.Result(List.of(marketOpen(START)), null)));

        BenchmarkPriceResult result = provider.fetch("VOO", START, END);

        assertThat(((BenchmarkPriceResult.Failure) result).reason()).isEqualTo("No usable Yahoo closes for VOO");
    }

    private static YahooChartResponse chart(YahooChartResponse.Result result) {
        return new YahooChartResponse(new YahooChartResponse.Chart(List.of(result), null));
    }

    private static Long marketOpen(LocalDate date) {
        return date.atTime(14, 30).toEpochSecond(ZoneOffset.UTC);
    }
}
