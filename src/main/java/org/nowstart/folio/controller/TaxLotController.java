package org.nowstart.folio.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.nowstart.folio.data.dto.LotRebuildResult;
import org.nowstart.folio.data.dto.RealizedGainSummary;
import org.nowstart.folio.data.dto.TaxLotView;
import org.nowstart.folio.service.lot.TaxLotQueryService;
import org.nowstart.folio.service.lot.TaxLotRebuildService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tax-lots")
@Tag(name = "Tax Lots", description = "세금 로트 재구성, 로트 조회, 실현손익 요약 API")
public class TaxLotController {

    private final TaxLotRebuildService taxLotRebuildService;
    private final TaxLotQueryService taxLotQueryService;

    public TaxLotController(TaxLotRebuildService taxLotRebuildService, TaxLotQueryService taxLotQueryService) {
        this.taxLotRebuildService = taxLotRebuildService;
        this.taxLotQueryService = taxLotQueryService;
    }

    @PostMapping("/rebuild/{taxpayerId}")
    @Operation(summary = "로트 재구성", description = "납세자의 거래 내역을 FIFO로 재생하여 로트/처분/워시세일 조정을 다시 만듭니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "재구성 성공"),
            @ApiResponse(responseCode = "404", description = "납세자 없음")
    })
    public LotRebuildResult rebuild(
            @PathVariable Long taxpayerId,
            @RequestParam(value = "includeTaxAdvantaged", defaultValue = "false") boolean includeTaxAdvantaged
    ) {
        return taxLotRebuildService.rebuild(taxpayerId, includeTaxAdvantaged);
    }

    @GetMapping
    @Operation(summary = "로트 조회", description = "납세자의 재구성된 로트를 조회합니다. openOnly=true 이면 잔여 수량이 있는 로트만 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "납세자 없음")
    })
    public List<TaxLotView> getLots(
            @RequestParam("taxpayerId") Long taxpayerId,
            @RequestParam(value = "openOnly", defaultValue = "true") boolean openOnly
    ) {
        return taxLotQueryService.getLots(taxpayerId, openOnly);
    }

    @GetMapping("/realized")
    @Operation(summary = "실현손익 요약", description = "연도별 단기/장기 실현손익과 워시세일 이연 손실을 집계합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "납세자 없음")
    })
    public RealizedGainSummary getRealizedGains(
            @RequestParam("taxpayerId") Long taxpayerId,
            @RequestParam("year") int year
    ) {
        return taxLotQueryService.getRealizedGains(taxpayerId, year);
    }
}
