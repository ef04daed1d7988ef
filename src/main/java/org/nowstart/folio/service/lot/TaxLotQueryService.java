package org.nowstart.folio.service.lot;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.folio.data.dto.RealizedGainSummary;
import org.nowstart.folio.data.dto.TaxLotView;
import org.nowstart.folio.data.entity.LotDisposal;
import org.nowstart.folio.data.entity.TaxLot;
import org.nowstart.folio.data.entity.WashSaleAdjustment;
import org.nowstart.folio.data.exception.FolioApiException;
import org.nowstart.folio.data.type.HoldingTerm;
import org.nowstart.folio.repository.LotDisposalRepository;
import org.nowstart.folio.repository.TaxLotRepository;
import org.nowstart.folio.repository.TaxpayerRepository;
import org.nowstart.folio.repository.WashSaleAdjustmentRepository;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class TaxLotQueryService {

    private final TaxpayerRepository taxpayerRepository;
    private final TaxLotRepository taxLotRepository;
    private final LotDisposalRepository lotDisposalRepository;
    private final WashSaleAdjustmentRepository washSaleAdjustmentRepository;

    @Transactional(readOnly = true)
    public List<TaxLotView> getLots(Long taxpayerId, boolean openOnly) {
        requireTaxpayer(taxpayerId);
        List<TaxLot> lots = openOnly
                ? taxLotRepository.findByTaxpayerIdAndQuantityOpenGreaterThanOrderByAccountIdAscTickerAscAcquiredDateAscIdAsc(
                        taxpayerId,
                        BigDecimal.ZERO)
                : taxLotRepository.findByTaxpayerIdOrderByAccountIdAscTickerAscAcquiredDateAscIdAsc(taxpayerId);
        return lots.stream().map(this::toView).toList();
    }

    @Transactional(readOnly = true)
    public RealizedGainSummary getRealizedGains(Long taxpayerId, int year) {
        requireTaxpayer(taxpayerId);
        LocalDate from = LocalDate.of(year, 1, 1);
        LocalDate to = LocalDate.of(year, 12, 31);

        Map<HoldingTerm, RealizedGainSummary.TermTotals> byTerm = new EnumMap<>(HoldingTerm.class);
        for (HoldingTerm term : HoldingTerm.values()) {
            byTerm.put(term, new RealizedGainSummary.TermTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0));
        }

        List<LotDisposal> disposals = lotDisposalRepository.findByTaxpayerIdAndAsOfDateBetweenOrderByAsOfDateAscIdAsc(taxpayerId, from, to);
        for (LotDisposal disposal : disposals) {
            HoldingTerm term = disposal.getTerm() == null ? HoldingTerm.UNKNOWN : disposal.getTerm();
            RealizedGainSummary.TermTotals current = byTerm.get(term);
            byTerm.put(term, new RealizedGainSummary.TermTotals(
                    current.proceeds().add(orZero(disposal.getProceedsAllocated())),
                    current.basis().add(orZero(disposal.getBasisAllocated())),
                    current.gain().add(orZero(disposal.getRealizedGain())),
                    current.disposals() + 1
            ));
        }

        BigDecimal washDeferred = washSaleAdjustmentRepository.findForLossSalesBetween(taxpayerId, from, to)
                .stream()
                .map(WashSaleAdjustment::getDeferredLoss)
                .map(TaxLotQueryService::orZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new RealizedGainSummary(taxpayerId, year, byTerm, washDeferred, disposals.size());
    }

    private void requireTaxpayer(Long taxpayerId) {
        if (!taxpayerRepository.existsById(taxpayerId)) {
            throw new FolioApiException(HttpStatus.NOT_FOUND, "taxpayer_not_found", "Taxpayer not found: " + taxpayerId);
        }
    }

    private TaxLotView toView(TaxLot lot) {
        return new TaxLotView(
                lot.getId(),
                lot.getAccountId(),
                lot.getTicker(),
                lot.getAcquiredDate(),
                lot.getOriginalQuantity(),
                lot.getQuantityOpen(),
                lot.getBasisOpen(),
                lot.isBasisUnknown(),
                lot.getSource(),
                lot.getNotes()
        );
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
