package org.nowstart.folio.service.lot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.folio.data.dto.LotRebuildResult;
import org.nowstart.folio.data.entity.Account;
import org.nowstart.folio.data.entity.AuditEvent;
import org.nowstart.folio.data.entity.LedgerTransaction;
import org.nowstart.folio.data.entity.Security;
import org.nowstart.folio.data.exception.FolioApiException;
import org.nowstart.folio.data.property.TaxLotProperties;
import org.nowstart.folio.data.type.AccountType;
import org.nowstart.folio.data.type.LotSource;
import org.nowstart.folio.data.type.TransactionType;
import org.nowstart.folio.repository.AccountRepository;
import org.nowstart.folio.repository.AuditEventRepository;
import org.nowstart.folio.repository.CorporateActionEventRepository;
import org.nowstart.folio.repository.LedgerTransactionRepository;
import org.nowstart.folio.repository.LotDisposalRepository;
import org.nowstart.folio.repository.SecurityRepository;
import org.nowstart.folio.repository.TaxLotRepository;
import org.nowstart.folio.repository.TaxpayerRepository;
import org.nowstart.folio.repository.WashSaleAdjustmentRepository;
import org.nowstart.folio.service.lot.LotReconstruction.CorporateActionOutcome;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * One rebuild as a single replace-all unit of work. Callers serialize per taxpayer.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class TaxLotRebuildExecutor {

    private static final List<TransactionType> LOT_TYPES = List.of(
            TransactionType.BUY,
            TransactionType.SELL,
            TransactionType.TRANSFER,
            TransactionType.OTHER
    );

    private final TaxpayerRepository taxpayerRepository;
    private final AccountRepository accountRepository;
    private final SecurityRepository securityRepository;
    private final LedgerTransactionRepository ledgerTransactionRepository;
    private final CorporateActionEventRepository corporateActionEventRepository;
    private final TaxLotRepository taxLotRepository;
    private final LotDisposalRepository lotDisposalRepository;
    private final WashSaleAdjustmentRepository washSaleAdjustmentRepository;
    private final AuditEventRepository auditEventRepository;
    private final LotReconstructionEngine lotReconstructionEngine;
    private final WashSaleEngine washSaleEngine;
    private final TaxLotProperties taxLotProperties;
    private final ObjectMapper objectMapper;

    @Transactional
    public LotRebuildResult replaceAll(Long taxpayerId, boolean includeTaxAdvantaged, LocalDate asOfDate) {
        if (!taxpayerRepository.existsById(taxpayerId)) {
            throw new FolioApiException(HttpStatus.NOT_FOUND, "taxpayer_not_found", "Taxpayer not found: " + taxpayerId);
        }

        int washDeleted = washSaleAdjustmentRepository.deleteByTaxpayerId(taxpayerId);
        int disposalsDeleted = lotDisposalRepository.deleteByTaxpayerId(taxpayerId);
        int lotsDeleted = taxLotRepository.deleteByTaxpayerIdAndSource(taxpayerId, LotSource.RECONSTRUCTED);
        log.info(
                "event=lots_cleared taxpayerId={} washAdjustments={} disposals={} lots={}",
                taxpayerId,
                washDeleted,
                disposalsDeleted,
                lotsDeleted
        );

        List<Account> accounts = accountRepository.findByTaxpayerIdOrderByIdAsc(taxpayerId);
        List<Long> taxableIds = accounts.stream()
                .filter(account -> account.getAccountType() == AccountType.TAXABLE)
                .map(Account::getId)
                .sorted()
                .toList();
        if (taxableIds.isEmpty()) {
            LotRebuildResult empty = new LotRebuildResult(
                    taxpayerId, List.of(), 0, 0, 0, 0,
                    List.of("No taxable accounts for taxpayer; no lots built.")
            );
            writeAudit("REBUILD_LOTS", "TaxLotRebuild", String.valueOf(taxpayerId), empty);
            return empty;
        }

        List<LedgerTransaction> transactions = ledgerTransactionRepository
                .findByAccountIdInAndTypeInAndTickerIsNotNullOrderByTradeDateAscIdAsc(taxableIds, LOT_TYPES);
        LotReconstruction reconstruction = lotReconstructionEngine.reconstruct(
                taxpayerId,
                transactions,
                corporateActionEventRepository.findByTaxpayerIdAndActionDateLessThanEqualOrderByActionDateAscIdAsc(taxpayerId, asOfDate),
                asOfDate
        );

        boolean washIncludesTaxAdvantaged = includeTaxAdvantaged || taxLotProperties.washIncludeTaxAdvantaged();
        Map<Long, Account> scopeAccounts = accounts.stream()
                .filter(account -> account.getAccountType() == AccountType.TAXABLE || washIncludesTaxAdvantaged)
                .collect(Collectors.toMap(Account::getId, Function.identity(), (left, right) -> left, LinkedHashMap::new));
        List<LedgerTransaction> candidateBuys = washIncludesTaxAdvantaged
                ? ledgerTransactionRepository.findByAccountIdInAndTypeInAndTickerIsNotNullOrderByTradeDateAscIdAsc(
                        scopeAccounts.keySet(),
                        List.of(TransactionType.BUY))
                : transactions.stream().filter(txn -> txn.getType() == TransactionType.BUY).toList();
        WashSaleResult washSales = washSaleEngine.apply(
                taxpayerId,
                reconstruction,
                candidateBuys,
                scopeAccounts,
                substituteGroups()
        );

        taxLotRepository.saveAll(reconstruction.lots());
        lotDisposalRepository.saveAll(reconstruction.disposals());
        washSaleAdjustmentRepository.saveAll(washSales.adjustments());

        for (CorporateActionOutcome outcome : reconstruction.corporateActions()) {
            if (outcome.newlyApplied()) {
                writeAudit("APPLY_CORP_ACTION", "CorporateActionEvent", String.valueOf(outcome.event().getId()), Map.of(
                        "actionType", String.valueOf(outcome.event().getActionType()),
                        "ratio", String.valueOf(outcome.event().getRatio()),
                        "touchedLots", outcome.touchedLots()
                ));
            }
        }
        if (!washSales.adjustments().isEmpty()) {
            writeAudit("WASH_APPLY", "TaxLotRebuild", String.valueOf(taxpayerId),
                    Map.of("washAdjustmentsCreated", washSales.adjustments().size()));
        }

        List<String> warnings = new ArrayList<>(reconstruction.warnings());
        warnings.addAll(washSales.warnings());
        LotRebuildResult result = new LotRebuildResult(
                taxpayerId,
                taxableIds,
                reconstruction.txnsScanned(),
                reconstruction.lots().size(),
                reconstruction.disposals().size(),
                washSales.adjustments().size(),
                warnings
        );
        writeAudit("REBUILD_LOTS", "TaxLotRebuild", String.valueOf(taxpayerId), result);
        return result;
    }

    private Map<String, String> substituteGroups() {
        Map<String, String> groups = new LinkedHashMap<>();
        for (Security security : securityRepository.findBySubstituteGroupIsNotNull()) {
            groups.put(LotBook.normalizeTicker(security.getTicker()), security.getSubstituteGroup());
        }
        return groups;
    }

    private void writeAudit(String type, String entity, String entityId, Object payload) {
        AuditEvent event = AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .type(type)
                .entity(entity)
                .entityId(entityId)
                .payload(toJson(payload))
                .build();
        auditEventRepository.save(event);
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit payload", e);
        }
    }
}
