package com.stakeduel.controller;

import com.stakeduel.dto.AccountRequests;
import com.stakeduel.dto.AccountResponses;
import com.stakeduel.dto.EventResponses;
import com.stakeduel.mapper.StakeduelResponseMapper;
import com.stakeduel.model.PlatformSettings;
import com.stakeduel.service.CreditExchangeService;
import com.stakeduel.service.DailyLimitTracker;
import com.stakeduel.service.EventLogService;
import com.stakeduel.service.LedgerService;
import com.stakeduel.service.MatchSettlementService;
import com.stakeduel.service.PlatformSettingsService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/accounts/{accountId}")
public class AccountController {

    private final LedgerService ledgerService;
    private final CreditExchangeService creditExchangeService;
    private final MatchSettlementService matchSettlementService;
    private final DailyLimitTracker dailyLimitTracker;
    private final PlatformSettingsService platformSettingsService;
    private final EventLogService eventLogService;
    private final StakeduelResponseMapper stakeduelResponseMapper;

    public AccountController(
            LedgerService ledgerService,
            CreditExchangeService creditExchangeService,
            MatchSettlementService matchSettlementService,
            DailyLimitTracker dailyLimitTracker,
            PlatformSettingsService platformSettingsService,
            EventLogService eventLogService,
            StakeduelResponseMapper stakeduelResponseMapper
    ) {
        this.ledgerService = ledgerService;
        this.creditExchangeService = creditExchangeService;
        this.matchSettlementService = matchSettlementService;
        this.dailyLimitTracker = dailyLimitTracker;
        this.platformSettingsService = platformSettingsService;
        this.eventLogService = eventLogService;
        this.stakeduelResponseMapper = stakeduelResponseMapper;
    }

    @GetMapping
    public ResponseEntity<AccountResponses.Balance> getBalance(@PathVariable String accountId) {
        return ResponseEntity.ok(stakeduelResponseMapper.toBalanceResponse(ledgerService.getAccount(accountId)));
    }

    @GetMapping("/ledger")
    public ResponseEntity<List<AccountResponses.LedgerEntry>> getLedger(
            @PathVariable String accountId,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit
    ) {
        return ResponseEntity.ok(stakeduelResponseMapper.toLedgerEntryResponses(ledgerService.getEntries(accountId, limit)));
    }

    @PostMapping("/purchases")
    public ResponseEntity<AccountResponses.ExchangeReceipt> purchase(
            @PathVariable String accountId,
            @Valid @RequestBody AccountRequests.PurchaseRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stakeduelResponseMapper.toReceiptResponse(
                creditExchangeService.purchase(accountId, request.assetId(), request.assetAmount())
        ));
    }

    @PostMapping("/cashouts")
    public ResponseEntity<AccountResponses.ExchangeReceipt> cashout(
            @PathVariable String accountId,
            @Valid @RequestBody AccountRequests.CashoutRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stakeduelResponseMapper.toReceiptResponse(
                creditExchangeService.cashout(accountId, request.assetId(), request.credits())
        ));
    }

    @PostMapping("/rounds")
    public ResponseEntity<AccountResponses.RoundResult> playRound(
            @PathVariable String accountId,
            @RequestBody AccountRequests.PlayRoundRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stakeduelResponseMapper.toRoundResultResponse(
                matchSettlementService.playRound(accountId, request.action(), request.stake(), request.difficulty())
        ));
    }

    @GetMapping("/matches")
    public ResponseEntity<List<AccountResponses.MatchSummary>> listMatches(
            @PathVariable String accountId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit
    ) {
        return ResponseEntity.ok(stakeduelResponseMapper.toMatchSummaryResponses(
                matchSettlementService.listMatches(accountId, limit)
        ));
    }

    @GetMapping("/limits")
    public ResponseEntity<AccountResponses.DailyLimits> getDailyLimits(@PathVariable String accountId) {
        PlatformSettings settings = platformSettingsService.current();
        return ResponseEntity.ok(stakeduelResponseMapper.toDailyLimitsResponse(
                dailyLimitTracker.getCounter(accountId, dailyLimitTracker.today()),
                settings
        ));
    }

    @GetMapping("/events")
    public ResponseEntity<EventResponses.EventPage> listAccountEvents(
            @PathVariable String accountId,
            @RequestParam(defaultValue = "0") @Min(0) long afterSequence,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit
    ) {
        return ResponseEntity.ok(stakeduelResponseMapper.toAccountEventPage(
                eventLogService.listAccountEvents(accountId, afterSequence, limit),
                afterSequence
        ));
    }
}
