package com.stakeduel.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stakeduel.dto.AccountResponses;
import com.stakeduel.dto.AdminResponses;
import com.stakeduel.dto.AssetResponses;
import com.stakeduel.dto.EventResponses;
import com.stakeduel.model.DailyCounter;
import com.stakeduel.model.DuelMatch;
import com.stakeduel.model.EventLogEntry;
import com.stakeduel.model.LedgerAccount;
import com.stakeduel.model.LedgerEntry;
import com.stakeduel.model.PlatformSettings;
import com.stakeduel.model.SupportedAsset;
import com.stakeduel.service.ExchangeReceipt;
import com.stakeduel.service.ReconciliationService;
import com.stakeduel.service.RoundResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class StakeduelResponseMapper {

    private final ObjectMapper objectMapper;

    public StakeduelResponseMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AccountResponses.Balance toBalanceResponse(LedgerAccount account) {
        return new AccountResponses.Balance(
                account.getAccountId(),
                account.getCreditBalance(),
                account.getLastKnownDay(),
                account.getRoundSequence(),
                account.getUpdatedAt()
        );
    }

    public List<AccountResponses.LedgerEntry> toLedgerEntryResponses(Collection<LedgerEntry> entries) {
        return entries.stream()
                .map(entry -> new AccountResponses.LedgerEntry(
                        entry.getEntryId(),
                        entry.getSequenceNumber(),
                        entry.getEntryType(),
                        entry.getReason(),
                        entry.getAmount(),
                        entry.getBalanceAfter(),
                        entry.getReferenceId(),
                        entry.getCreatedAt()
                ))
                .toList();
    }

    public AccountResponses.ExchangeReceipt toReceiptResponse(ExchangeReceipt receipt) {
        return new AccountResponses.ExchangeReceipt(
                receipt.referenceId(),
                receipt.accountId(),
                receipt.assetId(),
                receipt.assetAmount(),
                receipt.credits(),
                receipt.price(),
                receipt.pricePrecision(),
                receipt.priceObservedAt(),
                receipt.balance()
        );
    }

    public AccountResponses.RoundResult toRoundResultResponse(RoundResult result) {
        return new AccountResponses.RoundResult(
                result.matchId(),
                result.sequenceNumber(),
                result.playerAction(),
                result.opponentAction(),
                result.outcome(),
                result.difficulty(),
                result.stake(),
                result.payout(),
                result.balance(),
                result.roundsPlayedToday(),
                result.creditsWageredToday()
        );
    }

    public List<AccountResponses.MatchSummary> toMatchSummaryResponses(Collection<DuelMatch> matches) {
        return matches.stream()
                .map(match -> new AccountResponses.MatchSummary(
                        match.getMatchId(),
                        match.getSequenceNumber(),
                        match.getPlayerAction(),
                        match.getOpponentAction(),
                        match.getOutcome(),
                        match.getDifficulty(),
                        match.getStake(),
                        match.getPayout(),
                        match.getBalanceAfter(),
                        match.getCreatedAt()
                ))
                .toList();
    }

    public AccountResponses.DailyLimits toDailyLimitsResponse(DailyCounter counter, PlatformSettings settings) {
        return new AccountResponses.DailyLimits(
                counter.getAccountId(),
                counter.getCounterDay(),
                counter.getRoundsPlayed(),
                settings.getMaxDailyRounds(),
                counter.getCreditsWagered(),
                settings.getMaxDailyWager()
        );
    }

    public AssetResponses.Asset toAssetResponse(SupportedAsset asset) {
        return new AssetResponses.Asset(
                asset.getAssetId(),
                asset.getPriceFeedRef(),
                asset.getDecimals(),
                asset.getMinPurchase(),
                asset.getMaxPurchase(),
                asset.isActive()
        );
    }

    public List<AssetResponses.Asset> toAssetResponses(Collection<SupportedAsset> assets) {
        return assets.stream().map(this::toAssetResponse).toList();
    }

    public EventResponses.EventPage toEventPage(List<EventLogEntry> entries, long afterEventId) {
        List<EventResponses.Event> events = entries.stream().map(this::toEventResponse).toList();
        long nextCursor = events.isEmpty() ? afterEventId : events.get(events.size() - 1).eventId();
        return new EventResponses.EventPage(events, nextCursor);
    }

    /**
     * Same as {@link #toEventPage} but the cursor is the per-account sequence number.
     */
    public EventResponses.EventPage toAccountEventPage(List<EventLogEntry> entries, long afterSequence) {
        List<EventResponses.Event> events = entries.stream().map(this::toEventResponse).toList();
        long nextCursor = events.isEmpty() ? afterSequence : events.get(events.size() - 1).sequenceNumber();
        return new EventResponses.EventPage(events, nextCursor);
    }

    public EventResponses.Event toEventResponse(EventLogEntry entry) {
        return new EventResponses.Event(
                entry.getEventId(),
                entry.getAccountId(),
                entry.getSequenceNumber(),
                entry.getKind(),
                entry.getReferenceId(),
                readPayload(entry),
                entry.getCreatedAt()
        );
    }

    public AdminResponses.Settings toSettingsResponse(PlatformSettings settings) {
        return new AdminResponses.Settings(
                settings.getMaxDailyRounds(),
                settings.getMaxDailyWager(),
                settings.getWinMultiplierBps(),
                settings.getTargetWinProbability(),
                settings.getHistoryWindowSize(),
                settings.getDefaultDifficulty(),
                settings.isPaused(),
                settings.getUpdatedAt()
        );
    }

    public AdminResponses.Reconciliation toReconciliationResponse(ReconciliationService.ReconciliationReport report) {
        return new AdminResponses.Reconciliation(
                report.totalPurchasedCredits(),
                report.totalCashedOutCredits(),
                report.totalStaked(),
                report.totalPaidOut(),
                report.houseEarnings(),
                report.expectedBalances(),
                report.actualBalances(),
                report.balanced()
        );
    }

    private JsonNode readPayload(EventLogEntry entry) {
        try {
            return objectMapper.readTree(entry.getPayload());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored payload of event " + entry.getEventId() + " is not valid JSON", ex);
        }
    }
}
