package com.stakeduel.service;

import com.stakeduel.model.DuelAction;
import com.stakeduel.model.DuelMatch;
import com.stakeduel.model.DuelOutcome;
import com.stakeduel.model.EventKind;
import com.stakeduel.model.LedgerAccount;
import com.stakeduel.model.LedgerReason;
import com.stakeduel.model.OpponentDifficulty;
import com.stakeduel.model.PlatformSettings;
import com.stakeduel.model.RoundState;
import com.stakeduel.opponent.AiOpponent;
import com.stakeduel.opponent.WinRateStats;
import com.stakeduel.provider.VerificationProvider;
import com.stakeduel.repository.DuelMatchRepository;
import com.stakeduel.web.LedgerInvariantViolationException;
import com.stakeduel.web.StakeLedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.random.RandomGenerator;

/**
 * Settles one round end to end inside a single transaction: limit reservation, stake debit,
 * opponent move, resolution, payout, match record, move history and event. Any failure rolls
 * every step back.
 */
@Service
public class MatchSettlementService {

    static final long BPS_DENOMINATOR = 10_000L;

    private static final Logger log = LoggerFactory.getLogger(MatchSettlementService.class);

    private final PlatformSettingsService platformSettingsService;
    private final LedgerService ledgerService;
    private final DailyLimitTracker dailyLimitTracker;
    private final MoveHistoryService moveHistoryService;
    private final WinRateStatsService winRateStatsService;
    private final EventLogService eventLogService;
    private final AiOpponent aiOpponent;
    private final VerificationProvider verificationProvider;
    private final DuelMatchRepository duelMatchRepository;
    private final RandomGenerator opponentRandom;
    private final Clock clock;

    public MatchSettlementService(
            PlatformSettingsService platformSettingsService,
            LedgerService ledgerService,
            DailyLimitTracker dailyLimitTracker,
            MoveHistoryService moveHistoryService,
            WinRateStatsService winRateStatsService,
            EventLogService eventLogService,
            AiOpponent aiOpponent,
            VerificationProvider verificationProvider,
            DuelMatchRepository duelMatchRepository,
            RandomGenerator opponentRandom,
            Clock clock
    ) {
        this.platformSettingsService = platformSettingsService;
        this.ledgerService = ledgerService;
        this.dailyLimitTracker = dailyLimitTracker;
        this.moveHistoryService = moveHistoryService;
        this.winRateStatsService = winRateStatsService;
        this.eventLogService = eventLogService;
        this.aiOpponent = aiOpponent;
        this.verificationProvider = verificationProvider;
        this.duelMatchRepository = duelMatchRepository;
        this.opponentRandom = opponentRandom;
        this.clock = clock;
    }

    @Transactional
    public RoundResult playRound(String accountId, String roundInput, long stake, OpponentDifficulty difficulty) {
        PlatformSettings settings = platformSettingsService.current();
        if (settings.isPaused()) {
            log.warn("round_rejected accountId={} reason=system_paused", accountId);
            throw StakeLedgerException.systemPaused();
        }
        DuelAction playerAction = parseRoundInput(roundInput);
        OpponentDifficulty effectiveDifficulty = difficulty != null ? difficulty : settings.getDefaultDifficulty();

        RoundState state = RoundState.INITIATED;
        LedgerAccount account = ledgerService.lockAccount(accountId).orElse(null);
        if (stake <= 0) {
            throw StakeLedgerException.invalidStake("stake must be positive");
        }
        long balance = account != null ? account.getCreditBalance() : 0L;
        if (account == null || stake > balance) {
            log.warn("round_rejected accountId={} reason=insufficient_balance stake={} balance={}",
                    accountId, stake, balance);
            throw StakeLedgerException.insufficientBalance(accountId, stake, balance);
        }
        if (!verificationProvider.isVerified(accountId)) {
            log.warn("round_rejected accountId={} reason=unverified", accountId);
            throw StakeLedgerException.unverified(accountId);
        }

        Instant now = clock.instant();
        DailyLimitTracker.Reservation reservation = dailyLimitTracker.reserve(accountId, stake, now, settings);
        state = advance(accountId, state, RoundState.LIMIT_RESERVED);

        UUID matchId = UUID.randomUUID();
        ledgerService.debit(account, stake, LedgerReason.ROUND_STAKE, matchId);
        state = advance(accountId, state, RoundState.STAKE_DEBITED);

        List<DuelAction> history = moveHistoryService.getHistory(accountId);
        WinRateStats stats = winRateStatsService.statsFor(accountId, settings);
        DuelAction opponentAction = aiOpponent.selectAction(history, effectiveDifficulty, stats, opponentRandom);
        state = advance(accountId, state, RoundState.OPPONENT_MOVED);

        DuelOutcome outcome = DuelOutcome.resolve(playerAction, opponentAction);
        long payout = payoutFor(outcome, stake, settings.getWinMultiplierBps());
        if (payout > 0) {
            ledgerService.credit(account, payout, LedgerReason.ROUND_PAYOUT, matchId);
        }

        long sequenceNumber = account.getRoundSequence() + 1;
        account.setRoundSequence(sequenceNumber);

        DuelMatch match = new DuelMatch();
        match.setMatchId(matchId);
        match.setAccountId(accountId);
        match.setSequenceNumber(sequenceNumber);
        match.setPlayerAction(playerAction);
        match.setOpponentAction(opponentAction);
        match.setOutcome(outcome);
        match.setDifficulty(effectiveDifficulty);
        match.setStake(stake);
        match.setPayout(payout);
        match.setBalanceAfter(account.getCreditBalance());
        match.setCreatedAt(OffsetDateTime.ofInstant(now, ZoneOffset.UTC));
        duelMatchRepository.save(match);

        moveHistoryService.append(accountId, playerAction, settings.getHistoryWindowSize());
        eventLogService.append(account, EventKind.ROUND, matchId, new EventPayloads.Round(
                sequenceNumber,
                playerAction,
                opponentAction,
                outcome,
                effectiveDifficulty,
                stake,
                payout,
                account.getCreditBalance()
        ));
        advance(accountId, state, RoundState.RESOLVED);

        log.info("round_settled accountId={} sequence={} player={} opponent={} outcome={} stake={} payout={} balance={}",
                accountId, sequenceNumber, playerAction, opponentAction, outcome, stake, payout,
                account.getCreditBalance());

        return new RoundResult(
                matchId,
                sequenceNumber,
                playerAction,
                opponentAction,
                outcome,
                effectiveDifficulty,
                stake,
                payout,
                account.getCreditBalance(),
                reservation.roundsPlayed(),
                reservation.creditsWagered()
        );
    }

    @Transactional(readOnly = true)
    public List<DuelMatch> listMatches(String accountId, int limit) {
        return duelMatchRepository.findByAccountIdOrderBySequenceNumberDesc(
                accountId,
                PageRequest.of(0, Math.max(1, Math.min(limit, 500)))
        );
    }

    /**
     * WIN pays {@code floor(stake * bps / 10000)}, TIE returns the stake, LOSE pays nothing.
     */
    static long payoutFor(DuelOutcome outcome, long stake, int winMultiplierBps) {
        return switch (outcome) {
            case WIN -> {
                try {
                    yield Math.multiplyExact(stake, (long) winMultiplierBps) / BPS_DENOMINATOR;
                } catch (ArithmeticException ex) {
                    throw new LedgerInvariantViolationException("Payout overflow for stake " + stake, ex);
                }
            }
            case TIE -> stake;
            case LOSE -> 0L;
        };
    }

    static DuelAction parseRoundInput(String roundInput) {
        if (!StringUtils.hasText(roundInput)) {
            throw StakeLedgerException.invalidInput("action is required");
        }
        try {
            return DuelAction.valueOf(roundInput.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw StakeLedgerException.invalidInput("action must be one of ROCK, PAPER, SCISSORS");
        }
    }

    private static RoundState advance(String accountId, RoundState from, RoundState to) {
        log.debug("round_state accountId={} {} -> {}", accountId, from, to);
        return to;
    }
}
