package com.stakeduel.service;

import com.stakeduel.model.DailyCounter;
import com.stakeduel.model.DailyCounterId;
import com.stakeduel.model.PlatformSettings;
import com.stakeduel.repository.DailyCounterRepository;
import com.stakeduel.web.StakeLedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Per-account, per-UTC-day round and wager limits. Counters are created lazily and never
 * reset; a new day simply starts a new row.
 */
@Service
public class DailyLimitTracker {

    private static final Logger log = LoggerFactory.getLogger(DailyLimitTracker.class);

    private final DailyCounterRepository dailyCounterRepository;
    private final Clock clock;

    public DailyLimitTracker(DailyCounterRepository dailyCounterRepository, Clock clock) {
        this.dailyCounterRepository = dailyCounterRepository;
        this.clock = clock;
    }

    public static LocalDate utcDay(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    public LocalDate today() {
        return utcDay(clock.instant());
    }

    /**
     * Checks both limits for the UTC day of {@code now} and counts the round and its stake.
     * Nothing is written when either limit would be exceeded. The caller must hold the
     * account row lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Reservation reserve(String accountId, long stake, Instant now, PlatformSettings limits) {
        LocalDate day = utcDay(now);
        DailyCounter counter = dailyCounterRepository.findById(new DailyCounterId(accountId, day))
                .orElseGet(() -> newCounter(accountId, day));

        if (counter.getRoundsPlayed() >= limits.getMaxDailyRounds()) {
            log.warn("daily_limit_rejected accountId={} day={} limit=rounds roundsPlayed={} max={}",
                    accountId, day, counter.getRoundsPlayed(), limits.getMaxDailyRounds());
            throw StakeLedgerException.dailyRoundLimitExceeded(accountId, limits.getMaxDailyRounds());
        }
        long wagered;
        try {
            wagered = Math.addExact(counter.getCreditsWagered(), stake);
        } catch (ArithmeticException ex) {
            wagered = Long.MAX_VALUE;
        }
        if (wagered > limits.getMaxDailyWager()) {
            log.warn("daily_limit_rejected accountId={} day={} limit=wager creditsWagered={} stake={} max={}",
                    accountId, day, counter.getCreditsWagered(), stake, limits.getMaxDailyWager());
            throw StakeLedgerException.dailyWagerLimitExceeded(accountId, limits.getMaxDailyWager());
        }

        counter.setRoundsPlayed(counter.getRoundsPlayed() + 1);
        counter.setCreditsWagered(wagered);
        counter.setUpdatedAt(OffsetDateTime.ofInstant(now, ZoneOffset.UTC));
        dailyCounterRepository.save(counter);
        return new Reservation(accountId, day, stake, counter.getRoundsPlayed(), counter.getCreditsWagered());
    }

    @Transactional(readOnly = true)
    public DailyCounter getCounter(String accountId, LocalDate day) {
        return dailyCounterRepository.findById(new DailyCounterId(accountId, day))
                .orElseGet(() -> newCounter(accountId, day));
    }

    private static DailyCounter newCounter(String accountId, LocalDate day) {
        DailyCounter counter = new DailyCounter();
        counter.setAccountId(accountId);
        counter.setCounterDay(day);
        counter.setRoundsPlayed(0);
        counter.setCreditsWagered(0L);
        return counter;
    }

    public record Reservation(
            String accountId,
            LocalDate day,
            long stake,
            int roundsPlayed,
            long creditsWagered
    ) {
    }
}
