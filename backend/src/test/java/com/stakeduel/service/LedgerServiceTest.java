package com.stakeduel.service;

import com.stakeduel.model.LedgerAccount;
import com.stakeduel.model.LedgerEntry;
import com.stakeduel.model.LedgerEntryType;
import com.stakeduel.model.LedgerReason;
import com.stakeduel.repository.LedgerAccountRepository;
import com.stakeduel.repository.LedgerEntryRepository;
import com.stakeduel.web.ErrorCode;
import com.stakeduel.web.LedgerInvariantViolationException;
import com.stakeduel.web.StakeLedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    @Mock
    private LedgerAccountRepository ledgerAccountRepository;

    @Mock
    private LedgerEntryRepository ledgerEntryRepository;

    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        ledgerService = new LedgerService(
                ledgerAccountRepository,
                ledgerEntryRepository,
                Clock.fixed(Instant.parse("2026-03-01T23:59:59.999Z"), ZoneOffset.UTC)
        );
    }

    @Test
    void creditAddsAndRecordsEntry() {
        LedgerAccount account = account(10L);
        when(ledgerEntryRepository.save(any(LedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UUID reference = UUID.randomUUID();

        LedgerEntry entry = ledgerService.credit(account, 6L, LedgerReason.ROUND_PAYOUT, reference);

        assertEquals(16L, account.getCreditBalance());
        assertEquals(LedgerEntryType.CREDIT, entry.getEntryType());
        assertEquals(16L, entry.getBalanceAfter());
        assertEquals(reference, entry.getReferenceId());
        assertEquals(LocalDate.of(2026, 3, 1), account.getLastKnownDay());
    }

    @Test
    void entriesAreNumberedPerAccountUnderOneTimestamp() {
        LedgerAccount account = account(10L);
        when(ledgerEntryRepository.save(any(LedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UUID round = UUID.randomUUID();

        LedgerEntry stake = ledgerService.debit(account, 5L, LedgerReason.ROUND_STAKE, round);
        LedgerEntry payout = ledgerService.credit(account, 6L, LedgerReason.ROUND_PAYOUT, round);

        assertEquals(stake.getCreatedAt(), payout.getCreatedAt());
        assertEquals(1L, stake.getSequenceNumber());
        assertEquals(2L, payout.getSequenceNumber());
        assertEquals(2L, account.getEntrySequence());
    }

    @Test
    void debitOfWholeBalanceLeavesZero() {
        LedgerAccount account = account(5L);
        when(ledgerEntryRepository.save(any(LedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ledgerService.debit(account, 5L, LedgerReason.ROUND_STAKE, UUID.randomUUID());

        assertEquals(0L, account.getCreditBalance());
    }

    @Test
    void debitAboveBalanceIsInsufficientAndLeavesBalance() {
        LedgerAccount account = account(5L);

        StakeLedgerException ex = assertThrows(StakeLedgerException.class,
                () -> ledgerService.debit(account, 6L, LedgerReason.CASHOUT, UUID.randomUUID()));

        assertEquals(ErrorCode.INSUFFICIENT_BALANCE, ex.getErrorCode());
        assertEquals(5L, account.getCreditBalance());
        verify(ledgerEntryRepository, never()).save(any());
    }

    @Test
    void overflowIsAnInvariantViolation() {
        LedgerAccount account = account(Long.MAX_VALUE - 1);

        assertThrows(LedgerInvariantViolationException.class,
                () -> ledgerService.credit(account, 2L, LedgerReason.PURCHASE, UUID.randomUUID()));
        assertEquals(Long.MAX_VALUE - 1, account.getCreditBalance());
    }

    @Test
    void nonPositiveAmountIsAnInvariantViolation() {
        LedgerAccount account = account(5L);

        assertThrows(LedgerInvariantViolationException.class,
                () -> ledgerService.credit(account, 0L, LedgerReason.PURCHASE, UUID.randomUUID()));
        assertThrows(LedgerInvariantViolationException.class,
                () -> ledgerService.debit(account, -1L, LedgerReason.CASHOUT, UUID.randomUUID()));
    }

    @Test
    void unknownAccountBalanceIsNotFound() {
        when(ledgerAccountRepository.findById("ghost")).thenReturn(Optional.empty());

        StakeLedgerException ex = assertThrows(StakeLedgerException.class, () -> ledgerService.getBalance("ghost"));

        assertEquals(ErrorCode.ACCOUNT_NOT_FOUND, ex.getErrorCode());
    }

    private static LedgerAccount account(long balance) {
        LedgerAccount account = new LedgerAccount();
        account.setAccountId("wallet-1");
        account.setCreditBalance(balance);
        return account;
    }
}
