package com.stakeduel.service;

import com.stakeduel.model.LedgerAccount;
import com.stakeduel.model.LedgerEntry;
import com.stakeduel.model.LedgerEntryType;
import com.stakeduel.model.LedgerReason;
import com.stakeduel.repository.LedgerAccountRepository;
import com.stakeduel.repository.LedgerEntryRepository;
import com.stakeduel.web.LedgerInvariantViolationException;
import com.stakeduel.web.StakeLedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point for balance mutations. Callers must hold the account row lock
 * obtained through {@link #lockAccount(String)} in the same transaction.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final LedgerAccountRepository ledgerAccountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final Clock clock;

    public LedgerService(
            LedgerAccountRepository ledgerAccountRepository,
            LedgerEntryRepository ledgerEntryRepository,
            Clock clock
    ) {
        this.ledgerAccountRepository = ledgerAccountRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.clock = clock;
    }

    /**
     * Takes the account row lock, or returns empty for an unknown account.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<LedgerAccount> lockAccount(String accountId) {
        return ledgerAccountRepository.findByAccountIdForUpdate(accountId);
    }

    /**
     * Creates the account inside the caller's transaction when it is missing, then locks it.
     * A rollback of the caller also removes a freshly created account.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerAccount lockOrCreateAccount(String accountId) {
        if (ledgerAccountRepository.insertIfAbsent(accountId, OffsetDateTime.now(clock)) > 0) {
            log.info("account_created accountId={}", accountId);
        }
        return ledgerAccountRepository.findByAccountIdForUpdate(accountId)
                .orElseThrow(() -> new IllegalStateException("Account " + accountId + " missing after insert"));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEntry credit(LedgerAccount account, long amount, LedgerReason reason, UUID referenceId) {
        requirePositive(account, amount, reason);
        long newBalance;
        try {
            newBalance = Math.addExact(account.getCreditBalance(), amount);
        } catch (ArithmeticException ex) {
            throw violation("Credit of " + amount + " overflows balance of account " + account.getAccountId(), ex);
        }
        return apply(account, LedgerEntryType.CREDIT, amount, newBalance, reason, referenceId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEntry debit(LedgerAccount account, long amount, LedgerReason reason, UUID referenceId) {
        requirePositive(account, amount, reason);
        if (amount > account.getCreditBalance()) {
            throw StakeLedgerException.insufficientBalance(account.getAccountId(), amount, account.getCreditBalance());
        }
        long newBalance = account.getCreditBalance() - amount;
        if (newBalance < 0) {
            throw violation("Debit would leave account " + account.getAccountId() + " negative", null);
        }
        return apply(account, LedgerEntryType.DEBIT, amount, newBalance, reason, referenceId);
    }

    @Transactional(readOnly = true)
    public long getBalance(String accountId) {
        return ledgerAccountRepository.findById(accountId)
                .map(LedgerAccount::getCreditBalance)
                .orElseThrow(() -> StakeLedgerException.accountNotFound(accountId));
    }

    @Transactional(readOnly = true)
    public LedgerAccount getAccount(String accountId) {
        return ledgerAccountRepository.findById(accountId)
                .orElseThrow(() -> StakeLedgerException.accountNotFound(accountId));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntries(String accountId, int limit) {
        if (!ledgerAccountRepository.existsById(accountId)) {
            throw StakeLedgerException.accountNotFound(accountId);
        }
        return ledgerEntryRepository.findByAccountIdOrderBySequenceNumberDesc(accountId, PageRequest.of(0, limit));
    }

    private LedgerEntry apply(
            LedgerAccount account,
            LedgerEntryType type,
            long amount,
            long newBalance,
            LedgerReason reason,
            UUID referenceId
    ) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        long sequenceNumber = account.getEntrySequence() + 1;
        account.setEntrySequence(sequenceNumber);
        account.setCreditBalance(newBalance);
        account.setLastKnownDay(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
        account.setUpdatedAt(now);
        ledgerAccountRepository.save(account);

        LedgerEntry entry = new LedgerEntry();
        entry.setEntryId(UUID.randomUUID());
        entry.setAccountId(account.getAccountId());
        entry.setSequenceNumber(sequenceNumber);
        entry.setEntryType(type);
        entry.setReason(reason);
        entry.setAmount(amount);
        entry.setBalanceAfter(newBalance);
        entry.setReferenceId(referenceId);
        entry.setCreatedAt(now);
        LedgerEntry saved = ledgerEntryRepository.save(entry);

        log.debug("ledger_{} accountId={} amount={} reason={} balance={}",
                type.name().toLowerCase(), account.getAccountId(), amount, reason, newBalance);
        return saved;
    }

    private static void requirePositive(LedgerAccount account, long amount, LedgerReason reason) {
        if (amount <= 0) {
            throw violation("Non-positive " + reason + " amount " + amount + " for account " + account.getAccountId(), null);
        }
    }

    private static LedgerInvariantViolationException violation(String message, Throwable cause) {
        log.error("ledger_invariant_violation {}", message);
        return new LedgerInvariantViolationException(message, cause);
    }
}
