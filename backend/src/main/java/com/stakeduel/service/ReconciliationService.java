package com.stakeduel.service;

import com.stakeduel.repository.CreditCashoutRepository;
import com.stakeduel.repository.CreditPurchaseRepository;
import com.stakeduel.repository.DuelMatchRepository;
import com.stakeduel.repository.LedgerAccountRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Checks that purchased credits, minus cashed-out credits, plus the players' net round
 * result equals the sum of all balances. Only meaningful while no operation is in flight.
 */
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final LedgerAccountRepository ledgerAccountRepository;
    private final CreditPurchaseRepository creditPurchaseRepository;
    private final CreditCashoutRepository creditCashoutRepository;
    private final DuelMatchRepository duelMatchRepository;

    @Transactional(readOnly = true)
    public ReconciliationReport reconcile() {
        long purchased = creditPurchaseRepository.sumCredits();
        long cashedOut = creditCashoutRepository.sumCredits();
        long staked = duelMatchRepository.sumStakes();
        long paidOut = duelMatchRepository.sumPayouts();
        long balances = ledgerAccountRepository.sumCreditBalances();

        long netPlayerRoundResult = paidOut - staked;
        long expectedBalances = purchased - cashedOut + netPlayerRoundResult;
        boolean balanced = expectedBalances == balances;

        ReconciliationReport report = new ReconciliationReport(
                purchased,
                cashedOut,
                staked,
                paidOut,
                staked - paidOut,
                expectedBalances,
                balances,
                balanced
        );
        if (balanced) {
            log.info("reconciliation_ok balances={} houseEarnings={}", balances, report.houseEarnings());
        } else {
            log.error("reconciliation_mismatch expected={} actual={} purchased={} cashedOut={} staked={} paidOut={}",
                    expectedBalances, balances, purchased, cashedOut, staked, paidOut);
        }
        return report;
    }

    public record ReconciliationReport(
            long totalPurchasedCredits,
            long totalCashedOutCredits,
            long totalStaked,
            long totalPaidOut,
            long houseEarnings,
            long expectedBalances,
            long actualBalances,
            boolean balanced
    ) {
    }
}
