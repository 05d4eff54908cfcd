package com.stakeduel.web;

/**
 * Fatal ledger failure: arithmetic overflow or an attempted negative balance.
 * Never expected in normal operation.
 */
public class LedgerInvariantViolationException extends RuntimeException {

    public LedgerInvariantViolationException(String message) {
        super(message);
    }

    public LedgerInvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
