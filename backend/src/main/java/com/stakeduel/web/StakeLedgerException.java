package com.stakeduel.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Duration;

/**
 * Recoverable, caller-visible failure. Thrown before or inside a transaction; in the latter
 * case the transaction rolls back and no partial state remains.
 */
@Getter
public class StakeLedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    public StakeLedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StakeLedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    public String getCode() {
        return errorCode.wireCode();
    }

    public static StakeLedgerException invalidInput(String detail) {
        return new StakeLedgerException(ErrorCode.INVALID_INPUT, detail);
    }

    public static StakeLedgerException invalidStake(String detail) {
        return new StakeLedgerException(ErrorCode.INVALID_STAKE, detail);
    }

    public static StakeLedgerException amountOutOfBounds(String detail) {
        return new StakeLedgerException(ErrorCode.AMOUNT_OUT_OF_BOUNDS, detail);
    }

    public static StakeLedgerException insufficientBalance(String accountId, long requested, long balance) {
        return new StakeLedgerException(
                ErrorCode.INSUFFICIENT_BALANCE,
                "Account " + accountId + " has " + balance + " credits, " + requested + " requested"
        );
    }

    public static StakeLedgerException dailyRoundLimitExceeded(String accountId, int maxRounds) {
        return new StakeLedgerException(
                ErrorCode.DAILY_ROUND_LIMIT_EXCEEDED,
                "Account " + accountId + " reached the daily limit of " + maxRounds + " rounds"
        );
    }

    public static StakeLedgerException dailyWagerLimitExceeded(String accountId, long maxWager) {
        return new StakeLedgerException(
                ErrorCode.DAILY_WAGER_LIMIT_EXCEEDED,
                "Stake would exceed the daily wager limit of " + maxWager + " credits for account " + accountId
        );
    }

    public static StakeLedgerException unverified(String accountId) {
        return new StakeLedgerException(ErrorCode.UNVERIFIED, "Account " + accountId + " is not verified");
    }

    public static StakeLedgerException assetNotSupported(String assetId) {
        return new StakeLedgerException(ErrorCode.ASSET_NOT_SUPPORTED, "Asset " + assetId + " is not supported");
    }

    public static StakeLedgerException assetInactive(String assetId) {
        return new StakeLedgerException(ErrorCode.ASSET_INACTIVE, "Asset " + assetId + " is inactive");
    }

    public static StakeLedgerException accountNotFound(String accountId) {
        return new StakeLedgerException(ErrorCode.ACCOUNT_NOT_FOUND, "Account " + accountId + " not found");
    }

    public static StakeLedgerException oracleUnavailable(String detail, Throwable cause) {
        return new StakeLedgerException(ErrorCode.ORACLE_UNAVAILABLE, detail, cause);
    }

    public static StakeLedgerException stalePrice(String assetId, Duration age) {
        return new StakeLedgerException(
                ErrorCode.STALE_PRICE,
                "Price for " + assetId + " is " + age.toSeconds() + "s old"
        );
    }

    public static StakeLedgerException systemPaused() {
        return new StakeLedgerException(ErrorCode.SYSTEM_PAUSED, "Platform is paused");
    }
}
