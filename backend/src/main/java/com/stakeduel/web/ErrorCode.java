package com.stakeduel.web;

import org.springframework.http.HttpStatus;

import java.util.Locale;

/**
 * Recoverable failure codes surfaced to callers, with the HTTP status each maps to.
 */
public enum ErrorCode {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    INVALID_STAKE(HttpStatus.BAD_REQUEST),
    AMOUNT_OUT_OF_BOUNDS(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_BALANCE(HttpStatus.CONFLICT),
    DAILY_ROUND_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    DAILY_WAGER_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    UNVERIFIED(HttpStatus.FORBIDDEN),
    ASSET_NOT_SUPPORTED(HttpStatus.NOT_FOUND),
    ASSET_INACTIVE(HttpStatus.CONFLICT),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND),
    ORACLE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    STALE_PRICE(HttpStatus.SERVICE_UNAVAILABLE),
    SYSTEM_PAUSED(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String wireCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
