package com.stakeduel.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class StakeLedgerExceptionHandler {

    static final String INVARIANT_VIOLATION_CODE = "invariant_violation";

    private static final Logger log = LoggerFactory.getLogger(StakeLedgerExceptionHandler.class);

    @ExceptionHandler(StakeLedgerException.class)
    public ResponseEntity<StakeLedgerErrorResponse> handle(StakeLedgerException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new StakeLedgerErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(LedgerInvariantViolationException.class)
    public ResponseEntity<StakeLedgerErrorResponse> handleInvariantViolation(LedgerInvariantViolationException ex) {
        log.error("ledger_invariant_violation message={}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new StakeLedgerErrorResponse(INVARIANT_VIOLATION_CODE, "Ledger invariant violated"));
    }

    public record StakeLedgerErrorResponse(
            String code,
            String message
    ) {
    }
}
