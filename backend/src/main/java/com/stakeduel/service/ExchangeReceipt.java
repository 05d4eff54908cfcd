package com.stakeduel.service;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Outcome of a purchase or cashout: the asset amount moved, the credits moved and the
 * price snapshot the conversion used.
 */
public record ExchangeReceipt(
        UUID referenceId,
        String accountId,
        String assetId,
        BigInteger assetAmount,
        long credits,
        long price,
        int pricePrecision,
        OffsetDateTime priceObservedAt,
        long balance
) {
}
