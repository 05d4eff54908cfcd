package com.stakeduel.provider;

import java.time.Instant;

/**
 * Feed observation: {@code price / 10^precision} quote-currency units per whole asset.
 */
public record PriceQuote(
        long price,
        int precision,
        Instant observedAt
) {
}
