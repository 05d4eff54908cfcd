package com.stakeduel.provider;

import com.stakeduel.config.OracleProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MockPriceFeedClientTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void servesConfiguredPriceObservedNow() {
        OracleProperties properties = new OracleProperties();
        properties.getMock().getPrices().put("ETH-USD", 200_000_000_000L);
        MockPriceFeedClient client = new MockPriceFeedClient(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        PriceQuote quote = client.fetchPrice("ETH-USD");

        assertEquals(200_000_000_000L, quote.price());
        assertEquals(8, quote.precision());
        assertEquals(NOW, quote.observedAt());
    }

    @Test
    void unknownFeedFails() {
        MockPriceFeedClient client = new MockPriceFeedClient(new OracleProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

        assertThrows(PriceFeedException.class, () -> client.fetchPrice("BTC-USD"));
    }
}
