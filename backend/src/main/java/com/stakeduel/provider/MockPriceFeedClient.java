package com.stakeduel.provider;

import com.stakeduel.config.OracleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Configuration-backed feed for local runs and tests. Prices come from
 * {@code stakeduel.oracle.mock.prices} and are always observed "now".
 */
@Component
public class MockPriceFeedClient implements PriceFeedClient {

    private static final Logger log = LoggerFactory.getLogger(MockPriceFeedClient.class);

    private final OracleProperties oracleProperties;
    private final Clock clock;

    public MockPriceFeedClient(OracleProperties oracleProperties, Clock clock) {
        this.oracleProperties = oracleProperties;
        this.clock = clock;
    }

    @Override
    public PriceQuote fetchPrice(String priceFeedRef) {
        OracleProperties.Mock mock = oracleProperties.getMock();
        Long price = mock.getPrices().get(priceFeedRef);
        if (price == null) {
            throw new PriceFeedException("No mock price configured for feed " + priceFeedRef);
        }
        log.debug("Serving mock price feed={} price={} precision={}", priceFeedRef, price, mock.getPrecision());
        return new PriceQuote(price, mock.getPrecision(), clock.instant());
    }
}
