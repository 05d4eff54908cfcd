package com.stakeduel.provider;

public interface PriceFeedClient {

    /**
     * Reads the latest observation for a feed reference such as {@code ETH-USD}.
     *
     * @throws PriceFeedException when the feed cannot be read
     */
    PriceQuote fetchPrice(String priceFeedRef);
}
