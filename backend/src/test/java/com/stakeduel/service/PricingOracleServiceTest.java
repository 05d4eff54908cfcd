package com.stakeduel.service;

import com.stakeduel.config.OracleProperties;
import com.stakeduel.config.StakeduelProperties;
import com.stakeduel.model.SupportedAsset;
import com.stakeduel.provider.PriceFeedClient;
import com.stakeduel.provider.PriceFeedException;
import com.stakeduel.provider.PriceQuote;
import com.stakeduel.web.ErrorCode;
import com.stakeduel.web.StakeLedgerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PricingOracleServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final long ETH_PRICE = 200_000_000_000L;
    private static final BigInteger ONE_ETH = BigInteger.TEN.pow(18);

    @Mock
    private AssetRegistryService assetRegistryService;

    @Mock
    private PriceFeedClient priceFeedClient;

    private ExecutorService executor;
    private OracleProperties oracleProperties;
    private PricingOracleService pricingOracleService;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        oracleProperties = new OracleProperties();
        oracleProperties.setTimeout(Duration.ofMillis(200));
        pricingOracleService = new PricingOracleService(
                assetRegistryService,
                priceFeedClient,
                executor,
                oracleProperties,
                new StakeduelProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void getPriceReturnsFreshQuoteForActiveAsset() {
        stubEth(new PriceQuote(ETH_PRICE, 8, NOW.minusSeconds(30)));

        PricingOracleService.AssetQuote quote = pricingOracleService.getPrice("ETH");

        assertEquals(ETH_PRICE, quote.quote().price());
        assertEquals("ETH", quote.asset().getAssetId());
    }

    @Test
    void staleQuoteIsRejected() {
        stubEth(new PriceQuote(ETH_PRICE, 8, NOW.minus(Duration.ofMinutes(6))));

        StakeLedgerException ex = assertThrows(StakeLedgerException.class, () -> pricingOracleService.getPrice("ETH"));

        assertEquals(ErrorCode.STALE_PRICE, ex.getErrorCode());
    }

    @Test
    void feedFailureIsOracleUnavailable() {
        when(assetRegistryService.getActiveAsset("ETH")).thenReturn(eth());
        when(priceFeedClient.fetchPrice("ETH-USD")).thenThrow(new PriceFeedException("connection refused"));

        StakeLedgerException ex = assertThrows(StakeLedgerException.class, () -> pricingOracleService.getPrice("ETH"));

        assertEquals(ErrorCode.ORACLE_UNAVAILABLE, ex.getErrorCode());
    }

    @Test
    void slowFeedTimesOutAsOracleUnavailable() {
        when(assetRegistryService.getActiveAsset("ETH")).thenReturn(eth());
        when(priceFeedClient.fetchPrice("ETH-USD")).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return new PriceQuote(ETH_PRICE, 8, NOW);
        });

        StakeLedgerException ex = assertThrows(StakeLedgerException.class, () -> pricingOracleService.getPrice("ETH"));

        assertEquals(ErrorCode.ORACLE_UNAVAILABLE, ex.getErrorCode());
    }

    @Test
    void nonPositivePriceIsOracleUnavailable() {
        stubEth(new PriceQuote(0L, 8, NOW));

        StakeLedgerException ex = assertThrows(StakeLedgerException.class, () -> pricingOracleService.getPrice("ETH"));

        assertEquals(ErrorCode.ORACLE_UNAVAILABLE, ex.getErrorCode());
    }

    @Test
    void inactiveAssetIsRejectedBeforeTheFeedIsCalled() {
        when(assetRegistryService.getActiveAsset("OLD")).thenThrow(StakeLedgerException.assetInactive("OLD"));

        StakeLedgerException ex = assertThrows(StakeLedgerException.class, () -> pricingOracleService.getPrice("OLD"));

        assertEquals(ErrorCode.ASSET_INACTIVE, ex.getErrorCode());
    }

    @Test
    void convertsAtTwoThousandDollarsPerEth() {
        PricingOracleService.AssetQuote quote = ethQuote(ETH_PRICE);

        // $2000 at 100 credits per dollar
        assertEquals(200_000L, pricingOracleService.assetAmountToCredits(quote, ONE_ETH));
        assertEquals(new BigInteger("5000000000000"), pricingOracleService.creditsToAssetAmount(quote, 1L));
        assertEquals(new BigInteger("1000000000000000"), pricingOracleService.cashoutAssetAmount(quote, 200L));
    }

    @Test
    void requiredPaymentRoundsUpAndPayoutsRoundDown() {
        // $3333.33333333 per ETH does not divide evenly into credits
        PricingOracleService.AssetQuote quote = ethQuote(333_333_333_333L);

        BigInteger required = pricingOracleService.creditsToAssetAmount(quote, 7L);
        BigInteger paidOut = pricingOracleService.cashoutAssetAmount(quote, 7L);

        assertEquals(BigInteger.ONE, required.subtract(paidOut));
        assertTrue(pricingOracleService.assetAmountToCredits(quote, required) >= 7L);
        assertTrue(pricingOracleService.assetAmountToCredits(quote, paidOut) <= 7L);
    }

    @Test
    void roundTripStaysWithinOneCredit() {
        PricingOracleService.AssetQuote quote = ethQuote(333_333_333_333L);

        for (long credits = 1; credits <= 5_000; credits += 37) {
            BigInteger assetAmount = pricingOracleService.creditsToAssetAmount(quote, credits);
            long back = pricingOracleService.assetAmountToCredits(quote, assetAmount);
            assertTrue(back >= credits && back <= credits + 1, "credits=" + credits + " back=" + back);
        }
    }

    @Test
    void conversionIsMonotonic() {
        PricingOracleService.AssetQuote quote = ethQuote(333_333_333_333L);

        long previousCredits = -1;
        BigInteger previousAmount = BigInteger.valueOf(-1);
        BigInteger step = new BigInteger("1234567890123");
        for (int i = 0; i < 2_000; i++) {
            BigInteger assetAmount = step.multiply(BigInteger.valueOf(i));
            long credits = pricingOracleService.assetAmountToCredits(quote, assetAmount);
            assertTrue(credits >= previousCredits);
            previousCredits = credits;

            BigInteger required = pricingOracleService.creditsToAssetAmount(quote, i);
            assertTrue(required.compareTo(previousAmount) >= 0);
            previousAmount = required;
        }
    }

    @Test
    void boundsAreInclusive() {
        SupportedAsset asset = eth();

        pricingOracleService.requireWithinBounds(asset, asset.getMinPurchase());
        pricingOracleService.requireWithinBounds(asset, asset.getMaxPurchase());

        StakeLedgerException below = assertThrows(StakeLedgerException.class,
                () -> pricingOracleService.requireWithinBounds(asset, asset.getMinPurchase().subtract(BigInteger.ONE)));
        StakeLedgerException above = assertThrows(StakeLedgerException.class,
                () -> pricingOracleService.requireWithinBounds(asset, asset.getMaxPurchase().add(BigInteger.ONE)));
        assertEquals(ErrorCode.AMOUNT_OUT_OF_BOUNDS, below.getErrorCode());
        assertEquals(ErrorCode.AMOUNT_OUT_OF_BOUNDS, above.getErrorCode());
    }

    private void stubEth(PriceQuote quote) {
        when(assetRegistryService.getActiveAsset("ETH")).thenReturn(eth());
        when(priceFeedClient.fetchPrice("ETH-USD")).thenReturn(quote);
    }

    private static PricingOracleService.AssetQuote ethQuote(long price) {
        return new PricingOracleService.AssetQuote(eth(), new PriceQuote(price, 8, NOW));
    }

    private static SupportedAsset eth() {
        SupportedAsset asset = new SupportedAsset();
        asset.setAssetId("ETH");
        asset.setPriceFeedRef("ETH-USD");
        asset.setDecimals(18);
        asset.setMinPurchase(new BigInteger("1000000000000000"));
        asset.setMaxPurchase(new BigInteger("5000000000000000000"));
        asset.setActive(true);
        return asset;
    }
}
