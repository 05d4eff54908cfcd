package com.stakeduel.service;

import com.stakeduel.config.OracleProperties;
import com.stakeduel.config.StakeduelProperties;
import com.stakeduel.model.SupportedAsset;
import com.stakeduel.provider.PriceFeedClient;
import com.stakeduel.provider.PriceQuote;
import com.stakeduel.web.StakeLedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Prices assets in credits.
 * <p>
 * A quote of {@code price} at {@code precision} means {@code price / 10^precision} quote
 * units per whole asset, i.e. per {@code 10^decimals} base units; one quote unit buys
 * {@code creditsPerQuoteUnit} credits. All conversions are exact integer arithmetic:
 * the payment a player owes rounds up, anything the platform pays out rounds down.
 */
@Service
public class PricingOracleService {

    private static final Logger log = LoggerFactory.getLogger(PricingOracleService.class);

    private final AssetRegistryService assetRegistryService;
    private final PriceFeedClient priceFeedClient;
    private final ExecutorService priceFeedExecutor;
    private final OracleProperties oracleProperties;
    private final StakeduelProperties stakeduelProperties;
    private final Clock clock;

    public PricingOracleService(
            AssetRegistryService assetRegistryService,
            PriceFeedClient priceFeedClient,
            ExecutorService priceFeedExecutor,
            OracleProperties oracleProperties,
            StakeduelProperties stakeduelProperties,
            Clock clock
    ) {
        this.assetRegistryService = assetRegistryService;
        this.priceFeedClient = priceFeedClient;
        this.priceFeedExecutor = priceFeedExecutor;
        this.oracleProperties = oracleProperties;
        this.stakeduelProperties = stakeduelProperties;
        this.clock = clock;
    }

    public AssetQuote getPrice(String assetId) {
        SupportedAsset asset = assetRegistryService.getActiveAsset(assetId);
        return new AssetQuote(asset, fetchFreshQuote(asset));
    }

    /**
     * Asset base units a player must pay to receive {@code credits}.
     */
    public BigInteger creditsToAssetAmount(String assetId, long credits) {
        return creditsToAssetAmount(getPrice(assetId), credits);
    }

    /**
     * Credits granted for paying {@code assetAmount} base units.
     */
    public long assetAmountToCredits(String assetId, BigInteger assetAmount) {
        return assetAmountToCredits(getPrice(assetId), assetAmount);
    }

    /**
     * Asset base units paid out when {@code credits} are cashed out.
     */
    public BigInteger cashoutAssetAmount(String assetId, long credits) {
        return cashoutAssetAmount(getPrice(assetId), credits);
    }

    public BigInteger creditsToAssetAmount(AssetQuote quote, long credits) {
        requireNonNegative(credits);
        BigInteger numerator = BigInteger.valueOf(credits).multiply(baseUnitScale(quote));
        BigInteger denominator = creditsPerWholeAssetScaled(quote);
        BigInteger[] division = numerator.divideAndRemainder(denominator);
        return division[1].signum() == 0 ? division[0] : division[0].add(BigInteger.ONE);
    }

    public long assetAmountToCredits(AssetQuote quote, BigInteger assetAmount) {
        if (assetAmount.signum() < 0) {
            throw StakeLedgerException.invalidInput("assetAmount must not be negative");
        }
        BigInteger credits = assetAmount.multiply(creditsPerWholeAssetScaled(quote))
                .divide(baseUnitScale(quote));
        if (credits.bitLength() > 63) {
            throw StakeLedgerException.amountOutOfBounds("assetAmount converts to more credits than the ledger holds");
        }
        return credits.longValue();
    }

    public BigInteger cashoutAssetAmount(AssetQuote quote, long credits) {
        requireNonNegative(credits);
        return BigInteger.valueOf(credits).multiply(baseUnitScale(quote))
                .divide(creditsPerWholeAssetScaled(quote));
    }

    /**
     * Rejects asset amounts outside the asset's configured purchase bounds.
     */
    public void requireWithinBounds(SupportedAsset asset, BigInteger assetAmount) {
        if (assetAmount.compareTo(asset.getMinPurchase()) < 0 || assetAmount.compareTo(asset.getMaxPurchase()) > 0) {
            throw StakeLedgerException.amountOutOfBounds(
                    "Amount " + assetAmount + " of " + asset.getAssetId() + " is outside ["
                            + asset.getMinPurchase() + ", " + asset.getMaxPurchase() + "]"
            );
        }
    }

    private PriceQuote fetchFreshQuote(SupportedAsset asset) {
        Duration timeout = oracleProperties.getTimeout();
        Future<PriceQuote> future = priceFeedExecutor.submit(() -> priceFeedClient.fetchPrice(asset.getPriceFeedRef()));
        PriceQuote quote;
        try {
            quote = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("oracle_unavailable assetId={} feed={} reason=timeout timeoutMs={}",
                    asset.getAssetId(), asset.getPriceFeedRef(), timeout.toMillis());
            throw StakeLedgerException.oracleUnavailable("Price feed timed out for " + asset.getAssetId(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("oracle_unavailable assetId={} feed={} reason={}",
                    asset.getAssetId(), asset.getPriceFeedRef(), cause.getMessage());
            throw StakeLedgerException.oracleUnavailable("Price feed failed for " + asset.getAssetId(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw StakeLedgerException.oracleUnavailable("Interrupted while reading price for " + asset.getAssetId(), ex);
        }

        if (quote == null || quote.price() <= 0 || quote.precision() < 0 || quote.observedAt() == null) {
            log.warn("oracle_unavailable assetId={} reason=invalid_quote quote={}", asset.getAssetId(), quote);
            throw StakeLedgerException.oracleUnavailable("Price feed returned an invalid quote for " + asset.getAssetId(), null);
        }

        Duration age = Duration.between(quote.observedAt(), clock.instant());
        if (age.compareTo(oracleProperties.getMaxPriceAge()) > 0) {
            log.warn("stale_price assetId={} ageSeconds={} maxAgeSeconds={}",
                    asset.getAssetId(), age.toSeconds(), oracleProperties.getMaxPriceAge().toSeconds());
            throw StakeLedgerException.stalePrice(asset.getAssetId(), age);
        }
        return quote;
    }

    /**
     * Credits per whole asset, scaled by {@code 10^precision}.
     */
    private BigInteger creditsPerWholeAssetScaled(AssetQuote quote) {
        return BigInteger.valueOf(quote.quote().price())
                .multiply(BigInteger.valueOf(stakeduelProperties.getPricing().getCreditsPerQuoteUnit()));
    }

    /**
     * {@code 10^(decimals + precision)}.
     */
    private static BigInteger baseUnitScale(AssetQuote quote) {
        return BigInteger.TEN.pow(quote.asset().getDecimals() + quote.quote().precision());
    }

    private static void requireNonNegative(long credits) {
        if (credits < 0) {
            throw StakeLedgerException.invalidInput("credits must not be negative");
        }
    }

    /**
     * A validated, non-stale quote for an active asset.
     */
    public record AssetQuote(
            SupportedAsset asset,
            PriceQuote quote
    ) {
    }
}
