package com.stakeduel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger and round defaults. Limits, payout and history values seed the
 * platform settings row on first start; the admin API owns them afterwards.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "stakeduel")
public class StakeduelProperties {

    private Limits limits = new Limits();
    private Payout payout = new Payout();
    private History history = new History();
    private Pricing pricing = new Pricing();
    private Admin admin = new Admin();

    /**
     * Assets registered at startup when the registry does not know them yet.
     */
    private List<BootstrapAsset> bootstrapAssets = new ArrayList<>();

    @Getter
    @Setter
    public static class Limits {
        private int maxDailyRounds = 10;
        private long maxDailyWager = 1_000L;
    }

    @Getter
    @Setter
    public static class Payout {
        /**
         * Winning payout in basis points of the stake (12500 = 125%).
         */
        private int winMultiplierBps = 12_500;
    }

    @Getter
    @Setter
    public static class History {
        private int windowSize = 10;
    }

    @Getter
    @Setter
    public static class Pricing {
        /**
         * Credits granted per whole quote-currency unit (e.g. 100 credits per USD).
         */
        private long creditsPerQuoteUnit = 100L;
    }

    @Getter
    @Setter
    public static class Admin {
        /**
         * Shared token expected in the admin header. Blank disables the check.
         */
        private String token = "";
        private String headerName = "X-Admin-Token";
    }

    @Getter
    @Setter
    public static class BootstrapAsset {
        private String assetId;
        private String priceFeedRef;
        private int decimals;
        private BigInteger minPurchase;
        private BigInteger maxPurchase;
    }
}
