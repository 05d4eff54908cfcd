package com.stakeduel.config;

import com.stakeduel.model.OpponentDifficulty;
import com.stakeduel.model.WinRateScope;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StakeduelConfigurationPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(
                    StakeduelProperties.class,
                    OracleProperties.class,
                    OpponentProperties.class,
                    VerificationProperties.class
            );

    @Test
    void contextStartsWithPropertyBeans() {
        contextRunner.run(context -> {
            assertTrue(context.containsBean("stakeduelProperties"));
            assertTrue(context.containsBean("oracleProperties"));
            assertTrue(context.containsBean("opponentProperties"));
            assertTrue(context.containsBean("verificationProperties"));
        });
    }

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            StakeduelProperties stakeduel = context.getBean(StakeduelProperties.class);
            OracleProperties oracle = context.getBean(OracleProperties.class);
            OpponentProperties opponent = context.getBean(OpponentProperties.class);
            VerificationProperties verification = context.getBean(VerificationProperties.class);

            assertEquals(10, stakeduel.getLimits().getMaxDailyRounds());
            assertEquals(1_000L, stakeduel.getLimits().getMaxDailyWager());
            assertEquals(12_500, stakeduel.getPayout().getWinMultiplierBps());
            assertEquals(10, stakeduel.getHistory().getWindowSize());
            assertEquals(100L, stakeduel.getPricing().getCreditsPerQuoteUnit());
            assertEquals("X-Admin-Token", stakeduel.getAdmin().getHeaderName());
            assertTrue(stakeduel.getBootstrapAssets().isEmpty());

            assertEquals(Duration.ofSeconds(2), oracle.getTimeout());
            assertEquals(Duration.ofMinutes(5), oracle.getMaxPriceAge());
            assertEquals(8, oracle.getMock().getPrecision());

            assertEquals(new BigDecimal("0.75"), opponent.getTargetWinProbability());
            assertEquals(WinRateScope.PER_ACCOUNT, opponent.getScope());
            assertEquals(500, opponent.getWinRateWindow());
            assertEquals(0.95, opponent.profileFor(OpponentDifficulty.HARD).getConfidence());

            assertTrue(verification.isAllowAll());
        });
    }

    @Test
    void bindsOverridesIncludingBracketedFeedKeys() {
        contextRunner
                .withPropertyValues(
                        "stakeduel.limits.max-daily-rounds=25",
                        "stakeduel.payout.win-multiplier-bps=15000",
                        "stakeduel.bootstrap-assets[0].asset-id=ETH",
                        "stakeduel.bootstrap-assets[0].price-feed-ref=ETH-USD",
                        "stakeduel.bootstrap-assets[0].decimals=18",
                        "stakeduel.bootstrap-assets[0].min-purchase=1000000000000000",
                        "stakeduel.bootstrap-assets[0].max-purchase=5000000000000000000",
                        "stakeduel.oracle.timeout=750ms",
                        "stakeduel.oracle.mock.prices[ETH-USD]=200000000000",
                        "stakeduel.opponent.scope=PLATFORM",
                        "stakeduel.opponent.hard.confidence=0.9",
                        "stakeduel.verification.allow-all=false",
                        "stakeduel.verification.approved-accounts=wallet-1,wallet-2"
                )
                .run(context -> {
                    StakeduelProperties stakeduel = context.getBean(StakeduelProperties.class);
                    OracleProperties oracle = context.getBean(OracleProperties.class);
                    OpponentProperties opponent = context.getBean(OpponentProperties.class);
                    VerificationProperties verification = context.getBean(VerificationProperties.class);

                    assertEquals(25, stakeduel.getLimits().getMaxDailyRounds());
                    assertEquals(15_000, stakeduel.getPayout().getWinMultiplierBps());
                    assertEquals(1, stakeduel.getBootstrapAssets().size());
                    assertEquals(new BigInteger("5000000000000000000"),
                            stakeduel.getBootstrapAssets().get(0).getMaxPurchase());

                    assertEquals(Duration.ofMillis(750), oracle.getTimeout());
                    assertEquals(200_000_000_000L, oracle.getMock().getPrices().get("ETH-USD"));

                    assertEquals(WinRateScope.PLATFORM, opponent.getScope());
                    assertEquals(0.9, opponent.getHard().getConfidence());

                    assertTrue(verification.getApprovedAccounts().contains("wallet-2"));
                    assertEquals(2, verification.getApprovedAccounts().size());
                });
    }
}
