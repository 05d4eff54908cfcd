package com.stakeduel.config;

import com.stakeduel.model.SupportedAsset;
import com.stakeduel.service.AssetRegistryService;
import com.stakeduel.service.PricingOracleService;
import com.stakeduel.web.StakeLedgerException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class PriceFeedHealthIndicator implements HealthIndicator {

    private final AssetRegistryService assetRegistryService;
    private final PricingOracleService pricingOracleService;

    public PriceFeedHealthIndicator(AssetRegistryService assetRegistryService, PricingOracleService pricingOracleService) {
        this.assetRegistryService = assetRegistryService;
        this.pricingOracleService = pricingOracleService;
    }

    @Override
    public Health health() {
        try {
            Map<String, Object> feeds = new LinkedHashMap<>();
            boolean allUp = true;
            for (SupportedAsset asset : assetRegistryService.listActiveAssets()) {
                try {
                    PricingOracleService.AssetQuote quote = pricingOracleService.getPrice(asset.getAssetId());
                    feeds.put(asset.getAssetId(), Map.of(
                            "price", quote.quote().price(),
                            "precision", quote.quote().precision(),
                            "observedAt", quote.quote().observedAt().toString()
                    ));
                } catch (StakeLedgerException ex) {
                    allUp = false;
                    feeds.put(asset.getAssetId(), Map.of("error", ex.getCode()));
                }
            }
            Health.Builder builder = allUp ? Health.up() : Health.down();
            return builder.withDetail("feeds", feeds).build();
        } catch (Exception e) {
            return Health.down().withException(e).build();
        }
    }
}
