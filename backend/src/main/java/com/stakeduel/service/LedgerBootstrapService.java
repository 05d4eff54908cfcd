package com.stakeduel.service;

import com.stakeduel.config.StakeduelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ensures the settings row and the configured assets exist on startup. Existing rows are
 * left alone so admin changes survive restarts.
 */
@Component
public class LedgerBootstrapService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LedgerBootstrapService.class);

    private final PlatformSettingsService platformSettingsService;
    private final AssetRegistryService assetRegistryService;
    private final StakeduelProperties stakeduelProperties;

    public LedgerBootstrapService(
            PlatformSettingsService platformSettingsService,
            AssetRegistryService assetRegistryService,
            StakeduelProperties stakeduelProperties
    ) {
        this.platformSettingsService = platformSettingsService;
        this.assetRegistryService = assetRegistryService;
        this.stakeduelProperties = stakeduelProperties;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        platformSettingsService.seedIfMissing();

        for (StakeduelProperties.BootstrapAsset asset : stakeduelProperties.getBootstrapAssets()) {
            if (assetRegistryService.isRegistered(asset.getAssetId())) {
                log.debug("Asset bootstrap skipped: {} already registered.", asset.getAssetId());
                continue;
            }
            assetRegistryService.registerAsset(new AssetRegistryService.AssetDefinition(
                    asset.getAssetId(),
                    asset.getPriceFeedRef(),
                    asset.getDecimals(),
                    asset.getMinPurchase(),
                    asset.getMaxPurchase()
            ));
        }
    }
}
