package com.stakeduel.service;

import com.stakeduel.config.StakeduelProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerBootstrapServiceTest {

    @Mock
    private PlatformSettingsService platformSettingsService;

    @Mock
    private AssetRegistryService assetRegistryService;

    @Test
    void seedsSettingsAndRegistersOnlyUnknownAssets() {
        StakeduelProperties properties = new StakeduelProperties();
        properties.setBootstrapAssets(List.of(
                asset("ETH", "ETH-USD", 18),
                asset("USDC", "USDC-USD", 6)
        ));
        when(assetRegistryService.isRegistered("ETH")).thenReturn(true);
        when(assetRegistryService.isRegistered("USDC")).thenReturn(false);

        new LedgerBootstrapService(platformSettingsService, assetRegistryService, properties)
                .run(new DefaultApplicationArguments());

        verify(platformSettingsService).seedIfMissing();
        ArgumentCaptor<AssetRegistryService.AssetDefinition> captor =
                ArgumentCaptor.forClass(AssetRegistryService.AssetDefinition.class);
        verify(assetRegistryService, times(1)).registerAsset(captor.capture());
        assertEquals("USDC", captor.getValue().assetId());
        assertEquals("USDC-USD", captor.getValue().priceFeedRef());
        assertEquals(6, captor.getValue().decimals());
    }

    private static StakeduelProperties.BootstrapAsset asset(String assetId, String feed, int decimals) {
        StakeduelProperties.BootstrapAsset asset = new StakeduelProperties.BootstrapAsset();
        asset.setAssetId(assetId);
        asset.setPriceFeedRef(feed);
        asset.setDecimals(decimals);
        asset.setMinPurchase(BigInteger.ONE);
        asset.setMaxPurchase(BigInteger.valueOf(1_000_000L));
        return asset;
    }
}
