package com.stakeduel.service;

import com.stakeduel.model.SupportedAsset;
import com.stakeduel.repository.SupportedAssetRepository;
import com.stakeduel.web.StakeLedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Registry of purchasable assets. Only administrative operations mutate it.
 */
@Service
public class AssetRegistryService {

    private static final Logger log = LoggerFactory.getLogger(AssetRegistryService.class);

    private final SupportedAssetRepository supportedAssetRepository;
    private final Clock clock;

    public AssetRegistryService(SupportedAssetRepository supportedAssetRepository, Clock clock) {
        this.supportedAssetRepository = supportedAssetRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public SupportedAsset getAsset(String assetId) {
        return supportedAssetRepository.findById(assetId)
                .orElseThrow(() -> StakeLedgerException.assetNotSupported(assetId));
    }

    @Transactional(readOnly = true)
    public SupportedAsset getActiveAsset(String assetId) {
        SupportedAsset asset = getAsset(assetId);
        if (!asset.isActive()) {
            throw StakeLedgerException.assetInactive(assetId);
        }
        return asset;
    }

    @Transactional(readOnly = true)
    public List<SupportedAsset> listAssets() {
        return supportedAssetRepository.findAllByOrderByAssetIdAsc();
    }

    @Transactional(readOnly = true)
    public List<SupportedAsset> listActiveAssets() {
        return supportedAssetRepository.findByActiveTrueOrderByAssetIdAsc();
    }

    public boolean isRegistered(String assetId) {
        return supportedAssetRepository.existsById(assetId);
    }

    /**
     * Registers a new asset or replaces the definition of an existing one. The active flag
     * of an existing asset is left unchanged.
     */
    @Transactional
    public SupportedAsset registerAsset(AssetDefinition definition) {
        validate(definition);
        OffsetDateTime now = OffsetDateTime.now(clock);
        SupportedAsset asset = supportedAssetRepository.findById(definition.assetId()).orElse(null);
        boolean created = asset == null;
        if (created) {
            asset = new SupportedAsset();
            asset.setAssetId(definition.assetId());
            asset.setActive(true);
            asset.setCreatedAt(now);
        }
        asset.setPriceFeedRef(definition.priceFeedRef());
        asset.setDecimals(definition.decimals());
        asset.setMinPurchase(definition.minPurchase());
        asset.setMaxPurchase(definition.maxPurchase());
        asset.setUpdatedAt(now);

        SupportedAsset saved = supportedAssetRepository.save(asset);
        log.info("asset_{} assetId={} feed={} decimals={} min={} max={}",
                created ? "registered" : "updated", saved.getAssetId(), saved.getPriceFeedRef(),
                saved.getDecimals(), saved.getMinPurchase(), saved.getMaxPurchase());
        return saved;
    }

    @Transactional
    public SupportedAsset setActive(String assetId, boolean active) {
        SupportedAsset asset = getAsset(assetId);
        asset.setActive(active);
        asset.setUpdatedAt(OffsetDateTime.now(clock));
        SupportedAsset saved = supportedAssetRepository.save(asset);
        log.info("asset_{} assetId={}", active ? "activated" : "deactivated", assetId);
        return saved;
    }

    private static void validate(AssetDefinition definition) {
        if (definition.decimals() < 0 || definition.decimals() > 36) {
            throw StakeLedgerException.invalidInput("decimals must be between 0 and 36");
        }
        if (definition.minPurchase().signum() <= 0) {
            throw StakeLedgerException.invalidInput("minPurchase must be positive");
        }
        if (definition.maxPurchase().compareTo(definition.minPurchase()) < 0) {
            throw StakeLedgerException.invalidInput("maxPurchase must not be below minPurchase");
        }
    }

    public record AssetDefinition(
            String assetId,
            String priceFeedRef,
            int decimals,
            BigInteger minPurchase,
            BigInteger maxPurchase
    ) {
    }
}
