package com.stakeduel.controller;

import com.stakeduel.dto.AdminRequests;
import com.stakeduel.dto.AdminResponses;
import com.stakeduel.dto.AssetResponses;
import com.stakeduel.mapper.StakeduelResponseMapper;
import com.stakeduel.service.AssetRegistryService;
import com.stakeduel.service.PlatformSettingsService;
import com.stakeduel.service.ReconciliationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final PlatformSettingsService platformSettingsService;
    private final AssetRegistryService assetRegistryService;
    private final ReconciliationService reconciliationService;
    private final StakeduelResponseMapper stakeduelResponseMapper;

    public AdminController(
            PlatformSettingsService platformSettingsService,
            AssetRegistryService assetRegistryService,
            ReconciliationService reconciliationService,
            StakeduelResponseMapper stakeduelResponseMapper
    ) {
        this.platformSettingsService = platformSettingsService;
        this.assetRegistryService = assetRegistryService;
        this.reconciliationService = reconciliationService;
        this.stakeduelResponseMapper = stakeduelResponseMapper;
    }

    @GetMapping("/settings")
    public ResponseEntity<AdminResponses.Settings> getSettings() {
        return ResponseEntity.ok(stakeduelResponseMapper.toSettingsResponse(platformSettingsService.current()));
    }

    @PutMapping("/settings")
    public ResponseEntity<AdminResponses.Settings> updateSettings(
            @Valid @RequestBody AdminRequests.UpdateSettingsRequest request
    ) {
        return ResponseEntity.ok(stakeduelResponseMapper.toSettingsResponse(platformSettingsService.update(
                new PlatformSettingsService.SettingsUpdate(
                        request.maxDailyRounds(),
                        request.maxDailyWager(),
                        request.winMultiplierBps(),
                        request.targetWinProbability(),
                        request.historyWindowSize(),
                        request.defaultDifficulty()
                )
        )));
    }

    @PostMapping("/pause")
    public ResponseEntity<AdminResponses.Settings> pause() {
        return ResponseEntity.ok(stakeduelResponseMapper.toSettingsResponse(platformSettingsService.setPaused(true)));
    }

    @PostMapping("/unpause")
    public ResponseEntity<AdminResponses.Settings> unpause() {
        return ResponseEntity.ok(stakeduelResponseMapper.toSettingsResponse(platformSettingsService.setPaused(false)));
    }

    @PostMapping("/assets")
    public ResponseEntity<AssetResponses.Asset> registerAsset(
            @Valid @RequestBody AdminRequests.RegisterAssetRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stakeduelResponseMapper.toAssetResponse(
                assetRegistryService.registerAsset(new AssetRegistryService.AssetDefinition(
                        request.assetId(),
                        request.priceFeedRef(),
                        request.decimals(),
                        request.minPurchase(),
                        request.maxPurchase()
                ))
        ));
    }

    @PostMapping("/assets/{assetId}/deactivate")
    public ResponseEntity<AssetResponses.Asset> deactivateAsset(@PathVariable String assetId) {
        return ResponseEntity.ok(stakeduelResponseMapper.toAssetResponse(assetRegistryService.setActive(assetId, false)));
    }

    @PostMapping("/assets/{assetId}/activate")
    public ResponseEntity<AssetResponses.Asset> activateAsset(@PathVariable String assetId) {
        return ResponseEntity.ok(stakeduelResponseMapper.toAssetResponse(assetRegistryService.setActive(assetId, true)));
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<AdminResponses.Reconciliation> reconcile() {
        return ResponseEntity.ok(stakeduelResponseMapper.toReconciliationResponse(reconciliationService.reconcile()));
    }
}
