package com.stakeduel.controller;

import com.stakeduel.dto.AssetResponses;
import com.stakeduel.mapper.StakeduelResponseMapper;
import com.stakeduel.service.AssetRegistryService;
import com.stakeduel.service.PricingOracleService;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@RestController
@RequestMapping("/api/assets")
public class AssetController {

    private final AssetRegistryService assetRegistryService;
    private final PricingOracleService pricingOracleService;
    private final StakeduelResponseMapper stakeduelResponseMapper;

    public AssetController(
            AssetRegistryService assetRegistryService,
            PricingOracleService pricingOracleService,
            StakeduelResponseMapper stakeduelResponseMapper
    ) {
        this.assetRegistryService = assetRegistryService;
        this.pricingOracleService = pricingOracleService;
        this.stakeduelResponseMapper = stakeduelResponseMapper;
    }

    @GetMapping
    public ResponseEntity<List<AssetResponses.Asset>> listAssets() {
        return ResponseEntity.ok(stakeduelResponseMapper.toAssetResponses(assetRegistryService.listAssets()));
    }

    @GetMapping("/{assetId}/quote")
    public ResponseEntity<AssetResponses.Quote> quote(
            @PathVariable String assetId,
            @RequestParam @Min(1) long credits
    ) {
        PricingOracleService.AssetQuote quote = pricingOracleService.getPrice(assetId);
        return ResponseEntity.ok(new AssetResponses.Quote(
                assetId,
                credits,
                pricingOracleService.creditsToAssetAmount(quote, credits),
                pricingOracleService.cashoutAssetAmount(quote, credits),
                quote.quote().price(),
                quote.quote().precision(),
                OffsetDateTime.ofInstant(quote.quote().observedAt(), ZoneOffset.UTC)
        ));
    }
}
