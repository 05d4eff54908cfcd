package com.stakeduel.controller;

import com.stakeduel.config.StakeduelProperties;
import com.stakeduel.mapper.StakeduelResponseMapper;
import com.stakeduel.model.OpponentDifficulty;
import com.stakeduel.model.PlatformSettings;
import com.stakeduel.model.SupportedAsset;
import com.stakeduel.service.AssetRegistryService;
import com.stakeduel.service.PlatformSettingsService;
import com.stakeduel.service.ReconciliationService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AdminController.class, properties = "stakeduel.admin.token=s3cret")
@Import({StakeduelResponseMapper.class, StakeduelProperties.class})
class AdminControllerTest {

    private static final String TOKEN_HEADER = "X-Admin-Token";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PlatformSettingsService platformSettingsService;

    @MockitoBean
    private AssetRegistryService assetRegistryService;

    @MockitoBean
    private ReconciliationService reconciliationService;

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/admin/pause"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));

        verify(platformSettingsService, never()).setPaused(anyBoolean());
    }

    @Test
    void wrongTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/admin/settings").header(TOKEN_HEADER, "guess"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void pauseWithTokenReturnsSettings() throws Exception {
        PlatformSettings settings = settings();
        settings.setPaused(true);
        when(platformSettingsService.setPaused(true)).thenReturn(settings);

        mockMvc.perform(post("/api/admin/pause").header(TOKEN_HEADER, "s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true))
                .andExpect(jsonPath("$.maxDailyRounds").value(10));
    }

    @Test
    void updateSettingsPassesOnlyProvidedFields() throws Exception {
        PlatformSettings updated = settings();
        updated.setMaxDailyRounds(20);
        when(platformSettingsService.update(any())).thenReturn(updated);

        mockMvc.perform(put("/api/admin/settings")
                        .header(TOKEN_HEADER, "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"maxDailyRounds": 20}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxDailyRounds").value(20));

        ArgumentCaptor<PlatformSettingsService.SettingsUpdate> captor =
                ArgumentCaptor.forClass(PlatformSettingsService.SettingsUpdate.class);
        verify(platformSettingsService).update(captor.capture());
        assertEquals(20, captor.getValue().maxDailyRounds());
        assertNull(captor.getValue().winMultiplierBps());
    }

    @Test
    void updateSettingsRejectsProbabilityAboveOne() throws Exception {
        mockMvc.perform(put("/api/admin/settings")
                        .header(TOKEN_HEADER, "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetWinProbability": 1.5}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.targetWinProbability")
                        .value("targetWinProbability must be between 0 and 1"));

        verify(platformSettingsService, never()).update(any());
    }

    @Test
    void registerAssetReturnsCreated() throws Exception {
        SupportedAsset asset = new SupportedAsset();
        asset.setAssetId("USDC");
        asset.setPriceFeedRef("USDC-USD");
        asset.setDecimals(6);
        asset.setMinPurchase(BigInteger.ONE);
        asset.setMaxPurchase(BigInteger.valueOf(1_000_000_000L));
        when(assetRegistryService.registerAsset(any())).thenReturn(asset);

        mockMvc.perform(post("/api/admin/assets")
                        .header(TOKEN_HEADER, "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "assetId": "USDC",
                                  "priceFeedRef": "USDC-USD",
                                  "decimals": 6,
                                  "minPurchase": 1,
                                  "maxPurchase": 1000000000
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.assetId").value("USDC"))
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void reconciliationReportsBalance() throws Exception {
        when(reconciliationService.reconcile()).thenReturn(new ReconciliationService.ReconciliationReport(
                1_000L, 200L, 500L, 450L, 50L, 750L, 750L, true
        ));

        mockMvc.perform(get("/api/admin/reconciliation").header(TOKEN_HEADER, "s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.houseEarnings").value(50))
                .andExpect(jsonPath("$.balanced").value(true));
    }

    private static PlatformSettings settings() {
        PlatformSettings settings = new PlatformSettings();
        settings.setMaxDailyRounds(10);
        settings.setMaxDailyWager(1_000L);
        settings.setWinMultiplierBps(12_500);
        settings.setTargetWinProbability(new BigDecimal("0.75"));
        settings.setHistoryWindowSize(10);
        settings.setDefaultDifficulty(OpponentDifficulty.NORMAL);
        return settings;
    }
}
