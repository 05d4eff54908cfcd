package com.stakeduel.dto;

import java.math.BigInteger;
import java.time.OffsetDateTime;

public final class AssetResponses {

    private AssetResponses() {
    }

    public record Asset(
            String assetId,
            String priceFeedRef,
            int decimals,
            BigInteger minPurchase,
            BigInteger maxPurchase,
            boolean active
    ) {
    }

    public record Quote(
            String assetId,
            long credits,
            BigInteger requiredAssetAmount,
            BigInteger cashoutAssetAmount,
            long price,
            int pricePrecision,
            OffsetDateTime observedAt
    ) {
    }
}
