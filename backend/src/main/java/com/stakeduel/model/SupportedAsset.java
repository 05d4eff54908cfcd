package com.stakeduel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;
import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "supported_assets")
public class SupportedAsset {

    @Id
    @Column(name = "asset_id", nullable = false, updatable = false, length = 32)
    private String assetId;

    @Column(name = "price_feed_ref", nullable = false, length = 128)
    private String priceFeedRef;

    /**
     * Base units per whole asset, as a power of ten.
     */
    @Column(name = "decimals", nullable = false)
    private int decimals;

    @Column(name = "min_purchase", nullable = false, precision = 38, scale = 0)
    private BigInteger minPurchase;

    @Column(name = "max_purchase", nullable = false, precision = 38, scale = 0)
    private BigInteger maxPurchase;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
