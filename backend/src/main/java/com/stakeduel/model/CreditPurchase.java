package com.stakeduel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "credit_purchases")
public class CreditPurchase {

    @Id
    @Column(name = "purchase_id", nullable = false, updatable = false)
    private UUID purchaseId;

    @Column(name = "account_id", nullable = false, updatable = false, length = 128)
    private String accountId;

    @Column(name = "asset_id", nullable = false, updatable = false, length = 32)
    private String assetId;

    @Column(name = "asset_amount", nullable = false, updatable = false, precision = 38, scale = 0)
    private BigInteger assetAmount;

    @Column(name = "credits", nullable = false, updatable = false)
    private long credits;

    @Column(name = "price", nullable = false, updatable = false)
    private long price;

    @Column(name = "price_precision", nullable = false, updatable = false)
    private int pricePrecision;

    @Column(name = "price_observed_at", nullable = false, updatable = false)
    private OffsetDateTime priceObservedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
