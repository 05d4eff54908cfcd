package com.stakeduel.repository;

import com.stakeduel.model.CreditPurchase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CreditPurchaseRepository extends JpaRepository<CreditPurchase, UUID> {

    @Query("select coalesce(sum(p.credits), 0) from CreditPurchase p")
    long sumCredits();
}
