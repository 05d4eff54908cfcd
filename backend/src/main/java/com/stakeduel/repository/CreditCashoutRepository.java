package com.stakeduel.repository;

import com.stakeduel.model.CreditCashout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CreditCashoutRepository extends JpaRepository<CreditCashout, UUID> {

    @Query("select coalesce(sum(c.credits), 0) from CreditCashout c")
    long sumCredits();
}
