package com.stakeduel.repository;

import com.stakeduel.model.DailyCounter;
import com.stakeduel.model.DailyCounterId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DailyCounterRepository extends JpaRepository<DailyCounter, DailyCounterId> {
}
