package com.stakeduel.repository;

import com.stakeduel.model.MoveHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MoveHistoryRepository extends JpaRepository<MoveHistory, String> {
}
