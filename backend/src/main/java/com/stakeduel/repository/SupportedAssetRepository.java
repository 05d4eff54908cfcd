package com.stakeduel.repository;

import com.stakeduel.model.SupportedAsset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SupportedAssetRepository extends JpaRepository<SupportedAsset, String> {
    List<SupportedAsset> findAllByOrderByAssetIdAsc();

    List<SupportedAsset> findByActiveTrueOrderByAssetIdAsc();
}
