package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTierEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LoyaltyTierRepository extends JpaRepository<LoyaltyTierEntity, Long> {

    List<LoyaltyTierEntity> findAllByOrderByRequiredLevelAsc();
}
