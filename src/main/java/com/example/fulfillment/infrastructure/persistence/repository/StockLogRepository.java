package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.infrastructure.persistence.entity.StockLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StockLogRepository extends JpaRepository<StockLogEntity, Long> {

    List<StockLogEntity> findByProductIdOrderByIdAsc(Long productId);

    List<StockLogEntity> findByOrderIdOrderByIdAsc(Long orderId);
}
