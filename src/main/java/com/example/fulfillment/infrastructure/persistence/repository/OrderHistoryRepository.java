package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.infrastructure.persistence.entity.OrderHistoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderHistoryRepository extends JpaRepository<OrderHistoryEntity, Long> {

    List<OrderHistoryEntity> findByOrderIdOrderByCreatedAtAscIdAsc(Long orderId);
}
