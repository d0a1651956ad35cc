package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.domain.model.TransactionType;
import com.example.fulfillment.infrastructure.persistence.entity.PointsTransactionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA Repository for the points ledger. An EARN row counts as offset once an
 * EXPIRE or ADJUST row references it through {@code sourceTransactionId}.
 */
@Repository
public interface PointsTransactionRepository extends JpaRepository<PointsTransactionEntity, Long> {

    @Query("SELECT COALESCE(SUM(p.points), 0) FROM PointsTransactionEntity p WHERE p.userId = :userId")
    long sumPointsByUserId(@Param("userId") Long userId);

    boolean existsByOrderIdAndTransactionType(Long orderId, TransactionType transactionType);

    boolean existsByUserIdAndTransactionType(Long userId, TransactionType transactionType);

    boolean existsBySourceTransactionId(Long sourceTransactionId);

    List<PointsTransactionEntity> findByOrderIdAndTransactionTypeOrderByIdAsc(Long orderId,
                                                                              TransactionType transactionType);

    List<PointsTransactionEntity> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    @Query("SELECT COUNT(p) FROM PointsTransactionEntity p WHERE p.userId = :userId "
            + "AND p.transactionType = :type AND p.orderId IS NOT NULL "
            + "AND (:orderId IS NULL OR p.orderId <> :orderId)")
    long countByTypeOutsideOrder(@Param("userId") Long userId,
                                 @Param("type") TransactionType type,
                                 @Param("orderId") Long orderId);

    @Query("SELECT DISTINCT p.userId FROM PointsTransactionEntity p WHERE p.transactionType = :type "
            + "AND p.createdAt < :cutoff AND NOT EXISTS "
            + "(SELECT o.id FROM PointsTransactionEntity o WHERE o.sourceTransactionId = p.id)")
    List<Long> findUserIdsWithUnoffsetBefore(@Param("type") TransactionType type,
                                             @Param("cutoff") Instant cutoff);

    @Query("SELECT p FROM PointsTransactionEntity p WHERE p.userId = :userId AND p.transactionType = :type "
            + "AND p.createdAt < :cutoff AND NOT EXISTS "
            + "(SELECT o.id FROM PointsTransactionEntity o WHERE o.sourceTransactionId = p.id) "
            + "ORDER BY p.createdAt ASC, p.id ASC")
    List<PointsTransactionEntity> findUnoffsetBefore(@Param("userId") Long userId,
                                                     @Param("type") TransactionType type,
                                                     @Param("cutoff") Instant cutoff);
}
