package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.application.port.out.TaskQueuePort.TaskType;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskEntity;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA Repository for LoyaltyTask outbox rows.
 */
@Repository
public interface LoyaltyTaskRepository extends JpaRepository<LoyaltyTaskEntity, String> {

    @Query("SELECT t FROM LoyaltyTaskEntity t WHERE t.status = :status ORDER BY t.createdAt ASC")
    List<LoyaltyTaskEntity> findByStatus(@Param("status") LoyaltyTaskStatus status);

    @Query("SELECT t FROM LoyaltyTaskEntity t WHERE t.status = 'PENDING' ORDER BY t.createdAt ASC LIMIT :limit")
    List<LoyaltyTaskEntity> findPendingTasks(@Param("limit") int limit);

    List<LoyaltyTaskEntity> findByAggregateIdAndTaskType(String aggregateId, TaskType taskType);

    /**
     * Puts PROCESSING rows whose worker started before the cutoff back in the queue.
     */
    @Modifying
    @Query("UPDATE LoyaltyTaskEntity t SET t.status = :pending, t.startedAt = NULL "
            + "WHERE t.status = :processing AND t.startedAt < :startedBefore")
    int releaseStaleTasks(@Param("processing") LoyaltyTaskStatus processing,
                          @Param("pending") LoyaltyTaskStatus pending,
                          @Param("startedBefore") Instant startedBefore);

    @Modifying
    @Query("DELETE FROM LoyaltyTaskEntity t WHERE t.status = 'PROCESSED' AND t.processedAt < :before")
    int deleteProcessedTasksBefore(@Param("before") Instant before);
}
