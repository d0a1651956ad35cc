package com.example.fulfillment.application.port.out;

import com.example.fulfillment.domain.model.PointsTransaction;
import com.example.fulfillment.domain.model.TransactionType;

import java.time.Instant;
import java.util.List;

/**
 * Outbound port for the append-only points ledger.
 * There are no update or delete operations.
 */
public interface PointsLedgerPort {

    PointsTransaction append(PointsTransaction transaction);

    /**
     * Sum of all points rows of the user.
     */
    long balance(Long userId);

    boolean existsForOrder(Long orderId, TransactionType type);

    List<PointsTransaction> findForOrder(Long orderId, TransactionType type);

    /**
     * Whether the user has an EARN row referencing any order other than the given one.
     */
    boolean hasEarnOutsideOrder(Long userId, Long orderId);

    boolean existsForUser(Long userId, TransactionType type);

    /**
     * Whether an EXPIRE or ADJUST row already offsets the given transaction.
     */
    boolean isOffset(Long transactionId);

    /**
     * Users owning EARN rows created before the cutoff that no other row offsets yet.
     */
    List<Long> findUserIdsWithUnoffsetEarnsBefore(Instant cutoff);

    /**
     * EARN rows of the user created before the cutoff that no other row offsets yet, oldest first.
     */
    List<PointsTransaction> findUnoffsetEarnsBefore(Long userId, Instant cutoff);

    /**
     * All rows of the user, newest first.
     */
    List<PointsTransaction> findByUser(Long userId);
}
