package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.application.port.out.PointsLedgerPort;
import com.example.fulfillment.domain.model.PointsTransaction;
import com.example.fulfillment.domain.model.TransactionType;
import com.example.fulfillment.infrastructure.persistence.mapper.LoyaltyPersistenceMapper;
import com.example.fulfillment.infrastructure.persistence.repository.PointsTransactionRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Component
@Transactional
public class PointsLedgerAdapter implements PointsLedgerPort {

    private final PointsTransactionRepository repository;
    private final LoyaltyPersistenceMapper mapper;

    public PointsLedgerAdapter(PointsTransactionRepository repository, LoyaltyPersistenceMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Override
    public PointsTransaction append(PointsTransaction transaction) {
        return mapper.toDomain(repository.save(mapper.toEntity(transaction)));
    }

    @Override
    public long balance(Long userId) {
        return repository.sumPointsByUserId(userId);
    }

    @Override
    public boolean existsForOrder(Long orderId, TransactionType type) {
        return repository.existsByOrderIdAndTransactionType(orderId, type);
    }

    @Override
    public List<PointsTransaction> findForOrder(Long orderId, TransactionType type) {
        return repository.findByOrderIdAndTransactionTypeOrderByIdAsc(orderId, type).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    public boolean hasEarnOutsideOrder(Long userId, Long orderId) {
        return repository.countByTypeOutsideOrder(userId, TransactionType.EARN, orderId) > 0;
    }

    @Override
    public boolean existsForUser(Long userId, TransactionType type) {
        return repository.existsByUserIdAndTransactionType(userId, type);
    }

    @Override
    public boolean isOffset(Long transactionId) {
        return repository.existsBySourceTransactionId(transactionId);
    }

    @Override
    public List<Long> findUserIdsWithUnoffsetEarnsBefore(Instant cutoff) {
        return repository.findUserIdsWithUnoffsetBefore(TransactionType.EARN, cutoff);
    }

    @Override
    public List<PointsTransaction> findUnoffsetEarnsBefore(Long userId, Instant cutoff) {
        return repository.findUnoffsetBefore(userId, TransactionType.EARN, cutoff).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    public List<PointsTransaction> findByUser(Long userId) {
        return repository.findByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
                .map(mapper::toDomain)
                .toList();
    }
}
