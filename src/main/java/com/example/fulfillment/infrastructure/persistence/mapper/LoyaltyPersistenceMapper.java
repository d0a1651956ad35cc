package com.example.fulfillment.infrastructure.persistence.mapper;

import com.example.fulfillment.domain.model.LoyaltyTier;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.PointsTransaction;
import com.example.fulfillment.domain.model.Product;
import com.example.fulfillment.domain.model.UserAccount;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTierEntity;
import com.example.fulfillment.infrastructure.persistence.entity.PointsTransactionEntity;
import com.example.fulfillment.infrastructure.persistence.entity.ProductEntity;
import com.example.fulfillment.infrastructure.persistence.entity.UserAccountEntity;
import org.springframework.stereotype.Component;

/**
 * Mapper for the catalog and loyalty tables.
 */
@Component
public class LoyaltyPersistenceMapper {

    public PointsTransactionEntity toEntity(PointsTransaction transaction) {
        PointsTransactionEntity entity = new PointsTransactionEntity();
        entity.setUserId(transaction.getUserId());
        entity.setPoints(transaction.getPoints());
        entity.setTransactionType(transaction.getType());
        entity.setOrderId(transaction.getOrderId());
        entity.setDescription(transaction.getDescription());
        entity.setCreatedBy(transaction.getCreatedBy());
        entity.setSourceTransactionId(transaction.getSourceTransactionId());
        entity.setCreatedAt(transaction.getCreatedAt());
        return entity;
    }

    public PointsTransaction toDomain(PointsTransactionEntity entity) {
        return PointsTransaction.reconstitute(
                entity.getId(),
                entity.getUserId(),
                entity.getPoints(),
                entity.getTransactionType(),
                entity.getOrderId(),
                entity.getDescription(),
                entity.getCreatedBy(),
                entity.getSourceTransactionId(),
                entity.getCreatedAt()
        );
    }

    public LoyaltyTier toDomain(LoyaltyTierEntity entity) {
        return new LoyaltyTier(
                entity.getId(),
                entity.getName(),
                entity.getRequiredLevel(),
                entity.getPointsMultiplier(),
                entity.getDescription()
        );
    }

    public UserAccount toDomain(UserAccountEntity entity) {
        return UserAccount.of(entity.getId(), entity.getEmail(), entity.getTotalXp(), entity.getLoyaltyTierId());
    }

    public Product toDomain(ProductEntity entity) {
        return Product.of(
                entity.getId(),
                entity.getName(),
                Money.of(entity.getPrice(), entity.getCurrency()),
                entity.getVatPercent(),
                entity.getDiscountPercent(),
                entity.getStock(),
                entity.getPointsCoefficient(),
                entity.getPoints()
        );
    }
}
