package com.example.fulfillment.infrastructure.persistence.repository;

import com.example.fulfillment.infrastructure.persistence.entity.ProductEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * JPA Repository for Product entities. Stock is only ever changed through the
 * single-statement updates below, never by writing a previously read value back.
 */
@Repository
public interface ProductJpaRepository extends JpaRepository<ProductEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM ProductEntity p WHERE p.id = :id")
    Optional<ProductEntity> findByIdForUpdate(@Param("id") Long id);

    /**
     * @return 1 if the stock was decremented, 0 if not enough units were available
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProductEntity p SET p.stock = p.stock - :quantity WHERE p.id = :id AND p.stock >= :quantity")
    int decrementStockIfAvailable(@Param("id") Long id, @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProductEntity p SET p.stock = p.stock + :quantity WHERE p.id = :id")
    int incrementStock(@Param("id") Long id, @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProductEntity p SET p.stock = CASE WHEN p.stock >= :quantity THEN p.stock - :quantity ELSE 0 END "
            + "WHERE p.id = :id")
    int decrementStockFloored(@Param("id") Long id, @Param("quantity") int quantity);

    @Query("SELECT p.stock FROM ProductEntity p WHERE p.id = :id")
    Optional<Integer> findStockById(@Param("id") Long id);
}
