package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.application.port.out.StockGuard;
import com.example.fulfillment.domain.exception.InsufficientStockException;
import com.example.fulfillment.domain.exception.ProductNotFoundException;
import com.example.fulfillment.infrastructure.persistence.entity.ProductEntity;
import com.example.fulfillment.infrastructure.persistence.entity.StockLogEntity;
import com.example.fulfillment.infrastructure.persistence.entity.StockOperation;
import com.example.fulfillment.infrastructure.persistence.repository.ProductJpaRepository;
import com.example.fulfillment.infrastructure.persistence.repository.StockLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stock mutations as single conditional UPDATE statements. A reservation first
 * takes the product row lock so that concurrent reservations of the same
 * product queue up behind each other and see committed stock.
 * Every mutation is recorded in the stock log.
 */
@Component
@Transactional
public class StockGuardAdapter implements StockGuard {

    private static final Logger log = LoggerFactory.getLogger(StockGuardAdapter.class);

    private final ProductJpaRepository productRepository;
    private final StockLogRepository stockLogRepository;

    public StockGuardAdapter(ProductJpaRepository productRepository, StockLogRepository stockLogRepository) {
        this.productRepository = productRepository;
        this.stockLogRepository = stockLogRepository;
    }

    @Override
    public void reserve(Long productId, int quantity, Long orderId) {
        requirePositive(quantity);
        ProductEntity product = productRepository.findByIdForUpdate(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        int available = product.getStock();

        if (productRepository.decrementStockIfAvailable(productId, quantity) == 0) {
            log.warn("Insufficient stock for product {}: requested {}, available {}", productId, quantity, available);
            throw new InsufficientStockException(productId, quantity, available);
        }
        record(productId, orderId, StockOperation.RESERVE, -quantity, "Reserved for order");
    }

    @Override
    public void restore(Long productId, int quantity, Long orderId) {
        requirePositive(quantity);
        if (productRepository.incrementStock(productId, quantity) == 0) {
            throw new ProductNotFoundException(productId);
        }
        record(productId, orderId, StockOperation.RESTORE, quantity, "Restored from order");
    }

    @Override
    public void deductExempt(Long productId, int quantity, Long orderId) {
        requirePositive(quantity);
        if (productRepository.decrementStockFloored(productId, quantity) == 0) {
            throw new ProductNotFoundException(productId);
        }
        record(productId, orderId, StockOperation.ADJUST, -quantity, "Quantity increase on existing line");
    }

    private void record(Long productId, Long orderId, StockOperation operation, int delta, String reason) {
        int stockAfter = productRepository.findStockById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        stockLogRepository.save(StockLogEntity.of(productId, orderId, operation, delta, stockAfter, reason));
        log.debug("Stock {} of product {} by {} (order {}), now {}", operation, productId, delta, orderId, stockAfter);
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }
}
