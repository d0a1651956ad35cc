package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.application.port.out.ProductCatalogPort;
import com.example.fulfillment.domain.model.Product;
import com.example.fulfillment.infrastructure.persistence.mapper.LoyaltyPersistenceMapper;
import com.example.fulfillment.infrastructure.persistence.repository.ProductJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
public class ProductCatalogAdapter implements ProductCatalogPort {

    private final ProductJpaRepository productRepository;
    private final LoyaltyPersistenceMapper mapper;

    public ProductCatalogAdapter(ProductJpaRepository productRepository, LoyaltyPersistenceMapper mapper) {
        this.productRepository = productRepository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Product> findById(Long productId) {
        return productRepository.findById(productId).map(mapper::toDomain);
    }
}
