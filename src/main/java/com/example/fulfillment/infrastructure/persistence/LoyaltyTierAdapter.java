package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.application.port.out.LoyaltyTierPort;
import com.example.fulfillment.domain.model.LoyaltyTier;
import com.example.fulfillment.infrastructure.persistence.mapper.LoyaltyPersistenceMapper;
import com.example.fulfillment.infrastructure.persistence.repository.LoyaltyTierRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@Transactional(readOnly = true)
public class LoyaltyTierAdapter implements LoyaltyTierPort {

    private final LoyaltyTierRepository repository;
    private final LoyaltyPersistenceMapper mapper;

    public LoyaltyTierAdapter(LoyaltyTierRepository repository, LoyaltyPersistenceMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Override
    public List<LoyaltyTier> findAllOrdered() {
        return repository.findAllByOrderByRequiredLevelAsc().stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    public Optional<LoyaltyTier> findById(Long tierId) {
        return repository.findById(tierId).map(mapper::toDomain);
    }
}
