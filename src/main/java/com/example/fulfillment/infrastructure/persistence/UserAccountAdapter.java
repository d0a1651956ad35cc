package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.application.port.out.UserAccountPort;
import com.example.fulfillment.domain.exception.UserNotFoundException;
import com.example.fulfillment.domain.model.UserAccount;
import com.example.fulfillment.infrastructure.persistence.entity.UserAccountEntity;
import com.example.fulfillment.infrastructure.persistence.mapper.LoyaltyPersistenceMapper;
import com.example.fulfillment.infrastructure.persistence.repository.UserAccountRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Reads and writes the loyalty columns of existing user accounts.
 * Accounts themselves are created outside this service.
 */
@Component
@Transactional
public class UserAccountAdapter implements UserAccountPort {

    private final UserAccountRepository repository;
    private final LoyaltyPersistenceMapper mapper;

    public UserAccountAdapter(UserAccountRepository repository, LoyaltyPersistenceMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findById(Long userId) {
        return repository.findById(userId).map(mapper::toDomain);
    }

    @Override
    public Optional<UserAccount> findByIdForUpdate(Long userId) {
        return repository.findByIdForUpdate(userId).map(mapper::toDomain);
    }

    @Override
    public UserAccount save(UserAccount account) {
        UserAccountEntity entity = repository.findById(account.getId())
                .orElseThrow(() -> new UserNotFoundException(account.getId()));
        entity.setTotalXp(account.getTotalXp());
        entity.setLoyaltyTierId(account.getLoyaltyTierId());
        return mapper.toDomain(repository.save(entity));
    }
}
