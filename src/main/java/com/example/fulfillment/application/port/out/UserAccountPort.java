package com.example.fulfillment.application.port.out;

import com.example.fulfillment.domain.model.UserAccount;

import java.util.Optional;

/**
 * Outbound port for the loyalty fields of user accounts.
 */
public interface UserAccountPort {

    Optional<UserAccount> findById(Long userId);

    /**
     * Loads the account and holds a write lock on its row until the transaction ends.
     * Ledger operations of one user are serialized through this lock.
     */
    Optional<UserAccount> findByIdForUpdate(Long userId);

    UserAccount save(UserAccount account);
}
