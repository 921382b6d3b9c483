package com.ecommerce.account.repository;

import com.ecommerce.account.entity.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * AccountRepository - Spring Data JPA access to the 'accounts' table.
 *
 * Derived queries:
 * - findByEmailAndActiveTrue -> SELECT * FROM accounts WHERE email = ? AND is_active = TRUE
 * - findByIdAndActiveTrue    -> SELECT * FROM accounts WHERE id = ? AND is_active = TRUE
 * - existsByEmail            -> SELECT COUNT(*) > 0 FROM accounts WHERE email = ?
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByEmailAndActiveTrue(String email);

    Optional<Account> findByIdAndActiveTrue(UUID id);

    /**
     * Checks every row, active or not, since the email column is unique.
     */
    boolean existsByEmail(String email);
}
