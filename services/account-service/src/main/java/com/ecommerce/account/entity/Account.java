package com.ecommerce.account.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Account - JPA entity for a customer or administrator account.
 *
 * Maps to the 'accounts' table in PostgreSQL:
 * - id: UUID primary key, also the user_id claim of every token issued for the account
 * - email: unique login identifier
 * - password_hash: BCrypt hash, never returned by the API
 * - role: authorization tier ('USER' or 'ADMIN'), copied into tokens
 * - is_active: inactive accounts cannot log in
 */
@Entity
@Table(name = "accounts")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Account {

    public static final String DEFAULT_ROLE = "USER";

    @Id
    @Column(name = "id", columnDefinition = "UUID")
    private UUID id;

    @Column(name = "email", unique = true, nullable = false)
    private String email;

    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "phone")
    private String phone;

    @Builder.Default
    @Column(name = "role", nullable = false, length = 20)
    private String role = DEFAULT_ROLE;

    @Builder.Default
    @Column(name = "is_verified", nullable = false)
    private boolean verified = false;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
