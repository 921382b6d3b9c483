package com.ecommerce.account.dto;

import com.ecommerce.account.entity.Account;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Public view of an {@link Account}. The password hash is never exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {

    private UUID id;

    private String email;

    private String name;

    private String phone;

    private String role;

    private boolean verified;

    private boolean active;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
                .id(account.getId())
                .email(account.getEmail())
                .name(account.getName())
                .phone(account.getPhone())
                .role(account.getRole())
                .verified(account.isVerified())
                .active(account.isActive())
                .createdAt(account.getCreatedAt())
                .updatedAt(account.getUpdatedAt())
                .build();
    }
}
