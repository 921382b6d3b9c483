package com.ecommerce.account.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AuthResponse - result of a successful registration or login: the account
 * and a fresh token pair.
 *
 * <pre>
 * {
 *   "account": { "id": "123e4567-e89b-12d3-a456-426614174000", "email": "user@example.com", ... },
 *   "tokens": { "tokenType": "Bearer", "accessToken": "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...", ... }
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {

    private AccountResponse account;

    private TokenResponse tokens;
}
