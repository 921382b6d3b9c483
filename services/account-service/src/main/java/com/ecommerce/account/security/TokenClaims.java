package com.ecommerce.account.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * TokenClaims - identity recovered from a signed token.
 *
 * Built fresh by {@link TokenService} on every successful parse and never
 * stored server-side.
 *
 * Payload field names:
 * - user_id: subject id (UUID string for accounts)
 * - email: always present, may be empty
 * - role: omitted from the payload when empty, read back as ""
 * - token_type: "access" or "refresh"; absent on tokens from older
 *   deployments, in which case {@link #getKind()} is null
 * - iat / exp: NumericDate seconds
 */
@Value
@Builder
public class TokenClaims {

    String userId;

    String email;

    String role;

    TokenKind kind;

    Instant issuedAt;

    Instant expiresAt;
}
