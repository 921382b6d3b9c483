package com.ecommerce.account.security;

import lombok.Value;

import java.time.Instant;

/**
 * Access and refresh token issued together for one identity. Both share the
 * same issued-at instant.
 */
@Value
public class TokenPair {

    String accessToken;

    String refreshToken;

    Instant accessTokenExpiresAt;

    Instant refreshTokenExpiresAt;
}
