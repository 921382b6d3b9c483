package com.ecommerce.account.dto;

import com.ecommerce.account.security.TokenPair;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Token pair as returned to clients. The access token goes in
 * {@code Authorization: Bearer <accessToken>}; the refresh token is only
 * sent to POST /auth/refresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    private String tokenType;

    private String accessToken;

    private String refreshToken;

    private Instant accessTokenExpiresAt;

    private Instant refreshTokenExpiresAt;

    public static TokenResponse from(TokenPair pair) {
        return TokenResponse.builder()
                .tokenType("Bearer")
                .accessToken(pair.getAccessToken())
                .refreshToken(pair.getRefreshToken())
                .accessTokenExpiresAt(pair.getAccessTokenExpiresAt())
                .refreshTokenExpiresAt(pair.getRefreshTokenExpiresAt())
                .build();
    }
}
