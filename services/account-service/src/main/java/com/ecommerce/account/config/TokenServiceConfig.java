package com.ecommerce.account.config;

import com.ecommerce.account.security.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the single {@link TokenService} shared by the process.
 *
 * Properties (application.yml):
 * - jwt.secret: HMAC-SHA256 key, at least 32 bytes; supply through JWT_SECRET
 * - jwt.access-token-duration: access token lifetime (default 15m)
 * - jwt.refresh-token-duration: refresh token lifetime (default 7d)
 *
 * The secret is not checked here. Rotating it invalidates every token issued
 * under the previous value.
 */
@Configuration
@Slf4j
public class TokenServiceConfig {

    @Bean
    public TokenService tokenService(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.access-token-duration:15m}") Duration accessTokenDuration,
            @Value("${jwt.refresh-token-duration:7d}") Duration refreshTokenDuration) {
        log.info("Token service configured: access={}, refresh={}", accessTokenDuration, refreshTokenDuration);
        return new TokenService(secret, accessTokenDuration, refreshTokenDuration);
    }
}
