package com.ecommerce.account.exception;

import java.time.Instant;

/**
 * Token is authentic and well formed but its expiry instant has passed.
 */
public class TokenExpiredException extends TokenException {

    private final Instant expiredAt;

    public TokenExpiredException(Instant expiredAt) {
        super("Token expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
