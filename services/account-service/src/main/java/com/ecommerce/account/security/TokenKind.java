package com.ecommerce.account.security;

import java.util.Arrays;
import java.util.Optional;

/**
 * Which lifetime a token was issued with. Carried in the {@code token_type}
 * claim so a refresh exchange can refuse an access token.
 */
public enum TokenKind {

    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    /**
     * Resolve a {@code token_type} claim value.
     *
     * @param claimValue raw claim value, may be null
     * @return the kind, or empty if the value is not recognised
     */
    public static Optional<TokenKind> fromClaim(String claimValue) {
        return Arrays.stream(values())
                .filter(kind -> kind.claimValue.equals(claimValue))
                .findFirst();
    }
}
