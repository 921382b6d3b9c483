package com.ecommerce.account.security;

import lombok.Value;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.security.Principal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Principal installed by {@link JwtAuthenticationFilter} for a request carrying
 * a valid access token. Role comes from the token, so no database round trip
 * is needed to authorize.
 */
@Value
public class AuthenticatedUser implements Principal {

    String userId;

    String email;

    String role;

    Instant tokenExpiresAt;

    static AuthenticatedUser from(TokenClaims claims) {
        return new AuthenticatedUser(claims.getUserId(), claims.getEmail(), claims.getRole(), claims.getExpiresAt());
    }

    /**
     * Account id carried as the token subject, empty when the subject is not a UUID.
     */
    public Optional<UUID> accountId() {
        try {
            return Optional.of(UUID.fromString(userId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public List<GrantedAuthority> authorities() {
        if (role.isEmpty()) {
            return List.of();
        }
        return List.of(new SimpleGrantedAuthority("ROLE_" + role));
    }

    @Override
    public String getName() {
        return userId;
    }
}
