package com.ecommerce.account.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Answer of POST /auth/token/verify. A rejected token yields only
 * {@code {"valid": false}}, without saying why.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenVerificationResponse {

    private boolean valid;

    private String userId;

    private String email;

    private String role;

    private Instant expiresAt;

    public static TokenVerificationResponse invalid() {
        return TokenVerificationResponse.builder().valid(false).build();
    }
}
