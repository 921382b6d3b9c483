package com.ecommerce.account.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * SessionInfoResponse - current session as seen by GET /auth/session.
 *
 * <pre>
 * {
 *   "userId": "123e4567-e89b-12d3-a456-426614174000",
 *   "email": "user@example.com",
 *   "role": "USER",
 *   "authenticated": true,
 *   "accessTokenExpiresAt": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 *
 * Clients watch accessTokenExpiresAt to refresh before the access token lapses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionInfoResponse {

    private UUID userId;

    private String email;

    private String role;

    private boolean authenticated;

    private Instant accessTokenExpiresAt;
}
