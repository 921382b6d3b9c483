package com.ecommerce.account.controller;

import com.ecommerce.account.dto.AuthResponse;
import com.ecommerce.account.dto.LoginRequest;
import com.ecommerce.account.dto.RefreshTokenRequest;
import com.ecommerce.account.dto.RegisterRequest;
import com.ecommerce.account.dto.SessionInfoResponse;
import com.ecommerce.account.dto.TokenResponse;
import com.ecommerce.account.dto.TokenVerificationResponse;
import com.ecommerce.account.dto.VerifyTokenRequest;
import com.ecommerce.account.security.AuthenticatedUser;
import com.ecommerce.account.service.AccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST endpoints for account sessions.
 *
 * Endpoints:
 * - POST /auth/register     - create an account and return a token pair
 * - POST /auth/login        - authenticate with email/password and return a token pair
 * - POST /auth/refresh      - exchange a refresh token for a new pair
 * - POST /auth/token/verify - report whether a token is valid
 * - GET  /auth/session      - current session (requires Bearer access token)
 * - POST /auth/logout       - acknowledge logout (requires Bearer access token)
 *
 * Error Handling:
 * - 400 Bad Request: invalid input
 * - 401 Unauthorized: bad credentials, invalid or expired token
 * - 409 Conflict: email already registered
 * - 500 Internal Server Error: token signing failure
 *
 * @see AccountService for business logic
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AccountService accountService;

    /**
     * Register a new account.
     *
     * Flow:
     * 1. Validate email, password (8-72 chars) and name
     * 2. Reject an email that is already registered (409)
     * 3. Store the account with a BCrypt hash and role USER
     * 4. Issue an access/refresh token pair for it
     *
     * @param request email, password, name and optional phone
     * @return 201 with the account and its token pair
     */
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.register(request));
    }

    /**
     * Authenticate with email and password.
     *
     * Unknown email, inactive account and wrong password all answer the same
     * 401 with the same message.
     *
     * @param request email and password
     * @return the account and a fresh token pair carrying the stored role
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(accountService.login(request));
    }

    /**
     * An expired refresh token answers 401 with error "token_expired"; the
     * client must log in again.
     */
    @PostMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(accountService.refresh(request.getRefreshToken()));
    }

    /**
     * Report whether a token is currently valid.
     *
     * Always answers 200; an expired, forged or malformed token yields
     * {"valid": false} with no further detail.
     *
     * @param request the token to check
     * @return validity plus the token's identity and expiry when valid
     */
    @PostMapping("/token/verify")
    public ResponseEntity<TokenVerificationResponse> verify(@Valid @RequestBody VerifyTokenRequest request) {
        return ResponseEntity.ok(accountService.verifyToken(request.getToken()));
    }

    /**
     * @param user identity recovered from the bearer token by JwtAuthenticationFilter
     */
    @GetMapping("/session")
    public ResponseEntity<SessionInfoResponse> getSession(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(accountService.getSessionInfo(user));
    }

    /**
     * Tokens are not tracked server-side, so logout only acknowledges; the
     * client drops its tokens and the access token lapses on its own.
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout() {
        return ResponseEntity.noContent().build();
    }
}
