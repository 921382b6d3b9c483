package com.ecommerce.account.service;

import com.ecommerce.account.dto.AccountResponse;
import com.ecommerce.account.dto.AuthResponse;
import com.ecommerce.account.dto.LoginRequest;
import com.ecommerce.account.dto.RegisterRequest;
import com.ecommerce.account.dto.SessionInfoResponse;
import com.ecommerce.account.dto.TokenResponse;
import com.ecommerce.account.dto.TokenVerificationResponse;
import com.ecommerce.account.entity.Account;
import com.ecommerce.account.exception.AccountNotFoundException;
import com.ecommerce.account.exception.EmailAlreadyExistsException;
import com.ecommerce.account.exception.InvalidCredentialsException;
import com.ecommerce.account.exception.InvalidTokenException;
import com.ecommerce.account.exception.TokenException;
import com.ecommerce.account.exception.TokenExpiredException;
import com.ecommerce.account.repository.AccountRepository;
import com.ecommerce.account.security.AuthenticatedUser;
import com.ecommerce.account.security.TokenClaims;
import com.ecommerce.account.security.TokenKind;
import com.ecommerce.account.security.TokenPair;
import com.ecommerce.account.security.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * AccountService - registration, login and session token lifecycle.
 *
 * Every successful registration, login and refresh exchange ends in
 * {@link TokenService#issueTokenPair}. If issuing fails nothing is returned to
 * the client; a lone access token is never handed out.
 *
 * Sessions are stateless: nothing about issued tokens is stored, so logout is
 * left to the client discarding its tokens.
 *
 * @see TokenService for token issuance and validation
 * @see AccountRepository for persistence
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;

    private final PasswordEncoder passwordEncoder;

    private final TokenService tokenService;

    /**
     * Create an account with role USER and open a session for it.
     *
     * @throws EmailAlreadyExistsException if the email is taken, by an active account or not
     */
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        log.info("Registration attempt for email: {}", request.getEmail());

        if (accountRepository.existsByEmail(request.getEmail())) {
            throw new EmailAlreadyExistsException(request.getEmail());
        }

        Account account = accountRepository.save(Account.builder()
                .id(UUID.randomUUID())
                .email(request.getEmail())
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .name(request.getName())
                .phone(request.getPhone())
                .role(Account.DEFAULT_ROLE)
                .build());

        TokenPair tokens = issueFor(account);
        log.info("Account registered: {}", account.getId());
        return toAuthResponse(account, tokens);
    }

    /**
     * Check credentials and open a session. Unknown email, inactive account and
     * wrong password all fail the same way.
     *
     * @throws InvalidCredentialsException if the credentials do not match an active account
     */
    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        Account account = accountRepository.findByEmailAndActiveTrue(request.getEmail())
                .filter(candidate -> passwordEncoder.matches(request.getPassword(), candidate.getPasswordHash()))
                .orElseThrow(() -> {
                    log.info("Login rejected for email: {}", request.getEmail());
                    return new InvalidCredentialsException();
                });

        TokenPair tokens = issueFor(account);
        log.info("Account logged in: {}", account.getId());
        return toAuthResponse(account, tokens);
    }

    /**
     * Exchange a refresh token for a new pair carrying the same identity.
     *
     * Access tokens are refused here. Tokens issued before the token_type
     * claim existed carry no kind and are still accepted.
     *
     * @throws TokenExpiredException if the refresh token has expired
     * @throws InvalidTokenException if the token is not a usable refresh token
     */
    public TokenResponse refresh(String refreshToken) {
        TokenClaims claims = tokenService.validateToken(refreshToken);
        if (claims.getKind() == TokenKind.ACCESS) {
            log.warn("Access token presented for refresh by user: {}", claims.getUserId());
            throw new InvalidTokenException("Access token cannot be used as a refresh token");
        }

        TokenPair tokens = tokenService.issueTokenPair(claims.getUserId(), claims.getEmail(), claims.getRole());
        log.info("Tokens refreshed for user: {}", claims.getUserId());
        return TokenResponse.from(tokens);
    }

    /**
     * Report whether a token is currently valid. Never throws for a bad token.
     */
    public TokenVerificationResponse verifyToken(String token) {
        try {
            TokenClaims claims = tokenService.validateToken(token);
            return TokenVerificationResponse.builder()
                    .valid(true)
                    .userId(claims.getUserId())
                    .email(claims.getEmail())
                    .role(claims.getRole())
                    .expiresAt(claims.getExpiresAt())
                    .build();
        } catch (TokenException e) {
            log.debug("Token verification failed: {}", e.getMessage());
            return TokenVerificationResponse.invalid();
        }
    }

    /**
     * Session details for an authenticated caller. The account is re-read so a
     * deactivated account no longer has a session even while its token lives.
     *
     * @throws AccountNotFoundException if the account is gone or inactive, or the
     *         token subject is not an account id
     */
    @Transactional(readOnly = true)
    public SessionInfoResponse getSessionInfo(AuthenticatedUser user) {
        Account account = user.accountId()
                .flatMap(accountRepository::findByIdAndActiveTrue)
                .orElseThrow(() -> new AccountNotFoundException(user.getUserId()));

        return SessionInfoResponse.builder()
                .userId(account.getId())
                .email(account.getEmail())
                .role(account.getRole())
                .authenticated(true)
                .accessTokenExpiresAt(user.getTokenExpiresAt())
                .build();
    }

    private TokenPair issueFor(Account account) {
        return tokenService.issueTokenPair(account.getId().toString(), account.getEmail(), account.getRole());
    }

    private static AuthResponse toAuthResponse(Account account, TokenPair tokens) {
        return AuthResponse.builder()
                .account(AccountResponse.from(account))
                .tokens(TokenResponse.from(tokens))
                .build();
    }
}
