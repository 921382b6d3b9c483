package com.ecommerce.account.service;

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
import com.ecommerce.account.exception.TokenExpiredException;
import com.ecommerce.account.repository.AccountRepository;
import com.ecommerce.account.security.AuthenticatedUser;
import com.ecommerce.account.security.TestTokens;
import com.ecommerce.account.security.TokenClaims;
import com.ecommerce.account.security.TokenKind;
import com.ecommerce.account.security.TokenPair;
import com.ecommerce.account.security.TokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @Captor
    private ArgumentCaptor<Account> accountCaptor;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private TokenService tokenService;

    private AccountService accountService;

    @BeforeEach
    void setUp() {
        tokenService = new TokenService(TestTokens.SECRET, Duration.ofMinutes(15), Duration.ofDays(7));
        accountService = new AccountService(accountRepository, passwordEncoder, tokenService);
    }

    @Test
    void testRegisterHashesPasswordAndIssuesTokens() {
        when(accountRepository.existsByEmail("new@example.com")).thenReturn(false);
        when(accountRepository.save(any(Account.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuthResponse response = accountService.register(
                new RegisterRequest("new@example.com", "password123", "New User", "+15550100"));

        verify(accountRepository).save(accountCaptor.capture());
        Account saved = accountCaptor.getValue();
        assertThat(saved.getPasswordHash()).isNotEqualTo("password123");
        assertThat(passwordEncoder.matches("password123", saved.getPasswordHash())).isTrue();
        assertThat(saved.getRole()).isEqualTo("USER");

        TokenClaims claims = tokenService.validateToken(response.getTokens().getAccessToken());
        assertThat(claims.getUserId()).isEqualTo(saved.getId().toString());
        assertThat(claims.getEmail()).isEqualTo("new@example.com");
        assertThat(claims.getRole()).isEqualTo("USER");
        assertThat(response.getAccount().getId()).isEqualTo(saved.getId());
        assertThat(response.getTokens().getTokenType()).isEqualTo("Bearer");
    }

    @Test
    void testRegisterRejectsDuplicateEmail() {
        when(accountRepository.existsByEmail("taken@example.com")).thenReturn(true);

        assertThatThrownBy(() -> accountService.register(
                new RegisterRequest("taken@example.com", "password123", "Someone", null)))
                .isInstanceOf(EmailAlreadyExistsException.class);
        verify(accountRepository, never()).save(any());
    }

    @Test
    void testLoginIssuesTokensWithStoredRole() {
        Account account = account("admin@example.com", "password123", "ADMIN");
        when(accountRepository.findByEmailAndActiveTrue("admin@example.com")).thenReturn(Optional.of(account));

        AuthResponse response = accountService.login(new LoginRequest("admin@example.com", "password123"));

        TokenClaims access = tokenService.validateToken(response.getTokens().getAccessToken());
        TokenClaims refresh = tokenService.validateToken(response.getTokens().getRefreshToken());
        assertThat(access.getUserId()).isEqualTo(account.getId().toString());
        assertThat(access.getRole()).isEqualTo("ADMIN");
        assertThat(refresh.getKind()).isEqualTo(TokenKind.REFRESH);
    }

    @Test
    void testLoginRejectsWrongPassword() {
        Account account = account("user@example.com", "password123", "USER");
        when(accountRepository.findByEmailAndActiveTrue("user@example.com")).thenReturn(Optional.of(account));

        assertThatThrownBy(() -> accountService.login(new LoginRequest("user@example.com", "wrong-password")))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void testLoginRejectsUnknownEmail() {
        when(accountRepository.findByEmailAndActiveTrue("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accountService.login(new LoginRequest("ghost@example.com", "password123")))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Invalid credentials");
    }

    @Test
    void testRefreshIssuesNewPairForSameIdentity() {
        TokenPair original = tokenService.issueTokenPair("user123", "test@example.com", "ADMIN");

        TokenResponse refreshed = accountService.refresh(original.getRefreshToken());

        TokenClaims access = tokenService.validateToken(refreshed.getAccessToken());
        assertThat(access.getUserId()).isEqualTo("user123");
        assertThat(access.getEmail()).isEqualTo("test@example.com");
        assertThat(access.getRole()).isEqualTo("ADMIN");
        assertThat(access.getKind()).isEqualTo(TokenKind.ACCESS);
    }

    @Test
    void testRefreshRejectsAccessToken() {
        String accessToken = tokenService.issueAccessToken("user123", "test@example.com", "USER");

        assertThatThrownBy(() -> accountService.refresh(accessToken))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void testRefreshAcceptsLegacyTokenWithoutKind() {
        Instant now = Instant.now();
        String legacy = TestTokens.hmacSigned(TestTokens.HS256_HEADER,
                TestTokens.legacyPayload("user123", "test@example.com", "USER", now, now.plus(Duration.ofDays(7))),
                TestTokens.SECRET);

        TokenResponse refreshed = accountService.refresh(legacy);

        assertThat(tokenService.validateToken(refreshed.getRefreshToken()).getUserId()).isEqualTo("user123");
    }

    @Test
    void testRefreshRejectsExpiredToken() {
        TokenService past = new TokenService(TestTokens.SECRET, Duration.ofMinutes(15), Duration.ofDays(7),
                Clock.fixed(Instant.now().minus(Duration.ofDays(8)), ZoneOffset.UTC));
        String expired = past.issueRefreshToken("user123", "test@example.com", "USER");

        assertThatThrownBy(() -> accountService.refresh(expired))
                .isInstanceOf(TokenExpiredException.class);
    }

    @Test
    void testVerifyToken() {
        String token = tokenService.issueAccessToken("user123", "test@example.com", "USER");

        TokenVerificationResponse valid = accountService.verifyToken(token);
        assertThat(valid.isValid()).isTrue();
        assertThat(valid.getUserId()).isEqualTo("user123");
        assertThat(valid.getExpiresAt()).isAfter(Instant.now());

        TokenVerificationResponse invalid = accountService.verifyToken("not.a.token");
        assertThat(invalid.isValid()).isFalse();
        assertThat(invalid.getUserId()).isNull();
    }

    @Test
    void testGetSessionInfo() {
        Account account = account("user@example.com", "password123", "USER");
        when(accountRepository.findByIdAndActiveTrue(account.getId())).thenReturn(Optional.of(account));
        Instant expiresAt = Instant.now().plus(Duration.ofMinutes(10));

        SessionInfoResponse session = accountService.getSessionInfo(
                new AuthenticatedUser(account.getId().toString(), account.getEmail(), "USER", expiresAt));

        assertThat(session.getUserId()).isEqualTo(account.getId());
        assertThat(session.isAuthenticated()).isTrue();
        assertThat(session.getAccessTokenExpiresAt()).isEqualTo(expiresAt);
    }

    @Test
    void testGetSessionInfoForMissingAccount() {
        UUID id = UUID.randomUUID();
        when(accountRepository.findByIdAndActiveTrue(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accountService.getSessionInfo(
                new AuthenticatedUser(id.toString(), "gone@example.com", "USER", Instant.now())))
                .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void testGetSessionInfoForNonUuidSubject() {
        assertThatThrownBy(() -> accountService.getSessionInfo(
                new AuthenticatedUser("user123", "user@example.com", "USER", Instant.now())))
                .isInstanceOf(AccountNotFoundException.class)
                .hasMessageContaining("user123");

        verifyNoInteractions(accountRepository);
    }

    private Account account(String email, String password, String role) {
        return Account.builder()
                .id(UUID.randomUUID())
                .email(email)
                .passwordHash(passwordEncoder.encode(password))
                .name("Test User")
                .role(role)
                .build();
    }
}
