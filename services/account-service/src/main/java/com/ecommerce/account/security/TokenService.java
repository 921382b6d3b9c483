package com.ecommerce.account.security;

import com.ecommerce.account.exception.InvalidTokenException;
import com.ecommerce.account.exception.TokenExpiredException;
import com.ecommerce.account.exception.TokenGenerationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.SigningKeyResolverAdapter;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.Set;

/**
 * TokenService - issues and verifies the JWT access/refresh tokens that
 * authenticate every call into the platform.
 *
 * JWT Structure (RFC 7519):
 * - Header: {"alg":"HS256","typ":"JWT"}
 * - Payload: user_id, email, role (omitted when empty), token_type, iat, exp
 * - Signature: HMAC-SHA256 over header and payload, keyed by the shared secret
 *
 * The service is immutable after construction: the secret, the two lifetimes
 * and the parser are fixed, so one instance is shared by all request threads
 * without locking. It touches no store; every call is local computation.
 *
 * Failure kinds:
 * - {@link InvalidTokenException}: empty, malformed, wrong algorithm, unsigned,
 *   bad signature, missing claims
 * - {@link TokenExpiredException}: authentic but expired (validateToken only)
 * - {@link TokenGenerationException}: the secret cannot sign (issuance only)
 *
 * No key id is embedded. Changing the secret invalidates every outstanding
 * token at once.
 *
 * @see TokenClaims for the recovered identity
 * @see JwtAuthenticationFilter for per-request validation
 */
@Slf4j
public class TokenService {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    private static final SignatureAlgorithm SIGNING_ALGORITHM = SignatureAlgorithm.HS256;

    /** HMAC family only. "none" and asymmetric algorithms never reach signature verification. */
    private static final Set<String> ALLOWED_ALGORITHMS = Set.of(
            SignatureAlgorithm.HS256.getValue(),
            SignatureAlgorithm.HS384.getValue(),
            SignatureAlgorithm.HS512.getValue());

    private final byte[] secret;
    private final Duration accessTokenDuration;
    private final Duration refreshTokenDuration;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(String secret, Duration accessTokenDuration, Duration refreshTokenDuration) {
        this(secret, accessTokenDuration, refreshTokenDuration, Clock.systemUTC());
    }

    /**
     * @param secret shared HMAC secret, used as UTF-8 bytes; HS256 needs at
     *               least 32 bytes, a shorter secret fails at first issuance
     * @param accessTokenDuration lifetime of access tokens, must be positive
     * @param refreshTokenDuration lifetime of refresh tokens, must be positive
     * @param clock source of "now" for issuance and expiry checks
     */
    public TokenService(String secret, Duration accessTokenDuration, Duration refreshTokenDuration, Clock clock) {
        Objects.requireNonNull(secret, "secret");
        this.accessTokenDuration = requirePositive(accessTokenDuration, "accessTokenDuration");
        this.refreshTokenDuration = requirePositive(refreshTokenDuration, "refreshTokenDuration");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.parser = Jwts.parserBuilder()
                .setSigningKeyResolver(new SigningKeyResolverAdapter() {
                    @Override
                    public Key resolveSigningKey(JwsHeader header, Claims claims) {
                        String algorithm = header.getAlgorithm();
                        if (algorithm == null || !ALLOWED_ALGORITHMS.contains(algorithm)) {
                            throw new InvalidTokenException("Unexpected signing algorithm: " + algorithm);
                        }
                        return signingKey();
                    }
                })
                .setClock(() -> Date.from(this.clock.instant()))
                .build();
    }

    /**
     * Issue a short-lived access token.
     *
     * @return compact JWS string (header.payload.signature)
     * @throws TokenGenerationException if the secret cannot sign
     */
    public String issueAccessToken(String userId, String email, String role) {
        return sign(TokenKind.ACCESS, userId, email, role, clock.instant());
    }

    /**
     * Issue a long-lived refresh token. It carries the same claims as an
     * access token, distinguished by token_type and its longer expiry.
     *
     * @throws TokenGenerationException if the secret cannot sign
     */
    public String issueRefreshToken(String userId, String email, String role) {
        return sign(TokenKind.REFRESH, userId, email, role, clock.instant());
    }

    /**
     * Issue an access token and a refresh token for the same identity.
     * Either both are returned or the failure propagates and neither is.
     *
     * @throws TokenGenerationException if the secret cannot sign
     */
    public TokenPair issueTokenPair(String userId, String email, String role) {
        Instant now = clock.instant();
        String accessToken = sign(TokenKind.ACCESS, userId, email, role, now);
        String refreshToken = sign(TokenKind.REFRESH, userId, email, role, now);
        return new TokenPair(accessToken, refreshToken, expiryOf(TokenKind.ACCESS, now), expiryOf(TokenKind.REFRESH, now));
    }

    /**
     * Verify a token and return its claims.
     *
     * A token expiring exactly now is already expired. With the clock held
     * still, repeated calls on the same string give the same outcome.
     *
     * @throws InvalidTokenException if the token is not authentic or not well formed
     * @throws TokenExpiredException if the token is authentic but expired
     */
    public TokenClaims validateToken(String token) {
        TokenClaims claims = readVerifiedClaims(token);
        if (!claims.getExpiresAt().isAfter(clock.instant())) {
            throw new TokenExpiredException(claims.getExpiresAt());
        }
        return claims;
    }

    /**
     * Verify a token's signature and structure but ignore its expiry.
     *
     * For diagnostics such as naming the user whose session expired. Never
     * use the result to authorize an action.
     *
     * @throws InvalidTokenException if the token is not authentic or not well formed
     */
    public TokenClaims getClaimsFromToken(String token) {
        return readVerifiedClaims(token);
    }

    public Duration getAccessTokenDuration() {
        return accessTokenDuration;
    }

    public Duration getRefreshTokenDuration() {
        return refreshTokenDuration;
    }

    private String sign(TokenKind kind, String userId, String email, String role, Instant issuedAt) {
        try {
            JwtBuilder builder = Jwts.builder()
                    .setHeaderParam(Header.TYPE, Header.JWT_TYPE)
                    .claim(CLAIM_USER_ID, userId)
                    .claim(CLAIM_EMAIL, email);
            if (role != null && !role.isEmpty()) {
                builder.claim(CLAIM_ROLE, role);
            }
            return builder
                    .claim(CLAIM_TOKEN_TYPE, kind.claimValue())
                    .setIssuedAt(Date.from(issuedAt))
                    .setExpiration(Date.from(expiryOf(kind, issuedAt)))
                    .signWith(signingKey(), SIGNING_ALGORITHM)
                    .compact();
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenGenerationException("Failed to sign " + kind.claimValue() + " token", e);
        }
    }

    private Instant expiryOf(TokenKind kind, Instant issuedAt) {
        return issuedAt.plus(kind == TokenKind.ACCESS ? accessTokenDuration : refreshTokenDuration);
    }

    private TokenClaims readVerifiedClaims(String token) {
        if (token == null || token.isEmpty()) {
            throw new InvalidTokenException("Token is empty");
        }
        try {
            Claims body;
            try {
                body = parser.parseClaimsJws(token).getBody();
            } catch (ExpiredJwtException e) {
                // The parser verifies the signature before it looks at exp, and a
                // JwsHeader means a signature part was present and checked.
                if (!(e.getHeader() instanceof JwsHeader)) {
                    throw new InvalidTokenException("Token is not signed", e);
                }
                body = e.getClaims();
            }
            return toTokenClaims(body);
        } catch (InvalidTokenException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw e;
        } catch (JwtException | IllegalArgumentException | IllegalStateException | ClassCastException e) {
            // jjwt casts a decoded header to a Map and converts exp/iat to Date
            // without type checks, so non-object headers and non-numeric dates
            // surface as ClassCastException and IllegalStateException.
            log.debug("Rejected token: {}", e.getMessage());
            throw new InvalidTokenException("Token is invalid", e);
        }
    }

    private static TokenClaims toTokenClaims(Claims body) {
        String userId = body.get(CLAIM_USER_ID, String.class);
        Date expiration = body.getExpiration();
        if (userId == null || expiration == null) {
            throw new InvalidTokenException("Token is missing required claims");
        }
        String tokenType = body.get(CLAIM_TOKEN_TYPE, String.class);
        TokenKind kind = null;
        if (tokenType != null) {
            kind = TokenKind.fromClaim(tokenType)
                    .orElseThrow(() -> new InvalidTokenException("Unknown token type: " + tokenType));
        }
        String email = body.get(CLAIM_EMAIL, String.class);
        String role = body.get(CLAIM_ROLE, String.class);
        Date issuedAt = body.getIssuedAt();

        return TokenClaims.builder()
                .userId(userId)
                .email(email == null ? "" : email)
                .role(role == null ? "" : role)
                .kind(kind)
                .issuedAt(issuedAt == null ? null : issuedAt.toInstant())
                .expiresAt(expiration.toInstant())
                .build();
    }

    private Key signingKey() {
        return new SecretKeySpec(secret, SIGNING_ALGORITHM.getJcaName());
    }

    private static Duration requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return duration;
    }
}
