package com.ecommerce.account.security;

import com.ecommerce.account.exception.InvalidTokenException;
import com.ecommerce.account.exception.TokenExpiredException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * JwtAuthenticationFilter - recovers the caller's identity from the bearer
 * token once per request, before the request reaches a controller.
 *
 * Outcomes:
 * - valid access token: an {@link AuthenticatedUser} is placed in the security context
 * - expired token: the request stays anonymous and the stale identity is
 *   available through {@link #expiredSession(HttpServletRequest)}
 * - invalid or missing token: the request stays anonymous
 *
 * Protected endpoints then answer 401 through {@link TokenAuthenticationEntryPoint}.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private static final String EXPIRED_SESSION_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".EXPIRED_SESSION";

    /** Endpoints that authenticate by body, not by bearer token. */
    private static final Set<String> PUBLIC_PATHS = Set.of(
            "/auth/register",
            "/auth/login",
            "/auth/refresh",
            "/auth/token/verify");

    private final TokenService tokenService;

    /**
     * Claims of the expired token presented with this request, if any.
     * Diagnostic only; never authorize from this.
     */
    public static Optional<TokenClaims> expiredSession(HttpServletRequest request) {
        Object value = request.getAttribute(EXPIRED_SESSION_ATTRIBUTE);
        return value instanceof TokenClaims ? Optional.of((TokenClaims) value) : Optional.empty();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return PUBLIC_PATHS.contains(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER)) {
            String token = header.substring(BEARER.length()).trim();
            try {
                AuthenticatedUser user = AuthenticatedUser.from(tokenService.validateToken(token));
                if (SecurityContextHolder.getContext().getAuthentication() == null) {
                    var authentication = new UsernamePasswordAuthenticationToken(user, null, user.authorities());
                    SecurityContextHolder.getContext().setAuthentication(authentication);
                }
            } catch (TokenExpiredException e) {
                log.debug("Expired bearer token: {}", e.getMessage());
                request.setAttribute(EXPIRED_SESSION_ATTRIBUTE, tokenService.getClaimsFromToken(token));
            } catch (InvalidTokenException e) {
                log.warn("Invalid bearer token on {}: {}", request.getRequestURI(), e.getMessage());
            }
        }
        chain.doFilter(request, response);
    }
}
