package com.ecommerce.account.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the 401 body for requests that reached a protected endpoint without
 * a valid access token.
 *
 * An expired session tells the client to use its refresh token and names the
 * stale user. Anything else gets a bare "unauthenticated" so a malformed token
 * cannot be told apart from one signed with another secret.
 */
@RequiredArgsConstructor
public class TokenAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        JwtAuthenticationFilter.expiredSession(request).ifPresentOrElse(claims -> {
            body.put("error", "token_expired");
            body.put("message", "session expired");
            body.put("userId", claims.getUserId());
        }, () -> {
            body.put("error", "unauthenticated");
            body.put("message", "authentication required");
        });

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
