package com.ecommerce.account.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to JSON error bodies.
 *
 * Invalid tokens get a generic message: callers must not learn whether a token
 * was malformed or signed with another secret.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(TokenExpiredException.class)
    public ResponseEntity<Map<String, Object>> handleExpired(TokenExpiredException e) {
        return error(HttpStatus.UNAUTHORIZED, "token_expired", "token expired");
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidToken(InvalidTokenException e) {
        return error(HttpStatus.UNAUTHORIZED, "unauthenticated", "invalid token");
    }

    @ExceptionHandler(TokenGenerationException.class)
    public ResponseEntity<Map<String, Object>> handleTokenGeneration(TokenGenerationException e) {
        log.error("Token generation failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "failed to generate tokens");
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<Map<String, Object>> handleCredentials(InvalidCredentialsException e) {
        return error(HttpStatus.UNAUTHORIZED, "unauthenticated", "invalid credentials");
    }

    @ExceptionHandler(EmailAlreadyExistsException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(EmailAlreadyExistsException e) {
        return error(HttpStatus.CONFLICT, "already_exists", "email already exists");
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(AccountNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", "account not found");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = e.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(f -> f.getField(), f -> String.valueOf(f.getDefaultMessage()), (a, b) -> a));
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.BAD_REQUEST, "invalid_argument", "validation failed");
        response.getBody().put("errors", fields);
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.debug("Rejected request argument: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", "invalid request");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
