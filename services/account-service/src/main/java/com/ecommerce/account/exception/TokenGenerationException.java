package com.ecommerce.account.exception;

/**
 * Signing failed. The same secret fails the same way on every attempt, so this
 * is reported as an internal error and never retried.
 */
public class TokenGenerationException extends TokenException {

    public TokenGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
