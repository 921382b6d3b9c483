package com.ecommerce.account.exception;

/**
 * Base type for every failure raised by {@link com.ecommerce.account.security.TokenService}.
 *
 * Callers that only care whether a token could be used catch this type;
 * callers that must tell "log in again" from "refresh silently" catch the
 * subclasses.
 */
public abstract class TokenException extends RuntimeException {

    protected TokenException(String message) {
        super(message);
    }

    protected TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
