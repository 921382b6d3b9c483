package com.ecommerce.account.exception;

/**
 * Token is empty, malformed, signed with a disallowed algorithm, or its
 * signature does not verify under the configured secret.
 */
public class InvalidTokenException extends TokenException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
