package com.ruchira.nest.exception;

/**
 * Thrown when a request carries no credentials or the wrong ones.
 */
public class AuthenticationException extends BusinessException {

    public AuthenticationException(String message) {
        super(message);
    }
}
